package com.scholary.subtitle.batch.document;

/**
 * A single timed subtitle line with its original and translated text.
 *
 * <p>Times are millisecond offsets from the start of the media. An entry whose end does not come
 * after its start can be loaded from a file but is reported as invalid; edits never produce one.
 */
public record SubtitleEntry(
    long startMillis, long endMillis, String originalText, String translatedText) {

  public SubtitleEntry {
    if (startMillis < 0) {
      throw new IllegalArgumentException("Start time cannot be negative");
    }
    if (endMillis < startMillis) {
      throw new IllegalArgumentException("End time must be >= start time");
    }
    originalText = originalText == null ? "" : originalText;
    translatedText = translatedText == null ? "" : translatedText;
  }

  public static SubtitleEntry of(long startMillis, long endMillis, String originalText) {
    return new SubtitleEntry(startMillis, endMillis, originalText, "");
  }

  public long durationMillis() {
    return endMillis - startMillis;
  }

  /** True when the entry has a strictly positive duration. */
  public boolean isValid() {
    return endMillis > startMillis;
  }

  public SubtitleEntry withStartMillis(long value) {
    return new SubtitleEntry(value, endMillis, originalText, translatedText);
  }

  public SubtitleEntry withEndMillis(long value) {
    return new SubtitleEntry(startMillis, value, originalText, translatedText);
  }

  public SubtitleEntry withOriginalText(String value) {
    return new SubtitleEntry(startMillis, endMillis, value, translatedText);
  }

  public SubtitleEntry withTranslatedText(String value) {
    return new SubtitleEntry(startMillis, endMillis, originalText, value);
  }
}

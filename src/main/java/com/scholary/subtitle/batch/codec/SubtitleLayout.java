package com.scholary.subtitle.batch.codec;

import com.scholary.subtitle.batch.document.SubtitleEntry;
import java.util.ArrayList;
import java.util.List;

/**
 * How the two texts of an entry are arranged when exported.
 *
 * <p>A blank text is left out, so a layout that shows both texts degrades to a single line for
 * entries that have not been translated yet.
 */
public enum SubtitleLayout {
  TRANSLATED_ABOVE,
  ORIGINAL_ABOVE,
  ORIGINAL_ONLY,
  TRANSLATED_ONLY;

  /** Text lines for one entry, top to bottom. */
  public List<String> lines(SubtitleEntry entry) {
    List<String> lines = new ArrayList<>(2);
    switch (this) {
      case TRANSLATED_ABOVE -> {
        addIfPresent(lines, entry.translatedText());
        addIfPresent(lines, entry.originalText());
      }
      case ORIGINAL_ABOVE -> {
        addIfPresent(lines, entry.originalText());
        addIfPresent(lines, entry.translatedText());
      }
      case ORIGINAL_ONLY -> addIfPresent(lines, entry.originalText());
      case TRANSLATED_ONLY -> addIfPresent(lines, entry.translatedText());
    }
    return lines;
  }

  private static void addIfPresent(List<String> lines, String text) {
    if (text != null && !text.isBlank()) {
      lines.add(text.strip());
    }
  }
}

package com.scholary.subtitle.batch.optimization;

import com.scholary.subtitle.batch.document.SubtitleEntry;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Splits entries whose original text is too long to read comfortably.
 *
 * <p>CJK text is measured in characters, other text in words. A long entry is cut into the fewest
 * equal-sized pieces that fit the limit, and its time span is shared out in proportion to the
 * length of each piece. Entries that already carry a translation are left alone.
 */
public final class SentenceSplitter {

  private final int maxCjkChars;
  private final int maxWords;

  public SentenceSplitter(int maxCjkChars, int maxWords) {
    if (maxCjkChars <= 0 || maxWords <= 0) {
      throw new IllegalArgumentException("Split limits must be positive");
    }
    this.maxCjkChars = maxCjkChars;
    this.maxWords = maxWords;
  }

  public List<SubtitleEntry> split(List<SubtitleEntry> entries) {
    List<SubtitleEntry> result = new ArrayList<>(entries.size());
    for (SubtitleEntry entry : entries) {
      result.addAll(splitEntry(entry));
    }
    return result;
  }

  List<SubtitleEntry> splitEntry(SubtitleEntry entry) {
    if (!entry.translatedText().isBlank()) {
      return List.of(entry);
    }

    String text = entry.originalText().strip();
    boolean cjk = containsCjk(text);
    List<String> units = cjk ? cjkUnits(text) : wordUnits(text);
    int limit = cjk ? maxCjkChars : maxWords;
    int pieces = (units.size() + limit - 1) / limit;
    if (pieces <= 1 || entry.durationMillis() < pieces) {
      return List.of(entry);
    }

    int perPiece = (units.size() + pieces - 1) / pieces;
    List<SubtitleEntry> result = new ArrayList<>(pieces);
    long start = entry.startMillis();
    int consumed = 0;
    for (int from = 0; from < units.size(); from += perPiece) {
      int to = Math.min(units.size(), from + perPiece);
      consumed = to;
      long end =
          to == units.size()
              ? entry.endMillis()
              : entry.startMillis() + entry.durationMillis() * consumed / units.size();
      String piece = String.join(cjk ? "" : " ", units.subList(from, to));
      result.add(SubtitleEntry.of(start, end, piece));
      start = end;
    }
    return result;
  }

  static boolean containsCjk(String text) {
    return text.codePoints().anyMatch(SentenceSplitter::isCjk);
  }

  private static boolean isCjk(int codePoint) {
    Character.UnicodeScript script = Character.UnicodeScript.of(codePoint);
    return script == Character.UnicodeScript.HAN
        || script == Character.UnicodeScript.HIRAGANA
        || script == Character.UnicodeScript.KATAKANA
        || script == Character.UnicodeScript.HANGUL;
  }

  private static List<String> cjkUnits(String text) {
    List<String> units = new ArrayList<>();
    text.codePoints()
        .filter(cp -> !Character.isWhitespace(cp))
        .forEach(cp -> units.add(new String(Character.toChars(cp))));
    return units;
  }

  private static List<String> wordUnits(String text) {
    if (text.isEmpty()) {
      return List.of();
    }
    return Arrays.asList(text.split("\\s+"));
  }
}

package com.scholary.subtitle.batch.codec;

import com.scholary.subtitle.batch.document.SubtitleEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * SubRip codec.
 *
 * <p>Format:
 *
 * <pre>
 * 1
 * 00:00:00,000 --> 00:00:05,200
 * Hello world
 * Hallo Welt
 *
 * 2
 * 00:00:05,200 --> 00:00:10,300
 * This is a test
 * </pre>
 *
 * <p>On read, the first text line of a block becomes the original text and any further lines the
 * translated text.
 *
 * <p>SRT has no way to write an empty line inside a block, so blank texts are left out on write.
 * An entry with a blank original and a translation therefore reads back with the translation as
 * its original text. Use JSON to keep both columns exactly.
 */
@Component
public class SrtFormatCodec implements FormatCodec {

  private static final Pattern TIMING =
      Pattern.compile(
          "(\\d{1,2}):(\\d{2}):(\\d{2})[,.](\\d{3})\\s*-->\\s*"
              + "(\\d{1,2}):(\\d{2}):(\\d{2})[,.](\\d{3})");

  @Override
  public SubtitleFormat format() {
    return SubtitleFormat.SRT;
  }

  @Override
  public List<SubtitleEntry> read(String content) {
    List<SubtitleEntry> entries = new ArrayList<>();
    String[] blocks = content.replace("\r\n", "\n").replace('\r', '\n').trim().split("\n\\s*\n");

    for (String block : blocks) {
      if (block.isBlank()) {
        continue;
      }
      String[] lines = block.strip().split("\n");
      int timingLine = findTimingLine(lines);
      if (timingLine < 0) {
        throw new CodecException("SRT block without timing line: " + lines[0]);
      }

      Matcher m = TIMING.matcher(lines[timingLine]);
      if (!m.find()) {
        throw new CodecException("Malformed SRT timing line: " + lines[timingLine]);
      }
      long start = toMillis(m.group(1), m.group(2), m.group(3), m.group(4));
      long end = toMillis(m.group(5), m.group(6), m.group(7), m.group(8));
      if (end < start) {
        throw new CodecException("SRT block ends before it starts: " + lines[timingLine]);
      }

      String original = timingLine + 1 < lines.length ? lines[timingLine + 1].strip() : "";
      StringBuilder translated = new StringBuilder();
      for (int i = timingLine + 2; i < lines.length; i++) {
        if (translated.length() > 0) {
          translated.append('\n');
        }
        translated.append(lines[i].strip());
      }
      entries.add(new SubtitleEntry(start, end, original, translated.toString()));
    }
    return entries;
  }

  @Override
  public String write(List<SubtitleEntry> entries, SubtitleLayout layout, String style) {
    StringBuilder srt = new StringBuilder();

    for (int i = 0; i < entries.size(); i++) {
      SubtitleEntry entry = entries.get(i);

      srt.append(i + 1).append("\n");
      srt.append(formatSrtTime(entry.startMillis()))
          .append(" --> ")
          .append(formatSrtTime(entry.endMillis()))
          .append("\n");
      for (String line : layout.lines(entry)) {
        srt.append(line).append("\n");
      }
      srt.append("\n");
    }

    return srt.toString();
  }

  /** HH:MM:SS,mmm */
  static String formatSrtTime(long millis) {
    long hours = millis / 3_600_000;
    long minutes = (millis % 3_600_000) / 60_000;
    long secs = (millis % 60_000) / 1000;
    long ms = millis % 1000;
    return String.format("%02d:%02d:%02d,%03d", hours, minutes, secs, ms);
  }

  private static int findTimingLine(String[] lines) {
    // Index line is optional in practice, so look at the first two lines.
    for (int i = 0; i < Math.min(2, lines.length); i++) {
      if (lines[i].contains("-->")) {
        return i;
      }
    }
    return -1;
  }

  private static long toMillis(String h, String m, String s, String ms) {
    return Long.parseLong(h) * 3_600_000
        + Long.parseLong(m) * 60_000
        + Long.parseLong(s) * 1000
        + Long.parseLong(ms);
  }
}

package com.scholary.subtitle.batch.codec;

import com.scholary.subtitle.batch.document.SubtitleEntry;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Advanced SubStation Alpha codec.
 *
 * <p>ASS timestamps have centisecond resolution, so sub-10ms detail is truncated on write. Inline
 * override tags such as <code>{\an8}</code> are stripped on read. Lines within a dialogue are
 * separated by {@code \N}; the first becomes the original text, the rest the translated text.
 */
@Component
public class AssFormatCodec implements FormatCodec {

  static final String STYLES_SECTION = "[V4+ Styles]";

  static final String DEFAULT_STYLE =
      STYLES_SECTION
          + "\n"
          + "Format: Name, Fontname, Fontsize, PrimaryColour, SecondaryColour, OutlineColour,"
          + " BackColour, Bold, Italic, Underline, StrikeOut, ScaleX, ScaleY, Spacing, Angle,"
          + " BorderStyle, Outline, Shadow, Alignment, MarginL, MarginR, MarginV, Encoding\n"
          + "Style: Default,Arial,40,&H00FFFFFF,&H000000FF,&H00000000,&H00000000,0,0,0,0,100,100,"
          + "0,0,1,2,0,2,10,10,15,1\n";

  private static final String EVENTS_FORMAT =
      "Format: Layer, Start, End, Style, Name, MarginL, MarginR, MarginV, Effect, Text";

  private static final Pattern TIME = Pattern.compile("(\\d+):(\\d{2}):(\\d{2})\\.(\\d{2})");
  private static final Pattern OVERRIDE_TAG = Pattern.compile("\\{[^}]*}");

  @Override
  public SubtitleFormat format() {
    return SubtitleFormat.ASS;
  }

  @Override
  public List<SubtitleEntry> read(String content) {
    List<SubtitleEntry> entries = new ArrayList<>();
    List<String> fields = null;
    boolean inEvents = false;

    for (String raw : content.split("\\R")) {
      String line = raw.strip();
      if (line.startsWith("[")) {
        inEvents = line.equalsIgnoreCase("[Events]");
        continue;
      }
      if (!inEvents) {
        continue;
      }
      if (line.startsWith("Format:")) {
        fields =
            Arrays.stream(line.substring("Format:".length()).split(","))
                .map(String::strip)
                .toList();
      } else if (line.startsWith("Dialogue:")) {
        if (fields == null) {
          throw new CodecException("ASS dialogue before events format line");
        }
        entries.add(parseDialogue(line.substring("Dialogue:".length()), fields));
      }
    }
    return entries;
  }

  @Override
  public String write(List<SubtitleEntry> entries, SubtitleLayout layout, String style) {
    StringBuilder ass = new StringBuilder();
    ass.append("[Script Info]\n")
        .append("ScriptType: v4.00+\n")
        .append("PlayResX: 1280\n")
        .append("PlayResY: 720\n")
        .append("\n");

    ass.append(stylesSection(style)).append("\n");

    ass.append("[Events]\n").append(EVENTS_FORMAT).append("\n");
    for (SubtitleEntry entry : entries) {
      ass.append("Dialogue: 0,")
          .append(formatAssTime(entry.startMillis()))
          .append(',')
          .append(formatAssTime(entry.endMillis()))
          .append(",Default,,0,0,0,,")
          .append(String.join("\\N", layout.lines(entry)).replace("\n", "\\N"))
          .append("\n");
    }
    return ass.toString();
  }

  /** H:MM:SS.cc */
  static String formatAssTime(long millis) {
    long hours = millis / 3_600_000;
    long minutes = (millis % 3_600_000) / 60_000;
    long secs = (millis % 60_000) / 1000;
    long centis = (millis % 1000) / 10;
    return String.format("%d:%02d:%02d.%02d", hours, minutes, secs, centis);
  }

  private static String stylesSection(String style) {
    if (style == null || style.isBlank()) {
      return DEFAULT_STYLE;
    }
    String body = style.strip();
    String section = body.startsWith(STYLES_SECTION) ? body : STYLES_SECTION + "\n" + body;
    return section + "\n";
  }

  private static SubtitleEntry parseDialogue(String payload, List<String> fields) {
    String[] values = payload.strip().split(",", fields.size());
    if (values.length < fields.size()) {
      throw new CodecException("ASS dialogue has too few fields: " + payload);
    }
    long start = parseAssTime(values[fieldIndex(fields, "Start")]);
    long end = parseAssTime(values[fieldIndex(fields, "End")]);
    if (end < start) {
      throw new CodecException("ASS dialogue ends before it starts: " + payload);
    }

    String text = OVERRIDE_TAG.matcher(values[fieldIndex(fields, "Text")]).replaceAll("");
    String[] lines = text.split("\\\\[Nn]", -1);
    String original = lines[0].strip();
    StringBuilder translated = new StringBuilder();
    for (int i = 1; i < lines.length; i++) {
      if (translated.length() > 0) {
        translated.append('\n');
      }
      translated.append(lines[i].strip());
    }
    return new SubtitleEntry(start, end, original, translated.toString());
  }

  private static int fieldIndex(List<String> fields, String name) {
    int index = fields.indexOf(name);
    if (index < 0) {
      throw new CodecException("ASS events format has no " + name + " field");
    }
    return index;
  }

  private static long parseAssTime(String value) {
    Matcher m = TIME.matcher(value.strip());
    if (!m.matches()) {
      throw new CodecException("Malformed ASS timestamp: " + value);
    }
    return Long.parseLong(m.group(1)) * 3_600_000
        + Long.parseLong(m.group(2)) * 60_000
        + Long.parseLong(m.group(3)) * 1000
        + Long.parseLong(m.group(4)) * 10;
  }
}

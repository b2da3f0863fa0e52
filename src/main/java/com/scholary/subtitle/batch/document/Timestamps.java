package com.scholary.subtitle.batch.document;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fixed-precision timestamp format used for time cells: {@code HH:mm:ss.SSS}.
 *
 * <p>Hours are not wrapped at 24, so long recordings stay representable.
 */
public final class Timestamps {

  private static final Pattern CELL_PATTERN =
      Pattern.compile("(\\d{2}):(\\d{2}):(\\d{2})\\.(\\d{3})");

  private Timestamps() {}

  /**
   * Parse a time cell.
   *
   * @param value the text, e.g. {@code 00:01:02.345}
   * @return the offset in milliseconds
   * @throws MalformedTimestampException if the text is not a valid timestamp
   */
  public static long parse(String value) {
    if (value == null) {
      throw new MalformedTimestampException("null");
    }
    Matcher matcher = CELL_PATTERN.matcher(value.trim());
    if (!matcher.matches()) {
      throw new MalformedTimestampException(value);
    }

    int hours = Integer.parseInt(matcher.group(1));
    int minutes = Integer.parseInt(matcher.group(2));
    int seconds = Integer.parseInt(matcher.group(3));
    int millis = Integer.parseInt(matcher.group(4));
    if (minutes > 59 || seconds > 59) {
      throw new MalformedTimestampException(value);
    }

    return ((hours * 60L + minutes) * 60L + seconds) * 1000L + millis;
  }

  /** Format milliseconds as {@code HH:mm:ss.SSS}. */
  public static String format(long millis) {
    return format(millis, '.');
  }

  /**
   * Format milliseconds as {@code HH:mm:ss<separator>SSS}.
   *
   * <p>SRT uses a comma separator, the cell format a dot.
   */
  public static String format(long millis, char separator) {
    long hours = millis / 3_600_000;
    long minutes = (millis % 3_600_000) / 60_000;
    long seconds = (millis % 60_000) / 1000;
    long ms = millis % 1000;

    return String.format("%02d:%02d:%02d%c%03d", hours, minutes, seconds, separator, ms);
  }
}

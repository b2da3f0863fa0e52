package com.scholary.subtitle.batch.codec;

import java.nio.file.Path;
import java.util.Locale;

/** On-disk subtitle formats. */
public enum SubtitleFormat {
  SRT("srt"),
  ASS("ass"),
  JSON("json");

  private final String extension;

  SubtitleFormat(String extension) {
    this.extension = extension;
  }

  public String extension() {
    return extension;
  }

  /**
   * Resolve the format from a file name extension.
   *
   * @throws UnsupportedFormatException if the extension is not a known subtitle format
   */
  public static SubtitleFormat fromPath(Path path) {
    String name = path.getFileName().toString();
    int dot = name.lastIndexOf('.');
    String ext = dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    for (SubtitleFormat format : values()) {
      if (format.extension.equals(ext)) {
        return format;
      }
    }
    throw new UnsupportedFormatException("Unsupported subtitle file type: " + name);
  }
}

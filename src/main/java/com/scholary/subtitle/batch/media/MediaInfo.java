package com.scholary.subtitle.batch.media;

import java.time.Duration;

/**
 * Metadata of a job's source file.
 *
 * @param fileName file name without directories
 * @param sizeBytes file size
 * @param duration media duration, null for subtitle files
 * @param hasVideo whether the file carries a video stream
 */
public record MediaInfo(String fileName, long sizeBytes, Duration duration, boolean hasVideo) {

  public static MediaInfo ofSubtitle(String fileName, long sizeBytes) {
    return new MediaInfo(fileName, sizeBytes, null, false);
  }
}

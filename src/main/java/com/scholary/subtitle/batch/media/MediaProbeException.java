package com.scholary.subtitle.batch.media;

/** Thrown when ffprobe cannot read a source file. */
public class MediaProbeException extends RuntimeException {

  public MediaProbeException(String message) {
    super(message);
  }

  public MediaProbeException(String message, Throwable cause) {
    super(message, cause);
  }
}

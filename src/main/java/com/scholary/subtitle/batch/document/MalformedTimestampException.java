package com.scholary.subtitle.batch.document;

/** Thrown when a time cell value does not match {@code HH:mm:ss.SSS}. */
public class MalformedTimestampException extends DocumentEditException {

  public MalformedTimestampException(String value) {
    super(String.format("Malformed timestamp '%s', expected HH:mm:ss.SSS", value));
  }
}

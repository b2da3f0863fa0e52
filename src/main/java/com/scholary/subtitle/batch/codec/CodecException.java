package com.scholary.subtitle.batch.codec;

/** Thrown when a subtitle file cannot be read, parsed or written. */
public class CodecException extends RuntimeException {

  public CodecException(String message) {
    super(message);
  }

  public CodecException(String message, Throwable cause) {
    super(message, cause);
  }
}

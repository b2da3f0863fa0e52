package com.scholary.subtitle.batch.codec;

/** Thrown when a file extension does not name a supported subtitle format. */
public class UnsupportedFormatException extends CodecException {

  public UnsupportedFormatException(String message) {
    super(message);
  }
}

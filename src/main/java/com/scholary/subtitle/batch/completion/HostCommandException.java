package com.scholary.subtitle.batch.completion;

/** Thrown when a host power command cannot be started. */
public class HostCommandException extends RuntimeException {

  public HostCommandException(String message, Throwable cause) {
    super(message, cause);
  }
}

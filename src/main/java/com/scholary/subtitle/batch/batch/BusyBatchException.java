package com.scholary.subtitle.batch.batch;

/** Thrown when a command conflicts with a running batch or job. */
public class BusyBatchException extends RuntimeException {

  public BusyBatchException(String message) {
    super(message);
  }
}

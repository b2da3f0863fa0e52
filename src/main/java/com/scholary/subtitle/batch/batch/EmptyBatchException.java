package com.scholary.subtitle.batch.batch;

/** Thrown when a batch is started with no jobs in the list. */
public class EmptyBatchException extends RuntimeException {

  public EmptyBatchException() {
    super("No jobs to process");
  }
}

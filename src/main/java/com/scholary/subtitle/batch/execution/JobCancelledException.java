package com.scholary.subtitle.batch.execution;

/** Thrown inside a worker to unwind after cancellation. Never reported as a job failure. */
public class JobCancelledException extends RuntimeException {

  public JobCancelledException() {
    super("Job cancelled");
  }
}

package com.scholary.subtitle.batch.job;

/** Thrown when a command names a job that is not in the list. */
public class JobNotFoundException extends RuntimeException {

  public JobNotFoundException(String jobId) {
    super("Job not found: " + jobId);
  }
}

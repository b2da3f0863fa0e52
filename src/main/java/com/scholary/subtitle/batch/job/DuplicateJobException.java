package com.scholary.subtitle.batch.job;

/** Thrown when a job for the same source file is already in the list. */
public class DuplicateJobException extends RuntimeException {

  private final String jobId;

  public DuplicateJobException(String jobId) {
    super("A job for this file already exists: " + jobId);
    this.jobId = jobId;
  }

  public String getJobId() {
    return jobId;
  }
}

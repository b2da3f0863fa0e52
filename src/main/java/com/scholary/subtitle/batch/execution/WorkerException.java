package com.scholary.subtitle.batch.execution;

/**
 * Failure of an external collaborator while a job runs.
 *
 * <p>Reported asynchronously: the job is marked FAILED and the batch moves on.
 */
public class WorkerException extends RuntimeException {

  public WorkerException(String message) {
    super(message);
  }

  public WorkerException(String message, Throwable cause) {
    super(message, cause);
  }
}

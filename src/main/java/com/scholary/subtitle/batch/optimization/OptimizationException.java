package com.scholary.subtitle.batch.optimization;

import com.scholary.subtitle.batch.execution.WorkerException;

/** Exception thrown when the LLM backend fails or returns an unusable answer. */
public class OptimizationException extends WorkerException {

  public OptimizationException(String message) {
    super(message);
  }

  public OptimizationException(String message, Throwable cause) {
    super(message, cause);
  }
}

package com.scholary.subtitle.batch.completion;

/** What happens once a batch has no work left. */
public enum CompletionPolicy {
  DO_NOTHING,
  EXIT_PROCESS,
  SUSPEND_HOST,
  SHUTDOWN_HOST;

  /** Whether the action waits out a grace period that the host can abort. */
  public boolean isDeferred() {
    return this == SUSPEND_HOST || this == SHUTDOWN_HOST;
  }
}

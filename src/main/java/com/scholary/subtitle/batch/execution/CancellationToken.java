package com.scholary.subtitle.batch.execution;

/**
 * Cooperative stop signal handed to a worker when it starts.
 *
 * <p>Workers poll it between units of work; blocking calls are also interrupted when the job is
 * cancelled.
 */
public final class CancellationToken {

  private volatile boolean cancelled;

  public void cancel() {
    cancelled = true;
  }

  public boolean isCancelled() {
    return cancelled;
  }

  /**
   * @throws JobCancelledException if cancellation was requested
   */
  public void throwIfCancelled() {
    if (cancelled) {
      throw new JobCancelledException();
    }
  }
}

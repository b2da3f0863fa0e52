package com.scholary.subtitle.batch.events;

import com.scholary.subtitle.batch.completion.CompletionPolicy;
import com.scholary.subtitle.batch.job.JobSnapshot;
import java.time.Instant;

/**
 * Observer of job and batch events. Called on the control thread; implementations must not block.
 */
public interface BatchEventListener {

  default void jobStarted(JobSnapshot job) {}

  default void jobProgress(JobSnapshot job) {}

  default void jobFinished(JobSnapshot job) {}

  default void jobFailed(JobSnapshot job, String message) {}

  default void jobCancelled(JobSnapshot job) {}

  default void batchStarted(int jobCount) {}

  /** The batch ran out of work. Fired exactly once per started batch that is not cancelled. */
  default void batchFinished() {}

  default void batchCancelled() {}

  /**
   * A completion action was triggered.
   *
   * @param executeAt when the action runs, or null if it ran immediately
   */
  default void completionAction(CompletionPolicy policy, Instant executeAt) {}

  default void completionActionAborted(CompletionPolicy policy) {}
}

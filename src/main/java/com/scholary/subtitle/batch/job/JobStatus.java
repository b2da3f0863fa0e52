package com.scholary.subtitle.batch.job;

/**
 * Lifecycle states of a {@link SubtitleJob}.
 *
 * <pre>
 * PENDING -> {TRANSCRIBING | OPTIMIZING | GENERATING} -> {COMPLETED | FAILED}
 * </pre>
 *
 * <p>The three in-progress states may follow each other as a pipeline moves through its stages.
 * Cancel and reset force a job back to PENDING.
 */
public enum JobStatus {
  PENDING,
  TRANSCRIBING,
  OPTIMIZING,
  GENERATING,
  COMPLETED,
  FAILED;

  public boolean isRunning() {
    return this == TRANSCRIBING || this == OPTIMIZING || this == GENERATING;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }
}

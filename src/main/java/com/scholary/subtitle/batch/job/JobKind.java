package com.scholary.subtitle.batch.job;

/** What a job does with its source file. */
public enum JobKind {
  /** Transcribe, optionally optimize, then burn the subtitle into the video. */
  SUBTITLE_PIPELINE(JobStatus.TRANSCRIBING),
  TRANSCRIPTION_ONLY(JobStatus.TRANSCRIBING),
  /** Source is an existing subtitle file. */
  OPTIMIZATION_ONLY(JobStatus.OPTIMIZING);

  private final JobStatus initialStatus;

  JobKind(JobStatus initialStatus) {
    this.initialStatus = initialStatus;
  }

  /** The in-progress state a job of this kind enters when started. */
  public JobStatus initialStatus() {
    return initialStatus;
  }
}

package com.scholary.subtitle.batch.execution;

import com.scholary.subtitle.batch.document.SubtitleEntry;
import com.scholary.subtitle.batch.job.JobStatus;
import java.util.List;
import java.util.Map;

/**
 * Receives a worker's notifications on the control thread.
 *
 * <p>Exactly one of {@link #onSuccess} and {@link #onError} is called per launch, unless the job
 * is cancelled first, in which case neither is.
 */
public interface JobEventSink {

  default void onProgress(int percent, String message) {}

  default void onStage(JobStatus stage) {}

  default void onPartialUpdate(Map<Integer, String> texts) {}

  default void onFullUpdate(List<SubtitleEntry> entries) {}

  void onSuccess(JobOutcome outcome);

  void onError(String message, Throwable cause);
}

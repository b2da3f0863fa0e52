package com.scholary.subtitle.batch.transcription;

import com.scholary.subtitle.batch.document.SubtitleDocument;
import com.scholary.subtitle.batch.execution.WorkerContext;
import com.scholary.subtitle.batch.job.SubtitleJob;

/** Speech-to-text backend. Called on a worker thread. */
public interface Transcriber {

  /**
   * Transcribe the job's source file.
   *
   * @return a document holding the original text of each segment
   * @throws TranscriptionException if the backend fails
   * @throws com.scholary.subtitle.batch.execution.JobCancelledException if cancelled
   */
  SubtitleDocument transcribe(SubtitleJob job, WorkerContext context);
}

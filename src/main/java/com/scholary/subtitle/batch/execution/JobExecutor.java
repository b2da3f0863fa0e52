package com.scholary.subtitle.batch.execution;

import com.scholary.subtitle.batch.job.JobKind;
import com.scholary.subtitle.batch.job.SubtitleJob;

/**
 * Runs one kind of job on a worker thread.
 *
 * <p>Implementations read only the job's immutable fields (source, kind, parameters, media info)
 * and report everything else through the context.
 */
public interface JobExecutor {

  JobKind kind();

  /**
   * @throws JobCancelledException if the token was cancelled
   * @throws RuntimeException on any failure, reported as the job's error message
   */
  JobOutcome execute(SubtitleJob job, WorkerContext context);
}

package com.scholary.subtitle.batch.optimization;

import com.scholary.subtitle.batch.document.SubtitleDocument;
import com.scholary.subtitle.batch.execution.WorkerContext;
import com.scholary.subtitle.batch.job.SubtitleJob;

/** Text optimization and translation backend. Called on a worker thread. */
public interface SubtitleOptimizer {

  /**
   * Optimize a document.
   *
   * <p>The input document belongs to the caller and is not modified. Intermediate results are
   * reported through {@link WorkerContext#partialUpdate} and {@link WorkerContext#fullUpdate}.
   *
   * @param prompt extra instructions, may be blank
   * @return the optimized document
   * @throws OptimizationException if the backend fails
   */
  SubtitleDocument optimize(
      SubtitleJob job, SubtitleDocument document, String prompt, WorkerContext context);
}

package com.scholary.subtitle.batch.execution;

import com.scholary.subtitle.batch.document.SubtitleEntry;
import com.scholary.subtitle.batch.job.JobStatus;
import java.util.List;
import java.util.Map;

/**
 * Reporting channel of a running worker.
 *
 * <p>Every call is posted to the control thread and returns immediately. Reports made after the
 * job was cancelled are dropped.
 */
public interface WorkerContext {

  CancellationToken token();

  /** Percent done within the current stage, 0-100. */
  void progress(int percent, String message);

  /** The pipeline moved to another in-progress stage. */
  void stage(JobStatus stage);

  /** New texts for some entries, by key. */
  void partialUpdate(Map<Integer, String> texts);

  /** Replacement of the whole entry list. */
  void fullUpdate(List<SubtitleEntry> entries);

  default void checkCancelled() {
    token().throwIfCancelled();
  }
}

package com.scholary.subtitle.batch.batch;

import com.scholary.subtitle.batch.job.SubtitleJob;

/** Continuation run on the control thread when a started job completes or fails. */
@FunctionalInterface
public interface JobTerminalListener {

  void jobTerminal(SubtitleJob job);
}

package com.scholary.subtitle.batch.render;

import com.scholary.subtitle.batch.execution.WorkerContext;
import com.scholary.subtitle.batch.job.SubtitleJob;
import java.nio.file.Path;

/** Burns a subtitle file into the job's source video. Called on a worker thread. */
public interface SubtitleRenderer {

  /**
   * @return the rendered video
   * @throws RenderException if rendering fails
   */
  Path render(SubtitleJob job, Path subtitleFile, WorkerContext context);
}

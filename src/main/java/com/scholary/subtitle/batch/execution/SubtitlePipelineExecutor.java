package com.scholary.subtitle.batch.execution;

import com.scholary.subtitle.batch.codec.DocumentCodec;
import com.scholary.subtitle.batch.codec.SubtitleLayout;
import com.scholary.subtitle.batch.document.SubtitleDocument;
import com.scholary.subtitle.batch.job.JobKind;
import com.scholary.subtitle.batch.job.JobParameters;
import com.scholary.subtitle.batch.job.JobStatus;
import com.scholary.subtitle.batch.job.SubtitleJob;
import com.scholary.subtitle.batch.optimization.SubtitleOptimizer;
import com.scholary.subtitle.batch.render.SubtitleRenderer;
import com.scholary.subtitle.batch.transcription.Transcriber;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Full pipeline: transcribe, optionally optimize, then burn the subtitle into the video.
 *
 * <p>Reports TRANSCRIBING, OPTIMIZING and GENERATING as it moves through the stages. Stages that
 * the parameters switch off are skipped, and rendering is skipped for sources without video.
 */
@Component
public class SubtitlePipelineExecutor implements JobExecutor {

  private static final Logger LOGGER = LoggerFactory.getLogger(SubtitlePipelineExecutor.class);

  private final Transcriber transcriber;
  private final SubtitleOptimizer optimizer;
  private final SubtitleRenderer renderer;
  private final DocumentCodec codec;

  public SubtitlePipelineExecutor(
      Transcriber transcriber,
      SubtitleOptimizer optimizer,
      SubtitleRenderer renderer,
      DocumentCodec codec) {
    this.transcriber = transcriber;
    this.optimizer = optimizer;
    this.renderer = renderer;
    this.codec = codec;
  }

  @Override
  public JobKind kind() {
    return JobKind.SUBTITLE_PIPELINE;
  }

  @Override
  public JobOutcome execute(SubtitleJob job, WorkerContext context) {
    JobParameters parameters = job.getParameters();

    SubtitleDocument document = transcriber.transcribe(job, context);
    context.checkCancelled();
    Path subtitlePath = SubtitleOutputs.subtitlePath(job);
    codec.save(
        document, subtitlePath, parameters.outputFormat(), SubtitleLayout.ORIGINAL_ONLY, null);
    LOGGER.info("Transcript saved: id={}, path={}", job.getId(), subtitlePath);

    Path optimizedPath = null;
    if (parameters.optimize() || parameters.translate() || parameters.split()) {
      context.stage(JobStatus.OPTIMIZING);
      document = optimizer.optimize(job, document, parameters.prompt(), context);
      context.checkCancelled();
      optimizedPath = SubtitleOutputs.optimizedSubtitlePath(job);
      codec.save(document, optimizedPath, parameters.outputFormat(), parameters.layout(), null);
      LOGGER.info("Optimized subtitle saved: id={}, path={}", job.getId(), optimizedPath);
    }

    Path renderedPath = null;
    boolean hasVideo = job.getMediaInfo() != null && job.getMediaInfo().hasVideo();
    if (parameters.burnSubtitles() && hasVideo) {
      context.stage(JobStatus.GENERATING);
      renderedPath =
          renderer.render(job, optimizedPath != null ? optimizedPath : subtitlePath, context);
    } else if (parameters.burnSubtitles()) {
      LOGGER.info("Skipping render, source has no video stream: id={}", job.getId());
    }

    return new JobOutcome(subtitlePath, optimizedPath, renderedPath, document);
  }
}

package com.scholary.subtitle.batch.execution;

import com.scholary.subtitle.batch.codec.DocumentCodec;
import com.scholary.subtitle.batch.document.SubtitleDocument;
import com.scholary.subtitle.batch.job.JobKind;
import com.scholary.subtitle.batch.job.JobParameters;
import com.scholary.subtitle.batch.job.SubtitleJob;
import com.scholary.subtitle.batch.optimization.SubtitleOptimizer;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Loads an existing subtitle file, optimizes it and saves the result next to it. */
@Component
public class OptimizationJobExecutor implements JobExecutor {

  private static final Logger LOGGER = LoggerFactory.getLogger(OptimizationJobExecutor.class);

  private final SubtitleOptimizer optimizer;
  private final DocumentCodec codec;

  public OptimizationJobExecutor(SubtitleOptimizer optimizer, DocumentCodec codec) {
    this.optimizer = optimizer;
    this.codec = codec;
  }

  @Override
  public JobKind kind() {
    return JobKind.OPTIMIZATION_ONLY;
  }

  @Override
  public JobOutcome execute(SubtitleJob job, WorkerContext context) {
    JobParameters parameters = job.getParameters();
    SubtitleDocument source = codec.load(job.getSource());
    context.progress(0, "Loaded " + source.size() + " entries");

    SubtitleDocument optimized = optimizer.optimize(job, source, parameters.prompt(), context);
    context.checkCancelled();

    Path output = SubtitleOutputs.optimizedSubtitlePath(job);
    codec.save(optimized, output, parameters.outputFormat(), parameters.layout(), null);
    LOGGER.info("Optimized subtitle saved: id={}, path={}", job.getId(), output);

    return new JobOutcome(job.getSource(), output, null, optimized);
  }
}

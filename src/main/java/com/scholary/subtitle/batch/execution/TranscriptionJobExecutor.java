package com.scholary.subtitle.batch.execution;

import com.scholary.subtitle.batch.codec.DocumentCodec;
import com.scholary.subtitle.batch.codec.SubtitleLayout;
import com.scholary.subtitle.batch.document.SubtitleDocument;
import com.scholary.subtitle.batch.job.JobKind;
import com.scholary.subtitle.batch.job.SubtitleJob;
import com.scholary.subtitle.batch.transcription.Transcriber;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Transcribes the source and saves the raw transcript. */
@Component
public class TranscriptionJobExecutor implements JobExecutor {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionJobExecutor.class);

  private final Transcriber transcriber;
  private final DocumentCodec codec;

  public TranscriptionJobExecutor(Transcriber transcriber, DocumentCodec codec) {
    this.transcriber = transcriber;
    this.codec = codec;
  }

  @Override
  public JobKind kind() {
    return JobKind.TRANSCRIPTION_ONLY;
  }

  @Override
  public JobOutcome execute(SubtitleJob job, WorkerContext context) {
    SubtitleDocument document = transcriber.transcribe(job, context);
    context.checkCancelled();

    Path subtitlePath = SubtitleOutputs.subtitlePath(job);
    codec.save(
        document,
        subtitlePath,
        job.getParameters().outputFormat(),
        SubtitleLayout.ORIGINAL_ONLY,
        null);
    LOGGER.info(
        "Transcript saved: id={}, path={}, entries={}",
        job.getId(),
        subtitlePath,
        document.size());

    return new JobOutcome(subtitlePath, null, null, document);
  }
}

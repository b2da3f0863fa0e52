package com.scholary.subtitle.batch.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.scholary.subtitle.batch.codec.DocumentCodec;
import com.scholary.subtitle.batch.codec.SubtitleFormat;
import com.scholary.subtitle.batch.codec.SubtitleLayout;
import com.scholary.subtitle.batch.document.SubtitleDocument;
import com.scholary.subtitle.batch.document.SubtitleEntry;
import com.scholary.subtitle.batch.job.JobKind;
import com.scholary.subtitle.batch.job.JobParameters;
import com.scholary.subtitle.batch.job.JobStatus;
import com.scholary.subtitle.batch.job.SubtitleJob;
import com.scholary.subtitle.batch.media.MediaInfo;
import com.scholary.subtitle.batch.optimization.SubtitleOptimizer;
import com.scholary.subtitle.batch.render.RenderException;
import com.scholary.subtitle.batch.render.SubtitleRenderer;
import com.scholary.subtitle.batch.transcription.Transcriber;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class SubtitlePipelineExecutorTest {

  private Transcriber transcriber;
  private SubtitleOptimizer optimizer;
  private SubtitleRenderer renderer;
  private DocumentCodec codec;
  private WorkerContext context;
  private SubtitlePipelineExecutor executor;

  private final SubtitleDocument transcript =
      new SubtitleDocument(List.of(SubtitleEntry.of(0, 1000, "hello")));
  private final SubtitleDocument optimized =
      new SubtitleDocument(List.of(new SubtitleEntry(0, 1000, "Hello.", "Hallo.")));

  @BeforeEach
  void setUp() {
    transcriber = mock(Transcriber.class);
    optimizer = mock(SubtitleOptimizer.class);
    renderer = mock(SubtitleRenderer.class);
    codec = mock(DocumentCodec.class);
    context = mock(WorkerContext.class);
    executor = new SubtitlePipelineExecutor(transcriber, optimizer, renderer, codec);
  }

  private static JobParameters parameters(boolean optimize, boolean burn) {
    return new JobParameters(
        "",
        optimize,
        false,
        false,
        0,
        0,
        "be concise",
        SubtitleLayout.TRANSLATED_ABOVE,
        SubtitleFormat.SRT,
        0,
        0,
        "",
        burn);
  }

  private static SubtitleJob job(JobParameters parameters, boolean hasVideo) {
    return new SubtitleJob(
        Path.of("/videos/talk.mp4"),
        JobKind.SUBTITLE_PIPELINE,
        parameters,
        new MediaInfo("talk.mp4", 100, Duration.ofMinutes(1), hasVideo));
  }

  @Test
  void execute_shouldRunAllStagesInOrder() {
    SubtitleJob job = job(parameters(true, true), true);
    Path subtitle = Path.of("/videos/talk.srt").toAbsolutePath();
    Path optimizedPath = Path.of("/videos/talk_optimized.srt").toAbsolutePath();
    Path rendered = Path.of("/videos/talk_subtitled.mp4").toAbsolutePath();
    when(transcriber.transcribe(job, context)).thenReturn(transcript);
    when(optimizer.optimize(job, transcript, "be concise", context)).thenReturn(optimized);
    when(renderer.render(job, optimizedPath, context)).thenReturn(rendered);

    JobOutcome outcome = executor.execute(job, context);

    assertThat(outcome.subtitlePath()).isEqualTo(subtitle);
    assertThat(outcome.optimizedSubtitlePath()).isEqualTo(optimizedPath);
    assertThat(outcome.renderedVideoPath()).isEqualTo(rendered);
    assertThat(outcome.document()).isSameAs(optimized);

    InOrder order = inOrder(codec, context, renderer);
    order
        .verify(codec)
        .save(transcript, subtitle, SubtitleFormat.SRT, SubtitleLayout.ORIGINAL_ONLY, null);
    order.verify(context).stage(JobStatus.OPTIMIZING);
    order
        .verify(codec)
        .save(optimized, optimizedPath, SubtitleFormat.SRT, SubtitleLayout.TRANSLATED_ABOVE, null);
    order.verify(context).stage(JobStatus.GENERATING);
    order.verify(renderer).render(job, optimizedPath, context);
  }

  @Test
  void execute_shouldSkipOptimizationWhenSwitchedOff() {
    SubtitleJob job = job(parameters(false, true), true);
    when(transcriber.transcribe(job, context)).thenReturn(transcript);

    JobOutcome outcome = executor.execute(job, context);

    assertThat(outcome.optimizedSubtitlePath()).isNull();
    verifyNoInteractions(optimizer);
    verify(renderer).render(eq(job), eq(outcome.subtitlePath()), eq(context));
  }

  @Test
  void execute_shouldSkipRenderWithoutVideoStream() {
    SubtitleJob job = job(parameters(false, true), false);
    when(transcriber.transcribe(job, context)).thenReturn(transcript);

    JobOutcome outcome = executor.execute(job, context);

    assertThat(outcome.renderedVideoPath()).isNull();
    verifyNoInteractions(renderer);
    verify(context, never()).stage(JobStatus.GENERATING);
  }

  @Test
  void execute_shouldPropagateRenderFailure() {
    SubtitleJob job = job(parameters(false, true), true);
    when(transcriber.transcribe(job, context)).thenReturn(transcript);
    when(renderer.render(any(), any(), any()))
        .thenThrow(new RenderException("ffmpeg failed with exit code 1"));

    assertThatThrownBy(() -> executor.execute(job, context))
        .isInstanceOf(RenderException.class)
        .hasMessage("ffmpeg failed with exit code 1");
  }
}

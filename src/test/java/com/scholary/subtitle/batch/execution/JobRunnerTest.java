package com.scholary.subtitle.batch.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.subtitle.batch.control.DirectControlThread;
import com.scholary.subtitle.batch.document.SubtitleEntry;
import com.scholary.subtitle.batch.job.JobKind;
import com.scholary.subtitle.batch.job.JobParameters;
import com.scholary.subtitle.batch.job.JobStatus;
import com.scholary.subtitle.batch.job.SubtitleJob;
import com.scholary.subtitle.batch.media.MediaInfo;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.support.TaskExecutorAdapter;

class JobRunnerTest {

  private final Deque<Runnable> workerTasks = new ArrayDeque<>();
  private JobRunner runner;
  private RecordingSink sink;
  private SubtitleJob job;

  @BeforeEach
  void setUp() {
    runner =
        new JobRunner(
            new TaskExecutorAdapter(workerTasks::add), new DirectControlThread(), List.of());
    sink = new RecordingSink();
    job =
        new SubtitleJob(
            Path.of("/subs/talk.srt"),
            JobKind.OPTIMIZATION_ONLY,
            JobParameters.defaults(),
            MediaInfo.ofSubtitle("talk.srt", 10));
  }

  private void runWorkers() {
    while (!workerTasks.isEmpty()) {
      workerTasks.poll().run();
    }
  }

  @Test
  void launch_shouldRunTaskOnWorkerAndPostSuccess() {
    JobOutcome outcome = new JobOutcome(Path.of("/subs/talk_optimized.srt"), null, null, null);

    runner.launch(
        new RunningJob(job),
        sink,
        context -> {
          context.stage(JobStatus.OPTIMIZING);
          context.progress(50, "half");
          context.partialUpdate(Map.of(1, "text"));
          context.fullUpdate(List.of(SubtitleEntry.of(0, 100, "a")));
          return outcome;
        });

    assertThat(sink.events).isEmpty();
    runWorkers();

    assertThat(sink.events)
        .containsExactly("stage:OPTIMIZING", "progress:50:half", "partial:1", "full:1", "success");
    assertThat(sink.outcome).isSameAs(outcome);
  }

  @Test
  void launch_shouldReportWorkerFailure() {
    runner.launch(
        new RunningJob(job),
        sink,
        context -> {
          throw new WorkerException("Transcription backend returned 500");
        });
    runWorkers();

    assertThat(sink.events).containsExactly("error:Transcription backend returned 500");
  }

  @Test
  void launch_shouldDropNotificationsAfterCancel() {
    RunningJob handle = new RunningJob(job);

    runner.launch(
        handle,
        sink,
        context -> {
          handle.cancel();
          context.progress(10, "late");
          return new JobOutcome(null, null, null, null);
        });
    runWorkers();

    assertThat(sink.events).isEmpty();
  }

  @Test
  void launch_shouldNotRunTaskCancelledBeforeStart() {
    RunningJob handle = new RunningJob(job);
    List<String> ran = new ArrayList<>();

    runner.launch(
        handle,
        sink,
        context -> {
          ran.add("ran");
          return new JobOutcome(null, null, null, null);
        });
    handle.cancel();
    runWorkers();

    assertThat(ran).isEmpty();
    assertThat(sink.events).isEmpty();
  }

  @Test
  void launch_shouldReportRejectedSubmission() {
    JobRunner rejecting =
        new JobRunner(
            new TaskExecutorAdapter(
                task -> {
                  throw new RejectedExecutionException("queue full");
                }),
            new DirectControlThread(),
            List.of());

    rejecting.launch(new RunningJob(job), sink, context -> null);

    assertThat(sink.events).containsExactly("error:Worker pool is full, job was not started");
  }

  @Test
  void launch_shouldRejectKindWithoutExecutor() {
    assertThatThrownBy(() -> runner.launch(new RunningJob(job), sink))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("OPTIMIZATION_ONLY");
  }

  @Test
  void launch_shouldDispatchByJobKind() {
    JobOutcome outcome = new JobOutcome(null, null, null, null);
    JobExecutor executor =
        new JobExecutor() {
          @Override
          public JobKind kind() {
            return JobKind.OPTIMIZATION_ONLY;
          }

          @Override
          public JobOutcome execute(SubtitleJob target, WorkerContext context) {
            return outcome;
          }
        };
    JobRunner dispatching =
        new JobRunner(
            new TaskExecutorAdapter(workerTasks::add),
            new DirectControlThread(),
            List.of(executor));

    dispatching.launch(new RunningJob(job), sink);
    runWorkers();

    assertThat(sink.outcome).isSameAs(outcome);
  }

  @Test
  void messageOf_shouldFallBackToExceptionName() {
    assertThat(JobRunner.messageOf(new IllegalStateException())).isEqualTo("IllegalStateException");
    assertThat(JobRunner.messageOf(new IllegalStateException("bad"))).isEqualTo("bad");
  }

  private static final class RecordingSink implements JobEventSink {
    final List<String> events = new ArrayList<>();
    final Map<Integer, String> texts = new HashMap<>();
    JobOutcome outcome;

    @Override
    public void onProgress(int percent, String message) {
      events.add("progress:" + percent + ":" + message);
    }

    @Override
    public void onStage(JobStatus stage) {
      events.add("stage:" + stage);
    }

    @Override
    public void onPartialUpdate(Map<Integer, String> update) {
      texts.putAll(update);
      events.add("partial:" + update.size());
    }

    @Override
    public void onFullUpdate(List<SubtitleEntry> entries) {
      events.add("full:" + entries.size());
    }

    @Override
    public void onSuccess(JobOutcome result) {
      outcome = result;
      events.add("success");
    }

    @Override
    public void onError(String message, Throwable cause) {
      events.add("error:" + message);
    }
  }
}

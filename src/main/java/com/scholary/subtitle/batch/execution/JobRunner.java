package com.scholary.subtitle.batch.execution;

import com.scholary.subtitle.batch.control.ControlThread;
import com.scholary.subtitle.batch.document.SubtitleEntry;
import com.scholary.subtitle.batch.job.JobKind;
import com.scholary.subtitle.batch.job.JobStatus;
import com.scholary.subtitle.batch.job.SubtitleJob;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Launches job workers on the worker pool and routes their notifications back to the control
 * thread.
 *
 * <p>Notifications are delivered to the sink only while the job's token is not cancelled, so a
 * worker that keeps going after cancellation cannot touch orchestration state.
 */
@Component
public class JobRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobRunner.class);

  private final AsyncTaskExecutor workerExecutor;
  private final ControlThread controlThread;
  private final Map<JobKind, JobExecutor> executors = new EnumMap<>(JobKind.class);

  public JobRunner(
      @Qualifier("workerExecutor") AsyncTaskExecutor workerExecutor,
      ControlThread controlThread,
      List<JobExecutor> jobExecutors) {
    this.workerExecutor = workerExecutor;
    this.controlThread = controlThread;
    for (JobExecutor executor : jobExecutors) {
      executors.put(executor.kind(), executor);
    }
  }

  /** Launch the executor registered for the job's kind. */
  public void launch(RunningJob running, JobEventSink sink) {
    SubtitleJob job = running.job();
    JobExecutor executor = executors.get(job.getKind());
    if (executor == null) {
      throw new IllegalStateException("No executor for job kind " + job.getKind());
    }
    launch(running, sink, context -> executor.execute(job, context));
  }

  /**
   * Launch arbitrary work on behalf of a job.
   *
   * <p>Never throws for a full pool; a rejected submission is reported through {@link
   * JobEventSink#onError} like any other failure.
   */
  public void launch(RunningJob running, JobEventSink sink, WorkerTask task) {
    SubtitleJob job = running.job();
    CancellationToken token = running.token();
    WorkerContext context = new PostingWorkerContext(token, sink);

    try {
      Future<?> future = workerExecutor.submit(() -> runWorker(job, token, sink, task, context));
      running.attach(future);
    } catch (RejectedExecutionException e) {
      LOGGER.error("Worker pool rejected job: id={}", job.getId(), e);
      post(token, () -> sink.onError("Worker pool is full, job was not started", e));
    }
  }

  private void runWorker(
      SubtitleJob job,
      CancellationToken token,
      JobEventSink sink,
      WorkerTask task,
      WorkerContext context) {
    try {
      token.throwIfCancelled();
      JobOutcome outcome = task.run(context);
      post(token, () -> sink.onSuccess(outcome));
    } catch (JobCancelledException e) {
      LOGGER.info("Worker stopped after cancellation: id={}", job.getId());
    } catch (RuntimeException e) {
      if (token.isCancelled()) {
        LOGGER.info("Worker ended after cancellation: id={}, error={}", job.getId(), e.toString());
        return;
      }
      LOGGER.error("Worker failed: id={}", job.getId(), e);
      post(token, () -> sink.onError(messageOf(e), e));
    } catch (Error e) {
      // The executor's future would swallow this; the job still has to end.
      LOGGER.error("Worker died: id={}", job.getId(), e);
      post(token, () -> sink.onError(messageOf(e), e));
      if (e instanceof VirtualMachineError) {
        throw e;
      }
    }
  }

  private void post(CancellationToken token, Runnable notification) {
    controlThread.execute(
        () -> {
          if (!token.isCancelled()) {
            notification.run();
          }
        });
  }

  static String messageOf(Throwable error) {
    String message = error.getMessage();
    return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
  }

  private final class PostingWorkerContext implements WorkerContext {

    private final CancellationToken token;
    private final JobEventSink sink;

    PostingWorkerContext(CancellationToken token, JobEventSink sink) {
      this.token = token;
      this.sink = sink;
    }

    @Override
    public CancellationToken token() {
      return token;
    }

    @Override
    public void progress(int percent, String message) {
      post(token, () -> sink.onProgress(percent, message));
    }

    @Override
    public void stage(JobStatus stage) {
      post(token, () -> sink.onStage(stage));
    }

    @Override
    public void partialUpdate(Map<Integer, String> texts) {
      Map<Integer, String> copy = Map.copyOf(texts);
      post(token, () -> sink.onPartialUpdate(copy));
    }

    @Override
    public void fullUpdate(List<SubtitleEntry> entries) {
      List<SubtitleEntry> copy = List.copyOf(entries);
      post(token, () -> sink.onFullUpdate(copy));
    }
  }
}

package com.scholary.subtitle.batch.batch;

import com.scholary.subtitle.batch.events.BatchEventPublisher;
import com.scholary.subtitle.batch.execution.JobEventSink;
import com.scholary.subtitle.batch.execution.JobOutcome;
import com.scholary.subtitle.batch.execution.JobRunner;
import com.scholary.subtitle.batch.execution.RunningJob;
import com.scholary.subtitle.batch.job.JobStatus;
import com.scholary.subtitle.batch.job.SubtitleJob;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Starts and cancels individual jobs and applies their worker notifications.
 *
 * <p>Tracks the handle of every dispatched job. A notification is applied only while its handle is
 * still the one registered for the job, so reports from a cancelled or superseded worker are
 * dropped. Used on the control thread only.
 */
@Component
public class JobLifecycle {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobLifecycle.class);

  private final JobRunner runner;
  private final BatchEventPublisher events;
  private final Map<String, RunningJob> dispatched = new LinkedHashMap<>();

  public JobLifecycle(JobRunner runner, BatchEventPublisher events) {
    this.runner = runner;
    this.events = events;
  }

  /**
   * Start a job on the worker pool.
   *
   * <p>A COMPLETED job is not started again; the call is logged as a warning and returns false.
   * Exactly one of success or failure reaches {@code onTerminal}, unless the job is cancelled
   * first.
   *
   * @return true if the job was started
   * @throws IllegalStateException if the job is already dispatched
   */
  public boolean start(SubtitleJob job, JobTerminalListener onTerminal) {
    if (job.getStatus() == JobStatus.COMPLETED) {
      LOGGER.warn("Job already completed, not starting: id={}", job.getId());
      return false;
    }
    if (dispatched.containsKey(job.getId())) {
      throw new IllegalStateException("Job is already running: " + job.getId());
    }

    job.markStarted();
    RunningJob handle = new RunningJob(job);
    dispatched.put(job.getId(), handle);
    LOGGER.debug(
        "Job started: id={}, kind={}, status={}", job.getId(), job.getKind(), job.getStatus());
    events.jobStarted(job.snapshot());

    runner.launch(handle, new LifecycleSink(handle, onTerminal));
    return true;
  }

  /**
   * Stop a job and put it back to PENDING. Does nothing for a job that is not running.
   *
   * @return true if the job was running
   */
  public boolean cancel(SubtitleJob job) {
    RunningJob handle = dispatched.remove(job.getId());
    if (handle == null && !job.getStatus().isRunning()) {
      return false;
    }
    if (handle != null) {
      handle.cancel();
    }
    job.resetToPending();
    LOGGER.debug("Job cancelled: id={}", job.getId());
    events.jobCancelled(job.snapshot());
    return true;
  }

  public boolean isDispatched(SubtitleJob job) {
    return dispatched.containsKey(job.getId());
  }

  public boolean hasRunningJob() {
    return !dispatched.isEmpty();
  }

  private boolean isCurrent(RunningJob handle) {
    return dispatched.get(handle.job().getId()) == handle && !handle.isCancelled();
  }

  private final class LifecycleSink implements JobEventSink {

    private final RunningJob handle;
    private final JobTerminalListener onTerminal;

    LifecycleSink(RunningJob handle, JobTerminalListener onTerminal) {
      this.handle = handle;
      this.onTerminal = onTerminal;
    }

    @Override
    public void onProgress(int percent, String message) {
      if (!isCurrent(handle)) {
        return;
      }
      handle.job().updateProgress(percent, message);
      events.jobProgress(handle.job().snapshot());
    }

    @Override
    public void onStage(JobStatus stage) {
      if (!isCurrent(handle)) {
        return;
      }
      SubtitleJob job = handle.job();
      job.advanceTo(stage);
      job.updateProgress(0, "");
      LOGGER.info("Job stage: id={}, status={}", job.getId(), stage);
      events.jobProgress(job.snapshot());
    }

    @Override
    public void onSuccess(JobOutcome outcome) {
      if (!isCurrent(handle)) {
        return;
      }
      SubtitleJob job = handle.job();
      dispatched.remove(job.getId());
      job.setSubtitlePath(outcome.subtitlePath());
      job.setOptimizedSubtitlePath(outcome.optimizedSubtitlePath());
      job.setRenderedVideoPath(outcome.renderedVideoPath());
      job.markCompleted();
      LOGGER.debug("Job finished: id={}", job.getId());
      events.jobFinished(job.snapshot());
      onTerminal.jobTerminal(job);
    }

    @Override
    public void onError(String message, Throwable cause) {
      if (!isCurrent(handle)) {
        return;
      }
      SubtitleJob job = handle.job();
      dispatched.remove(job.getId());
      job.markFailed(message);
      LOGGER.debug("Job failed: id={}, error={}", job.getId(), message);
      events.jobFailed(job.snapshot(), message);
      onTerminal.jobTerminal(job);
    }
  }
}

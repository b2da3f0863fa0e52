package com.scholary.subtitle.batch.batch;

import com.scholary.subtitle.batch.completion.CompletionActionDispatcher;
import com.scholary.subtitle.batch.completion.CompletionPolicy;
import com.scholary.subtitle.batch.config.BatchProperties;
import com.scholary.subtitle.batch.events.BatchEventPublisher;
import com.scholary.subtitle.batch.job.JobList;
import com.scholary.subtitle.batch.job.SubtitleJob;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs the jobs of the job list one at a time.
 *
 * <p>A started batch runs the first job in list order that is neither COMPLETED nor FAILED. Every
 * time that job ends, the list is scanned again from the top. When nothing runnable is left the
 * batch is finished: the scheduler returns to IDLE, listeners are told, and the completion
 * dispatcher runs the configured policy.
 *
 * <p>Used on the control thread only.
 */
@Component
public class BatchScheduler {

  private static final Logger LOGGER = LoggerFactory.getLogger(BatchScheduler.class);

  private final JobList jobs;
  private final JobLifecycle lifecycle;
  private final CompletionActionDispatcher dispatcher;
  private final BatchEventPublisher events;

  private SchedulerState state = SchedulerState.IDLE;
  private CompletionPolicy policy;

  public BatchScheduler(
      JobList jobs,
      JobLifecycle lifecycle,
      CompletionActionDispatcher dispatcher,
      BatchEventPublisher events,
      BatchProperties properties) {
    this.jobs = jobs;
    this.lifecycle = lifecycle;
    this.dispatcher = dispatcher;
    this.events = events;
    this.policy = properties.completionPolicy();
  }

  /**
   * Start processing the job list.
   *
   * @throws EmptyBatchException if the list is empty
   * @throws BusyBatchException if a batch is active or a job is already running on its own
   */
  public void startBatch() {
    if (jobs.isEmpty()) {
      throw new EmptyBatchException();
    }
    if (state == SchedulerState.ACTIVE) {
      throw new BusyBatchException("A batch is already running");
    }
    if (lifecycle.hasRunningJob()) {
      throw new BusyBatchException("A job is already running");
    }

    state = SchedulerState.ACTIVE;
    LOGGER.debug("Batch started: jobs={}, completionPolicy={}", jobs.size(), policy);
    events.batchStarted(jobs.size());
    advance();
  }

  /** Stop the batch and every running job. Jobs never started stay PENDING. Safe when idle. */
  public void cancelBatch() {
    boolean wasActive = state == SchedulerState.ACTIVE;
    state = SchedulerState.IDLE;
    for (SubtitleJob job : jobs.jobs()) {
      lifecycle.cancel(job);
    }
    if (wasActive) {
      LOGGER.debug("Batch cancelled");
      events.batchCancelled();
    }
  }

  /**
   * Remove a job from the list, cancelling it first if it runs on its own.
   *
   * @throws BusyBatchException while a batch is active
   */
  public SubtitleJob removeJob(String jobId) {
    requireIdle("Cannot remove jobs while a batch is running");
    SubtitleJob job = jobs.require(jobId);
    lifecycle.cancel(job);
    return jobs.remove(jobId);
  }

  /**
   * Empty the job list.
   *
   * @throws BusyBatchException while a batch is active
   */
  public void clearAll() {
    requireIdle("Cannot clear jobs while a batch is running");
    for (SubtitleJob job : jobs.jobs()) {
      lifecycle.cancel(job);
    }
    jobs.clear();
    LOGGER.info("Job list cleared");
  }

  /**
   * Start a single job outside a batch, for instance to reprocess a failed one.
   *
   * @return false if the job is COMPLETED and was not started
   * @throws BusyBatchException if a batch is active or another job is running
   */
  public boolean startJob(String jobId) {
    requireIdle("Cannot start a job while a batch is running");
    SubtitleJob job = jobs.require(jobId);
    if (lifecycle.hasRunningJob()) {
      throw new BusyBatchException("Another job is already running");
    }
    return lifecycle.start(job, finished -> {});
  }

  /**
   * Cancel a single job that runs on its own.
   *
   * @throws BusyBatchException while a batch is active; use {@link #cancelBatch()}
   */
  public boolean cancelJob(String jobId) {
    requireIdle("Cannot cancel a single job while a batch is running");
    return lifecycle.cancel(jobs.require(jobId));
  }

  /**
   * Put a job back to PENDING so it runs again, cancelling it if it runs on its own.
   *
   * @throws BusyBatchException if the job is running under the active batch
   */
  public SubtitleJob resetJob(String jobId) {
    SubtitleJob job = jobs.require(jobId);
    if (state == SchedulerState.ACTIVE && lifecycle.isDispatched(job)) {
      throw new BusyBatchException("Cannot reset a job the batch is running");
    }
    if (!lifecycle.cancel(job)) {
      job.resetToPending();
      events.jobProgress(job.snapshot());
    }
    return job;
  }

  /** The next job a batch would run: the first one in list order that has not ended. */
  public static Optional<SubtitleJob> findNextRunnable(List<SubtitleJob> candidates) {
    return candidates.stream().filter(job -> !job.getStatus().isTerminal()).findFirst();
  }

  public SchedulerState getState() {
    return state;
  }

  public CompletionPolicy getPolicy() {
    return policy;
  }

  public void setPolicy(CompletionPolicy policy) {
    LOGGER.info("Completion policy set: {}", policy);
    this.policy = policy;
  }

  private void advance() {
    Optional<SubtitleJob> next = findNextRunnable(jobs.jobs());
    if (next.isEmpty()) {
      finishBatch();
      return;
    }
    lifecycle.start(next.get(), this::onJobTerminal);
  }

  private void onJobTerminal(SubtitleJob job) {
    if (state != SchedulerState.ACTIVE) {
      return;
    }
    advance();
  }

  private void finishBatch() {
    state = SchedulerState.IDLE;
    LOGGER.debug("Batch finished: jobs={}", jobs.size());
    events.batchFinished();
    dispatcher.dispatch(policy);
  }

  private void requireIdle(String message) {
    if (state == SchedulerState.ACTIVE) {
      throw new BusyBatchException(message);
    }
  }
}

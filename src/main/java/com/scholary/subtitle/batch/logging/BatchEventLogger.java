package com.scholary.subtitle.batch.logging;

import com.scholary.subtitle.batch.completion.CompletionPolicy;
import com.scholary.subtitle.batch.events.BatchEventListener;
import com.scholary.subtitle.batch.job.JobSnapshot;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * Structured logging of batch events with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event is logged with an {@code event_type} field and, for job events, the job id, so
 * the console pattern and log shippers can filter on them.
 */
@Component
public class BatchEventLogger implements BatchEventListener {

  private static final Logger LOGGER = LoggerFactory.getLogger(BatchEventLogger.class);

  @Override
  public void jobStarted(JobSnapshot job) {
    try {
      putJobFields("job_started", job);
      LOGGER.info("Job started: file={}, kind={}", job.fileName(), job.kind());
    } finally {
      clearEventFields();
    }
  }

  @Override
  public void jobProgress(JobSnapshot job) {
    try {
      putJobFields("job_progress", job);
      MDC.put("percentComplete", String.valueOf(job.progress()));
      LOGGER.debug(
          "Job progress: file={}, status={}, progress={}%, message={}",
          job.fileName(),
          job.status(),
          job.progress(),
          job.progressMessage());
    } finally {
      clearEventFields();
    }
  }

  @Override
  public void jobFinished(JobSnapshot job) {
    try {
      putJobFields("job_finished", job);
      LOGGER.info(
          "Job finished: file={}, subtitle={}, optimized={}, video={}",
          job.fileName(),
          job.subtitlePath(),
          job.optimizedSubtitlePath(),
          job.renderedVideoPath());
    } finally {
      clearEventFields();
    }
  }

  @Override
  public void jobFailed(JobSnapshot job, String message) {
    try {
      putJobFields("job_failed", job);
      MDC.put("errorMessage", message);
      LOGGER.error("Job failed: file={}, error={}", job.fileName(), message);
    } finally {
      clearEventFields();
    }
  }

  @Override
  public void jobCancelled(JobSnapshot job) {
    try {
      putJobFields("job_cancelled", job);
      LOGGER.info("Job cancelled: file={}", job.fileName());
    } finally {
      clearEventFields();
    }
  }

  @Override
  public void batchStarted(int jobCount) {
    try {
      MDC.put("event_type", "batch_started");
      MDC.put("jobCount", String.valueOf(jobCount));
      LOGGER.info("Batch started: jobs={}", jobCount);
    } finally {
      clearEventFields();
    }
  }

  @Override
  public void batchFinished() {
    try {
      MDC.put("event_type", "batch_finished");
      LOGGER.info("Batch finished");
    } finally {
      clearEventFields();
    }
  }

  @Override
  public void batchCancelled() {
    try {
      MDC.put("event_type", "batch_cancelled");
      LOGGER.info("Batch cancelled");
    } finally {
      clearEventFields();
    }
  }

  @Override
  public void completionAction(CompletionPolicy policy, Instant executeAt) {
    try {
      MDC.put("event_type", "completion_action");
      MDC.put("policy", policy.name());
      LOGGER.warn(
          "Completion action: policy={}, executeAt={}",
          policy,
          executeAt == null ? "now" : executeAt);
    } finally {
      clearEventFields();
    }
  }

  @Override
  public void completionActionAborted(CompletionPolicy policy) {
    try {
      MDC.put("event_type", "completion_action_aborted");
      MDC.put("policy", policy.name());
      LOGGER.info("Completion action aborted: policy={}", policy);
    } finally {
      clearEventFields();
    }
  }

  private static void putJobFields(String eventType, JobSnapshot job) {
    MDC.put("event_type", eventType);
    MDC.put("jobId", job.id());
    MDC.put("jobKind", job.kind().name());
    MDC.put("jobStatus", job.status().name());
  }

  /** Clear event-specific fields from MDC. */
  private static void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("jobId");
    MDC.remove("jobKind");
    MDC.remove("jobStatus");
    MDC.remove("percentComplete");
    MDC.remove("errorMessage");
    MDC.remove("jobCount");
    MDC.remove("policy");
  }
}

package com.scholary.subtitle.batch.batch;

import com.scholary.subtitle.batch.job.JobSnapshot;

/**
 * Outcome of starting a single job.
 *
 * @param started false if the job had already completed and was left alone
 * @param message why the job was not started, null when it was
 */
public record JobStartResult(boolean started, String message, JobSnapshot job) {

  static JobStartResult started(JobSnapshot job) {
    return new JobStartResult(true, null, job);
  }

  static JobStartResult skipped(JobSnapshot job) {
    return new JobStartResult(false, "Job already completed; reset it to process it again", job);
  }
}

package com.scholary.subtitle.batch.batch;

import com.scholary.subtitle.batch.completion.CompletionPolicy;
import com.scholary.subtitle.batch.completion.PendingHostAction;
import com.scholary.subtitle.batch.job.JobSnapshot;
import java.util.List;

/**
 * Point-in-time view of the scheduler and its job list.
 *
 * @param pendingAction suspend or shutdown waiting out its grace period, or null
 */
public record BatchStatus(
    SchedulerState state,
    CompletionPolicy completionPolicy,
    PendingHostAction pendingAction,
    List<JobSnapshot> jobs) {}

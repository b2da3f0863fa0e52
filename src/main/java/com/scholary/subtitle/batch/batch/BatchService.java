package com.scholary.subtitle.batch.batch;

import com.scholary.subtitle.batch.completion.CompletionActionDispatcher;
import com.scholary.subtitle.batch.completion.CompletionPolicy;
import com.scholary.subtitle.batch.control.ControlThread;
import com.scholary.subtitle.batch.job.DuplicateJobException;
import com.scholary.subtitle.batch.job.JobFactory;
import com.scholary.subtitle.batch.job.JobKind;
import com.scholary.subtitle.batch.job.JobList;
import com.scholary.subtitle.batch.job.JobParameters;
import com.scholary.subtitle.batch.job.JobSnapshot;
import com.scholary.subtitle.batch.job.SubtitleJob;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Host-facing entry point for the job list and the batch scheduler.
 *
 * <p>Callable from any thread. Every command is run on the control thread and the caller waits
 * for its result; rejections are rethrown to the caller unchanged. Media probing for new jobs
 * happens on the calling thread so the control thread never waits on ffprobe.
 */
@Service
public class BatchService {

  private static final Logger LOGGER = LoggerFactory.getLogger(BatchService.class);

  private final ControlThread controlThread;
  private final JobList jobs;
  private final JobFactory jobFactory;
  private final BatchScheduler scheduler;
  private final CompletionActionDispatcher dispatcher;

  public BatchService(
      ControlThread controlThread,
      JobList jobs,
      JobFactory jobFactory,
      BatchScheduler scheduler,
      CompletionActionDispatcher dispatcher) {
    this.controlThread = controlThread;
    this.jobs = jobs;
    this.jobFactory = jobFactory;
    this.scheduler = scheduler;
    this.dispatcher = dispatcher;
  }

  /**
   * Add a job for one file.
   *
   * @throws DuplicateJobException if the file is already listed
   */
  public JobSnapshot addJob(Path source, JobKind kind, JobParameters parameters) {
    return addJobs(List.of(source), kind, parameters).get(0);
  }

  /**
   * Add jobs for several files, all or none.
   *
   * @throws DuplicateJobException if a file is already listed or given twice
   */
  public List<JobSnapshot> addJobs(List<Path> sources, JobKind kind, JobParameters parameters) {
    Set<String> ids = new LinkedHashSet<>();
    for (Path source : sources) {
      String id = SubtitleJob.idFor(source);
      if (!ids.add(id)) {
        throw new DuplicateJobException(id);
      }
    }
    List<String> listed = controlThread.call(() -> ids.stream().filter(jobs::contains).toList());
    if (!listed.isEmpty()) {
      throw new DuplicateJobException(listed.get(0));
    }

    List<SubtitleJob> created = new ArrayList<>(sources.size());
    for (Path source : sources) {
      created.add(jobFactory.create(source, kind, parameters));
    }

    return controlThread.call(
        () -> {
          jobs.addAll(created);
          LOGGER.info("Added {} job(s): kind={}", created.size(), kind);
          return created.stream().map(SubtitleJob::snapshot).toList();
        });
  }

  public void removeJob(String jobId) {
    controlThread.run(() -> scheduler.removeJob(jobId));
  }

  public void clearAll() {
    controlThread.run(scheduler::clearAll);
  }

  public void startBatch() {
    controlThread.run(scheduler::startBatch);
  }

  public void cancelBatch() {
    controlThread.run(scheduler::cancelBatch);
  }

  /**
   * Start one job on its own. A COMPLETED job is not started; the result says so.
   *
   * @throws BusyBatchException if a batch is active or another job is running
   */
  public JobStartResult startJob(String jobId) {
    return controlThread.call(
        () -> {
          boolean started = scheduler.startJob(jobId);
          JobSnapshot snapshot = jobs.require(jobId).snapshot();
          return started ? JobStartResult.started(snapshot) : JobStartResult.skipped(snapshot);
        });
  }

  public JobSnapshot cancelJob(String jobId) {
    return controlThread.call(
        () -> {
          scheduler.cancelJob(jobId);
          return jobs.require(jobId).snapshot();
        });
  }

  public JobSnapshot resetJob(String jobId) {
    return controlThread.call(() -> scheduler.resetJob(jobId).snapshot());
  }

  public JobSnapshot getJob(String jobId) {
    return controlThread.call(() -> jobs.require(jobId).snapshot());
  }

  public List<JobSnapshot> listJobs() {
    return controlThread.call(jobs::snapshot);
  }

  public BatchStatus status() {
    return controlThread.call(
        () ->
            new BatchStatus(
                scheduler.getState(),
                scheduler.getPolicy(),
                dispatcher.pendingAction().orElse(null),
                jobs.snapshot()));
  }

  public void setCompletionPolicy(CompletionPolicy policy) {
    controlThread.run(() -> scheduler.setPolicy(policy));
  }

  /**
   * @return true if a pending suspend or shutdown was aborted
   */
  public boolean abortCompletionAction() {
    return controlThread.call(dispatcher::abortPending);
  }
}

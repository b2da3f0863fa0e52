package com.scholary.subtitle.batch.execution;

/** Work submitted to the worker pool on behalf of a job. */
@FunctionalInterface
public interface WorkerTask {

  JobOutcome run(WorkerContext context);
}

package com.scholary.subtitle.batch.execution;

import com.scholary.subtitle.batch.job.SubtitleJob;
import java.util.concurrent.Future;

/** Handle on a launched worker. */
public class RunningJob {

  private final SubtitleJob job;
  private final CancellationToken token;
  private volatile Future<?> future;

  public RunningJob(SubtitleJob job) {
    this.job = job;
    this.token = new CancellationToken();
  }

  void attach(Future<?> future) {
    this.future = future;
  }

  /** Set the token and interrupt the worker thread. Idempotent. */
  public void cancel() {
    token.cancel();
    Future<?> f = future;
    if (f != null) {
      f.cancel(true);
    }
  }

  public SubtitleJob job() {
    return job;
  }

  public CancellationToken token() {
    return token;
  }

  public boolean isCancelled() {
    return token.isCancelled();
  }
}

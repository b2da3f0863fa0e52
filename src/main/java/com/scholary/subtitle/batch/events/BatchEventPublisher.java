package com.scholary.subtitle.batch.events;

import com.scholary.subtitle.batch.completion.CompletionPolicy;
import com.scholary.subtitle.batch.job.JobSnapshot;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Fans events out to every registered {@link BatchEventListener}. A failing listener is logged. */
@Component
public class BatchEventPublisher {

  private static final Logger LOGGER = LoggerFactory.getLogger(BatchEventPublisher.class);

  private final List<BatchEventListener> listeners = new CopyOnWriteArrayList<>();

  public BatchEventPublisher(List<BatchEventListener> listeners) {
    this.listeners.addAll(listeners);
  }

  public void addListener(BatchEventListener listener) {
    listeners.add(listener);
  }

  public void removeListener(BatchEventListener listener) {
    listeners.remove(listener);
  }

  public void jobStarted(JobSnapshot job) {
    publish(l -> l.jobStarted(job));
  }

  public void jobProgress(JobSnapshot job) {
    publish(l -> l.jobProgress(job));
  }

  public void jobFinished(JobSnapshot job) {
    publish(l -> l.jobFinished(job));
  }

  public void jobFailed(JobSnapshot job, String message) {
    publish(l -> l.jobFailed(job, message));
  }

  public void jobCancelled(JobSnapshot job) {
    publish(l -> l.jobCancelled(job));
  }

  public void batchStarted(int jobCount) {
    publish(l -> l.batchStarted(jobCount));
  }

  public void batchFinished() {
    publish(BatchEventListener::batchFinished);
  }

  public void batchCancelled() {
    publish(BatchEventListener::batchCancelled);
  }

  public void completionAction(CompletionPolicy policy, Instant executeAt) {
    publish(l -> l.completionAction(policy, executeAt));
  }

  public void completionActionAborted(CompletionPolicy policy) {
    publish(l -> l.completionActionAborted(policy));
  }

  private void publish(Consumer<BatchEventListener> event) {
    for (BatchEventListener listener : listeners) {
      try {
        event.accept(listener);
      } catch (RuntimeException e) {
        LOGGER.error("Event listener failed: listener={}", listener.getClass().getSimpleName(), e);
      }
    }
  }
}

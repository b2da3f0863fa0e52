package com.scholary.subtitle.batch.completion;

import com.scholary.subtitle.batch.control.ControlThread;
import com.scholary.subtitle.batch.events.BatchEventPublisher;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Runs the completion action of a finished batch.
 *
 * <p>Suspend and shutdown wait out {@link #GRACE_PERIOD} first, during which the host can abort
 * them. A new dispatch replaces an action that is still pending. Used on the control thread only.
 */
@Component
public class CompletionActionDispatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(CompletionActionDispatcher.class);

  public static final Duration GRACE_PERIOD = Duration.ofSeconds(60);

  private final TaskScheduler taskScheduler;
  private final ControlThread controlThread;
  private final HostCommandRunner commandRunner;
  private final ProcessTerminator terminator;
  private final BatchEventPublisher events;
  private final HostPlatform platform;

  private PendingHostAction pending;
  private ScheduledFuture<?> pendingFuture;

  @Autowired
  public CompletionActionDispatcher(
      @Qualifier("completionScheduler") TaskScheduler taskScheduler,
      ControlThread controlThread,
      HostCommandRunner commandRunner,
      ProcessTerminator terminator,
      BatchEventPublisher events) {
    this(taskScheduler, controlThread, commandRunner, terminator, events, HostPlatform.current());
  }

  CompletionActionDispatcher(
      TaskScheduler taskScheduler,
      ControlThread controlThread,
      HostCommandRunner commandRunner,
      ProcessTerminator terminator,
      BatchEventPublisher events,
      HostPlatform platform) {
    this.taskScheduler = taskScheduler;
    this.controlThread = controlThread;
    this.commandRunner = commandRunner;
    this.terminator = terminator;
    this.events = events;
    this.platform = platform;
  }

  public void dispatch(CompletionPolicy policy) {
    if (pending != null) {
      LOGGER.info("Replacing pending completion action: {}", pending.policy());
      cancelPending();
    }

    switch (policy) {
      case DO_NOTHING -> LOGGER.info("Batch finished, no completion action");
      case EXIT_PROCESS -> {
        events.completionAction(policy, null);
        terminator.terminate(0);
      }
      case SUSPEND_HOST, SHUTDOWN_HOST -> schedule(policy);
    }
  }

  /**
   * Abort a pending suspend or shutdown.
   *
   * @return true if an action was pending
   */
  public boolean abortPending() {
    if (pending == null) {
      return false;
    }
    CompletionPolicy policy = pending.policy();
    cancelPending();
    LOGGER.info("Completion action aborted: {}", policy);
    events.completionActionAborted(policy);
    return true;
  }

  public Optional<PendingHostAction> pendingAction() {
    return Optional.ofNullable(pending);
  }

  private void schedule(CompletionPolicy policy) {
    Instant executeAt = Instant.now().plus(GRACE_PERIOD);
    PendingHostAction action = new PendingHostAction(policy, executeAt);
    pending = action;
    pendingFuture =
        taskScheduler.schedule(() -> controlThread.execute(() -> fire(action)), executeAt);

    LOGGER.warn("{} in {}s unless aborted", policy, GRACE_PERIOD.toSeconds());
    events.completionAction(policy, executeAt);
  }

  private void fire(PendingHostAction action) {
    if (pending != action) {
      return;
    }
    pending = null;
    pendingFuture = null;
    try {
      commandRunner.run(platform.commandFor(action.policy()));
    } catch (HostCommandException e) {
      LOGGER.error("Completion action failed: {}", action.policy(), e);
    }
  }

  private void cancelPending() {
    if (pendingFuture != null) {
      pendingFuture.cancel(false);
    }
    pending = null;
    pendingFuture = null;
  }
}

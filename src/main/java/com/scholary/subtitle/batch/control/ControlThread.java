package com.scholary.subtitle.batch.control;

import java.util.concurrent.Callable;

/**
 * The single thread that owns job, scheduler, intake and document state.
 *
 * <p>Host commands are marshaled onto it with {@link #call}; worker notifications are posted with
 * {@link #execute}. Code running on the control thread never blocks on other threads.
 */
public interface ControlThread {

  /** Post a task without waiting for it. */
  void execute(Runnable task);

  /**
   * Run a task on the control thread and wait for its result. Runs inline when already on it.
   *
   * <p>Runtime exceptions thrown by the task are rethrown to the caller as they are.
   */
  <T> T call(Callable<T> task);

  default void run(Runnable task) {
    call(
        () -> {
          task.run();
          return null;
        });
  }

  boolean isControlThread();
}

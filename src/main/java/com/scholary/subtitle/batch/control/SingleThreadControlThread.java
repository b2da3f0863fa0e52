package com.scholary.subtitle.batch.control;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link ControlThread} backed by a named single-thread executor. */
public class SingleThreadControlThread implements ControlThread, AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(SingleThreadControlThread.class);

  private final ExecutorService executor;
  private volatile Thread thread;

  public SingleThreadControlThread(String name) {
    this.executor =
        Executors.newSingleThreadExecutor(
            runnable -> {
              Thread t = new Thread(runnable, name);
              t.setDaemon(true);
              thread = t;
              return t;
            });
  }

  @Override
  public void execute(Runnable task) {
    executor.execute(
        () -> {
          try {
            task.run();
          } catch (RuntimeException e) {
            LOGGER.error("Unhandled error on control thread", e);
          }
        });
  }

  @Override
  public <T> T call(Callable<T> task) {
    if (isControlThread()) {
      return invokeInline(task);
    }

    Future<T> future;
    try {
      future = executor.submit(task);
    } catch (RejectedExecutionException e) {
      throw new ControlThreadException("Control thread is shut down", e);
    }

    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ControlThreadException("Interrupted waiting for control thread", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new ControlThreadException("Control task failed", cause);
    }
  }

  @Override
  public boolean isControlThread() {
    return Thread.currentThread() == thread;
  }

  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private static <T> T invokeInline(Callable<T> task) {
    try {
      return task.call();
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new ControlThreadException("Control task failed", e);
    }
  }
}

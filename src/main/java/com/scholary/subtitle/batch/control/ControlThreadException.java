package com.scholary.subtitle.batch.control;

/** Thrown when a task cannot be handed to, or awaited on, the control thread. */
public class ControlThreadException extends RuntimeException {

  public ControlThreadException(String message, Throwable cause) {
    super(message, cause);
  }
}

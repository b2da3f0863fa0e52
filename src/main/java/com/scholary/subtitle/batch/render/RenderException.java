package com.scholary.subtitle.batch.render;

import com.scholary.subtitle.batch.execution.WorkerException;

/** Exception thrown when ffmpeg fails to render a video. */
public class RenderException extends WorkerException {

  public RenderException(String message) {
    super(message);
  }

  public RenderException(String message, Throwable cause) {
    super(message, cause);
  }
}

package com.scholary.subtitle.batch.transcription;

import com.scholary.subtitle.batch.execution.WorkerException;

/**
 * Exception thrown when Whisper API calls fail.
 *
 * <p>This could be due to network issues, service unavailability, or invalid responses.
 */
public class TranscriptionException extends WorkerException {

  public TranscriptionException(String message) {
    super(message);
  }

  public TranscriptionException(String message, Throwable cause) {
    super(message, cause);
  }
}

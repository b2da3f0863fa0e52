package com.scholary.subtitle.batch.api;

import java.time.Instant;

/**
 * Error body of every rejected request.
 *
 * @param error short error code, the exception type
 * @param message human-readable explanation
 */
public record ErrorResponse(String error, String message, Instant timestamp) {

  public static ErrorResponse of(Exception e) {
    return new ErrorResponse(e.getClass().getSimpleName(), e.getMessage(), Instant.now());
  }
}

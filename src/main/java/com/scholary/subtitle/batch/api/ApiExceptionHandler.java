package com.scholary.subtitle.batch.api;

import com.scholary.subtitle.batch.batch.BusyBatchException;
import com.scholary.subtitle.batch.batch.EmptyBatchException;
import com.scholary.subtitle.batch.codec.CodecException;
import com.scholary.subtitle.batch.codec.UnsupportedFormatException;
import com.scholary.subtitle.batch.document.DocumentEditException;
import com.scholary.subtitle.batch.job.DuplicateJobException;
import com.scholary.subtitle.batch.job.JobNotFoundException;
import com.scholary.subtitle.batch.media.MediaProbeException;
import java.time.Instant;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps domain exceptions to HTTP responses with an {@link ErrorResponse} body.
 *
 * <p>Conflicts with running work are 409, unknown jobs 404, bad input 400, and files that cannot
 * be read or probed 422.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler({
    BusyBatchException.class,
    DuplicateJobException.class,
    IllegalStateException.class
  })
  public ResponseEntity<ErrorResponse> handleConflict(RuntimeException e) {
    LOGGER.warn("Request rejected: {}", e.getMessage());
    return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorResponse.of(e));
  }

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleNotFound(JobNotFoundException e) {
    LOGGER.warn("Job not found: {}", e.getMessage());
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of(e));
  }

  @ExceptionHandler({
    EmptyBatchException.class,
    DocumentEditException.class,
    UnsupportedFormatException.class,
    IllegalArgumentException.class
  })
  public ResponseEntity<ErrorResponse> handleBadRequest(RuntimeException e) {
    LOGGER.warn("Bad request: {}", e.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponse.of(e));
  }

  @ExceptionHandler({CodecException.class, MediaProbeException.class})
  public ResponseEntity<ErrorResponse> handleUnprocessable(RuntimeException e) {
    LOGGER.error("Cannot process file: {}", e.getMessage(), e);
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(ErrorResponse.of(e));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
    String errors =
        e.getBindingResult().getFieldErrors().stream()
            .map(error -> String.format("'%s': %s", error.getField(), error.getDefaultMessage()))
            .collect(Collectors.joining(", "));
    LOGGER.warn("Validation failed: {}", errors);
    return ResponseEntity.badRequest()
        .body(new ErrorResponse("ValidationFailed", "Validation failed: " + errors, Instant.now()));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
    LOGGER.warn("Malformed request body: {}", e.getMessage());
    return ResponseEntity.badRequest()
        .body(
            new ErrorResponse(
                "MalformedRequest",
                "The request body is missing or could not be parsed",
                Instant.now()));
  }
}

package com.scholary.subtitle.batch.document;

/**
 * Base exception for rejected document edits.
 *
 * <p>A rejected edit never modifies the document.
 */
public class DocumentEditException extends RuntimeException {

  public DocumentEditException(String message) {
    super(message);
  }

  public DocumentEditException(String message, Throwable cause) {
    super(message, cause);
  }
}

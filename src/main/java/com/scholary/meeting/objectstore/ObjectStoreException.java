package com.scholary.meeting.objectstore;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>Unchecked: a missing transcript or a rejected upload cannot be fixed by the caller, only
 * reported.
 */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}

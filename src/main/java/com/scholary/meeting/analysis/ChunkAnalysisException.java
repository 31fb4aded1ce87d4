package com.scholary.meeting.analysis;

/**
 * Exception thrown when a chunk cannot be analyzed.
 *
 * <p>Retryable failures (throttling, server errors, broken connections, garbled responses) may
 * succeed on another attempt; the rest will not.
 */
public class ChunkAnalysisException extends RuntimeException {

  private final boolean retryable;

  public ChunkAnalysisException(String message, boolean retryable) {
    super(message);
    this.retryable = retryable;
  }

  public ChunkAnalysisException(String message, Throwable cause, boolean retryable) {
    super(message, cause);
    this.retryable = retryable;
  }

  public boolean isRetryable() {
    return retryable;
  }
}

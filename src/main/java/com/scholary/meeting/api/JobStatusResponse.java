package com.scholary.meeting.api;

/**
 * Response for job status query.
 *
 * <p>Shows the current state of an async job and includes the result if completed.
 */
public record JobStatusResponse(
    String jobId,
    String meetingId,
    Status status,
    Integer progress,
    String phase,
    MeetingTurnsResponse result,
    String error) {

  public enum Status {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
  }
}

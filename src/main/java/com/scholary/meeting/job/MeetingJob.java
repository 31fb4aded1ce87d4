package com.scholary.meeting.job;

import com.scholary.meeting.api.JobStatusResponse.Status;
import com.scholary.meeting.api.MeetingTurnsRequest;
import com.scholary.meeting.api.MeetingTurnsResponse;

/**
 * An async meeting run.
 *
 * <p>Tracks the job's state, progress, and result. Updated from the job thread and read by status
 * polls, so the mutable fields are volatile.
 */
public class MeetingJob {

  private final String jobId;
  private final MeetingTurnsRequest request;

  private volatile Status status;
  private volatile Integer progress; // 0-100
  private volatile String phase;
  private volatile MeetingTurnsResponse result;
  private volatile String error;

  public MeetingJob(String jobId, MeetingTurnsRequest request) {
    this.jobId = jobId;
    this.request = request;
    this.status = Status.PENDING;
    this.progress = 0;
    this.phase = "queued";
  }

  public String getJobId() {
    return jobId;
  }

  public MeetingTurnsRequest getRequest() {
    return request;
  }

  public Status getStatus() {
    return status;
  }

  public void setStatus(Status status) {
    this.status = status;
  }

  public Integer getProgress() {
    return progress;
  }

  public void setProgress(Integer progress) {
    this.progress = progress;
  }

  public String getPhase() {
    return phase;
  }

  public void setPhase(String phase) {
    this.phase = phase;
  }

  public MeetingTurnsResponse getResult() {
    return result;
  }

  public void setResult(MeetingTurnsResponse result) {
    this.result = result;
  }

  public String getError() {
    return error;
  }

  public void setError(String error) {
    this.error = error;
  }
}

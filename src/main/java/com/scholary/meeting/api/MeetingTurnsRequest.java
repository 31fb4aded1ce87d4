package com.scholary.meeting.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * Request for extracting the turns of a meeting transcript held in object storage.
 *
 * <p>The bucket defaults to the configured one. {@code forceReanalysis} drops cached chunk results
 * of the meeting before the run.
 */
public record MeetingTurnsRequest(
    @NotBlank @Pattern(regexp = "[A-Za-z0-9._-]+") String meetingId,
    @NotBlank String inputKey,
    String bucket,
    String timeZone,
    Boolean save,
    Boolean forceReanalysis) {

  public MeetingTurnsRequest {
    if (save == null) {
      save = true;
    }
    if (forceReanalysis == null) {
      forceReanalysis = false;
    }
  }
}

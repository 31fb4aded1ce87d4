package com.scholary.meeting.turn;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One speaker turn.
 *
 * <p>{@code idx} is local to a chunk in analyzer output and global in a merged transcript.
 * Timestamps are wall-clock {@code HH:MM:SS} strings. Boxed fields may be null when the analyzer
 * left them out; the validator reports those.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Turn(
    @JsonProperty("idx") Integer idx,
    @JsonProperty("start_ts") String startTs,
    @JsonProperty("end_ts") String endTs,
    @JsonProperty("speaker") String speaker,
    @JsonProperty("type") TurnType type,
    @JsonProperty("question_likelihood") Double questionLikelihood,
    @JsonProperty("text") String text) {

  public Turn withIdx(int newIdx) {
    return new Turn(newIdx, startTs, endTs, speaker, type, questionLikelihood, text);
  }

  public Turn withSpan(String newStartTs, String newEndTs) {
    return new Turn(idx, newStartTs, newEndTs, speaker, type, questionLikelihood, text);
  }
}

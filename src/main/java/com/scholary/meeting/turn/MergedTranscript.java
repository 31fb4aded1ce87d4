package com.scholary.meeting.turn;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Canonical turn sequence of a meeting.
 *
 * @param turns turns in chronological order, {@code idx} renumbered 0..N-1
 * @param duplicatesRemoved overlap turns folded into an existing turn
 * @param missingChunks indices of chunks that had no analysis result
 * @param warnings gap notices and structural validation findings
 */
public record MergedTranscript(
    @JsonProperty("turns") List<Turn> turns,
    @JsonProperty("duplicates_removed") int duplicatesRemoved,
    @JsonProperty("missing_chunks") List<Integer> missingChunks,
    @JsonProperty("warnings") List<String> warnings) {

  public MergedTranscript {
    turns = List.copyOf(turns);
    missingChunks = List.copyOf(missingChunks);
    warnings = List.copyOf(warnings);
  }

  public boolean isComplete() {
    return missingChunks.isEmpty();
  }
}

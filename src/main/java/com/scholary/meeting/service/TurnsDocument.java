package com.scholary.meeting.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.meeting.turn.Turn;
import java.util.List;

/** Contents of {@code 01_turns.json}. */
public record TurnsDocument(
    @JsonProperty("meeting_id") String meetingId,
    @JsonProperty("time_zone") String timeZone,
    @JsonProperty("turns") List<Turn> turns,
    @JsonProperty("metadata") Metadata metadata) {

  public record Metadata(
      @JsonProperty("total_turns") int totalTurns,
      @JsonProperty("chunk_count") int chunkCount,
      @JsonProperty("duplicates_removed") int duplicatesRemoved,
      @JsonProperty("missing_chunks") List<Integer> missingChunks,
      @JsonProperty("warnings") List<String> warnings,
      @JsonProperty("merged_at") String mergedAt) {}
}

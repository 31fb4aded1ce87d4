package com.scholary.meeting.api;

import com.scholary.meeting.turn.Turn;
import java.util.List;

/**
 * Result of a meeting run.
 *
 * <p>Contains the merged turns, diagnostics, and storage locations if saved.
 */
public record MeetingTurnsResponse(
    String meetingId,
    String timeZone,
    List<Turn> turns,
    ChunkInfo chunkInfo,
    StorageInfo storageInfo,
    Diagnostics diagnostics) {

  public record ChunkInfo(int totalChunks, int analyzedChunks, int totalTurns) {}

  public record StorageInfo(
      String bucket, String jsonKey, String textKey, String jsonUrl, String textUrl) {}

  public record Diagnostics(
      int duplicatesRemoved, List<Integer> missingChunks, List<String> warnings) {}
}

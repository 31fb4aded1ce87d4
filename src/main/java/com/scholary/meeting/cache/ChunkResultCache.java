package com.scholary.meeting.cache;

import com.scholary.meeting.turn.Turn;
import java.util.List;
import java.util.Optional;

/**
 * Cache of per-chunk analysis results.
 *
 * <p>Re-running a meeting whose chunks were already analyzed skips the analyzer for those chunks.
 * Keys combine the meeting, the chunk index, its character range and a hash of its text, so a
 * changed transcript never hits a stale entry.
 */
public interface ChunkResultCache {

  /**
   * Store the turns of a chunk.
   *
   * @param cacheKey unique key for this chunk
   * @param turns the analyzed turns
   */
  void put(String cacheKey, List<Turn> turns);

  /**
   * Retrieve cached turns.
   *
   * @param cacheKey unique key for this chunk
   * @return the cached turns, or empty if not found
   */
  Optional<List<Turn>> get(String cacheKey);

  /** Drop every cached chunk of a meeting. */
  void evictMeeting(String meetingId);

  /**
   * Generate a cache key for a chunk.
   *
   * @param meetingId the meeting id
   * @param chunkIndex the chunk index
   * @param startChar the chunk start offset
   * @param endChar the chunk end offset
   * @param textHash hash of the chunk text
   * @return a unique cache key
   */
  static String generateKey(
      String meetingId, int chunkIndex, int startChar, int endChar, int textHash) {
    return String.format(
        "%s:chunk-%d:%d-%d:%08x", meetingId, chunkIndex, startChar, endChar, textHash);
  }

  static String generateMeetingPrefix(String meetingId) {
    return meetingId + ":";
  }
}

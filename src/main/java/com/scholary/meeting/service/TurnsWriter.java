package com.scholary.meeting.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.meeting.api.MeetingTurnsResponse;
import com.scholary.meeting.objectstore.ObjectStoreClient;
import com.scholary.meeting.turn.MergedTranscript;
import com.scholary.meeting.turn.Turn;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes merged turns in various formats.
 *
 * <p>Supports JSON (machine-readable, with merge diagnostics) and plain text (one line per turn,
 * for reading).
 */
@Component
public class TurnsWriter {

  private static final Logger LOGGER = LoggerFactory.getLogger(TurnsWriter.class);

  static final Duration URL_TTL = Duration.ofDays(7);

  private final ObjectMapper objectMapper;
  private final ObjectStoreClient objectStoreClient;

  public TurnsWriter(ObjectMapper objectMapper, ObjectStoreClient objectStoreClient) {
    this.objectMapper = objectMapper;
    this.objectStoreClient = objectStoreClient;
  }

  /**
   * Write merged turns as JSON.
   *
   * <p>Format:
   *
   * <pre>
   * {
   *   "meeting_id": "m-1",
   *   "time_zone": "UTC",
   *   "turns": [ {"idx": 0, "start_ts": "10:00:00", ...} ],
   *   "metadata": {"total_turns": 1, "chunk_count": 1, "duplicates_removed": 0, ...}
   * }
   * </pre>
   */
  public byte[] writeJson(
      String meetingId, String timeZone, MergedTranscript merged, int chunkCount)
      throws IOException {
    TurnsDocument document =
        new TurnsDocument(
            meetingId,
            timeZone,
            merged.turns(),
            new TurnsDocument.Metadata(
                merged.turns().size(),
                chunkCount,
                merged.duplicatesRemoved(),
                merged.missingChunks(),
                merged.warnings(),
                Instant.now().toString()));

    return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(document);
  }

  /**
   * Write merged turns as plain text.
   *
   * <p>Format:
   *
   * <pre>
   * [10:00:00-10:00:12] Alice: we need to finalize the budget by friday.
   * [10:00:12-10:00:15] Bob: agreed
   * </pre>
   */
  public byte[] writeText(List<Turn> turns) {
    StringBuilder text = new StringBuilder();
    for (Turn turn : turns) {
      text.append('[')
          .append(turn.startTs())
          .append('-')
          .append(turn.endTs())
          .append("] ")
          .append(turn.speaker())
          .append(": ")
          .append(turn.text())
          .append('\n');
    }
    return text.toString().getBytes(StandardCharsets.UTF_8);
  }

  /**
   * Save merged turns to object store.
   *
   * @param bucket the bucket name
   * @param meetingId the meeting id
   * @param timeZone the meeting time zone
   * @param merged the merged transcript
   * @param chunkCount number of chunks the transcript was split into
   * @return storage info with URLs
   */
  public MeetingTurnsResponse.StorageInfo saveTurns(
      String bucket, String meetingId, String timeZone, MergedTranscript merged, int chunkCount)
      throws IOException {

    String jsonKey = MeetingKeys.turnsJson(meetingId);
    String textKey = MeetingKeys.turnsText(meetingId);

    byte[] jsonBytes = writeJson(meetingId, timeZone, merged, chunkCount);
    objectStoreClient.putObject(
        bucket, jsonKey, new ByteArrayInputStream(jsonBytes), jsonBytes.length, "application/json");

    byte[] textBytes = writeText(merged.turns());
    objectStoreClient.putObject(
        bucket,
        textKey,
        new ByteArrayInputStream(textBytes),
        textBytes.length,
        ChunkStore.TEXT_CONTENT_TYPE);

    URL jsonUrl = objectStoreClient.presignGet(bucket, jsonKey, URL_TTL);
    URL textUrl = objectStoreClient.presignGet(bucket, textKey, URL_TTL);

    LOGGER.info("Saved {} turns for meeting {}: {}", merged.turns().size(), meetingId, jsonKey);
    return new MeetingTurnsResponse.StorageInfo(
        bucket, jsonKey, textKey, jsonUrl.toString(), textUrl.toString());
  }
}

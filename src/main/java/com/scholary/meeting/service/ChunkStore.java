package com.scholary.meeting.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.meeting.chunking.ChunkingParams;
import com.scholary.meeting.chunking.TranscriptChunk;
import com.scholary.meeting.objectstore.ObjectStoreClient;
import com.scholary.meeting.objectstore.ObjectStoreException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads transcripts from and writes chunk slices to object storage.
 *
 * <p>Each chunk is stored as its own text object, its overlap (if any) as a second object, and the
 * descriptors together in {@code metadata.json}. See {@link MeetingKeys} for the layout.
 */
@Component
public class ChunkStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkStore.class);

  static final String TEXT_CONTENT_TYPE = "text/plain; charset=utf-8";

  private final ObjectStoreClient objectStoreClient;
  private final ObjectMapper objectMapper;

  public ChunkStore(ObjectStoreClient objectStoreClient, ObjectMapper objectMapper) {
    this.objectStoreClient = objectStoreClient;
    this.objectMapper = objectMapper;
  }

  /**
   * Read a UTF-8 text object.
   *
   * @throws ObjectStoreException if the object is missing or cannot be read
   */
  public String readText(String bucket, String key) {
    try (InputStream stream = objectStoreClient.getObjectStream(bucket, key)) {
      String text = new String(stream.readAllBytes(), StandardCharsets.UTF_8);
      LOGGER.info("Read transcript: bucket={}, key={}, chars={}", bucket, key, text.length());
      return text;
    } catch (IOException e) {
      throw new ObjectStoreException(
          String.format("Failed to read text object: bucket=%s, key=%s", bucket, key), e);
    }
  }

  /**
   * Persist every chunk slice of a transcript plus the chunk metadata.
   *
   * @return the key of the metadata object
   */
  public String writeChunks(
      String bucket,
      String meetingId,
      String inputKey,
      String transcript,
      List<TranscriptChunk> chunks,
      ChunkingParams params)
      throws IOException {
    for (TranscriptChunk chunk : chunks) {
      putText(bucket, MeetingKeys.chunkText(meetingId, chunk.chunkIndex()), chunk.text(transcript));

      Optional<String> overlap = chunk.overlapText(transcript).filter(text -> !text.isEmpty());
      if (overlap.isPresent()) {
        putText(bucket, MeetingKeys.chunkOverlap(meetingId, chunk.chunkIndex()), overlap.get());
      }
    }

    ChunkSetMetadata metadata =
        new ChunkSetMetadata(
            meetingId,
            inputKey,
            chunks.size(),
            transcript.length(),
            params.estimateTokens(transcript.length()),
            params,
            chunks,
            Instant.now().toString());
    byte[] json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(metadata);
    String metadataKey = MeetingKeys.chunkMetadata(meetingId);
    objectStoreClient.putObject(
        bucket, metadataKey, new ByteArrayInputStream(json), json.length, "application/json");

    LOGGER.info("Stored {} chunks for meeting {} in bucket {}", chunks.size(), meetingId, bucket);
    return metadataKey;
  }

  private void putText(String bucket, String key, String text) {
    byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
    objectStoreClient.putObject(
        bucket, key, new ByteArrayInputStream(bytes), bytes.length, TEXT_CONTENT_TYPE);
  }
}

package com.scholary.meeting.service;

import com.scholary.meeting.api.MeetingTurnsRequest;
import com.scholary.meeting.api.MeetingTurnsResponse;
import com.scholary.meeting.cache.ChunkResultCache;
import com.scholary.meeting.chunking.ChunkingParams;
import com.scholary.meeting.chunking.TranscriptChunk;
import com.scholary.meeting.chunking.TranscriptChunker;
import com.scholary.meeting.config.PipelineProperties;
import com.scholary.meeting.objectstore.ObjectStoreProperties;
import com.scholary.meeting.turn.MergeParams;
import com.scholary.meeting.turn.MergedTranscript;
import com.scholary.meeting.turn.Turn;
import com.scholary.meeting.turn.TurnMerger;
import java.io.IOException;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Extracts the turns of one meeting transcript.
 *
 * <p>Phases:
 *
 * <ol>
 *   <li>read the transcript from object storage
 *   <li>plan chunks (and store the slices when the transcript was split)
 *   <li>analyze all chunks in parallel
 *   <li>merge the chunk results into one turn sequence
 *   <li>save the turns as JSON and text
 * </ol>
 *
 * <p>Failed chunks do not fail the run; they show up in the diagnostics.
 */
@Service
public class MeetingTurnsOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(MeetingTurnsOrchestrator.class);

  private final ChunkStore chunkStore;
  private final TranscriptChunker chunker;
  private final ChunkAnalysisRunner analysisRunner;
  private final TurnMerger merger;
  private final TurnsWriter turnsWriter;
  private final ChunkResultCache chunkResultCache;
  private final ChunkingParams chunkingParams;
  private final MergeParams mergeParams;
  private final String defaultTimeZone;
  private final String defaultBucket;

  public MeetingTurnsOrchestrator(
      ChunkStore chunkStore,
      TranscriptChunker chunker,
      ChunkAnalysisRunner analysisRunner,
      TurnMerger merger,
      TurnsWriter turnsWriter,
      ChunkResultCache chunkResultCache,
      ChunkingParams chunkingParams,
      MergeParams mergeParams,
      PipelineProperties pipelineProperties,
      ObjectStoreProperties objectStoreProperties) {
    this.chunkStore = chunkStore;
    this.chunker = chunker;
    this.analysisRunner = analysisRunner;
    this.merger = merger;
    this.turnsWriter = turnsWriter;
    this.chunkResultCache = chunkResultCache;
    this.chunkingParams = chunkingParams;
    this.mergeParams = mergeParams;
    this.defaultTimeZone = pipelineProperties.defaultTimeZone();
    this.defaultBucket = objectStoreProperties.bucket();
  }

  /**
   * Run the whole pipeline for a meeting.
   *
   * @param request the meeting request
   * @param progress receives phase and overall progress
   * @return merged turns with diagnostics and, if saved, storage locations
   * @throws IllegalArgumentException if the time zone is unknown
   * @throws IOException if an artifact cannot be serialized
   */
  public MeetingTurnsResponse process(MeetingTurnsRequest request, ProgressListener progress)
      throws IOException {
    String correlationId = UUID.randomUUID().toString();
    MDC.put("correlationId", correlationId);

    try {
      String meetingId = request.meetingId();
      String bucket = request.bucket() != null ? request.bucket() : defaultBucket;
      String timeZone = resolveTimeZone(request.timeZone());

      LOGGER.info(
          "Starting meeting run: meetingId={}, bucket={}, key={}, timeZone={}",
          meetingId,
          bucket,
          request.inputKey(),
          timeZone);

      if (request.forceReanalysis()) {
        chunkResultCache.evictMeeting(meetingId);
      }

      // Phase 1: read
      progress.onProgress("read", 5);
      String transcript = chunkStore.readText(bucket, request.inputKey());

      // Phase 2: chunk
      progress.onProgress("chunk", 10);
      List<TranscriptChunk> chunks = chunker.chunk(transcript, chunkingParams);
      if (chunks.size() > 1 && request.save()) {
        chunkStore.writeChunks(
            bucket, meetingId, request.inputKey(), transcript, chunks, chunkingParams);
      }

      // Phase 3: analyze, reported as 20-80% of the run
      progress.onProgress("analyze", 20);
      Map<Integer, List<Turn>> results =
          analysisRunner.analyzeAll(
              meetingId,
              transcript,
              chunks,
              timeZone,
              (phase, percent) -> progress.onProgress(phase, 20 + percent * 60 / 100));

      // Phase 4: merge
      progress.onProgress("merge", 80);
      MergedTranscript merged = merger.merge(chunks, results, mergeParams);
      if (!merged.isComplete()) {
        LOGGER.warn("Meeting {} merged without chunks {}", meetingId, merged.missingChunks());
      }

      // Phase 5: save
      MeetingTurnsResponse.StorageInfo storageInfo = null;
      if (request.save()) {
        progress.onProgress("save", 90);
        storageInfo = turnsWriter.saveTurns(bucket, meetingId, timeZone, merged, chunks.size());
      }

      LOGGER.info(
          "Meeting run completed: meetingId={}, turns={}, duplicatesRemoved={}",
          meetingId,
          merged.turns().size(),
          merged.duplicatesRemoved());

      return new MeetingTurnsResponse(
          meetingId,
          timeZone,
          merged.turns(),
          new MeetingTurnsResponse.ChunkInfo(chunks.size(), results.size(), merged.turns().size()),
          storageInfo,
          new MeetingTurnsResponse.Diagnostics(
              merged.duplicatesRemoved(), merged.missingChunks(), merged.warnings()));

    } finally {
      MDC.remove("correlationId");
    }
  }

  private String resolveTimeZone(String requested) {
    return zoneId(requested != null && !requested.isBlank() ? requested : defaultTimeZone);
  }

  /**
   * Canonical id of a time zone.
   *
   * @throws IllegalArgumentException if the zone is unknown
   */
  public static String zoneId(String zone) {
    try {
      return ZoneId.of(zone).getId();
    } catch (DateTimeException e) {
      throw new IllegalArgumentException("Unknown time zone: " + zone, e);
    }
  }
}

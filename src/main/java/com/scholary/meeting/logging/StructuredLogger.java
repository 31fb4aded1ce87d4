package com.scholary.meeting.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Logs pipeline events with their fields in the MDC.
 *
 * <p>The console pattern prints the MDC and the {@code json} profile ships every field as a JSON
 * property, so events can be filtered by {@code event_type} and {@code chunk_index}.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log chunk planning event. */
  public void logChunkPlanned(
      int chunkIndex, int startChar, int endChar, Integer overlapStartChar, String boundary) {
    try {
      MDC.put("event_type", "chunk_planned");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("startChar", String.valueOf(startChar));
      MDC.put("endChar", String.valueOf(endChar));
      MDC.put("overlapStartChar", String.valueOf(overlapStartChar));
      MDC.put("boundary", boundary);

      logger.debug(
          "Chunk planned: index={}, range=[{}-{}), overlapStart={}, boundary={}",
          chunkIndex,
          startChar,
          endChar,
          overlapStartChar,
          boundary);
    } finally {
      clearEventFields();
    }
  }

  /** Log a chunk end that could not be placed on a natural break. */
  public void logDegradedBoundary(
      int chunkIndex, int tentativeEnd, int actualEnd, String boundary) {
    try {
      MDC.put("event_type", "boundary_degraded");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("tentativeEnd", String.valueOf(tentativeEnd));
      MDC.put("endChar", String.valueOf(actualEnd));
      MDC.put("boundary", boundary);

      logger.warn(
          "No natural break before offset {}: chunk={} ends at {} ({})",
          tentativeEnd,
          chunkIndex,
          actualEnd,
          boundary);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk analysis started event. */
  public void logAnalysisStarted(int chunkIndex, int attempt, int chars) {
    try {
      MDC.put("event_type", "chunk_analysis_started");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("chars", String.valueOf(chars));

      logger.debug(
          "Chunk analysis started: index={}, attempt={}, chars={}", chunkIndex, attempt, chars);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk analysis finished event. */
  public void logAnalysisFinished(int chunkIndex, int turnCount, long analyzeMs, boolean cached) {
    try {
      MDC.put("event_type", "chunk_analysis_finished");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("turnCount", String.valueOf(turnCount));
      MDC.put("analyzeMs", String.valueOf(analyzeMs));
      MDC.put("cached", String.valueOf(cached));

      logger.debug(
          "Chunk analysis finished: index={}, turns={}, analyze={}ms, cached={}",
          chunkIndex,
          turnCount,
          analyzeMs,
          cached);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk analysis retry event. */
  public void logAnalysisRetry(
      int chunkIndex, int attempt, int maxAttempts, String errorType, String message) {
    try {
      MDC.put("event_type", "chunk_analysis_retry");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxAttempts", String.valueOf(maxAttempts));
      MDC.put("errorType", errorType);

      logger.warn(
          "Chunk analysis retry: chunk={}, attempt={}/{}, error={}, message={}",
          chunkIndex,
          attempt,
          maxAttempts,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk analysis failure event. */
  public void logAnalysisFailed(int chunkIndex, int attempts, String errorType, String message) {
    try {
      MDC.put("event_type", "chunk_analysis_failed");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("attempt", String.valueOf(attempts));
      MDC.put("errorType", errorType);

      logger.error(
          "Chunk analysis failed: chunk={}, attempts={}, error={}, message={}",
          chunkIndex,
          attempts,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log a chunk whose result is absent at merge time. */
  public void logChunkResultMissing(int chunkIndex) {
    try {
      MDC.put("event_type", "chunk_result_missing");
      MDC.put("chunk_index", String.valueOf(chunkIndex));

      logger.warn("Chunk {} has no analysis result, merging without it", chunkIndex);
    } finally {
      clearEventFields();
    }
  }

  /** Log overlap merge event. */
  public void logOverlapMerge(
      int leftChunk, int rightChunk, int windowTurns, int duplicatesRemoved, int turnsAppended) {
    try {
      MDC.put("event_type", "overlap_merge");
      MDC.put("leftChunk", String.valueOf(leftChunk));
      MDC.put("rightChunk", String.valueOf(rightChunk));
      MDC.put("windowTurns", String.valueOf(windowTurns));
      MDC.put("dupRemoved", String.valueOf(duplicatesRemoved));
      MDC.put("turnsAppended", String.valueOf(turnsAppended));

      logger.debug(
          "Overlap merge: chunks=[{},{}], window={} turns, dupRemoved={}, appended={}",
          leftChunk,
          rightChunk,
          windowTurns,
          duplicatesRemoved,
          turnsAppended);
    } finally {
      clearEventFields();
    }
  }

  /** Log job progress event. */
  public void logJobProgress(String jobId, String phase, int percentComplete) {
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("percentComplete", String.valueOf(percentComplete));
      MDC.put("phase", phase);

      logger.info("Job progress: jobId={}, phase={}, progress={}%", jobId, phase, percentComplete);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String meetingId, String inputKey) {
    MDC.put("jobId", jobId);
    MDC.put("meetingId", meetingId);
    MDC.put("inputKey", inputKey);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("meetingId");
    MDC.remove("inputKey");
  }

  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("chunk_index");
    MDC.remove("startChar");
    MDC.remove("endChar");
    MDC.remove("overlapStartChar");
    MDC.remove("boundary");
    MDC.remove("tentativeEnd");
    MDC.remove("attempt");
    MDC.remove("maxAttempts");
    MDC.remove("chars");
    MDC.remove("turnCount");
    MDC.remove("analyzeMs");
    MDC.remove("cached");
    MDC.remove("errorType");
    MDC.remove("leftChunk");
    MDC.remove("rightChunk");
    MDC.remove("windowTurns");
    MDC.remove("dupRemoved");
    MDC.remove("turnsAppended");
    MDC.remove("percentComplete");
    MDC.remove("phase");
  }
}

package com.scholary.meeting.chunking;

import com.scholary.meeting.chunking.BoundaryFinder.Boundary;
import com.scholary.meeting.logging.StructuredLogger;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Splits a transcript into overlapping chunks.
 *
 * <p>Transcripts at or below the token threshold come back as a single chunk. Longer ones are cut
 * into windows of {@code chunkSizeTokens}, each ending on the most natural break found near its
 * tentative end, and each sharing its last {@code overlapTokens} worth of characters with the next
 * chunk:
 *
 * <pre>
 * Chunk 0: [0 ......................... e0)
 * Chunk 1:                   [e0 - ov ................. e1)
 * Chunk 2:                                    [e1 - ov ........ len)
 * </pre>
 *
 * <p>The next start is always derived from the adjusted end of the previous chunk. Every end lies
 * more than {@code overlapChars} past its start, so the start strictly advances.
 */
@Component
public class TranscriptChunker {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptChunker.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  /**
   * Plan the chunks of a transcript.
   *
   * @param text the transcript; null or empty yields no chunks
   * @param params chunking parameters
   * @return chunk descriptors in index order, covering {@code [0, text.length())} without gaps
   */
  public List<TranscriptChunk> chunk(String text, ChunkingParams params) {
    if (text == null || text.isEmpty()) {
      LOGGER.info("Empty transcript, no chunks planned");
      return List.of();
    }

    int length = text.length();
    int totalTokens = params.estimateTokens(length);

    if (totalTokens <= params.thresholdTokens()) {
      LOGGER.info(
          "Transcript fits in one chunk: chars={}, estimatedTokens={}, threshold={}",
          length,
          totalTokens,
          params.thresholdTokens());
      return List.of(TranscriptChunk.last(0, 0, length, totalTokens, BreakKind.END_OF_TEXT));
    }

    int chunkSizeChars = params.chunkSizeChars();
    int overlapChars = params.overlapChars();

    LOGGER.info(
        "Planning chunks: chars={}, estimatedTokens={}, chunkSize={} chars, overlap={} chars",
        length,
        totalTokens,
        chunkSizeChars,
        overlapChars);

    List<TranscriptChunk> chunks = new ArrayList<>();
    int start = 0;
    int index = 0;

    while (true) {
      int tentativeEnd = (int) Math.min((long) start + chunkSizeChars, length);

      if (tentativeEnd >= length) {
        TranscriptChunk last =
            TranscriptChunk.last(
                index, start, length, params.estimateTokens(length - start), BreakKind.END_OF_TEXT);
        chunks.add(last);
        structuredLogger.logChunkPlanned(index, start, length, null, BreakKind.END_OF_TEXT.name());
        break;
      }

      int progressFloor = start + overlapChars + 1;
      int naturalFloor = Math.max(progressFloor, tentativeEnd - overlapChars);
      Boundary boundary = BoundaryFinder.find(text, tentativeEnd, naturalFloor, progressFloor);
      int end = boundary.position();

      if (boundary.kind().isDegraded()) {
        structuredLogger.logDegradedBoundary(index, tentativeEnd, end, boundary.kind().name());
      }

      int overlapStart = Math.max(start, end - overlapChars);
      if (Character.isLowSurrogate(text.charAt(overlapStart))) {
        overlapStart = overlapStart - 1 > start ? overlapStart - 1 : overlapStart + 1;
      }
      chunks.add(
          new TranscriptChunk(
              index,
              start,
              end,
              overlapStart,
              params.estimateTokens(end - start),
              true,
              boundary.kind()));
      structuredLogger.logChunkPlanned(index, start, end, overlapStart, boundary.kind().name());

      start = overlapStart;
      index++;
    }

    LOGGER.info("Planned {} chunks", chunks.size());
    return chunks;
  }
}

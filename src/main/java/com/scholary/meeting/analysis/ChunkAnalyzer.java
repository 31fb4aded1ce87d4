package com.scholary.meeting.analysis;

import com.scholary.meeting.turn.Turn;
import java.util.List;

/**
 * Turns the text of one chunk into speaker turns.
 *
 * <p>Implementations are called concurrently, one call per chunk, and must not share mutable state
 * between calls. Each call makes a single attempt; retries belong to the caller.
 */
public interface ChunkAnalyzer {

  /**
   * Analyze one chunk.
   *
   * @param request chunk text and context
   * @return the chunk's turns with chunk-local {@code idx} values
   * @throws ChunkAnalysisException if the analysis fails
   */
  List<Turn> analyze(ChunkAnalysisRequest request);
}

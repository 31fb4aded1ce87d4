package com.scholary.meeting.api;

import com.scholary.meeting.chunking.ChunkingParams;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * Request for previewing chunk boundaries of a transcript.
 *
 * <p>Unset sizes fall back to the configured chunking parameters.
 */
public record ChunkPreviewRequest(
    @NotNull String text,
    @Min(1) Integer chunkSizeTokens,
    @Min(0) Integer overlapTokens,
    @Min(0) Integer thresholdTokens,
    @Min(1) Integer charsPerToken) {

  /** Merge the overrides of this request into the configured parameters. */
  public ChunkingParams toParams(ChunkingParams defaults) {
    return new ChunkingParams(
        chunkSizeTokens != null ? chunkSizeTokens : defaults.chunkSizeTokens(),
        overlapTokens != null ? overlapTokens : defaults.overlapTokens(),
        thresholdTokens != null ? thresholdTokens : defaults.thresholdTokens(),
        charsPerToken != null ? charsPerToken : defaults.charsPerToken());
  }
}

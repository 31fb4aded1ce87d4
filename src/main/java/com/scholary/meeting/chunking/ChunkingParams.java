package com.scholary.meeting.chunking;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Parameters for splitting one transcript.
 *
 * <p>All sizes are in estimated tokens; {@code charsPerToken} converts them to character counts.
 * The estimate is a fixed ratio, not a tokenizer.
 *
 * @param chunkSizeTokens target size of each chunk
 * @param overlapTokens size of the region shared by consecutive chunks
 * @param thresholdTokens transcripts at or below this size are not split
 * @param charsPerToken characters per estimated token
 */
public record ChunkingParams(
    @JsonProperty("chunk_size_tokens") int chunkSizeTokens,
    @JsonProperty("overlap_tokens") int overlapTokens,
    @JsonProperty("threshold_tokens") int thresholdTokens,
    @JsonProperty("chars_per_token") int charsPerToken) {

  public static final int DEFAULT_CHUNK_SIZE_TOKENS = 15_000;
  public static final int DEFAULT_OVERLAP_TOKENS = 2_000;
  public static final int DEFAULT_THRESHOLD_TOKENS = 50_000;
  public static final int DEFAULT_CHARS_PER_TOKEN = 4;

  public ChunkingParams {
    if (chunkSizeTokens <= 0) {
      throw new IllegalArgumentException(
          "chunkSizeTokens must be positive, got " + chunkSizeTokens);
    }
    if (overlapTokens < 0) {
      throw new IllegalArgumentException("overlapTokens cannot be negative, got " + overlapTokens);
    }
    // The next chunk starts at end - overlap, so the overlap has to leave room to advance
    if (overlapTokens >= chunkSizeTokens) {
      throw new IllegalArgumentException(
          String.format(
              "overlapTokens (%d) must be less than chunkSizeTokens (%d)",
              overlapTokens, chunkSizeTokens));
    }
    if (thresholdTokens < 0) {
      throw new IllegalArgumentException(
          "thresholdTokens cannot be negative, got " + thresholdTokens);
    }
    if (charsPerToken <= 0) {
      throw new IllegalArgumentException("charsPerToken must be positive, got " + charsPerToken);
    }
    if ((long) chunkSizeTokens * charsPerToken > Integer.MAX_VALUE) {
      throw new IllegalArgumentException(
          String.format(
              "chunkSizeTokens (%d) * charsPerToken (%d) exceeds %d characters",
              chunkSizeTokens, charsPerToken, Integer.MAX_VALUE));
    }
  }

  public static ChunkingParams defaults() {
    return new ChunkingParams(
        DEFAULT_CHUNK_SIZE_TOKENS,
        DEFAULT_OVERLAP_TOKENS,
        DEFAULT_THRESHOLD_TOKENS,
        DEFAULT_CHARS_PER_TOKEN);
  }

  public int chunkSizeChars() {
    return chunkSizeTokens * charsPerToken;
  }

  public int overlapChars() {
    return overlapTokens * charsPerToken;
  }

  /** Estimated token count for a span of the given number of characters. */
  public int estimateTokens(int chars) {
    return chars / charsPerToken;
  }
}

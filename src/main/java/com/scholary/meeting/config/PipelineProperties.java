package com.scholary.meeting.config;

import com.scholary.meeting.chunking.ChunkingParams;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the meeting pipeline.
 *
 * <p>These map to the "pipeline.*" keys in application.yml and are validated at startup.
 */
@ConfigurationProperties(prefix = "pipeline")
@Validated
public record PipelineProperties(
    @NotNull @Valid Chunking chunking,
    @NotNull @Valid Merge merge,
    @NotNull @Valid Analysis analysis,
    @NotBlank String defaultTimeZone,
    @Positive int asyncExecutorThreads,
    @Min(0) int asyncExecutorQueueSize) {

  /** Chunk sizes in estimated tokens. */
  public record Chunking(
      @Positive int chunkSizeTokens,
      @Min(0) int overlapTokens,
      @Min(0) int thresholdTokens,
      @Positive int charsPerToken) {

    public ChunkingParams toParams() {
      return new ChunkingParams(chunkSizeTokens, overlapTokens, thresholdTokens, charsPerToken);
    }
  }

  /** Overlap de-duplication tuning. */
  public record Merge(
      @DecimalMin(value = "0.0", inclusive = false) @DecimalMax("1.0") double similarityThreshold,
      @Positive int averageTokensPerTurn,
      @Positive int maxWindowTurns) {}

  /** Fan-out and retry of per-chunk analysis. */
  public record Analysis(
      @Positive int maxConcurrency,
      @Min(0) int queueCapacity,
      @Positive int maxAttempts,
      @Min(0) long retryBackoffMillis) {}
}

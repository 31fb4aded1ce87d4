package com.scholary.meeting.chunking;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Optional;

/**
 * Descriptor of one slice of a transcript.
 *
 * <p>Holds offsets only, never the text itself, so a descriptor can be stored and shipped next to
 * the transcript it was computed from. {@code overlapStartChar} marks where the region shared with
 * the next chunk begins and is null for the last chunk. With a zero overlap it equals {@code
 * endChar}.
 */
public record TranscriptChunk(
    @JsonProperty("chunk_index") int chunkIndex,
    @JsonProperty("start_char") int startChar,
    @JsonProperty("end_char") int endChar,
    @JsonProperty("overlap_start_char") Integer overlapStartChar,
    @JsonProperty("estimated_tokens") int estimatedTokens,
    @JsonProperty("has_next_chunk") boolean hasNextChunk,
    @JsonProperty("end_boundary") BreakKind endBoundary) {

  public TranscriptChunk {
    if (chunkIndex < 0) {
      throw new IllegalArgumentException("Chunk index cannot be negative");
    }
    if (startChar < 0 || startChar >= endChar) {
      throw new IllegalArgumentException(
          String.format("Invalid chunk span [%d, %d)", startChar, endChar));
    }
    if (hasNextChunk != (overlapStartChar != null)) {
      throw new IllegalArgumentException(
          "Overlap start must be present exactly when a next chunk exists");
    }
    if (overlapStartChar != null && (overlapStartChar < startChar || overlapStartChar > endChar)) {
      throw new IllegalArgumentException(
          String.format(
              "Overlap start %d outside chunk span [%d, %d)",
              overlapStartChar,
              startChar,
              endChar));
    }
  }

  /** Create the descriptor of a last chunk (no overlap). */
  public static TranscriptChunk last(
      int chunkIndex, int startChar, int endChar, int estimatedTokens, BreakKind endBoundary) {
    return new TranscriptChunk(
        chunkIndex, startChar, endChar, null, estimatedTokens, false, endBoundary);
  }

  public CharRange span() {
    return new CharRange(startChar, endChar);
  }

  /** The region shared with the next chunk, empty for the last chunk. */
  public Optional<CharRange> overlapSpan() {
    return overlapStartChar == null
        ? Optional.empty()
        : Optional.of(new CharRange(overlapStartChar, endChar));
  }

  public int length() {
    return span().length();
  }

  /** Width of the region shared with the next chunk (0 for the last chunk). */
  public int overlapLength() {
    return overlapStartChar == null ? 0 : endChar - overlapStartChar;
  }

  /** This chunk's text, cut from the transcript it was planned against. */
  public String text(String transcript) {
    return span().slice(transcript);
  }

  /** The overlap text, cut from the transcript it was planned against. */
  public Optional<String> overlapText(String transcript) {
    return overlapSpan().map(range -> range.slice(transcript));
  }
}

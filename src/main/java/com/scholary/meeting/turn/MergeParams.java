package com.scholary.meeting.turn;

/**
 * Tuning for overlap de-duplication.
 *
 * <p>The overlap window holds {@code ceil(overlapTokens / averageTokensPerTurn)} turns, capped at
 * {@code maxWindowTurns}. Too small a window misses duplicates; too large a window invites false
 * merges with unrelated turns and costs more comparisons.
 *
 * @param similarityThreshold minimum Jaccard similarity for two turns to count as one
 * @param averageTokensPerTurn assumed size of a turn, used to size the window
 * @param maxWindowTurns upper bound on the window
 * @param charsPerToken converts overlap characters to tokens
 */
public record MergeParams(
    double similarityThreshold, int averageTokensPerTurn, int maxWindowTurns, int charsPerToken) {

  public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.75;
  public static final int DEFAULT_AVERAGE_TOKENS_PER_TURN = 50;
  public static final int DEFAULT_MAX_WINDOW_TURNS = 50;

  public MergeParams {
    if (similarityThreshold <= 0.0 || similarityThreshold > 1.0) {
      throw new IllegalArgumentException(
          "similarityThreshold must be in (0, 1], got " + similarityThreshold);
    }
    if (averageTokensPerTurn <= 0) {
      throw new IllegalArgumentException(
          "averageTokensPerTurn must be positive, got " + averageTokensPerTurn);
    }
    if (maxWindowTurns <= 0) {
      throw new IllegalArgumentException("maxWindowTurns must be positive, got " + maxWindowTurns);
    }
    if (charsPerToken <= 0) {
      throw new IllegalArgumentException("charsPerToken must be positive, got " + charsPerToken);
    }
  }

  public static MergeParams defaults() {
    return new MergeParams(
        DEFAULT_SIMILARITY_THRESHOLD,
        DEFAULT_AVERAGE_TOKENS_PER_TURN,
        DEFAULT_MAX_WINDOW_TURNS,
        4);
  }

  /** Number of trailing turns to compare against, for an overlap of the given width. */
  public int windowTurns(int overlapChars) {
    if (overlapChars <= 0) {
      return 0;
    }
    int overlapTokens = overlapChars / charsPerToken;
    int turns = (overlapTokens + averageTokensPerTurn - 1) / averageTokensPerTurn;
    return Math.min(maxWindowTurns, Math.max(1, turns));
  }
}

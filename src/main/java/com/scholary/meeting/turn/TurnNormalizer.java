package com.scholary.meeting.turn;

import java.util.ArrayList;
import java.util.List;

/**
 * Cleans up analyzer output before it is merged.
 *
 * <p>Type labels are already mapped by {@link TurnType#fromLabel(String)}; here a missing type
 * becomes {@link TurnType#MONOLOGUE}, the question likelihood is clamped to [0, 1] (missing or NaN
 * becomes 0.0) and speaker labels are trimmed.
 */
public final class TurnNormalizer {

  private TurnNormalizer() {}

  public static Turn normalize(Turn turn) {
    TurnType type = turn.type() != null ? turn.type() : TurnType.MONOLOGUE;
    String speaker = turn.speaker() != null ? turn.speaker().trim() : null;
    return new Turn(
        turn.idx(),
        turn.startTs(),
        turn.endTs(),
        speaker,
        type,
        clampLikelihood(turn.questionLikelihood()),
        turn.text());
  }

  public static List<Turn> normalizeAll(List<Turn> turns) {
    List<Turn> normalized = new ArrayList<>(turns.size());
    for (Turn turn : turns) {
      if (turn != null) {
        normalized.add(normalize(turn));
      }
    }
    return normalized;
  }

  static double clampLikelihood(Double value) {
    if (value == null || value.isNaN()) {
      return 0.0;
    }
    return Math.max(0.0, Math.min(1.0, value));
  }
}

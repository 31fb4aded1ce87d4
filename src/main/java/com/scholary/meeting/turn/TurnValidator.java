package com.scholary.meeting.turn;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Structural checks on a merged turn sequence.
 *
 * <p>Findings are returned as messages; nothing here throws. A merged transcript with findings is
 * still usable.
 */
public final class TurnValidator {

  private TurnValidator() {}

  public static List<String> validate(List<Turn> turns) {
    List<String> warnings = new ArrayList<>();
    Integer previousIdx = null;
    Integer previousStart = null;

    for (int position = 0; position < turns.size(); position++) {
      Turn turn = turns.get(position);
      String label = "Turn " + position;

      if (turn.idx() == null) {
        warnings.add(label + ": missing idx");
      } else if (turn.idx() < 0) {
        warnings.add(label + ": negative idx " + turn.idx());
      }
      if (turn.speaker() == null || turn.speaker().isBlank()) {
        warnings.add(label + ": missing speaker");
      }
      if (turn.text() == null || turn.text().isBlank()) {
        warnings.add(label + ": missing text");
      }
      if (turn.type() == null) {
        warnings.add(label + ": missing type");
      }
      if (turn.questionLikelihood() == null) {
        warnings.add(label + ": missing question_likelihood");
      } else if (turn.questionLikelihood() < 0.0 || turn.questionLikelihood() > 1.0) {
        warnings.add(label + ": question_likelihood out of range " + turn.questionLikelihood());
      }
      if (!Timestamps.isValid(turn.startTs())) {
        warnings.add(label + ": invalid start_ts '" + turn.startTs() + "'");
      }
      if (!Timestamps.isValid(turn.endTs())) {
        warnings.add(label + ": invalid end_ts '" + turn.endTs() + "'");
      }

      if (turn.idx() != null) {
        if (previousIdx != null && turn.idx() <= previousIdx) {
          warnings.add(
              String.format(
                  "%s: idx %d not greater than previous idx %d", label, turn.idx(), previousIdx));
        }
        previousIdx = turn.idx();
      }

      OptionalInt start = Timestamps.toSeconds(turn.startTs());
      if (start.isPresent()) {
        if (previousStart != null && start.getAsInt() < previousStart) {
          warnings.add(
              String.format(
                  "%s: start_ts %s earlier than previous turn's start %s",
                  label, turn.startTs(), Timestamps.format(previousStart)));
        }
        previousStart = start.getAsInt();
      }
    }
    return warnings;
  }
}

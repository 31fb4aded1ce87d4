package com.scholary.meeting.turn;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Kind of a turn, as labeled by the analyzer.
 *
 * <p>Analyzers are loose with their labels, so parsing accepts a few synonyms and maps anything
 * unknown to {@link #MONOLOGUE}.
 */
public enum TurnType {
  QUESTION("question"),
  ANSWER("answer"),
  FOLLOWUP("followup"),
  MONOLOGUE("monologue"),
  HOUSEKEEPING("housekeeping");

  private static final Logger LOGGER = LoggerFactory.getLogger(TurnType.class);

  private static final Map<String, TurnType> SYNONYMS =
      Map.ofEntries(
          Map.entry("statement", MONOLOGUE),
          Map.entry("comment", MONOLOGUE),
          Map.entry("discussion", MONOLOGUE),
          Map.entry("context", MONOLOGUE),
          Map.entry("other", MONOLOGUE),
          Map.entry("response", ANSWER),
          Map.entry("reply", ANSWER),
          Map.entry("follow-up", FOLLOWUP),
          Map.entry("follow up", FOLLOWUP),
          Map.entry("questioning", QUESTION));

  private final String label;

  TurnType(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }

  /**
   * Parse an analyzer label.
   *
   * @param value the raw label, may be null
   * @return the matching type, {@link #MONOLOGUE} for unknown labels, null for a null label
   */
  @JsonCreator
  public static TurnType fromLabel(String value) {
    if (value == null) {
      return null;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (TurnType type : values()) {
      if (type.label.equals(normalized)) {
        return type;
      }
    }
    TurnType synonym = SYNONYMS.get(normalized);
    if (synonym != null) {
      return synonym;
    }
    LOGGER.warn("Unknown turn type '{}', using {}", value, MONOLOGUE.label);
    return MONOLOGUE;
  }
}

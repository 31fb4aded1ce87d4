package com.scholary.meeting.chunking;

/**
 * How a chunk's end boundary was chosen, from most to least natural.
 */
public enum BreakKind {
  /** The chunk runs to the end of the transcript. */
  END_OF_TEXT,

  /** Right after a blank line. */
  PARAGRAPH,

  /** Right after a line break. */
  LINE,

  /** Right after a sentence terminator and the whitespace following it. */
  SENTENCE,

  /**
   * Right after the nearest preceding whitespace.
   *
   * <p>Degraded: no natural break in the lookback window.
   */
  WHITESPACE,

  /**
   * At the tentative end, possibly inside a word.
   *
   * <p>Last resort when there is no whitespace to fall back to.
   */
  HARD_CUT;

  public boolean isDegraded() {
    return this == WHITESPACE || this == HARD_CUT;
  }
}

package com.scholary.meeting.chunking;

/**
 * Half-open character range {@code [start, end)} into a transcript.
 *
 * <p>Used for chunk spans and overlap regions. Offsets are UTF-16 indices, the same ones {@link
 * String#substring(int, int)} takes.
 */
public record CharRange(int start, int end) {

  public CharRange {
    if (start < 0) {
      throw new IllegalArgumentException("Start offset cannot be negative");
    }
    if (end < start) {
      throw new IllegalArgumentException("End offset must be >= start offset");
    }
  }

  public int length() {
    return end - start;
  }

  /** Number of characters this range has in common with another, 0 if they are disjoint. */
  public int sharedLength(CharRange other) {
    return Math.max(0, Math.min(end, other.end) - Math.max(start, other.start));
  }

  /** Cut this range out of the text it was computed against. */
  public String slice(String text) {
    return text.substring(start, end);
  }
}

package com.scholary.meeting.chunking;

/**
 * Backward search for the end of a chunk.
 *
 * <p>A boundary is an offset {@code p}: the chunk ends right before {@code text.charAt(p)}. Natural
 * breaks are searched in priority order (paragraph, line, sentence), each within {@code
 * [naturalFloor, target]}. If none is found the nearest whitespace down to {@code progressFloor}
 * is used, and a hard cut at {@code target} is the last resort. A hard cut inside a surrogate pair
 * moves to the start of the pair, or past it when that would fall below {@code progressFloor}.
 *
 * <p>Stateless; every call scans only the text between the floors and the target.
 */
public final class BoundaryFinder {

  /** Where a chunk ends and why. */
  public record Boundary(int position, BreakKind kind) {}

  private BoundaryFinder() {}

  /**
   * Find the end of a chunk.
   *
   * @param text the full transcript
   * @param target the tentative end (exclusive), strictly less than the text length
   * @param naturalFloor lowest offset accepted for a natural break
   * @param progressFloor lowest offset accepted at all; must be positive
   * @return the chosen boundary, never below {@code progressFloor}
   */
  public static Boundary find(String text, int target, int naturalFloor, int progressFloor) {
    if (progressFloor < 1 || progressFloor > target || target > text.length()) {
      throw new IllegalArgumentException(
          String.format(
              "Invalid search window: progressFloor=%d, target=%d, length=%d",
              progressFloor, target, text.length()));
    }
    int floor = Math.max(naturalFloor, progressFloor);

    for (int p = target; p >= floor; p--) {
      if (isParagraphBreak(text, p)) {
        return new Boundary(p, BreakKind.PARAGRAPH);
      }
    }
    for (int p = target; p >= floor; p--) {
      if (text.charAt(p - 1) == '\n') {
        return new Boundary(p, BreakKind.LINE);
      }
    }
    for (int p = target; p >= Math.max(floor, 2); p--) {
      if (Character.isWhitespace(text.charAt(p - 1)) && isSentenceTerminator(text.charAt(p - 2))) {
        return new Boundary(p, BreakKind.SENTENCE);
      }
    }
    for (int p = target; p >= progressFloor; p--) {
      if (Character.isWhitespace(text.charAt(p - 1))) {
        return new Boundary(p, BreakKind.WHITESPACE);
      }
    }
    return new Boundary(hardCut(text, target, progressFloor), BreakKind.HARD_CUT);
  }

  // Never between the two halves of a surrogate pair
  private static int hardCut(String text, int target, int progressFloor) {
    if (target < text.length() && Character.isLowSurrogate(text.charAt(target))) {
      return target - 1 >= progressFloor ? target - 1 : target + 1;
    }
    return target;
  }

  // A newline preceded by another newline, ignoring horizontal whitespace in between
  private static boolean isParagraphBreak(String text, int p) {
    if (text.charAt(p - 1) != '\n') {
      return false;
    }
    for (int i = p - 2; i >= 0; i--) {
      char c = text.charAt(i);
      if (c == '\n') {
        return true;
      }
      if (c != ' ' && c != '\t' && c != '\r') {
        return false;
      }
    }
    return false;
  }

  private static boolean isSentenceTerminator(char c) {
    return c == '.' || c == '!' || c == '?';
  }
}

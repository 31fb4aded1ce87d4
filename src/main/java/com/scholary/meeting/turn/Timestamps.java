package com.scholary.meeting.turn;

import java.util.OptionalInt;
import java.util.regex.Pattern;

/** Helpers for {@code HH:MM:SS} wall-clock timestamps. */
public final class Timestamps {

  private static final Pattern FORMAT = Pattern.compile("^\\d{2}:\\d{2}:\\d{2}$");

  private Timestamps() {}

  public static boolean isValid(String timestamp) {
    return timestamp != null && FORMAT.matcher(timestamp).matches();
  }

  /**
   * Seconds since midnight.
   *
   * @return empty if the timestamp is null or not {@code HH:MM:SS}
   */
  public static OptionalInt toSeconds(String timestamp) {
    if (!isValid(timestamp)) {
      return OptionalInt.empty();
    }
    int hours = Integer.parseInt(timestamp.substring(0, 2));
    int minutes = Integer.parseInt(timestamp.substring(3, 5));
    int seconds = Integer.parseInt(timestamp.substring(6, 8));
    return OptionalInt.of(hours * 3600 + minutes * 60 + seconds);
  }

  public static String format(int totalSeconds) {
    return String.format(
        "%02d:%02d:%02d", totalSeconds / 3600, (totalSeconds % 3600) / 60, totalSeconds % 60);
  }

  /** The earlier of two timestamps; an unparseable one loses to a parseable one. */
  public static String earlier(String a, String b) {
    OptionalInt sa = toSeconds(a);
    OptionalInt sb = toSeconds(b);
    if (sa.isEmpty()) {
      return sb.isPresent() ? b : a;
    }
    if (sb.isEmpty()) {
      return a;
    }
    return sb.getAsInt() < sa.getAsInt() ? b : a;
  }

  /** The later of two timestamps; an unparseable one loses to a parseable one. */
  public static String later(String a, String b) {
    OptionalInt sa = toSeconds(a);
    OptionalInt sb = toSeconds(b);
    if (sa.isEmpty()) {
      return sb.isPresent() ? b : a;
    }
    if (sb.isEmpty()) {
      return a;
    }
    return sb.getAsInt() > sa.getAsInt() ? b : a;
  }
}

package com.scholary.meeting.turn;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Jaccard similarity over normalized word sets.
 *
 * <p>Text is lowercased, stripped of punctuation and symbols, and split on whitespace before the
 * sets are compared, so "Friday." and "friday" count as the same word.
 */
public final class TextSimilarity {

  private static final Pattern PUNCTUATION = Pattern.compile("[\\p{P}\\p{S}]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private TextSimilarity() {}

  public static String normalize(String text) {
    if (text == null) {
      return "";
    }
    String stripped = PUNCTUATION.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ");
    return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
  }

  public static Set<String> tokens(String text) {
    String normalized = normalize(text);
    if (normalized.isEmpty()) {
      return Set.of();
    }
    return new HashSet<>(Arrays.asList(WHITESPACE.split(normalized)));
  }

  /**
   * Similarity in [0, 1].
   *
   * <p>Identical normalized texts score 1.0, and an empty side scores 0.0.
   */
  public static double similarity(String a, String b) {
    String na = normalize(a);
    String nb = normalize(b);
    if (na.equals(nb) && !na.isEmpty()) {
      return 1.0;
    }
    if (na.isEmpty() || nb.isEmpty()) {
      return 0.0;
    }
    return jaccard(tokens(na), tokens(nb));
  }

  static double jaccard(Set<String> a, Set<String> b) {
    Set<String> intersection = new HashSet<>(a);
    intersection.retainAll(b);
    int union = a.size() + b.size() - intersection.size();
    return union > 0 ? (double) intersection.size() / union : 0.0;
  }
}

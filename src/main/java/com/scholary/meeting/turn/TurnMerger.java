package com.scholary.meeting.turn;

import com.scholary.meeting.chunking.TranscriptChunk;
import com.scholary.meeting.logging.StructuredLogger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Folds per-chunk turn lists into one canonical transcript.
 *
 * <p>Chunks are folded in index order, whatever order their results arrived in. The first chunk
 * with a result is taken whole. For every later chunk, each turn is compared against a window of
 * trailing turns already merged, sized from the text the chunk shares with the previous one. A turn
 * whose speaker matches and whose text is similar enough to a window turn is folded into it instead
 * of being appended:
 *
 * <pre>
 * merged:  ... [A: "we need to finalize the budget by friday"]   &lt;- window
 * chunk 1:     [a: "we need to finalize the budget by friday."]  -> folded, not appended
 * </pre>
 *
 * <p>A chunk without a result is skipped and reported; the fold carries on with the next one.
 */
@Component
public class TurnMerger {

  private static final Logger LOGGER = LoggerFactory.getLogger(TurnMerger.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  /**
   * Merge chunk results.
   *
   * @param chunks descriptors of every chunk of the transcript
   * @param results turns per chunk index; a missing key or null value is an absent result
   * @param params similarity and window tuning
   * @return the merged transcript, never null
   */
  public MergedTranscript merge(
      List<TranscriptChunk> chunks, Map<Integer, List<Turn>> results, MergeParams params) {
    List<TranscriptChunk> ordered = new ArrayList<>(chunks);
    ordered.sort(Comparator.comparingInt(TranscriptChunk::chunkIndex));

    LOGGER.info("Merging results of {} chunks", ordered.size());

    List<Turn> merged = new ArrayList<>();
    List<Integer> missing = new ArrayList<>();
    List<String> warnings = new ArrayList<>();
    TreeSet<Integer> known = new TreeSet<>();
    int duplicatesRemoved = 0;
    TranscriptChunk previous = null;

    for (TranscriptChunk chunk : ordered) {
      known.add(chunk.chunkIndex());
      List<Turn> result = results.get(chunk.chunkIndex());

      if (result == null) {
        missing.add(chunk.chunkIndex());
        warnings.add("Chunk " + chunk.chunkIndex() + " has no analysis result");
        structuredLogger.logChunkResultMissing(chunk.chunkIndex());
        continue;
      }

      List<Turn> turns = result.stream().filter(Objects::nonNull).toList();

      if (previous == null) {
        merged.addAll(turns);
        LOGGER.debug("Chunk {} taken whole: {} turns", chunk.chunkIndex(), turns.size());
        previous = chunk;
        continue;
      }

      int sharedChars = previous.span().sharedLength(chunk.span());
      int windowTurns = Math.min(params.windowTurns(sharedChars), merged.size());
      int windowStart = merged.size() - windowTurns;
      int windowEnd = merged.size();
      int folded = 0;

      for (Turn turn : turns) {
        int match = findDuplicate(merged, windowStart, windowEnd, turn, params);
        if (match >= 0) {
          merged.set(match, fold(merged.get(match), turn));
          folded++;
        } else {
          merged.add(turn);
        }
      }

      duplicatesRemoved += folded;
      structuredLogger.logOverlapMerge(
          previous.chunkIndex(), chunk.chunkIndex(), windowTurns, folded, turns.size() - folded);
      previous = chunk;
    }

    for (Integer index : results.keySet()) {
      if (!known.contains(index)) {
        LOGGER.warn("Ignoring result for unknown chunk index {}", index);
        warnings.add("Result for unknown chunk " + index + " ignored");
      }
    }

    List<Turn> renumbered = new ArrayList<>(merged.size());
    for (int i = 0; i < merged.size(); i++) {
      renumbered.add(merged.get(i).withIdx(i));
    }

    List<String> findings = TurnValidator.validate(renumbered);
    if (!findings.isEmpty()) {
      LOGGER.warn("Merged transcript has {} validation findings", findings.size());
      warnings.addAll(findings);
    }

    LOGGER.info(
        "Merged transcript: turns={}, duplicatesRemoved={}, missingChunks={}",
        renumbered.size(),
        duplicatesRemoved,
        missing);
    return new MergedTranscript(renumbered, duplicatesRemoved, missing, warnings);
  }

  /** Index of the most similar window turn at or above the threshold, or -1. */
  private int findDuplicate(
      List<Turn> merged, int windowStart, int windowEnd, Turn turn, MergeParams params) {
    int best = -1;
    double bestSimilarity = 0.0;
    for (int i = windowStart; i < windowEnd; i++) {
      Turn candidate = merged.get(i);
      if (!sameSpeaker(candidate.speaker(), turn.speaker())) {
        continue;
      }
      double similarity = TextSimilarity.similarity(candidate.text(), turn.text());
      if (similarity >= params.similarityThreshold() && similarity > bestSimilarity) {
        best = i;
        bestSimilarity = similarity;
      }
    }
    return best;
  }

  /**
   * Fold a duplicate into the turn it matched.
   *
   * <p>The turn with the longer text survives whole; on a tie the existing one does. The span
   * covers both.
   */
  static Turn fold(Turn existing, Turn duplicate) {
    Turn survivor = length(duplicate.text()) > length(existing.text()) ? duplicate : existing;
    return survivor.withSpan(
        Timestamps.earlier(existing.startTs(), duplicate.startTs()),
        Timestamps.later(existing.endTs(), duplicate.endTs()));
  }

  static boolean sameSpeaker(String a, String b) {
    return normalizeSpeaker(a).equals(normalizeSpeaker(b));
  }

  private static String normalizeSpeaker(String speaker) {
    return speaker == null ? "" : speaker.trim().toLowerCase(Locale.ROOT);
  }

  private static int length(String text) {
    return text == null ? 0 : text.length();
  }
}

package com.scholary.meeting.service;

import com.scholary.meeting.analysis.ChunkAnalysisException;
import com.scholary.meeting.analysis.ChunkAnalysisRequest;
import com.scholary.meeting.analysis.ChunkAnalyzer;
import com.scholary.meeting.cache.ChunkResultCache;
import com.scholary.meeting.chunking.TranscriptChunk;
import com.scholary.meeting.config.PipelineProperties;
import com.scholary.meeting.logging.StructuredLogger;
import com.scholary.meeting.turn.Turn;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs the analyzer over every chunk of a transcript, in parallel.
 *
 * <p>Calls go to the bounded {@code analysisExecutor}, so at most its pool size run at once.
 * Retryable failures are retried with exponential backoff and jitter. A chunk that still fails is
 * left out of the result map; the merge treats it as missing. Results come back keyed and sorted
 * by chunk index, whatever order the calls finished in.
 */
@Service
public class ChunkAnalysisRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkAnalysisRunner.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final ChunkAnalyzer analyzer;
  private final ChunkResultCache cache;
  private final Executor executor;
  private final int maxAttempts;
  private final long retryBackoffMillis;

  public ChunkAnalysisRunner(
      ChunkAnalyzer analyzer,
      ChunkResultCache cache,
      @Qualifier("analysisExecutor") Executor executor,
      PipelineProperties properties) {
    this.analyzer = analyzer;
    this.cache = cache;
    this.executor = executor;
    this.maxAttempts = properties.analysis().maxAttempts();
    this.retryBackoffMillis = properties.analysis().retryBackoffMillis();
  }

  /**
   * Analyze all chunks and wait for every call to finish.
   *
   * @param meetingId the meeting id
   * @param transcript the transcript the chunks were planned against
   * @param chunks chunk descriptors
   * @param timeZone the meeting time zone
   * @param progress told after each chunk, with the share of chunks done
   * @return turns per chunk index, only for chunks that succeeded
   */
  public Map<Integer, List<Turn>> analyzeAll(
      String meetingId,
      String transcript,
      List<TranscriptChunk> chunks,
      String timeZone,
      ProgressListener progress) {

    LOGGER.info("Analyzing {} chunks of meeting {}", chunks.size(), meetingId);

    Map<Integer, List<Turn>> results = new ConcurrentHashMap<>();
    AtomicInteger done = new AtomicInteger();
    int total = chunks.size();
    Map<String, String> mdc = MDC.getCopyOfContextMap();
    List<CompletableFuture<Void>> futures = new ArrayList<>();

    for (TranscriptChunk chunk : chunks) {
      ChunkAnalysisRequest request =
          new ChunkAnalysisRequest(
              meetingId,
              chunk.chunkIndex(),
              chunk.text(transcript),
              chunk.overlapText(transcript).orElse(null),
              timeZone);
      String cacheKey =
          ChunkResultCache.generateKey(
              meetingId,
              chunk.chunkIndex(),
              chunk.startChar(),
              chunk.endChar(),
              request.text().hashCode());

      try {
        futures.add(
            CompletableFuture.supplyAsync(
                    () -> withMdc(mdc, () -> analyzeWithRetry(request, cacheKey)), executor)
                .handle(
                    (turns, error) -> {
                      if (error == null) {
                        results.put(chunk.chunkIndex(), turns);
                      } else {
                        LOGGER.warn(
                            "Chunk {} of meeting {} left out: {}",
                            chunk.chunkIndex(),
                            meetingId,
                            unwrapMessage(error));
                      }
                      progress.onProgress("analyze", done.incrementAndGet() * 100 / total);
                      return null;
                    }));
      } catch (RejectedExecutionException e) {
        structuredLogger.logAnalysisFailed(
            chunk.chunkIndex(), 0, e.getClass().getSimpleName(), "analysis queue full");
        progress.onProgress("analyze", done.incrementAndGet() * 100 / total);
      }
    }

    CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

    LOGGER.info(
        "Analysis finished for meeting {}: {}/{} chunks succeeded",
        meetingId,
        results.size(),
        total);
    return new TreeMap<>(results);
  }

  /** Analyze one chunk, from the cache if possible, retrying retryable failures. */
  List<Turn> analyzeWithRetry(ChunkAnalysisRequest request, String cacheKey) {
    int chunkIndex = request.chunkIndex();

    Optional<List<Turn>> cached = cache.get(cacheKey);
    if (cached.isPresent()) {
      structuredLogger.logAnalysisFinished(chunkIndex, cached.get().size(), 0, true);
      return cached.get();
    }

    for (int attempt = 1; ; attempt++) {
      structuredLogger.logAnalysisStarted(chunkIndex, attempt, request.text().length());
      long startTime = System.currentTimeMillis();
      try {
        List<Turn> turns = analyzer.analyze(request);
        if (turns == null) {
          throw new ChunkAnalysisException("Analyzer returned no turn list", false);
        }
        cache.put(cacheKey, turns);
        structuredLogger.logAnalysisFinished(
            chunkIndex, turns.size(), System.currentTimeMillis() - startTime, false);
        return turns;

      } catch (ChunkAnalysisException e) {
        String errorType = e.isRetryable() ? "retryable" : "permanent";
        if (!e.isRetryable() || attempt >= maxAttempts) {
          structuredLogger.logAnalysisFailed(chunkIndex, attempt, errorType, e.getMessage());
          throw e;
        }
        long backoffMs = backoffMillis(attempt);
        structuredLogger.logAnalysisRetry(
            chunkIndex, attempt, maxAttempts, errorType, e.getMessage());
        sleep(backoffMs);

      } catch (RuntimeException e) {
        structuredLogger.logAnalysisFailed(
            chunkIndex, attempt, e.getClass().getSimpleName(), e.getMessage());
        throw e;
      }
    }
  }

  // base * 2^(attempt-1), plus up to one base of jitter
  long backoffMillis(int attempt) {
    if (retryBackoffMillis <= 0) {
      return 0;
    }
    long exponential = retryBackoffMillis << Math.min(attempt - 1, 20);
    return exponential + ThreadLocalRandom.current().nextLong(retryBackoffMillis);
  }

  private static void sleep(long millis) {
    if (millis <= 0) {
      return;
    }
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ChunkAnalysisException("Chunk analysis interrupted", e, false);
    }
  }

  // Runs the task with the submitting thread's MDC, restoring the worker's own afterwards
  private static <T> T withMdc(Map<String, String> context, Supplier<T> task) {
    Map<String, String> previous = MDC.getCopyOfContextMap();
    if (context != null) {
      MDC.setContextMap(context);
    }
    try {
      return task.get();
    } finally {
      if (previous != null) {
        MDC.setContextMap(previous);
      } else {
        MDC.clear();
      }
    }
  }

  private static String unwrapMessage(Throwable error) {
    Throwable cause =
        error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    return cause.getMessage();
  }
}

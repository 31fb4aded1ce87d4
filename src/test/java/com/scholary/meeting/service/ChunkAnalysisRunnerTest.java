package com.scholary.meeting.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.meeting.analysis.ChunkAnalysisException;
import com.scholary.meeting.analysis.ChunkAnalysisRequest;
import com.scholary.meeting.analysis.ChunkAnalyzer;
import com.scholary.meeting.cache.ChunkResultCache;
import com.scholary.meeting.cache.InMemoryChunkResultCache;
import com.scholary.meeting.chunking.BreakKind;
import com.scholary.meeting.chunking.TranscriptChunk;
import com.scholary.meeting.config.PipelineProperties;
import com.scholary.meeting.turn.Turn;
import com.scholary.meeting.turn.TurnType;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ChunkAnalysisRunnerTest {

  private static final String MEETING_ID = "standup";

  private ChunkAnalyzer analyzer;
  private ChunkResultCache cache;
  private ExecutorService executor;
  private ChunkAnalysisRunner runner;

  @BeforeEach
  void setUp() {
    analyzer = mock(ChunkAnalyzer.class);
    cache = new InMemoryChunkResultCache(100, 1);
    executor = Executors.newFixedThreadPool(2);
    runner = new ChunkAnalysisRunner(analyzer, cache, executor, properties(3, 0));
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void analyzeAll_shouldReturnResultsKeyedByChunkIndex() {
    when(analyzer.analyze(any())).thenAnswer(invocation -> turnsFor(invocation.getArgument(0)));

    Map<Integer, List<Turn>> results =
        runner.analyzeAll(MEETING_ID, transcript(4), chunks(4), "UTC", ProgressListener.NONE);

    assertThat(results.keySet()).containsExactly(0, 1, 2, 3);
    assertThat(results.get(2)).extracting(Turn::text).containsExactly("chunk 2");
  }

  @Test
  void analyzeAll_shouldSendChunkTextAndOverlap() {
    List<ChunkAnalysisRequest> requests = new CopyOnWriteArrayList<>();
    when(analyzer.analyze(any()))
        .thenAnswer(
            invocation -> {
              requests.add(invocation.getArgument(0));
              return List.of();
            });

    runner.analyzeAll(MEETING_ID, transcript(2), chunks(2), "Europe/Berlin", ProgressListener.NONE);

    ChunkAnalysisRequest first =
        requests.stream().filter(r -> r.chunkIndex() == 0).findFirst().orElseThrow();
    ChunkAnalysisRequest last =
        requests.stream().filter(r -> r.chunkIndex() == 1).findFirst().orElseThrow();
    assertThat(first.text()).isEqualTo("abcdeabc");
    assertThat(first.overlapText()).isEqualTo("abc");
    assertThat(first.timeZone()).isEqualTo("Europe/Berlin");
    assertThat(last.overlapText()).isNull();
  }

  @Test
  void analyzeAll_shouldLeaveOutPermanentlyFailedChunk() {
    when(analyzer.analyze(any()))
        .thenAnswer(
            invocation -> {
              ChunkAnalysisRequest request = invocation.getArgument(0);
              if (request.chunkIndex() == 1) {
                throw new ChunkAnalysisException("bad chunk", false);
              }
              return turnsFor(request);
            });

    Map<Integer, List<Turn>> results =
        runner.analyzeAll(MEETING_ID, transcript(3), chunks(3), "UTC", ProgressListener.NONE);

    assertThat(results.keySet()).containsExactly(0, 2);
    verify(analyzer, times(1)).analyze(argThat(request -> request.chunkIndex() == 1));
  }

  @Test
  void analyzeAll_shouldRetryRetryableFailure() {
    AtomicInteger calls = new AtomicInteger();
    when(analyzer.analyze(any()))
        .thenAnswer(
            invocation -> {
              if (calls.incrementAndGet() == 1) {
                throw new ChunkAnalysisException("analyzer busy", true);
              }
              return turnsFor(invocation.getArgument(0));
            });

    Map<Integer, List<Turn>> results =
        runner.analyzeAll(MEETING_ID, transcript(1), chunks(1), "UTC", ProgressListener.NONE);

    assertThat(results).containsKey(0);
    verify(analyzer, times(2)).analyze(any());
  }

  @Test
  void analyzeAll_shouldGiveUpAfterMaxAttempts() {
    when(analyzer.analyze(any())).thenThrow(new ChunkAnalysisException("analyzer down", true));

    Map<Integer, List<Turn>> results =
        runner.analyzeAll(MEETING_ID, transcript(1), chunks(1), "UTC", ProgressListener.NONE);

    assertThat(results).isEmpty();
    verify(analyzer, times(3)).analyze(any());
  }

  @Test
  void analyzeAll_shouldNotRetryUnexpectedException() {
    when(analyzer.analyze(any())).thenThrow(new IllegalStateException("bug"));

    Map<Integer, List<Turn>> results =
        runner.analyzeAll(MEETING_ID, transcript(1), chunks(1), "UTC", ProgressListener.NONE);

    assertThat(results).isEmpty();
    verify(analyzer, times(1)).analyze(any());
  }

  @Test
  void analyzeAll_shouldTreatNullResultAsFailure() {
    when(analyzer.analyze(any())).thenReturn(null);

    Map<Integer, List<Turn>> results =
        runner.analyzeAll(MEETING_ID, transcript(1), chunks(1), "UTC", ProgressListener.NONE);

    assertThat(results).isEmpty();
    verify(analyzer, times(1)).analyze(any());
  }

  @Test
  void analyzeAll_shouldUseCachedResult() {
    String transcript = transcript(1);
    TranscriptChunk chunk = chunks(1).get(0);
    List<Turn> cached = List.of(turn("from cache"));
    cache.put(
        ChunkResultCache.generateKey(
            MEETING_ID,
            chunk.chunkIndex(),
            chunk.startChar(),
            chunk.endChar(),
            chunk.text(transcript).hashCode()),
        cached);

    Map<Integer, List<Turn>> results =
        runner.analyzeAll(MEETING_ID, transcript, List.of(chunk), "UTC", ProgressListener.NONE);

    assertThat(results.get(0)).isEqualTo(cached);
    verify(analyzer, never()).analyze(any());
  }

  @Test
  void analyzeAll_shouldCacheSuccessfulResults() {
    when(analyzer.analyze(any())).thenAnswer(invocation -> turnsFor(invocation.getArgument(0)));

    runner.analyzeAll(MEETING_ID, transcript(2), chunks(2), "UTC", ProgressListener.NONE);
    runner.analyzeAll(MEETING_ID, transcript(2), chunks(2), "UTC", ProgressListener.NONE);

    verify(analyzer, times(2)).analyze(any());
  }

  @Test
  void analyzeAll_shouldBoundConcurrentCalls() {
    AtomicInteger running = new AtomicInteger();
    AtomicInteger maxRunning = new AtomicInteger();
    when(analyzer.analyze(any()))
        .thenAnswer(
            invocation -> {
              int now = running.incrementAndGet();
              maxRunning.accumulateAndGet(now, Math::max);
              Thread.sleep(50);
              running.decrementAndGet();
              return turnsFor(invocation.getArgument(0));
            });

    Map<Integer, List<Turn>> results =
        runner.analyzeAll(MEETING_ID, transcript(8), chunks(8), "UTC", ProgressListener.NONE);

    assertThat(results).hasSize(8);
    assertThat(maxRunning.get()).isLessThanOrEqualTo(2);
  }

  @Test
  void analyzeAll_shouldReportProgressUpToHundred() {
    when(analyzer.analyze(any())).thenAnswer(invocation -> turnsFor(invocation.getArgument(0)));
    List<Integer> percents = new CopyOnWriteArrayList<>();

    runner.analyzeAll(
        MEETING_ID, transcript(4), chunks(4), "UTC", (phase, percent) -> percents.add(percent));

    assertThat(percents).hasSize(4).containsOnly(25, 50, 75, 100);
  }

  @Test
  void analyzeAll_shouldSkipChunksRejectedByExecutor() {
    Executor rejecting =
        task -> {
          throw new RejectedExecutionException("queue full");
        };
    ChunkAnalysisRunner saturated =
        new ChunkAnalysisRunner(analyzer, cache, rejecting, properties(3, 0));
    List<Integer> percents = new ArrayList<>();

    Map<Integer, List<Turn>> results =
        saturated.analyzeAll(
            MEETING_ID, transcript(2), chunks(2), "UTC", (phase, percent) -> percents.add(percent));

    assertThat(results).isEmpty();
    assertThat(percents).containsExactly(50, 100);
    verify(analyzer, never()).analyze(any());
  }

  @Test
  void backoffMillis_shouldGrowExponentiallyWithJitter() {
    ChunkAnalysisRunner withBackoff =
        new ChunkAnalysisRunner(analyzer, cache, executor, properties(3, 100));

    assertThat(withBackoff.backoffMillis(1)).isBetween(100L, 199L);
    assertThat(withBackoff.backoffMillis(3)).isBetween(400L, 499L);
    assertThat(runner.backoffMillis(2)).isZero();
  }

  private static PipelineProperties properties(int maxAttempts, long backoffMillis) {
    return new PipelineProperties(
        new PipelineProperties.Chunking(15_000, 2_000, 50_000, 4),
        new PipelineProperties.Merge(0.75, 50, 50),
        new PipelineProperties.Analysis(2, 100, maxAttempts, backoffMillis),
        "UTC",
        2,
        20);
  }

  // count chunks of 8 chars over "abcde" repeated, each sharing 3 chars with the next
  private static String transcript(int count) {
    return "abcde".repeat(count) + "abc";
  }

  private static List<TranscriptChunk> chunks(int count) {
    List<TranscriptChunk> chunks = new ArrayList<>();
    for (int i = 0; i < count - 1; i++) {
      chunks.add(new TranscriptChunk(i, i * 5, i * 5 + 8, i * 5 + 5, 2, true, BreakKind.HARD_CUT));
    }
    int lastStart = (count - 1) * 5;
    chunks.add(
        TranscriptChunk.last(count - 1, lastStart, count * 5 + 3, 2, BreakKind.END_OF_TEXT));
    return chunks;
  }

  private static List<Turn> turnsFor(ChunkAnalysisRequest request) {
    return List.of(turn("chunk " + request.chunkIndex()));
  }

  private static Turn turn(String text) {
    return new Turn(0, "10:00:00", "10:00:05", "Alice", TurnType.MONOLOGUE, 0.0, text);
  }
}

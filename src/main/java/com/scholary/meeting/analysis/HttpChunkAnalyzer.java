package com.scholary.meeting.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.meeting.turn.Turn;
import com.scholary.meeting.turn.TurnNormalizer;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the chunk analyzer service.
 *
 * <p>Posts the chunk as JSON to {@code /api/v1/analyze} and reads back {@code {"turns": [...]}}.
 * Each call is a single attempt; the failure is classified so the caller can decide whether to
 * retry. HTTP 429 and 5xx, I/O errors and unparseable bodies are retryable.
 */
@Component
public class HttpChunkAnalyzer implements ChunkAnalyzer {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpChunkAnalyzer.class);

  static final String ANALYZE_PATH = "/api/v1/analyze";

  private final HttpClient httpClient;
  private final AnalyzerProperties properties;
  private final ObjectMapper objectMapper;

  public HttpChunkAnalyzer(AnalyzerProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info("Initialized analyzer client: baseUrl={}", properties.baseUrl());
  }

  @Override
  public List<Turn> analyze(ChunkAnalysisRequest request) {
    LOGGER.debug(
        "Analyzing chunk: meeting={}, index={}, chars={}",
        request.meetingId(),
        request.chunkIndex(),
        request.text().length());

    String body;
    try {
      body = objectMapper.writeValueAsString(request);
    } catch (JsonProcessingException e) {
      throw new ChunkAnalysisException("Failed to encode analyze request", e, false);
    }

    HttpRequest httpRequest =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + ANALYZE_PATH))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();

    HttpResponse<String> response;
    try {
      response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new ChunkAnalysisException(
          String.format("Analyzer request failed for chunk %d", request.chunkIndex()), e, true);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ChunkAnalysisException("Analyzer request interrupted", e, false);
    }

    int status = response.statusCode();
    if (status != 200) {
      boolean retryable = status == 429 || status >= 500;
      throw new ChunkAnalysisException(
          String.format(
              "Analyzer returned status %d for chunk %d: %s",
              status, request.chunkIndex(), abbreviate(response.body())),
          retryable);
    }

    List<Turn> turns = parseTurns(response.body());
    LOGGER.info("Chunk {} analyzed: {} turns", request.chunkIndex(), turns.size());
    return turns;
  }

  /** Parse and normalize an analyzer response body. */
  List<Turn> parseTurns(String body) {
    AnalyzeResponse parsed;
    try {
      parsed = objectMapper.readValue(body, AnalyzeResponse.class);
    } catch (JsonProcessingException e) {
      throw new ChunkAnalysisException("Unparseable analyzer response", e, true);
    }
    if (parsed == null || parsed.turns() == null) {
      throw new ChunkAnalysisException("Analyzer response has no turns field", true);
    }
    return TurnNormalizer.normalizeAll(parsed.turns());
  }

  private static String abbreviate(String text) {
    if (text == null || text.length() <= 200) {
      return text;
    }
    return text.substring(0, 200) + "...";
  }
}

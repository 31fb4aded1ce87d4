package com.scholary.meeting.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.scholary.meeting.api.JobStatusResponse.Status;
import com.scholary.meeting.chunking.BreakKind;
import com.scholary.meeting.chunking.TranscriptChunk;
import com.scholary.meeting.job.MeetingJob;
import com.scholary.meeting.service.MeetingJobRunner;
import com.scholary.meeting.turn.MergedTranscript;
import com.scholary.meeting.turn.Turn;
import com.scholary.meeting.turn.TurnType;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class MeetingControllerTest {

  @Autowired private TestRestTemplate restTemplate;

  @MockBean private MeetingJobRunner jobRunner;

  @Test
  void preview_shouldReturnSingleChunkForShortTranscript() {
    ChunkPreviewRequest request =
        new ChunkPreviewRequest("Alice: hello.\nBob: hi.\n", null, null, null, null);

    ResponseEntity<ChunkPreviewResponse> response =
        restTemplate.postForEntity("/api/chunks/preview", request, ChunkPreviewResponse.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    ChunkPreviewResponse body = response.getBody();
    assertThat(body).isNotNull();
    assertThat(body.chunked()).isFalse();
    assertThat(body.chunkCount()).isEqualTo(1);
    assertThat(body.params().chunkSizeTokens()).isEqualTo(15_000);
    assertThat(body.chunks().get(0).endBoundary()).isEqualTo(BreakKind.END_OF_TEXT);
  }

  @Test
  void preview_shouldApplyOverrides() {
    String text = "Alice: we need to finalize the budget by friday.\n".repeat(20);
    ChunkPreviewRequest request = new ChunkPreviewRequest(text, 50, 10, 0, 4);

    ResponseEntity<ChunkPreviewResponse> response =
        restTemplate.postForEntity("/api/chunks/preview", request, ChunkPreviewResponse.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    ChunkPreviewResponse body = response.getBody();
    assertThat(body).isNotNull();
    assertThat(body.chunked()).isTrue();
    assertThat(body.chunks()).hasSize(body.chunkCount());
    assertThat(body.chunks().get(0).overlapLength()).isEqualTo(40);
  }

  @Test
  void preview_shouldRejectOverlapNotSmallerThanChunk() {
    ChunkPreviewRequest request = new ChunkPreviewRequest("some text", 100, 100, 0, 4);

    ResponseEntity<String> response =
        restTemplate.postForEntity("/api/chunks/preview", request, String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).contains("must be less than chunkSizeTokens");
  }

  @Test
  void preview_shouldRejectChunkSizeOverflowingCharacterCount() {
    ChunkPreviewRequest request = new ChunkPreviewRequest("some text", (1 << 30) + 10, 2, 0, 4);

    ResponseEntity<String> response =
        restTemplate.postForEntity("/api/chunks/preview", request, String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).contains("exceeds");
  }

  @Test
  void preview_shouldRejectMissingText() {
    ChunkPreviewRequest request = new ChunkPreviewRequest(null, null, null, null, null);

    ResponseEntity<String> response =
        restTemplate.postForEntity("/api/chunks/preview", request, String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
  }

  @Test
  void merge_shouldFoldDuplicatesAcrossChunks() {
    List<TranscriptChunk> chunks =
        List.of(
            new TranscriptChunk(0, 0, 2000, 1200, 500, true, BreakKind.LINE),
            TranscriptChunk.last(1, 1200, 3000, 450, BreakKind.END_OF_TEXT));
    Map<Integer, List<Turn>> results =
        Map.of(
            0,
            List.of(turn("Alice", "10:00:04", "we need to finalize the budget by friday")),
            1,
            List.of(
                turn("alice", "10:00:05", "we need to finalize the budget by friday."),
                turn("Bob", "10:00:10", "agreed")));

    ResponseEntity<MergedTranscript> response =
        restTemplate.postForEntity(
            "/api/merge", new MergeRequest(chunks, results, null), MergedTranscript.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    MergedTranscript merged = response.getBody();
    assertThat(merged).isNotNull();
    assertThat(merged.turns()).hasSize(2);
    assertThat(merged.duplicatesRemoved()).isEqualTo(1);
    assertThat(merged.turns().get(1).type()).isEqualTo(TurnType.ANSWER);
  }

  @Test
  void merge_shouldRejectInvalidThreshold() {
    MergeRequest request =
        new MergeRequest(
            List.of(TranscriptChunk.last(0, 0, 10, 2, BreakKind.END_OF_TEXT)), Map.of(), 1.5);

    ResponseEntity<String> response =
        restTemplate.postForEntity("/api/merge", request, String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).contains("similarityThreshold");
  }

  @Test
  void start_shouldAcceptJobAndExposeStatus() {
    MeetingTurnsRequest request =
        new MeetingTurnsRequest("standup-42", "in/standup.txt", null, null, null, null);

    ResponseEntity<AsyncJobResponse> response =
        restTemplate.postForEntity("/api/meetings", request, AsyncJobResponse.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
    AsyncJobResponse job = response.getBody();
    assertThat(job).isNotNull();
    assertThat(job.statusUrl()).isEqualTo("/api/jobs/" + job.jobId());
    verify(jobRunner).run(any(MeetingJob.class));

    ResponseEntity<JobStatusResponse> status =
        restTemplate.getForEntity(job.statusUrl(), JobStatusResponse.class);

    assertThat(status.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(status.getBody()).isNotNull();
    assertThat(status.getBody().meetingId()).isEqualTo("standup-42");
    assertThat(status.getBody().status()).isEqualTo(Status.PENDING);
    assertThat(status.getBody().phase()).isEqualTo("queued");
  }

  @Test
  void start_shouldRejectInvalidMeetingId() {
    MeetingTurnsRequest request =
        new MeetingTurnsRequest("not a valid id!", "in/standup.txt", null, null, null, null);

    ResponseEntity<String> response =
        restTemplate.postForEntity("/api/meetings", request, String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getHeaders().getContentType())
        .isEqualTo(MediaType.APPLICATION_PROBLEM_JSON);
    assertThat(response.getBody()).contains("\"status\":400").contains("meetingId");
    verify(jobRunner, never()).run(any(MeetingJob.class));
  }

  @Test
  void start_shouldRejectUnknownTimeZoneBeforeQueueing() {
    MeetingTurnsRequest request =
        new MeetingTurnsRequest(
            "standup-44", "in/standup.txt", null, "Mars/Olympus_Mons", null, null);

    ResponseEntity<String> response =
        restTemplate.postForEntity("/api/meetings", request, String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getHeaders().getContentType())
        .isEqualTo(MediaType.APPLICATION_PROBLEM_JSON);
    assertThat(response.getBody()).contains("Unknown time zone: Mars/Olympus_Mons");
    verify(jobRunner, never()).run(any(MeetingJob.class));
  }

  @Test
  void start_shouldAcceptKnownTimeZone() {
    MeetingTurnsRequest request =
        new MeetingTurnsRequest(
            "standup-45", "in/standup.txt", null, "Europe/London", null, null);

    ResponseEntity<AsyncJobResponse> response =
        restTemplate.postForEntity("/api/meetings", request, AsyncJobResponse.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
  }

  @Test
  void start_shouldReturnServiceUnavailableWhenQueueIsFull() {
    doThrow(new TaskRejectedException("queue full")).when(jobRunner).run(any(MeetingJob.class));
    MeetingTurnsRequest request =
        new MeetingTurnsRequest("standup-43", "in/standup.txt", null, null, null, null);

    ResponseEntity<String> response =
        restTemplate.postForEntity("/api/meetings", request, String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
  }

  @Test
  void jobStatus_shouldReturnNotFoundForUnknownJob() {
    ResponseEntity<String> response =
        restTemplate.getForEntity("/api/jobs/does-not-exist", String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
  }

  private static Turn turn(String speaker, String startTs, String text) {
    TurnType type = text.equals("agreed") ? TurnType.ANSWER : TurnType.MONOLOGUE;
    return new Turn(0, startTs, startTs, speaker, type, 0.0, text);
  }
}

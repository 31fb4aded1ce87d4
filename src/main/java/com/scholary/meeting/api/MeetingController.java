package com.scholary.meeting.api;

import com.scholary.meeting.api.JobStatusResponse.Status;
import com.scholary.meeting.chunking.ChunkingParams;
import com.scholary.meeting.chunking.TranscriptChunk;
import com.scholary.meeting.chunking.TranscriptChunker;
import com.scholary.meeting.job.JobRepository;
import com.scholary.meeting.job.MeetingJob;
import com.scholary.meeting.service.MeetingJobRunner;
import com.scholary.meeting.service.MeetingTurnsOrchestrator;
import com.scholary.meeting.turn.MergeParams;
import com.scholary.meeting.turn.MergedTranscript;
import com.scholary.meeting.turn.TurnMerger;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for meeting turn extraction.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Previewing how a transcript would be chunked
 *   <li>Merging chunk results analyzed elsewhere
 *   <li>Asynchronous meeting runs (returns job ID immediately)
 *   <li>Job status polling
 * </ul>
 */
@RestController
@Tag(name = "Meetings", description = "Transcript chunking, merge and meeting runs")
public class MeetingController {

  private static final Logger LOGGER = LoggerFactory.getLogger(MeetingController.class);

  private final TranscriptChunker chunker;
  private final TurnMerger merger;
  private final ChunkingParams chunkingParams;
  private final MergeParams mergeParams;
  private final JobRepository jobRepository;
  private final MeetingJobRunner jobRunner;

  public MeetingController(
      TranscriptChunker chunker,
      TurnMerger merger,
      ChunkingParams chunkingParams,
      MergeParams mergeParams,
      JobRepository jobRepository,
      MeetingJobRunner jobRunner) {
    this.chunker = chunker;
    this.merger = merger;
    this.chunkingParams = chunkingParams;
    this.mergeParams = mergeParams;
    this.jobRepository = jobRepository;
    this.jobRunner = jobRunner;
  }

  @PostMapping("/api/chunks/preview")
  @Operation(
      summary = "Preview chunks",
      description = "Plan the chunks of a transcript without analyzing it")
  public ChunkPreviewResponse preview(@Valid @RequestBody ChunkPreviewRequest request) {
    ChunkingParams params = request.toParams(chunkingParams);
    List<TranscriptChunk> chunks = chunker.chunk(request.text(), params);
    int totalChars = request.text().length();

    return new ChunkPreviewResponse(
        totalChars,
        params.estimateTokens(totalChars),
        chunks.size() > 1,
        chunks.size(),
        params,
        chunks);
  }

  @PostMapping("/api/merge")
  @Operation(
      summary = "Merge chunk results",
      description = "Fold per-chunk turn lists into one de-duplicated turn sequence")
  public MergedTranscript merge(@Valid @RequestBody MergeRequest request) {
    MergeParams params =
        request.similarityThreshold() == null
            ? mergeParams
            : new MergeParams(
                request.similarityThreshold(),
                mergeParams.averageTokensPerTurn(),
                mergeParams.maxWindowTurns(),
                mergeParams.charsPerToken());
    return merger.merge(request.chunks(), request.results(), params);
  }

  /**
   * Start asynchronous meeting run.
   *
   * <p>An unknown time zone is rejected before the job is queued.
   */
  @PostMapping("/api/meetings")
  @Operation(
      summary = "Start meeting run",
      description = "Chunk, analyze and merge a stored transcript; returns a job ID for polling")
  public ResponseEntity<AsyncJobResponse> start(@Valid @RequestBody MeetingTurnsRequest request) {
    String jobId = UUID.randomUUID().toString();
    LOGGER.info(
        "Meeting run request: meetingId={}, key={}", request.meetingId(), request.inputKey());

    if (request.timeZone() != null && !request.timeZone().isBlank()) {
      MeetingTurnsOrchestrator.zoneId(request.timeZone());
    }

    MeetingJob job = new MeetingJob(jobId, request);
    jobRepository.save(job);

    try {
      jobRunner.run(job);
    } catch (TaskRejectedException e) {
      LOGGER.warn("Job queue full, rejecting job {}", jobId);
      job.setStatus(Status.FAILED);
      job.setError("Job queue full");
      jobRepository.save(job);
      return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
    }

    LOGGER.info("Created async meeting job: {}", jobId);
    return ResponseEntity.accepted().body(new AsyncJobResponse(jobId, "/api/jobs/" + jobId));
  }

  /**
   * Get job status.
   *
   * <p>Includes the full result once the job has completed.
   */
  @GetMapping("/api/jobs/{id}")
  @Operation(summary = "Get job status", description = "Check the status of a meeting run")
  public ResponseEntity<JobStatusResponse> jobStatus(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(
            job ->
                ResponseEntity.ok(
                    new JobStatusResponse(
                        job.getJobId(),
                        job.getRequest().meetingId(),
                        job.getStatus(),
                        job.getProgress(),
                        job.getPhase(),
                        job.getResult(),
                        job.getError())))
        .orElse(ResponseEntity.notFound().build());
  }
}

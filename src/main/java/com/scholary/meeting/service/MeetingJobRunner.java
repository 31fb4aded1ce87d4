package com.scholary.meeting.service;

import com.scholary.meeting.api.JobStatusResponse.Status;
import com.scholary.meeting.api.MeetingTurnsResponse;
import com.scholary.meeting.job.JobRepository;
import com.scholary.meeting.job.MeetingJob;
import com.scholary.meeting.logging.StructuredLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Runs meeting jobs on the {@code taskExecutor} pool.
 *
 * <p>A separate bean from the controller so that {@link Async} goes through the Spring proxy.
 */
@Component
public class MeetingJobRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(MeetingJobRunner.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final MeetingTurnsOrchestrator orchestrator;
  private final JobRepository jobRepository;

  public MeetingJobRunner(MeetingTurnsOrchestrator orchestrator, JobRepository jobRepository) {
    this.orchestrator = orchestrator;
    this.jobRepository = jobRepository;
  }

  /** Process a job; the outcome is recorded on the job, never thrown. */
  @Async("taskExecutor")
  public void run(MeetingJob job) {
    StructuredLogger.setJobContext(
        job.getJobId(), job.getRequest().meetingId(), job.getRequest().inputKey());
    LOGGER.info("Starting async processing for job: {}", job.getJobId());

    try {
      job.setStatus(Status.PROCESSING);
      jobRepository.save(job);

      MeetingTurnsResponse result =
          orchestrator.process(
              job.getRequest(),
              (phase, percent) -> {
                job.setPhase(phase);
                job.setProgress(percent);
                structuredLogger.logJobProgress(job.getJobId(), phase, percent);
              });

      job.setStatus(Status.COMPLETED);
      job.setPhase("done");
      job.setProgress(100);
      job.setResult(result);
      jobRepository.save(job);

      LOGGER.info("Completed async processing for job: {}", job.getJobId());

    } catch (Exception e) {
      LOGGER.error("Async processing failed for job: {}", job.getJobId(), e);
      job.setStatus(Status.FAILED);
      job.setError(e.getMessage());
      jobRepository.save(job);
    } finally {
      StructuredLogger.clearJobContext();
    }
  }
}

package com.scholary.meeting.job;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.meeting.api.JobStatusResponse.Status;
import com.scholary.meeting.api.MeetingTurnsRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JobRepositoryTest {

  private JobRepository repository;

  @BeforeEach
  void setUp() {
    repository = new JobRepository(10, 60);
  }

  @Test
  void findById_shouldReturnSavedJob() {
    MeetingJob job =
        new MeetingJob(
            "job-1",
            new MeetingTurnsRequest("standup", "meetings/standup.txt", null, null, null, null));

    repository.save(job);

    assertThat(repository.findById("job-1")).containsSame(job);
  }

  @Test
  void findById_shouldReturnEmptyForUnknownJob() {
    assertThat(repository.findById("missing")).isEmpty();
  }

  @Test
  void newJob_shouldStartQueued() {
    MeetingJob job =
        new MeetingJob(
            "job-2",
            new MeetingTurnsRequest("standup", "meetings/standup.txt", null, null, null, null));

    assertThat(job.getStatus()).isEqualTo(Status.PENDING);
    assertThat(job.getProgress()).isZero();
    assertThat(job.getPhase()).isEqualTo("queued");
  }
}

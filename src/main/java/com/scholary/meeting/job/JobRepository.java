package com.scholary.meeting.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for meeting jobs.
 *
 * <p>Backed by a Caffeine cache so finished jobs age out and memory stays bounded. Jobs do not
 * survive a restart.
 */
@Repository
public class JobRepository {

  private final Cache<String, MeetingJob> cache;

  public JobRepository(
      @Value("${jobstore.maxSize}") int maxSize,
      @Value("${jobstore.expireAfterMinutes}") int expireAfterMinutes) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(expireAfterMinutes))
            .build();
  }

  public void save(MeetingJob job) {
    cache.put(job.getJobId(), job);
  }

  public Optional<MeetingJob> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }
}

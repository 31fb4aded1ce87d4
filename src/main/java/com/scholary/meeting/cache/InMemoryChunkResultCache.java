package com.scholary.meeting.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.meeting.turn.Turn;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Caffeine-backed {@link ChunkResultCache}.
 *
 * <p>Bounded in size and expiring after write (default 24 hours).
 */
@Component
public class InMemoryChunkResultCache implements ChunkResultCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryChunkResultCache.class);

  private final Cache<String, List<Turn>> cache;

  public InMemoryChunkResultCache(
      @Value("${cache.chunkResults.maxSize:1000}") int maxSize,
      @Value("${cache.chunkResults.ttlHours:24}") int ttlHours) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofHours(ttlHours))
            .build();

    LOGGER.info("Initialized chunk result cache: maxSize={}, ttlHours={}", maxSize, ttlHours);
  }

  @Override
  public void put(String cacheKey, List<Turn> turns) {
    cache.put(cacheKey, List.copyOf(turns));
    LOGGER.debug("Cached chunk result: key={}, turns={}", cacheKey, turns.size());
  }

  @Override
  public Optional<List<Turn>> get(String cacheKey) {
    List<Turn> turns = cache.getIfPresent(cacheKey);
    if (turns != null) {
      LOGGER.debug("Cache hit: key={}", cacheKey);
      return Optional.of(turns);
    }
    LOGGER.debug("Cache miss: key={}", cacheKey);
    return Optional.empty();
  }

  @Override
  public void evictMeeting(String meetingId) {
    String prefix = ChunkResultCache.generateMeetingPrefix(meetingId);
    List<String> keys = cache.asMap().keySet().stream().filter(k -> k.startsWith(prefix)).toList();
    cache.invalidateAll(keys);
    LOGGER.info("Evicted {} chunk results for meeting {}", keys.size(), meetingId);
  }
}

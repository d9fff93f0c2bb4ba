package com.scholary.radio.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for narration jobs.
 *
 * <p>Uses Caffeine cache for automatic eviction of old jobs, so a station that runs for weeks does
 * not accumulate job records forever.
 */
@Repository
public class NarrationJobRepository {

  private final Cache<String, NarrationJob> cache;

  public NarrationJobRepository(
      @Value("${jobstore.maxSize}") int maxSize,
      @Value("${jobstore.expireAfterMinutes}") int expireAfterMinutes) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(expireAfterMinutes))
            .build();
  }

  public void save(NarrationJob job) {
    cache.put(job.getJobId(), job);
  }

  public Optional<NarrationJob> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }

  /** Most recent jobs first. */
  public List<NarrationJob> findRecent(int limit) {
    return cache.asMap().values().stream()
        .sorted(Comparator.comparingLong(NarrationJob::getSequence).reversed())
        .limit(limit)
        .collect(Collectors.toList());
  }

  public void delete(String jobId) {
    cache.invalidate(jobId);
  }
}

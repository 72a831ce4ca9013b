package com.scholary.video.transcriber.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory job store backed by a Caffeine cache.
 *
 * <p>The cache is bounded by size and expires jobs a fixed time after their last write, so the
 * registry never grows without limit. Updates go through {@code computeIfPresent} on the cache's
 * map view, which is atomic per key: concurrent pollers always read a complete snapshot.
 */
@Repository
public class InMemoryJobStore implements JobStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryJobStore.class);

  private final Cache<String, Job> cache;
  private final Clock clock;

  @Autowired
  public InMemoryJobStore(
      @Value("${jobstore.maxSize}") int maxSize,
      @Value("${jobstore.expireAfterMinutes}") int expireAfterMinutes) {
    this(maxSize, Duration.ofMinutes(expireAfterMinutes), Ticker.systemTicker(), Clock.systemUTC());
  }

  InMemoryJobStore(int maxSize, Duration expireAfterWrite, Ticker ticker, Clock clock) {
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(expireAfterWrite)
            .ticker(ticker)
            .build();
    this.clock = clock;

    LOGGER.info(
        "Initialized job store: maxSize={}, expireAfterWrite={}", maxSize, expireAfterWrite);
  }

  @Override
  public Job create(String id) {
    Job job = Job.submitted(id, clock.instant());
    Job existing = cache.asMap().putIfAbsent(id, job);
    if (existing != null) {
      throw new IllegalStateException("Job already exists: " + id);
    }
    return job;
  }

  @Override
  public boolean update(String id, JobUpdate update) {
    AtomicBoolean applied = new AtomicBoolean(false);
    Job updated =
        cache
            .asMap()
            .computeIfPresent(
                id,
                (key, current) -> {
                  if (!current.accepts(update)) {
                    return current;
                  }
                  applied.set(true);
                  return current.apply(update);
                });

    if (updated == null) {
      LOGGER.debug("Ignoring update for unknown job: {}", id);
    } else if (!applied.get()) {
      LOGGER.warn(
          "Rejected update for job {}: stage={} -> {}", id, updated.stage(), update.stage());
    }
    return applied.get();
  }

  @Override
  public Optional<Job> get(String id) {
    return Optional.ofNullable(cache.getIfPresent(id));
  }
}

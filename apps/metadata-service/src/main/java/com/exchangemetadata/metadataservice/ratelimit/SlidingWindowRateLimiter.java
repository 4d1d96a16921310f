package com.exchangemetadata.metadataservice.ratelimit;

import com.exchangemetadata.domain.metadata.RateLimitRule;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SlidingWindowRateLimiter implements RateLimiter {
  private static final Logger log = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);
  private static final Duration UNLIMITED_RETENTION = Duration.ofDays(1);

  private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();
  private final Clock clock;

  public SlidingWindowRateLimiter(List<RateLimitRule> initialRules, Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    if (initialRules != null && !initialRules.isEmpty()) {
      updateRules(initialRules);
    }
  }

  @Override
  public RateLimitDecision tryAcquire(String bucketName, int weight) {
    if (bucketName == null || bucketName.isBlank()) {
      throw new IllegalArgumentException("bucket must not be blank");
    }
    if (weight <= 0) {
      throw new IllegalArgumentException("weight must be > 0");
    }
    Bucket bucket = buckets.computeIfAbsent(bucketName, Bucket::new);
    bucket.lock.lock();
    try {
      Instant now = clock.instant();
      bucket.prune(now);
      Duration retryAfter = Duration.ZERO;
      for (RateLimitRule window : bucket.windows) {
        if (weight > window.limit()) {
          throw new IllegalArgumentException(
              "weight "
                  + weight
                  + " exceeds limit "
                  + window.limit()
                  + " of bucket "
                  + bucketName
                  + " per "
                  + window.interval());
        }
        Duration wait = bucket.waitFor(window, weight, now);
        if (wait.compareTo(retryAfter) > 0) {
          retryAfter = wait;
        }
      }
      if (!retryAfter.isZero()) {
        return RateLimitDecision.deny(retryAfter);
      }
      bucket.grants.addLast(new Grant(now, weight));
      return RateLimitDecision.grant();
    } finally {
      bucket.lock.unlock();
    }
  }

  @Override
  public void updateRules(List<RateLimitRule> rules) {
    Map<String, List<RateLimitRule>> byBucket = new LinkedHashMap<>();
    for (RateLimitRule rule : rules) {
      byBucket.computeIfAbsent(rule.bucket(), ignored -> new ArrayList<>()).add(rule);
    }
    byBucket.forEach(
        (bucketName, windows) -> {
          Bucket bucket = buckets.computeIfAbsent(bucketName, Bucket::new);
          bucket.lock.lock();
          try {
            bucket.windows = List.copyOf(windows);
          } finally {
            bucket.lock.unlock();
          }
          log.debug("Rate limit rules updated bucket={} windows={}", bucketName, windows.size());
        });
  }

  @Override
  public List<RateLimitUsage> usage() {
    List<RateLimitUsage> usage = new ArrayList<>();
    for (Bucket bucket : buckets.values()) {
      bucket.lock.lock();
      try {
        Instant now = clock.instant();
        bucket.prune(now);
        for (RateLimitRule window : bucket.windows) {
          usage.add(
              new RateLimitUsage(
                  bucket.name, window.interval(), window.limit(), bucket.consumed(window, now)));
        }
      } finally {
        bucket.lock.unlock();
      }
    }
    usage.sort(
        Comparator.comparing(RateLimitUsage::bucket).thenComparing(RateLimitUsage::interval));
    return usage;
  }

  private record Grant(Instant at, int weight) {}

  private static final class Bucket {
    private final ReentrantLock lock = new ReentrantLock();
    private final String name;
    private final Deque<Grant> grants = new ArrayDeque<>();
    private List<RateLimitRule> windows = List.of();

    private Bucket(String name) {
      this.name = name;
    }

    private void prune(Instant now) {
      Duration retention = UNLIMITED_RETENTION;
      if (!windows.isEmpty()) {
        retention =
            windows.stream().map(RateLimitRule::interval).max(Comparator.naturalOrder()).orElseThrow();
      }
      Instant horizon = now.minus(retention);
      while (!grants.isEmpty() && !grants.peekFirst().at().isAfter(horizon)) {
        grants.removeFirst();
      }
    }

    private long consumed(RateLimitRule window, Instant now) {
      Instant horizon = now.minus(window.interval());
      long consumed = 0L;
      for (Iterator<Grant> it = grants.descendingIterator(); it.hasNext(); ) {
        Grant grant = it.next();
        if (!grant.at().isAfter(horizon)) {
          break;
        }
        consumed += grant.weight();
      }
      return consumed;
    }

    private Duration waitFor(RateLimitRule window, int weight, Instant now) {
      long consumed = consumed(window, now);
      long excess = consumed + weight - window.limit();
      if (excess <= 0) {
        return Duration.ZERO;
      }
      Instant horizon = now.minus(window.interval());
      long freed = 0L;
      for (Grant grant : grants) {
        if (!grant.at().isAfter(horizon)) {
          continue;
        }
        freed += grant.weight();
        if (freed >= excess) {
          return Duration.between(now, grant.at().plus(window.interval()));
        }
      }
      // Unreachable while weight <= limit.
      return window.interval();
    }
  }
}

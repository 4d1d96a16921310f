package com.exchangemetadata.metadataservice.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.exchangemetadata.domain.metadata.RateLimitRule;
import com.exchangemetadata.metadataservice.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class SlidingWindowRateLimiterTest {
  private static final Instant START = Instant.parse("2026-03-01T00:00:00Z");

  @Test
  void eleventhCallInsideOneSecondIsDeniedWithPositiveRetryAfter() {
    MutableClock clock = new MutableClock(START);
    SlidingWindowRateLimiter limiter =
        new SlidingWindowRateLimiter(
            List.of(new RateLimitRule("REQUEST_WEIGHT", Duration.ofSeconds(1), 10)), clock);

    for (int i = 0; i < 10; i++) {
      assertTrue(limiter.tryAcquire("REQUEST_WEIGHT", 1).granted());
      clock.advance(Duration.ofMillis(50));
    }
    RateLimitDecision eleventh = limiter.tryAcquire("REQUEST_WEIGHT", 1);

    assertTrue(eleventh.denied());
    assertTrue(eleventh.retryAfter().compareTo(Duration.ZERO) > 0);
    // the first grant was at START and expires at START + 1s; now is START + 500ms
    assertEquals(Duration.ofMillis(500), eleventh.retryAfter());
  }

  @Test
  void deniedRequestsAreNotRecorded() {
    MutableClock clock = new MutableClock(START);
    SlidingWindowRateLimiter limiter =
        new SlidingWindowRateLimiter(
            List.of(new RateLimitRule("REQUEST_WEIGHT", Duration.ofSeconds(1), 2)), clock);

    assertTrue(limiter.tryAcquire("REQUEST_WEIGHT", 2).granted());
    assertTrue(limiter.tryAcquire("REQUEST_WEIGHT", 1).denied());
    assertTrue(limiter.tryAcquire("REQUEST_WEIGHT", 1).denied());

    clock.advance(Duration.ofSeconds(1));

    assertTrue(limiter.tryAcquire("REQUEST_WEIGHT", 2).granted());
  }

  @Test
  void neverExceedsLimitInAnyRollingWindow() {
    MutableClock clock = new MutableClock(START);
    Duration interval = Duration.ofMillis(1000);
    long limit = 25;
    SlidingWindowRateLimiter limiter =
        new SlidingWindowRateLimiter(List.of(new RateLimitRule("B", interval, limit)), clock);
    Random random = new Random(42L);
    List<Instant> grantTimes = new ArrayList<>();
    List<Integer> grantWeights = new ArrayList<>();

    for (int i = 0; i < 2000; i++) {
      clock.advance(Duration.ofMillis(random.nextInt(40)));
      int weight = 1 + random.nextInt(5);
      if (limiter.tryAcquire("B", weight).granted()) {
        grantTimes.add(clock.instant());
        grantWeights.add(weight);
      }
    }

    for (int i = 0; i < grantTimes.size(); i++) {
      Instant windowStart = grantTimes.get(i);
      Instant windowEnd = windowStart.plus(interval);
      long sum = 0;
      for (int j = i; j < grantTimes.size() && grantTimes.get(j).isBefore(windowEnd); j++) {
        sum += grantWeights.get(j);
      }
      assertTrue(sum <= limit, "window starting at " + windowStart + " consumed " + sum);
    }
  }

  @Test
  void everyWindowOfABucketMustHaveRoom() {
    MutableClock clock = new MutableClock(START);
    SlidingWindowRateLimiter limiter =
        new SlidingWindowRateLimiter(
            List.of(
                new RateLimitRule("ORDERS", Duration.ofSeconds(10), 5),
                new RateLimitRule("ORDERS", Duration.ofMinutes(1), 6)),
            clock);

    for (int i = 0; i < 5; i++) {
      assertTrue(limiter.tryAcquire("ORDERS", 1).granted());
    }
    assertTrue(limiter.tryAcquire("ORDERS", 1).denied());

    clock.advance(Duration.ofSeconds(10));
    assertTrue(limiter.tryAcquire("ORDERS", 1).granted());

    RateLimitDecision minuteDenied = limiter.tryAcquire("ORDERS", 1);
    assertTrue(minuteDenied.denied());
    assertEquals(Duration.ofSeconds(50), minuteDenied.retryAfter());
  }

  @Test
  void retryAfterCoversEnoughExpiredWeight() {
    MutableClock clock = new MutableClock(START);
    SlidingWindowRateLimiter limiter =
        new SlidingWindowRateLimiter(
            List.of(new RateLimitRule("B", Duration.ofSeconds(10), 10)), clock);
    limiter.tryAcquire("B", 3);
    clock.advance(Duration.ofSeconds(2));
    limiter.tryAcquire("B", 3);
    clock.advance(Duration.ofSeconds(2));
    limiter.tryAcquire("B", 4);

    RateLimitDecision decision = limiter.tryAcquire("B", 5);

    // two grants (3 + 3) must age out; the second one expires at START + 12s, now is START + 4s
    assertEquals(Duration.ofSeconds(8), decision.retryAfter());
  }

  @Test
  void bucketWithoutRulesIsUnlimitedButKeepsHistoryForLaterRules() {
    MutableClock clock = new MutableClock(START);
    SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(List.of(), clock);

    for (int i = 0; i < 100; i++) {
      assertTrue(limiter.tryAcquire("RAW_REQUESTS", 1).granted());
    }
    limiter.updateRules(List.of(new RateLimitRule("RAW_REQUESTS", Duration.ofMinutes(5), 100)));

    assertTrue(limiter.tryAcquire("RAW_REQUESTS", 1).denied());
  }

  @Test
  void ruleRefreshReplacesOnlyNamedBuckets() {
    MutableClock clock = new MutableClock(START);
    SlidingWindowRateLimiter limiter =
        new SlidingWindowRateLimiter(
            List.of(
                new RateLimitRule("REQUEST_WEIGHT", Duration.ofMinutes(1), 10),
                new RateLimitRule("SAPI_IP_WEIGHT", Duration.ofMinutes(1), 5)),
            clock);
    limiter.tryAcquire("REQUEST_WEIGHT", 8);

    limiter.updateRules(List.of(new RateLimitRule("REQUEST_WEIGHT", Duration.ofMinutes(1), 9)));

    assertTrue(limiter.tryAcquire("REQUEST_WEIGHT", 2).denied());
    assertTrue(limiter.tryAcquire("REQUEST_WEIGHT", 1).granted());
    List<RateLimitUsage> usage = limiter.usage();
    assertEquals(2, usage.size());
    assertEquals(new RateLimitUsage("REQUEST_WEIGHT", Duration.ofMinutes(1), 9, 9), usage.get(0));
    assertEquals(new RateLimitUsage("SAPI_IP_WEIGHT", Duration.ofMinutes(1), 5, 0), usage.get(1));
  }

  @Test
  void rejectsNonPositiveWeightAndWeightAboveLimit() {
    SlidingWindowRateLimiter limiter =
        new SlidingWindowRateLimiter(
            List.of(new RateLimitRule("B", Duration.ofSeconds(1), 10)), new MutableClock(START));

    assertThrows(IllegalArgumentException.class, () -> limiter.tryAcquire("B", 0));
    assertThrows(IllegalArgumentException.class, () -> limiter.tryAcquire("B", -1));
    assertThrows(IllegalArgumentException.class, () -> limiter.tryAcquire("B", 11));
    assertThrows(IllegalArgumentException.class, () -> limiter.tryAcquire(" ", 1));
  }

  @Test
  void concurrentCallersNeverOverGrant() throws Exception {
    MutableClock clock = new MutableClock(START);
    SlidingWindowRateLimiter limiter =
        new SlidingWindowRateLimiter(
            List.of(new RateLimitRule("B", Duration.ofMinutes(1), 100)), clock);
    ExecutorService executor = Executors.newFixedThreadPool(8);
    CountDownLatch startGate = new CountDownLatch(1);
    AtomicInteger granted = new AtomicInteger();
    try {
      for (int i = 0; i < 500; i++) {
        executor.submit(
            () -> {
              startGate.await();
              if (limiter.tryAcquire("B", 1).granted()) {
                granted.incrementAndGet();
              }
              return null;
            });
      }
      startGate.countDown();
    } finally {
      executor.shutdown();
    }
    assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));

    assertEquals(100, granted.get());
    assertFalse(limiter.tryAcquire("B", 1).granted());
  }
}

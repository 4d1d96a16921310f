package com.exchangemetadata.integration.binance;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RateLimitRetryExecutor {
  private static final Logger log = LoggerFactory.getLogger(RateLimitRetryExecutor.class);
  private static final String RETRY_COUNTER = "connector.binance.rate_limit.retry";
  private static final String EXHAUSTED_COUNTER = "connector.binance.rate_limit.exhausted";

  private final int maxAttempts;
  private final RetryAfterParser retryAfterParser;
  private final JitteredExponentialBackoff backoff;
  private final Sleeper sleeper;
  private final MeterRegistry meterRegistry;

  public RateLimitRetryExecutor(
      int maxAttempts,
      RetryAfterParser retryAfterParser,
      JitteredExponentialBackoff backoff,
      MeterRegistry meterRegistry) {
    this(maxAttempts, retryAfterParser, backoff, duration -> Thread.sleep(duration.toMillis()), meterRegistry);
  }

  public RateLimitRetryExecutor(
      int maxAttempts,
      RetryAfterParser retryAfterParser,
      JitteredExponentialBackoff backoff,
      Sleeper sleeper,
      MeterRegistry meterRegistry) {
    this.maxAttempts = Math.max(1, maxAttempts);
    this.retryAfterParser = Objects.requireNonNull(retryAfterParser, "retryAfterParser must not be null");
    this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
  }

  public <T> T execute(String endpoint, Supplier<T> call) {
    for (int attempt = 1; ; attempt++) {
      try {
        return call.get();
      } catch (BinanceConnectorException ex) {
        if (!ex.isRateLimitError()) {
          throw ex;
        }
        if (attempt >= maxAttempts) {
          meterRegistry.counter(EXHAUSTED_COUNTER, "endpoint", endpoint).increment();
          log.warn(
              "Binance rate limit retries exhausted endpoint={} attempts={} status={}",
              endpoint,
              attempt,
              ex.httpStatus());
          throw ex;
        }
        Duration wait = waitBefore(attempt, ex);
        meterRegistry.counter(RETRY_COUNTER, "endpoint", endpoint).increment();
        log.info(
            "Binance rate limited endpoint={} attempt={} waitMs={}", endpoint, attempt, wait.toMillis());
        pause(wait, ex);
      }
    }
  }

  private Duration waitBefore(int attempt, BinanceConnectorException ex) {
    Duration cap = backoff.maxDelay();
    return ex.retryAfterHeader()
        .flatMap(retryAfterParser::parse)
        .map(retryAfter -> retryAfter.compareTo(cap) <= 0 ? retryAfter : cap)
        .orElseGet(() -> backoff.delayFor(attempt));
  }

  private void pause(Duration wait, BinanceConnectorException cause) {
    if (wait.isZero() || wait.isNegative()) {
      return;
    }
    try {
      sleeper.sleep(wait);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      cause.addSuppressed(interrupted);
      throw cause;
    }
  }

  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }
}

package com.exchangemetadata.integration.binance;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

public class JitteredExponentialBackoff {
  private final Duration baseDelay;
  private final Duration maxDelay;
  private final boolean jitterEnabled;
  private final DoubleSupplier jitterSource;

  public JitteredExponentialBackoff(Duration baseDelay, Duration maxDelay, boolean jitterEnabled) {
    this(baseDelay, maxDelay, jitterEnabled, () -> ThreadLocalRandom.current().nextDouble());
  }

  public JitteredExponentialBackoff(
      Duration baseDelay, Duration maxDelay, boolean jitterEnabled, DoubleSupplier jitterSource) {
    this.baseDelay = nonNegative(baseDelay);
    Duration cap = nonNegative(maxDelay);
    this.maxDelay = cap.compareTo(this.baseDelay) < 0 ? this.baseDelay : cap;
    this.jitterEnabled = jitterEnabled;
    this.jitterSource = Objects.requireNonNull(jitterSource, "jitterSource must not be null");
  }

  public Duration delayFor(int attempt) {
    long cappedMs = exponentialMs(attempt);
    if (!jitterEnabled || cappedMs == 0L) {
      return Duration.ofMillis(cappedMs);
    }
    double factor = Math.max(0.0d, Math.min(0.999999999d, jitterSource.getAsDouble()));
    return Duration.ofMillis((long) Math.floor(factor * (cappedMs + 1L)));
  }

  public Duration maxDelay() {
    return maxDelay;
  }

  private long exponentialMs(int attempt) {
    long baseMs = baseDelay.toMillis();
    if (baseMs == 0L) {
      return 0L;
    }
    int doublings = Math.min(30, Math.max(0, attempt - 1));
    double scaled = baseMs * Math.pow(2.0d, doublings);
    return (long) Math.min((double) maxDelay.toMillis(), scaled);
  }

  private static Duration nonNegative(Duration value) {
    if (value == null || value.isNegative()) {
      return Duration.ZERO;
    }
    return value;
  }
}

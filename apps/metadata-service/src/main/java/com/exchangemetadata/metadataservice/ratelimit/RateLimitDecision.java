package com.exchangemetadata.metadataservice.ratelimit;

import java.time.Duration;
import java.util.Objects;

public record RateLimitDecision(boolean granted, Duration retryAfter) {
  private static final RateLimitDecision GRANTED = new RateLimitDecision(true, Duration.ZERO);

  public RateLimitDecision {
    Objects.requireNonNull(retryAfter, "retryAfter must not be null");
    if (!granted && (retryAfter.isZero() || retryAfter.isNegative())) {
      throw new IllegalArgumentException("denied decision requires a positive retryAfter");
    }
  }

  public static RateLimitDecision grant() {
    return GRANTED;
  }

  public static RateLimitDecision deny(Duration retryAfter) {
    return new RateLimitDecision(false, retryAfter);
  }

  public boolean denied() {
    return !granted;
  }
}

package com.exchangemetadata.domain.metadata;

import java.time.Duration;

public record RateLimitRule(String bucket, Duration interval, long limit) {
  public RateLimitRule {
    if (bucket == null || bucket.isBlank()) {
      throw new MetadataDomainException("bucket must not be blank");
    }
    if (interval == null || interval.isZero() || interval.isNegative()) {
      throw new MetadataDomainException("interval must be > 0");
    }
    if (limit <= 0) {
      throw new MetadataDomainException("limit must be > 0");
    }
  }
}

package com.exchangemetadata.metadataservice.ratelimit;

import java.time.Duration;

public record RateLimitUsage(String bucket, Duration interval, long limit, long consumed) {
  public long remaining() {
    return Math.max(0L, limit - consumed);
  }
}

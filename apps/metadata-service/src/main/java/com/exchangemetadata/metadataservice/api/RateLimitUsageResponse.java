package com.exchangemetadata.metadataservice.api;

import com.exchangemetadata.metadataservice.ratelimit.RateLimitUsage;

public record RateLimitUsageResponse(
    String bucket, long intervalMs, long limit, long consumed, long remaining) {
  public static RateLimitUsageResponse from(RateLimitUsage usage) {
    return new RateLimitUsageResponse(
        usage.bucket(),
        usage.interval().toMillis(),
        usage.limit(),
        usage.consumed(),
        usage.remaining());
  }
}

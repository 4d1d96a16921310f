package com.exchangemetadata.metadataservice.api;

import com.exchangemetadata.domain.metadata.RateLimitRule;

public record RateLimitRuleResponse(String bucket, long intervalMs, long limit) {
  public static RateLimitRuleResponse from(RateLimitRule rule) {
    return new RateLimitRuleResponse(rule.bucket(), rule.interval().toMillis(), rule.limit());
  }
}

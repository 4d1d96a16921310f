package com.exchangemetadata.metadataservice.ratelimit;

import com.exchangemetadata.domain.metadata.RateLimitRule;
import java.util.List;

public interface RateLimiter {
  RateLimitDecision tryAcquire(String bucket, int weight);

  void updateRules(List<RateLimitRule> rules);

  List<RateLimitUsage> usage();
}

package com.exchangemetadata.metadataservice.config;

import com.exchangemetadata.domain.metadata.RateLimitRule;
import com.exchangemetadata.domain.metadata.ResourceKind;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "metadata.poller")
public class MetadataPollerProperties {
  private boolean enabled = true;
  private int schedulerPoolSize = 3;
  private boolean warmStartEnabled = true;
  private boolean publishOnJournalFailure = false;
  private long downThresholdMinutes = 5L;
  private Resource exchangeInfo = new Resource(60_000L, "REQUEST_WEIGHT", 20);
  private Resource accountInfo = new Resource(30_000L, "REQUEST_WEIGHT", 20);
  private Resource systemStatus = new Resource(10_000L, "SAPI_IP_WEIGHT", 1);
  private List<RateLimit> rateLimits = defaultRateLimits();

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public int getSchedulerPoolSize() {
    return schedulerPoolSize;
  }

  public void setSchedulerPoolSize(int schedulerPoolSize) {
    this.schedulerPoolSize = schedulerPoolSize;
  }

  public boolean isWarmStartEnabled() {
    return warmStartEnabled;
  }

  public void setWarmStartEnabled(boolean warmStartEnabled) {
    this.warmStartEnabled = warmStartEnabled;
  }

  public boolean isPublishOnJournalFailure() {
    return publishOnJournalFailure;
  }

  public void setPublishOnJournalFailure(boolean publishOnJournalFailure) {
    this.publishOnJournalFailure = publishOnJournalFailure;
  }

  public long getDownThresholdMinutes() {
    return downThresholdMinutes;
  }

  public void setDownThresholdMinutes(long downThresholdMinutes) {
    this.downThresholdMinutes = downThresholdMinutes;
  }

  public Resource getExchangeInfo() {
    return exchangeInfo;
  }

  public void setExchangeInfo(Resource exchangeInfo) {
    this.exchangeInfo = exchangeInfo;
  }

  public Resource getAccountInfo() {
    return accountInfo;
  }

  public void setAccountInfo(Resource accountInfo) {
    this.accountInfo = accountInfo;
  }

  public Resource getSystemStatus() {
    return systemStatus;
  }

  public void setSystemStatus(Resource systemStatus) {
    this.systemStatus = systemStatus;
  }

  public List<RateLimit> getRateLimits() {
    return rateLimits;
  }

  public void setRateLimits(List<RateLimit> rateLimits) {
    this.rateLimits = rateLimits;
  }

  public Resource resource(ResourceKind kind) {
    if (kind == ResourceKind.EXCHANGE_INFO) {
      return exchangeInfo;
    }
    if (kind == ResourceKind.ACCOUNT_INFO) {
      return accountInfo;
    }
    return systemStatus;
  }

  public Duration downThreshold() {
    return Duration.ofMinutes(Math.max(1L, downThresholdMinutes));
  }

  public List<RateLimitRule> rateLimitRules() {
    List<RateLimitRule> rules = new ArrayList<>();
    for (RateLimit rateLimit : rateLimits) {
      rules.add(
          new RateLimitRule(
              rateLimit.getBucket(),
              Duration.ofMillis(rateLimit.getIntervalMs()),
              rateLimit.getLimit()));
    }
    return rules;
  }

  private static List<RateLimit> defaultRateLimits() {
    List<RateLimit> defaults = new ArrayList<>();
    defaults.add(new RateLimit("REQUEST_WEIGHT", 60_000L, 6000L));
    defaults.add(new RateLimit("SAPI_IP_WEIGHT", 60_000L, 12000L));
    return defaults;
  }

  public static class Resource {
    private boolean enabled = true;
    private long intervalMs;
    private long initialDelayMs = 0L;
    private String bucket;
    private int weight;

    public Resource() {
      this(60_000L, "REQUEST_WEIGHT", 1);
    }

    Resource(long intervalMs, String bucket, int weight) {
      this.intervalMs = intervalMs;
      this.bucket = bucket;
      this.weight = weight;
    }

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public long getIntervalMs() {
      return intervalMs;
    }

    public void setIntervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
    }

    public long getInitialDelayMs() {
      return initialDelayMs;
    }

    public void setInitialDelayMs(long initialDelayMs) {
      this.initialDelayMs = initialDelayMs;
    }

    public String getBucket() {
      return bucket;
    }

    public void setBucket(String bucket) {
      this.bucket = bucket;
    }

    public int getWeight() {
      return weight;
    }

    public void setWeight(int weight) {
      this.weight = weight;
    }

    public Duration interval() {
      return Duration.ofMillis(intervalMs);
    }

    public Duration initialDelay() {
      return Duration.ofMillis(initialDelayMs);
    }
  }

  public static class RateLimit {
    private String bucket;
    private long intervalMs;
    private long limit;

    public RateLimit() {}

    RateLimit(String bucket, long intervalMs, long limit) {
      this.bucket = bucket;
      this.intervalMs = intervalMs;
      this.limit = limit;
    }

    public String getBucket() {
      return bucket;
    }

    public void setBucket(String bucket) {
      this.bucket = bucket;
    }

    public long getIntervalMs() {
      return intervalMs;
    }

    public void setIntervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
    }

    public long getLimit() {
      return limit;
    }

    public void setLimit(long limit) {
      this.limit = limit;
    }
  }
}

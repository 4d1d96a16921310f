package com.exchangemetadata.metadataservice.poller;

import com.exchangemetadata.domain.metadata.ResourceKind;
import com.exchangemetadata.metadataservice.config.MetadataPollerProperties;
import java.time.Duration;
import java.util.Objects;

public record PollerSettings(
    ResourceKind kind,
    Duration interval,
    Duration initialDelay,
    String bucket,
    int weight,
    boolean publishOnJournalFailure,
    Duration downThreshold) {
  public PollerSettings {
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(interval, "interval must not be null");
    Objects.requireNonNull(initialDelay, "initialDelay must not be null");
    Objects.requireNonNull(downThreshold, "downThreshold must not be null");
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException(
          "interval must be > 0 for " + kind.slug() + ", got " + interval.toMillis() + "ms");
    }
    if (initialDelay.isNegative()) {
      throw new IllegalArgumentException("initialDelay must be >= 0 for " + kind.slug());
    }
    if (bucket == null || bucket.isBlank()) {
      throw new IllegalArgumentException("bucket must not be blank");
    }
    if (weight <= 0) {
      throw new IllegalArgumentException("weight must be > 0");
    }
  }

  public static PollerSettings from(ResourceKind kind, MetadataPollerProperties properties) {
    MetadataPollerProperties.Resource resource = properties.resource(kind);
    return new PollerSettings(
        kind,
        resource.interval(),
        resource.initialDelay(),
        resource.getBucket(),
        resource.getWeight(),
        properties.isPublishOnJournalFailure(),
        properties.downThreshold());
  }
}

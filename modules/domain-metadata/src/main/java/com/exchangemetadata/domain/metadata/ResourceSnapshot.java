package com.exchangemetadata.domain.metadata;

import java.time.Instant;
import java.util.Objects;

public record ResourceSnapshot(
    ResourceKind kind,
    Instant fetchedAt,
    long sequence,
    MetadataPayload payload,
    PollOutcome outcome,
    PollFailure failure) {
  public ResourceSnapshot {
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(fetchedAt, "fetchedAt must not be null");
    Objects.requireNonNull(outcome, "outcome must not be null");
    if (sequence < 1) {
      throw new MetadataDomainException("sequence must be >= 1");
    }
    if (outcome == PollOutcome.SUCCESS) {
      if (payload == null) {
        throw new MetadataDomainException("successful snapshot requires a payload");
      }
      if (!kind.payloadType().isInstance(payload)) {
        throw new MetadataDomainException(
            "payload type "
                + payload.getClass().getSimpleName()
                + " does not match kind "
                + kind);
      }
      if (failure != null) {
        throw new MetadataDomainException("successful snapshot must not carry a failure");
      }
    } else {
      if (payload != null) {
        throw new MetadataDomainException("failed snapshot must not carry a payload");
      }
      Objects.requireNonNull(failure, "failure must not be null for a failed snapshot");
    }
  }

  public static ResourceSnapshot success(
      ResourceKind kind, Instant fetchedAt, long sequence, MetadataPayload payload) {
    return new ResourceSnapshot(kind, fetchedAt, sequence, payload, PollOutcome.SUCCESS, null);
  }

  public static ResourceSnapshot failure(
      ResourceKind kind, Instant fetchedAt, long sequence, PollFailure failure) {
    return new ResourceSnapshot(kind, fetchedAt, sequence, null, PollOutcome.FAILURE, failure);
  }

  public boolean isSuccess() {
    return outcome == PollOutcome.SUCCESS;
  }

  public <T extends MetadataPayload> T payloadAs(Class<T> type) {
    if (!isSuccess()) {
      throw new MetadataDomainException("snapshot " + kind + "#" + sequence + " has no payload");
    }
    return type.cast(payload);
  }
}

package com.exchangemetadata.metadataservice.poller;

import com.exchangemetadata.domain.metadata.ResourceKind;
import java.time.Duration;
import java.time.Instant;

public record PollerHealthState(
    ResourceKind kind,
    PollerHealthStatus status,
    PollerState state,
    Instant lastSuccessAt,
    Instant lastPollStartedAt,
    Instant lastPollCompletedAt,
    Instant lastErrorAt,
    String lastErrorCode,
    String lastErrorMessage,
    long consecutiveFailures,
    long lastSequence,
    boolean journalGap,
    Instant updatedAt) {
  public static PollerHealthState initial(ResourceKind kind, Instant now) {
    return new PollerHealthState(
        kind, PollerHealthStatus.DOWN, PollerState.IDLE, null, null, null, null, null, null, 0L, 0L,
        false, now);
  }

  public boolean inFlight() {
    return state == PollerState.FETCHING || state == PollerState.APPLYING;
  }

  public PollerHealthStatus effectiveStatus(Instant now, Duration downThreshold) {
    if (lastSuccessAt == null) {
      return PollerHealthStatus.DOWN;
    }
    if (Duration.between(lastSuccessAt, now).compareTo(downThreshold) >= 0) {
      return PollerHealthStatus.DOWN;
    }
    return status;
  }

  PollerHealthState withState(PollerState nextState, Instant now) {
    return new PollerHealthState(
        kind,
        status,
        nextState,
        lastSuccessAt,
        lastPollStartedAt,
        lastPollCompletedAt,
        lastErrorAt,
        lastErrorCode,
        lastErrorMessage,
        consecutiveFailures,
        lastSequence,
        journalGap,
        now);
  }

  PollerHealthState started(Instant startedAt) {
    return new PollerHealthState(
        kind,
        status,
        PollerState.FETCHING,
        lastSuccessAt,
        startedAt,
        lastPollCompletedAt,
        lastErrorAt,
        lastErrorCode,
        lastErrorMessage,
        consecutiveFailures,
        lastSequence,
        journalGap,
        startedAt);
  }

  PollerHealthState succeeded(Instant completedAt, long sequence, boolean gap) {
    return new PollerHealthState(
        kind,
        gap || journalGap ? PollerHealthStatus.DEGRADED : PollerHealthStatus.UP,
        PollerState.IDLE,
        completedAt,
        lastPollStartedAt,
        completedAt,
        lastErrorAt,
        lastErrorCode,
        lastErrorMessage,
        0L,
        Math.max(lastSequence, sequence),
        journalGap || gap,
        completedAt);
  }

  PollerHealthState failed(
      PollerHealthStatus failureStatus,
      Instant completedAt,
      long sequence,
      String errorCode,
      String errorMessage) {
    return new PollerHealthState(
        kind,
        failureStatus,
        PollerState.FAILED,
        lastSuccessAt,
        lastPollStartedAt,
        completedAt,
        completedAt,
        errorCode,
        errorMessage,
        consecutiveFailures + 1,
        Math.max(lastSequence, sequence),
        journalGap,
        completedAt);
  }
}

package com.exchangemetadata.metadataservice.api;

import com.exchangemetadata.metadataservice.poller.PollerHealthState;
import java.time.Duration;
import java.time.Instant;

public record PollerHealthResponse(
    String kind,
    String status,
    String state,
    boolean inFlight,
    Instant lastSuccessAt,
    Instant lastPollStartedAt,
    Instant lastPollCompletedAt,
    Instant lastErrorAt,
    String lastErrorCode,
    String lastErrorMessage,
    long consecutiveFailures,
    long lastSequence,
    boolean journalGap) {
  public static PollerHealthResponse from(
      PollerHealthState state, Instant now, Duration downThreshold) {
    return new PollerHealthResponse(
        state.kind().slug(),
        state.effectiveStatus(now, downThreshold).name(),
        state.state().name(),
        state.inFlight(),
        state.lastSuccessAt(),
        state.lastPollStartedAt(),
        state.lastPollCompletedAt(),
        state.lastErrorAt(),
        state.lastErrorCode(),
        state.lastErrorMessage(),
        state.consecutiveFailures(),
        state.lastSequence(),
        state.journalGap());
  }
}

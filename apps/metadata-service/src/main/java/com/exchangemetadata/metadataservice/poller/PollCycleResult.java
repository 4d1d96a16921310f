package com.exchangemetadata.metadataservice.poller;

import java.time.Duration;
import java.util.Objects;

public record PollCycleResult(PollCycleOutcome outcome, long sequence, Duration nextDelay) {
  public PollCycleResult {
    Objects.requireNonNull(outcome, "outcome must not be null");
    Objects.requireNonNull(nextDelay, "nextDelay must not be null");
  }
}

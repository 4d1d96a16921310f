package com.exchangemetadata.metadataservice.poller;

import java.util.Locale;

public enum PollCycleOutcome {
  SUCCESS,
  FAILURE,
  RATE_LIMITED,
  JOURNAL_FAILURE,
  COALESCED,
  UNEXPECTED;

  public String metricTag() {
    return name().toLowerCase(Locale.ROOT);
  }
}

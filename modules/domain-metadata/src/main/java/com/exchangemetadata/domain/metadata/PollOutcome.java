package com.exchangemetadata.domain.metadata;

public enum PollOutcome {
  SUCCESS,
  FAILURE
}

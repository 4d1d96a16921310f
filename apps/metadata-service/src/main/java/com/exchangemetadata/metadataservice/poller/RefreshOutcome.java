package com.exchangemetadata.metadataservice.poller;

public enum RefreshOutcome {
  ACCEPTED,
  COALESCED
}

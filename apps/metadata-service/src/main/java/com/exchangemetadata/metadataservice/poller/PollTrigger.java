package com.exchangemetadata.metadataservice.poller;

public enum PollTrigger {
  SCHEDULED,
  MANUAL
}

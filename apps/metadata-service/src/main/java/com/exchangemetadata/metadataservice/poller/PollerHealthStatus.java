package com.exchangemetadata.metadataservice.poller;

public enum PollerHealthStatus {
  UP,
  DEGRADED,
  DOWN
}

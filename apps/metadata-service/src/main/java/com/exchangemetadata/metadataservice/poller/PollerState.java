package com.exchangemetadata.metadataservice.poller;

public enum PollerState {
  IDLE,
  WAITING,
  FETCHING,
  APPLYING,
  FAILED
}

package com.exchangemetadata.metadataservice.state;

public enum StoreUpdateResult {
  APPLIED,
  DISCARDED
}

package com.exchangemetadata.domain.metadata;

public enum SystemStatusValue {
  NORMAL,
  MAINTENANCE
}

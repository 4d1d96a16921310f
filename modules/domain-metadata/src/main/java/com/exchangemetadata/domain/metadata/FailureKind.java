package com.exchangemetadata.domain.metadata;

public enum FailureKind {
  TRANSPORT,
  TIMEOUT,
  HTTP_STATUS,
  RATE_LIMITED,
  PARSE,
  UNEXPECTED
}

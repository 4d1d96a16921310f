package com.exchangemetadata.integration.binance;

import com.exchangemetadata.domain.metadata.FailureKind;
import java.util.Objects;
import java.util.Optional;

public class BinanceConnectorException extends RuntimeException {
  public static final int IO_FAILURE_STATUS = -1;
  private static final int RATE_LIMIT_CODE = -1003;

  private final FailureKind failureKind;
  private final int httpStatus;
  private final Integer binanceCode;
  private final String retryAfterHeader;

  public BinanceConnectorException(
      FailureKind failureKind,
      String message,
      int httpStatus,
      Integer binanceCode,
      String retryAfterHeader,
      Throwable cause) {
    super(message, cause);
    this.failureKind = Objects.requireNonNull(failureKind, "failureKind must not be null");
    this.httpStatus = httpStatus;
    this.binanceCode = binanceCode;
    this.retryAfterHeader = retryAfterHeader;
  }

  public static BinanceConnectorException parse(String message, Throwable cause) {
    return new BinanceConnectorException(
        FailureKind.PARSE, message, IO_FAILURE_STATUS, null, null, cause);
  }

  public FailureKind failureKind() {
    return failureKind;
  }

  public Integer binanceCode() {
    return binanceCode;
  }

  public int httpStatus() {
    return httpStatus;
  }

  public Optional<String> retryAfterHeader() {
    return Optional.ofNullable(retryAfterHeader);
  }

  public boolean isRateLimitError() {
    return httpStatus == 429 || httpStatus == 418 || Integer.valueOf(RATE_LIMIT_CODE).equals(binanceCode);
  }

  static FailureKind classifyStatus(int httpStatus, Integer binanceCode) {
    if (httpStatus == 429 || httpStatus == 418 || Integer.valueOf(RATE_LIMIT_CODE).equals(binanceCode)) {
      return FailureKind.RATE_LIMITED;
    }
    return FailureKind.HTTP_STATUS;
  }
}

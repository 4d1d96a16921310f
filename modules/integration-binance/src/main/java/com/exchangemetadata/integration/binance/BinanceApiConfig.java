package com.exchangemetadata.integration.binance;

import java.net.URI;
import java.time.Duration;

public record BinanceApiConfig(URI baseUri, String apiKey, Duration timeout) {
  public BinanceApiConfig {
    if (baseUri == null) {
      throw new IllegalArgumentException("baseUri is required");
    }
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be > 0");
    }
    apiKey = apiKey == null ? "" : apiKey.trim();
  }

  public boolean hasApiKey() {
    return !apiKey.isBlank();
  }
}

package com.exchangemetadata.metadataservice;

import com.exchangemetadata.domain.metadata.AccountProfile;
import com.exchangemetadata.domain.metadata.AssetBalance;
import com.exchangemetadata.domain.metadata.CommissionRates;
import com.exchangemetadata.domain.metadata.ExchangeInfo;
import com.exchangemetadata.domain.metadata.RateLimitRule;
import com.exchangemetadata.domain.metadata.SymbolRule;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class MetadataFixtures {
  private MetadataFixtures() {}

  public static ExchangeInfo exchangeInfo() {
    return new ExchangeInfo(
        Instant.parse("2026-03-01T00:00:00Z"),
        "UTC",
        List.of(
            new RateLimitRule("REQUEST_WEIGHT", Duration.ofMinutes(1), 6000),
            new RateLimitRule("RAW_REQUESTS", Duration.ofMinutes(5), 61000)),
        List.of(btcusdt(), ethusdt()));
  }

  public static SymbolRule btcusdt() {
    return new SymbolRule(
        "BTCUSDT",
        "TRADING",
        "BTC",
        "USDT",
        new BigDecimal("0.00010000"),
        new BigDecimal("0.00100000"),
        new BigDecimal("0.00100000"),
        new BigDecimal("0.01000000"),
        new BigDecimal("1000000.00000000"),
        new BigDecimal("0.00100000"),
        new BigDecimal("9000.00000000"));
  }

  public static SymbolRule ethusdt() {
    return new SymbolRule(
        "ETHUSDT",
        "BREAK",
        "ETH",
        "USDT",
        new BigDecimal("0.01000000"),
        new BigDecimal("0.00010000"),
        new BigDecimal("0.00100000"),
        new BigDecimal("0.01000000"),
        new BigDecimal("100000.00000000"),
        new BigDecimal("0.00010000"),
        new BigDecimal("9000.00000000"));
  }

  public static AccountProfile accountProfile() {
    return new AccountProfile(
        "SPOT",
        true,
        false,
        true,
        new CommissionRates(
            new BigDecimal("0.00100000"),
            new BigDecimal("0.00100000"),
            BigDecimal.ZERO,
            BigDecimal.ZERO),
        Set.of("SPOT"),
        Map.of(
            "USDT",
            new AssetBalance(new BigDecimal("125.50000000"), new BigDecimal("20.00000000"))));
  }
}

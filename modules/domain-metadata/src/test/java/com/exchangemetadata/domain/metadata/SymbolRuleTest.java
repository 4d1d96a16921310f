package com.exchangemetadata.domain.metadata;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class SymbolRuleTest {
  @Test
  void shouldFindSymbolIgnoringCase() {
    ExchangeInfo info =
        new ExchangeInfo(
            Instant.parse("2026-03-01T00:00:00Z"),
            "UTC",
            List.of(new RateLimitRule("REQUEST_WEIGHT", Duration.ofMinutes(1), 6000)),
            List.of(btcusdt()));

    SymbolRule rule = info.findSymbol("btcusdt").orElseThrow();

    assertEquals(new BigDecimal("0.00010000"), rule.tickSize());
    assertEquals(new BigDecimal("0.00100000"), rule.lotSize());
    assertTrue(rule.isTrading());
    assertTrue(info.findSymbol("DOGEUSDT").isEmpty());
    assertEquals(List.of("BTCUSDT"), info.symbolNames());
  }

  @Test
  void shouldRejectZeroTickSize() {
    assertThrows(
        MetadataDomainException.class,
        () ->
            new SymbolRule(
                "BTCUSDT",
                "TRADING",
                "BTC",
                "USDT",
                BigDecimal.ZERO,
                new BigDecimal("0.001"),
                new BigDecimal("0.001"),
                new BigDecimal("0.01"),
                new BigDecimal("1000000"),
                new BigDecimal("0.001"),
                new BigDecimal("9000")));
  }

  @Test
  void shouldRejectInvertedQuantityBounds() {
    assertThrows(
        MetadataDomainException.class,
        () ->
            new SymbolRule(
                "BTCUSDT",
                "TRADING",
                "BTC",
                "USDT",
                new BigDecimal("0.01"),
                new BigDecimal("0.001"),
                new BigDecimal("0.001"),
                new BigDecimal("0.01"),
                new BigDecimal("1000000"),
                new BigDecimal("10"),
                new BigDecimal("1")));
  }

  @Test
  void shouldRejectInvalidRateLimitRule() {
    assertThrows(
        MetadataDomainException.class,
        () -> new RateLimitRule("ORDERS", Duration.ofSeconds(10), 0));
    assertThrows(
        MetadataDomainException.class, () -> new RateLimitRule("ORDERS", Duration.ZERO, 10));
  }

  static SymbolRule btcusdt() {
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
}

package com.exchangemetadata.integration.binance;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class RetryAfterParserTest {
  private final RetryAfterParser parser =
      new RetryAfterParser(Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC));

  @Test
  void shouldParseDeltaSeconds() {
    assertEquals(Optional.of(Duration.ofSeconds(120)), parser.parse(" 120 "));
  }

  @Test
  void shouldParseHttpDateRelativeToClock() {
    assertEquals(
        Optional.of(Duration.ofSeconds(30)), parser.parse("Sun, 01 Mar 2026 12:00:30 GMT"));
    assertEquals(Optional.of(Duration.ZERO), parser.parse("Sun, 01 Mar 2026 11:00:00 GMT"));
  }

  @Test
  void shouldIgnoreUnparseableValues() {
    assertTrue(parser.parse(null).isEmpty());
    assertTrue(parser.parse("-5").isEmpty());
    assertTrue(parser.parse("soon").isEmpty());
  }
}

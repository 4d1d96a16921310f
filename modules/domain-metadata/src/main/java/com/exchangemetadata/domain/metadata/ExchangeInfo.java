package com.exchangemetadata.domain.metadata;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public record ExchangeInfo(
    Instant serverTime, String timezone, List<RateLimitRule> rateLimits, List<SymbolRule> symbols)
    implements MetadataPayload {
  public ExchangeInfo {
    rateLimits = List.copyOf(Objects.requireNonNull(rateLimits, "rateLimits must not be null"));
    symbols = List.copyOf(Objects.requireNonNull(symbols, "symbols must not be null"));
  }

  @Override
  public ResourceKind kind() {
    return ResourceKind.EXCHANGE_INFO;
  }

  public Optional<SymbolRule> findSymbol(String symbol) {
    if (symbol == null) {
      return Optional.empty();
    }
    return symbols.stream().filter(rule -> rule.symbol().equalsIgnoreCase(symbol)).findFirst();
  }

  public List<String> symbolNames() {
    return symbols.stream().map(SymbolRule::symbol).toList();
  }
}

package com.exchangemetadata.domain.metadata;

import java.math.BigDecimal;
import java.util.Objects;

public record SymbolRule(
    String symbol,
    String status,
    String baseAsset,
    String quoteAsset,
    BigDecimal tickSize,
    BigDecimal lotSize,
    BigDecimal stepSize,
    BigDecimal minPrice,
    BigDecimal maxPrice,
    BigDecimal minQty,
    BigDecimal maxQty) {
  public SymbolRule {
    requireNonBlank(symbol, "symbol");
    requireNonBlank(status, "status");
    requirePositive(tickSize, "tickSize");
    requirePositive(lotSize, "lotSize");
    requirePositive(stepSize, "stepSize");
    requirePositive(minPrice, "minPrice");
    requirePositive(maxPrice, "maxPrice");
    requirePositive(minQty, "minQty");
    requirePositive(maxQty, "maxQty");
    if (minPrice.compareTo(maxPrice) > 0) {
      throw new MetadataDomainException(symbol + ": minPrice must be <= maxPrice");
    }
    if (minQty.compareTo(maxQty) > 0) {
      throw new MetadataDomainException(symbol + ": minQty must be <= maxQty");
    }
  }

  private static void requirePositive(BigDecimal value, String fieldName) {
    if (value == null || value.compareTo(BigDecimal.ZERO) <= 0) {
      throw new MetadataDomainException(fieldName + " must be > 0");
    }
  }

  private static void requireNonBlank(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new MetadataDomainException(fieldName + " must not be blank");
    }
  }

  public boolean isTrading() {
    return Objects.equals("TRADING", status);
  }
}

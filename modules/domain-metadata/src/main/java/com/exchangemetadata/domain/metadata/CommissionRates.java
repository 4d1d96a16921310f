package com.exchangemetadata.domain.metadata;

import java.math.BigDecimal;

public record CommissionRates(
    BigDecimal maker, BigDecimal taker, BigDecimal buyer, BigDecimal seller) {
  public CommissionRates {
    requireNonNegative(maker, "maker");
    requireNonNegative(taker, "taker");
    requireNonNegative(buyer, "buyer");
    requireNonNegative(seller, "seller");
  }

  public static CommissionRates zero() {
    return new CommissionRates(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
  }

  private static void requireNonNegative(BigDecimal value, String fieldName) {
    if (value == null || value.compareTo(BigDecimal.ZERO) < 0) {
      throw new MetadataDomainException(fieldName + " commission must be >= 0");
    }
  }
}

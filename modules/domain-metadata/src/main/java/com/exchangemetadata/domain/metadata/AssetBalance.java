package com.exchangemetadata.domain.metadata;

import java.math.BigDecimal;
import java.util.Objects;

public record AssetBalance(BigDecimal available, BigDecimal locked) {
  public AssetBalance {
    Objects.requireNonNull(available, "available must not be null");
    Objects.requireNonNull(locked, "locked must not be null");
    if (available.compareTo(BigDecimal.ZERO) < 0) {
      throw new MetadataDomainException("available must be >= 0");
    }
    if (locked.compareTo(BigDecimal.ZERO) < 0) {
      throw new MetadataDomainException("locked must be >= 0");
    }
  }

  public BigDecimal total() {
    return available.add(locked);
  }
}

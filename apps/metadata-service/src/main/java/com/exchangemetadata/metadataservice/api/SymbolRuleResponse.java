package com.exchangemetadata.metadataservice.api;

import com.exchangemetadata.domain.metadata.SymbolRule;
import java.math.BigDecimal;

public record SymbolRuleResponse(
    String symbol,
    String status,
    boolean trading,
    String baseAsset,
    String quoteAsset,
    BigDecimal tickSize,
    BigDecimal lotSize,
    BigDecimal stepSize,
    BigDecimal minPrice,
    BigDecimal maxPrice,
    BigDecimal minQty,
    BigDecimal maxQty) {
  public static SymbolRuleResponse from(SymbolRule rule) {
    return new SymbolRuleResponse(
        rule.symbol(),
        rule.status(),
        rule.isTrading(),
        rule.baseAsset(),
        rule.quoteAsset(),
        rule.tickSize(),
        rule.lotSize(),
        rule.stepSize(),
        rule.minPrice(),
        rule.maxPrice(),
        rule.minQty(),
        rule.maxQty());
  }
}

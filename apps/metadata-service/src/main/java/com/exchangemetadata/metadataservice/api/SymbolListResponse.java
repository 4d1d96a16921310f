package com.exchangemetadata.metadataservice.api;

import com.exchangemetadata.domain.metadata.ExchangeInfo;
import com.exchangemetadata.domain.metadata.ResourceSnapshot;
import java.time.Instant;
import java.util.List;

public record SymbolListResponse(List<String> symbols, int count, long sequence, Instant fetchedAt) {
  public static SymbolListResponse from(ResourceSnapshot snapshot) {
    List<String> symbols = snapshot.payloadAs(ExchangeInfo.class).symbolNames();
    return new SymbolListResponse(
        symbols, symbols.size(), snapshot.sequence(), snapshot.fetchedAt());
  }
}

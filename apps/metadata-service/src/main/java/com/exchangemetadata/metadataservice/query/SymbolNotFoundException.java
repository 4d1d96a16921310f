package com.exchangemetadata.metadataservice.query;

public class SymbolNotFoundException extends RuntimeException {
  private final String symbol;

  public SymbolNotFoundException(String symbol) {
    super("Symbol not found: " + symbol);
    this.symbol = symbol;
  }

  public String getSymbol() {
    return symbol;
  }
}

package com.exchangemetadata.integration.binance;

public enum BinanceSignatureType {
  HMAC_SHA256,
  ED25519
}

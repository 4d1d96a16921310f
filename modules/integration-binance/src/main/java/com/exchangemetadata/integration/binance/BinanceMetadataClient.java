package com.exchangemetadata.integration.binance;

import com.exchangemetadata.domain.metadata.AccountProfile;
import com.exchangemetadata.domain.metadata.ExchangeInfo;
import com.exchangemetadata.domain.metadata.MetadataPayload;
import com.exchangemetadata.domain.metadata.ResourceKind;
import com.exchangemetadata.domain.metadata.SystemStatus;

public interface BinanceMetadataClient {
  ExchangeInfo fetchExchangeInfo();

  AccountProfile fetchAccountProfile();

  SystemStatus fetchSystemStatus();

  default MetadataPayload fetch(ResourceKind kind) {
    if (kind == ResourceKind.EXCHANGE_INFO) {
      return fetchExchangeInfo();
    }
    if (kind == ResourceKind.ACCOUNT_INFO) {
      return fetchAccountProfile();
    }
    if (kind == ResourceKind.SYSTEM_STATUS) {
      return fetchSystemStatus();
    }
    throw new IllegalArgumentException("Unsupported resource kind: " + kind);
  }
}

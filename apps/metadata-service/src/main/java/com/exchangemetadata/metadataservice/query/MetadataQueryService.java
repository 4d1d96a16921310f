package com.exchangemetadata.metadataservice.query;

import com.exchangemetadata.domain.metadata.AccountProfile;
import com.exchangemetadata.domain.metadata.ExchangeInfo;
import com.exchangemetadata.domain.metadata.ResourceKind;
import com.exchangemetadata.domain.metadata.ResourceSnapshot;
import com.exchangemetadata.domain.metadata.SymbolRule;
import com.exchangemetadata.domain.metadata.SystemStatus;
import com.exchangemetadata.metadataservice.state.VersionedStateStore;
import java.util.Optional;
import org.springframework.stereotype.Service;

@Service
public class MetadataQueryService {
  private final VersionedStateStore store;

  public MetadataQueryService(VersionedStateStore store) {
    this.store = store;
  }

  public Optional<ResourceSnapshot> latest(ResourceKind kind) {
    return store.read(kind);
  }

  public ResourceSnapshot require(ResourceKind kind) {
    return store.read(kind).orElseThrow(() -> new ResourceNotYetPolledException(kind));
  }

  public ExchangeInfo exchangeInfo() {
    return require(ResourceKind.EXCHANGE_INFO).payloadAs(ExchangeInfo.class);
  }

  public AccountProfile accountProfile() {
    return require(ResourceKind.ACCOUNT_INFO).payloadAs(AccountProfile.class);
  }

  public SystemStatus systemStatus() {
    return require(ResourceKind.SYSTEM_STATUS).payloadAs(SystemStatus.class);
  }

  public SymbolRule symbol(String symbol) {
    if (symbol == null || symbol.isBlank()) {
      throw new IllegalArgumentException("symbol must not be blank");
    }
    return exchangeInfo().findSymbol(symbol).orElseThrow(() -> new SymbolNotFoundException(symbol));
  }
}

package com.exchangemetadata.domain.metadata;

import java.util.Locale;
import java.util.Optional;

public enum ResourceKind {
  EXCHANGE_INFO("exchange-info", ExchangeInfo.class),
  ACCOUNT_INFO("account-info", AccountProfile.class),
  SYSTEM_STATUS("system-status", SystemStatus.class);

  private final String slug;
  private final Class<? extends MetadataPayload> payloadType;

  ResourceKind(String slug, Class<? extends MetadataPayload> payloadType) {
    this.slug = slug;
    this.payloadType = payloadType;
  }

  public String slug() {
    return slug;
  }

  public Class<? extends MetadataPayload> payloadType() {
    return payloadType;
  }

  public static Optional<ResourceKind> fromSlug(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    for (ResourceKind kind : values()) {
      if (kind.slug.equals(normalized)) {
        return Optional.of(kind);
      }
    }
    return Optional.empty();
  }
}

package com.exchangemetadata.metadataservice.api;

import com.exchangemetadata.domain.metadata.ResourceKind;

final class ResourceKindPaths {
  private ResourceKindPaths() {}

  static ResourceKind parse(String value) {
    return ResourceKind.fromSlug(value)
        .orElseThrow(() -> new IllegalArgumentException("Unknown resource kind: " + value));
  }
}

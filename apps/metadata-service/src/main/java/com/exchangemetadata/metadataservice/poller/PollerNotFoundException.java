package com.exchangemetadata.metadataservice.poller;

import com.exchangemetadata.domain.metadata.ResourceKind;

public class PollerNotFoundException extends RuntimeException {
  private final ResourceKind kind;

  public PollerNotFoundException(ResourceKind kind) {
    super("No poller is configured for " + kind.slug());
    this.kind = kind;
  }

  public ResourceKind getKind() {
    return kind;
  }
}

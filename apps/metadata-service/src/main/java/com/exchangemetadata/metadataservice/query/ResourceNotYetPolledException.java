package com.exchangemetadata.metadataservice.query;

import com.exchangemetadata.domain.metadata.ResourceKind;

public class ResourceNotYetPolledException extends RuntimeException {
  private final ResourceKind kind;

  public ResourceNotYetPolledException(ResourceKind kind) {
    super("No successful snapshot yet for " + kind.slug());
    this.kind = kind;
  }

  public ResourceKind getKind() {
    return kind;
  }
}

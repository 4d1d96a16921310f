package com.exchangemetadata.domain.metadata;

public interface MetadataPayload {
  ResourceKind kind();
}

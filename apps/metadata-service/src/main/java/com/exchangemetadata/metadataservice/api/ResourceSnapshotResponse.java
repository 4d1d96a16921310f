package com.exchangemetadata.metadataservice.api;

import com.exchangemetadata.domain.metadata.MetadataPayload;
import com.exchangemetadata.domain.metadata.ResourceSnapshot;
import java.time.Instant;

public record ResourceSnapshotResponse(
    String kind, long sequence, Instant fetchedAt, MetadataPayload payload) {
  public static ResourceSnapshotResponse from(ResourceSnapshot snapshot) {
    return new ResourceSnapshotResponse(
        snapshot.kind().slug(), snapshot.sequence(), snapshot.fetchedAt(), snapshot.payload());
  }
}

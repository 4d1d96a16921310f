package com.exchangemetadata.metadataservice.api;

import com.exchangemetadata.domain.metadata.ResourceSnapshot;
import com.exchangemetadata.domain.metadata.SystemStatus;
import java.time.Instant;

public record SystemStatusResponse(String status, String message, long sequence, Instant fetchedAt) {
  public static SystemStatusResponse from(ResourceSnapshot snapshot) {
    SystemStatus status = snapshot.payloadAs(SystemStatus.class);
    return new SystemStatusResponse(
        status.value().name(), status.message(), snapshot.sequence(), snapshot.fetchedAt());
  }
}

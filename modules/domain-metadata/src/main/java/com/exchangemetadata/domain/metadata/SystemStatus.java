package com.exchangemetadata.domain.metadata;

import java.util.Objects;

public record SystemStatus(SystemStatusValue value, String message) implements MetadataPayload {
  public SystemStatus {
    Objects.requireNonNull(value, "value must not be null");
    if (message == null || message.isBlank()) {
      message = value.name().toLowerCase();
    }
  }

  public static SystemStatus normal() {
    return new SystemStatus(SystemStatusValue.NORMAL, "normal");
  }

  public static SystemStatus maintenance() {
    return new SystemStatus(SystemStatusValue.MAINTENANCE, "system_maintenance");
  }

  @Override
  public ResourceKind kind() {
    return ResourceKind.SYSTEM_STATUS;
  }
}

package com.exchangemetadata.domain.metadata;

import java.util.Objects;

public record PollFailure(FailureKind kind, String message) {
  private static final int MAX_MESSAGE_LENGTH = 500;

  public PollFailure {
    Objects.requireNonNull(kind, "kind must not be null");
    message = compact(message, kind);
  }

  private static String compact(String message, FailureKind kind) {
    if (message == null || message.isBlank()) {
      return kind.name();
    }
    String compact = message.replaceAll("\\s+", " ").trim();
    if (compact.length() <= MAX_MESSAGE_LENGTH) {
      return compact;
    }
    return compact.substring(0, MAX_MESSAGE_LENGTH);
  }
}

package com.exchangemetadata.infra.journal.contract;

import com.exchangemetadata.domain.metadata.ResourceKind;
import java.time.Instant;
import java.util.Objects;

public record JournalAck(
    ResourceKind kind, long sequence, Instant writtenAt, String segment, long position) {
  public JournalAck {
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(writtenAt, "writtenAt must not be null");
    Objects.requireNonNull(segment, "segment must not be null");
  }
}

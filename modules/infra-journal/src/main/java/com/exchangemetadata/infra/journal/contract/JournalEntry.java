package com.exchangemetadata.infra.journal.contract;

import com.exchangemetadata.domain.metadata.ResourceKind;
import com.exchangemetadata.domain.metadata.ResourceSnapshot;
import java.time.Instant;
import java.util.Objects;

public record JournalEntry(ResourceSnapshot snapshot, Instant writtenAt) {
  public JournalEntry {
    Objects.requireNonNull(snapshot, "snapshot must not be null");
    Objects.requireNonNull(writtenAt, "writtenAt must not be null");
  }

  public ResourceKind kind() {
    return snapshot.kind();
  }

  public long sequence() {
    return snapshot.sequence();
  }
}

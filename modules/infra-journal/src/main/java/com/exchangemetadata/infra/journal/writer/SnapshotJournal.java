package com.exchangemetadata.infra.journal.writer;

import com.exchangemetadata.domain.metadata.ResourceKind;
import com.exchangemetadata.domain.metadata.ResourceSnapshot;
import com.exchangemetadata.infra.journal.contract.JournalAck;
import com.exchangemetadata.infra.journal.contract.JournalEntry;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.Predicate;

public interface SnapshotJournal {
  JournalAck append(ResourceSnapshot snapshot);

  List<JournalEntry> read(ResourceKind kind);

  Optional<JournalEntry> findLatest(ResourceKind kind, Predicate<JournalEntry> filter);

  OptionalLong lastSequence(ResourceKind kind);
}

package com.exchangemetadata.metadataservice.state;

import com.exchangemetadata.domain.metadata.ResourceKind;
import com.exchangemetadata.domain.metadata.ResourceSnapshot;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Latest successful snapshot per kind. Writers race through a compare-and-set loop that only moves
 * a slot forward to a strictly greater sequence, so the slot always holds the maximum sequence seen
 * regardless of arrival order. Readers never lock.
 */
public class VersionedStateStore {
  private static final Logger log = LoggerFactory.getLogger(VersionedStateStore.class);

  private final Map<ResourceKind, AtomicReference<ResourceSnapshot>> slots =
      new EnumMap<>(ResourceKind.class);
  private final MeterRegistry meterRegistry;

  public VersionedStateStore(MeterRegistry meterRegistry) {
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
    for (ResourceKind kind : ResourceKind.values()) {
      slots.put(kind, new AtomicReference<>());
    }
  }

  public StoreUpdateResult update(ResourceSnapshot snapshot) {
    Objects.requireNonNull(snapshot, "snapshot must not be null");
    if (!snapshot.isSuccess()) {
      throw new IllegalArgumentException(
          "only successful snapshots are stored, got "
              + snapshot.outcome()
              + " for "
              + snapshot.kind());
    }
    AtomicReference<ResourceSnapshot> slot = slots.get(snapshot.kind());
    while (true) {
      ResourceSnapshot current = slot.get();
      if (current != null && current.sequence() >= snapshot.sequence()) {
        meterRegistry
            .counter("metadata.store.conflicts.total", "kind", snapshot.kind().slug())
            .increment();
        log.debug(
            "Discarded stale snapshot kind={} sequence={} currentSequence={}",
            snapshot.kind().slug(),
            snapshot.sequence(),
            current.sequence());
        return StoreUpdateResult.DISCARDED;
      }
      if (slot.compareAndSet(current, snapshot)) {
        return StoreUpdateResult.APPLIED;
      }
    }
  }

  public Optional<ResourceSnapshot> read(ResourceKind kind) {
    Objects.requireNonNull(kind, "kind must not be null");
    return Optional.ofNullable(slots.get(kind).get());
  }
}

package com.exchangemetadata.metadataservice.state;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.exchangemetadata.domain.metadata.FailureKind;
import com.exchangemetadata.domain.metadata.PollFailure;
import com.exchangemetadata.domain.metadata.ResourceKind;
import com.exchangemetadata.domain.metadata.ResourceSnapshot;
import com.exchangemetadata.domain.metadata.SystemStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class VersionedStateStoreTest {
  private static final Instant FETCHED_AT = Instant.parse("2026-03-01T00:00:00Z");

  @Test
  void appliesOnlyStrictlyGreaterSequences() {
    SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    VersionedStateStore store = new VersionedStateStore(meterRegistry);

    assertEquals(StoreUpdateResult.APPLIED, store.update(status(2)));
    assertEquals(StoreUpdateResult.DISCARDED, store.update(status(1)));
    assertEquals(StoreUpdateResult.DISCARDED, store.update(status(2)));
    assertEquals(StoreUpdateResult.APPLIED, store.update(status(3)));

    assertEquals(3L, store.read(ResourceKind.SYSTEM_STATUS).orElseThrow().sequence());
    assertEquals(
        2.0d,
        meterRegistry
            .get("metadata.store.conflicts.total")
            .tag("kind", "system-status")
            .counter()
            .count());
  }

  @Test
  void kindsAreIndependent() {
    VersionedStateStore store = new VersionedStateStore(new SimpleMeterRegistry());
    ResourceSnapshot status = status(7);

    store.update(status);

    assertSame(status, store.read(ResourceKind.SYSTEM_STATUS).orElseThrow());
    assertTrue(store.read(ResourceKind.EXCHANGE_INFO).isEmpty());
    assertTrue(store.read(ResourceKind.ACCOUNT_INFO).isEmpty());
  }

  @Test
  void rejectsFailureSnapshots() {
    VersionedStateStore store = new VersionedStateStore(new SimpleMeterRegistry());
    ResourceSnapshot failure =
        ResourceSnapshot.failure(
            ResourceKind.SYSTEM_STATUS,
            FETCHED_AT,
            1,
            new PollFailure(FailureKind.TRANSPORT, "connection reset"));

    assertThrows(IllegalArgumentException.class, () -> store.update(failure));
    assertTrue(store.read(ResourceKind.SYSTEM_STATUS).isEmpty());
  }

  @Test
  void holdsMaximumSequenceRegardlessOfArrivalOrder() throws Exception {
    VersionedStateStore store = new VersionedStateStore(new SimpleMeterRegistry());
    List<Long> sequences = new ArrayList<>();
    for (long sequence = 1; sequence <= 1000; sequence++) {
      sequences.add(sequence);
    }
    Collections.shuffle(sequences, new Random(7L));
    ExecutorService executor = Executors.newFixedThreadPool(8);
    CountDownLatch startGate = new CountDownLatch(1);
    try {
      for (Long sequence : sequences) {
        executor.submit(
            () -> {
              startGate.await();
              store.update(status(sequence));
              return null;
            });
      }
      startGate.countDown();
    } finally {
      executor.shutdown();
    }
    assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));

    assertEquals(1000L, store.read(ResourceKind.SYSTEM_STATUS).orElseThrow().sequence());
  }

  private static ResourceSnapshot status(long sequence) {
    return ResourceSnapshot.success(
        ResourceKind.SYSTEM_STATUS, FETCHED_AT, sequence, SystemStatus.normal());
  }
}

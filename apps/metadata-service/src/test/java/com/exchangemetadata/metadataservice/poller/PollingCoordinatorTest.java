package com.exchangemetadata.metadataservice.poller;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.exchangemetadata.domain.metadata.FailureKind;
import com.exchangemetadata.domain.metadata.PollFailure;
import com.exchangemetadata.domain.metadata.ResourceKind;
import com.exchangemetadata.domain.metadata.ResourceSnapshot;
import com.exchangemetadata.domain.metadata.SystemStatus;
import com.exchangemetadata.domain.metadata.SystemStatusValue;
import com.exchangemetadata.infra.journal.observability.NoOpJournalTelemetry;
import com.exchangemetadata.infra.journal.serde.JournalEntryJsonCodec;
import com.exchangemetadata.infra.journal.serde.JournalObjectMapperFactory;
import com.exchangemetadata.infra.journal.writer.FileSnapshotJournal;
import com.exchangemetadata.infra.journal.writer.JournalReadException;
import com.exchangemetadata.infra.journal.writer.SnapshotJournal;
import com.exchangemetadata.integration.binance.BinanceMetadataClient;
import com.exchangemetadata.integration.binance.RetryAfterParser;
import com.exchangemetadata.metadataservice.MetadataFixtures;
import com.exchangemetadata.metadataservice.MutableClock;
import com.exchangemetadata.metadataservice.config.MetadataPollerProperties;
import com.exchangemetadata.metadataservice.ratelimit.RateLimitUsage;
import com.exchangemetadata.metadataservice.ratelimit.SlidingWindowRateLimiter;
import com.exchangemetadata.metadataservice.state.VersionedStateStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.OptionalLong;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.TaskScheduler;

class PollingCoordinatorTest {
  private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

  @TempDir Path tempDir;

  private MutableClock clock;
  private FileSnapshotJournal journal;
  private VersionedStateStore store;
  private SlidingWindowRateLimiter rateLimiter;
  private BinanceMetadataClient client;
  private TaskScheduler scheduler;
  private MetadataPollerProperties properties;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(NOW);
    journal = openJournal();
    store = new VersionedStateStore(new SimpleMeterRegistry());
    rateLimiter = new SlidingWindowRateLimiter(new MetadataPollerProperties().rateLimitRules(), clock);
    client = mock(BinanceMetadataClient.class);
    scheduler = mock(TaskScheduler.class);
    when(scheduler.getClock()).thenReturn(clock);
    properties = new MetadataPollerProperties();
  }

  @AfterEach
  void tearDown() {
    journal.close();
  }

  @Test
  void warmStartResumesSequencesAndSeedsStoreWithLatestSuccess() {
    journal.append(status(1, SystemStatusValue.NORMAL));
    journal.append(status(2, SystemStatusValue.MAINTENANCE));
    journal.append(
        ResourceSnapshot.failure(
            ResourceKind.SYSTEM_STATUS, NOW, 3, new PollFailure(FailureKind.TIMEOUT, "slow")));
    journal.append(
        ResourceSnapshot.success(
            ResourceKind.EXCHANGE_INFO, NOW, 4, MetadataFixtures.exchangeInfo()));
    journal.close();
    journal = openJournal();
    PollingCoordinator coordinator = coordinator(journal);

    coordinator.warmStart();

    ResourceSnapshot seeded = store.read(ResourceKind.SYSTEM_STATUS).orElseThrow();
    assertEquals(2L, seeded.sequence());
    assertEquals(SystemStatusValue.MAINTENANCE, seeded.payloadAs(SystemStatus.class).value());
    assertEquals(3L, coordinator.poller(ResourceKind.SYSTEM_STATUS).orElseThrow().lastSequence());
    assertEquals(4L, store.read(ResourceKind.EXCHANGE_INFO).orElseThrow().sequence());
    assertTrue(store.read(ResourceKind.ACCOUNT_INFO).isEmpty());
    assertEquals(0L, coordinator.poller(ResourceKind.ACCOUNT_INFO).orElseThrow().lastSequence());
    assertTrue(
        rateLimiter
            .usage()
            .contains(new RateLimitUsage("RAW_REQUESTS", Duration.ofMinutes(5), 61000, 0)));

    when(client.fetch(ResourceKind.SYSTEM_STATUS)).thenReturn(SystemStatus.normal());
    PollCycleResult next =
        coordinator.poller(ResourceKind.SYSTEM_STATUS).orElseThrow().pollOnce(PollTrigger.SCHEDULED);

    assertEquals(PollCycleOutcome.SUCCESS, next.outcome());
    assertEquals(4L, next.sequence());
    assertEquals(4L, store.read(ResourceKind.SYSTEM_STATUS).orElseThrow().sequence());
  }

  @Test
  void unreadableJournalStartsThatKindCold() {
    SnapshotJournal brokenJournal = mock(SnapshotJournal.class);
    when(brokenJournal.lastSequence(any(ResourceKind.class))).thenReturn(OptionalLong.of(9L));
    when(brokenJournal.lastSequence(ResourceKind.EXCHANGE_INFO))
        .thenThrow(
            new JournalReadException(
                ResourceKind.EXCHANGE_INFO, "00000000000000000001.log", "corrupt record", null));
    PollingCoordinator coordinator = coordinator(brokenJournal);

    coordinator.warmStart();

    assertEquals(0L, coordinator.poller(ResourceKind.EXCHANGE_INFO).orElseThrow().lastSequence());
    assertEquals(9L, coordinator.poller(ResourceKind.SYSTEM_STATUS).orElseThrow().lastSequence());
    assertTrue(store.read(ResourceKind.EXCHANGE_INFO).isEmpty());
  }

  @Test
  void disabledKindHasNoPoller() {
    properties.getAccountInfo().setEnabled(false);
    PollingCoordinator coordinator = coordinator(journal);

    assertTrue(coordinator.poller(ResourceKind.ACCOUNT_INFO).isEmpty());
    assertEquals(2, coordinator.pollers().size());
    assertThrows(
        PollerNotFoundException.class, () -> coordinator.refresh(ResourceKind.ACCOUNT_INFO));
  }

  @Test
  void applicationReadyStartsEveryEnabledPoller() {
    PollingCoordinator coordinator = coordinator(journal);

    coordinator.onApplicationReady();

    verify(scheduler, times(3)).schedule(any(Runnable.class), any(Instant.class));
    assertTrue(coordinator.pollers().stream().allMatch(ResourcePoller::isRunning));

    coordinator.stop();

    assertTrue(coordinator.pollers().stream().noneMatch(ResourcePoller::isRunning));
  }

  @Test
  void disabledPollingSchedulesNothingButStillAcceptsManualRefresh() {
    properties.setEnabled(false);
    PollingCoordinator coordinator = coordinator(journal);

    coordinator.onApplicationReady();

    verify(scheduler, never()).schedule(any(Runnable.class), any(Instant.class));
    assertEquals(RefreshOutcome.ACCEPTED, coordinator.refresh(ResourceKind.SYSTEM_STATUS));
    verify(scheduler, times(1)).schedule(any(Runnable.class), any(Instant.class));
    assertEquals(3, coordinator.health().size());
  }

  private PollingCoordinator coordinator(SnapshotJournal snapshotJournal) {
    return new PollingCoordinator(
        properties,
        client,
        rateLimiter,
        snapshotJournal,
        store,
        new PollerHealthRegistry(),
        new RetryAfterParser(clock),
        scheduler,
        new SimpleMeterRegistry(),
        clock);
  }

  private FileSnapshotJournal openJournal() {
    return new FileSnapshotJournal(
        tempDir,
        false,
        1024 * 1024,
        new JournalEntryJsonCodec(JournalObjectMapperFactory.create()),
        new NoOpJournalTelemetry(),
        clock);
  }

  private static ResourceSnapshot status(long sequence, SystemStatusValue value) {
    return ResourceSnapshot.success(
        ResourceKind.SYSTEM_STATUS, NOW, sequence, new SystemStatus(value, value.name()));
  }
}

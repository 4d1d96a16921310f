package com.exchangemetadata.metadataservice.poller;

import com.exchangemetadata.domain.metadata.ExchangeInfo;
import com.exchangemetadata.domain.metadata.ResourceKind;
import com.exchangemetadata.domain.metadata.ResourceSnapshot;
import com.exchangemetadata.infra.journal.contract.JournalEntry;
import com.exchangemetadata.infra.journal.writer.SnapshotJournal;
import com.exchangemetadata.integration.binance.BinanceMetadataClient;
import com.exchangemetadata.integration.binance.RetryAfterParser;
import com.exchangemetadata.metadataservice.config.MetadataPollerProperties;
import com.exchangemetadata.metadataservice.ratelimit.RateLimiter;
import com.exchangemetadata.metadataservice.state.StoreUpdateResult;
import com.exchangemetadata.metadataservice.state.VersionedStateStore;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

@Component
public class PollingCoordinator {
  private static final Logger log = LoggerFactory.getLogger(PollingCoordinator.class);

  private final MetadataPollerProperties properties;
  private final SnapshotJournal journal;
  private final VersionedStateStore store;
  private final RateLimiter rateLimiter;
  private final PollerHealthRegistry healthRegistry;
  private final Map<ResourceKind, ResourcePoller> pollers = new EnumMap<>(ResourceKind.class);

  @Autowired
  public PollingCoordinator(
      MetadataPollerProperties properties,
      BinanceMetadataClient client,
      RateLimiter rateLimiter,
      SnapshotJournal journal,
      VersionedStateStore store,
      PollerHealthRegistry healthRegistry,
      RetryAfterParser retryAfterParser,
      @Qualifier("metadataPollerScheduler") TaskScheduler scheduler,
      MeterRegistry meterRegistry) {
    this(
        properties,
        client,
        rateLimiter,
        journal,
        store,
        healthRegistry,
        retryAfterParser,
        scheduler,
        meterRegistry,
        Clock.systemUTC());
  }

  PollingCoordinator(
      MetadataPollerProperties properties,
      BinanceMetadataClient client,
      RateLimiter rateLimiter,
      SnapshotJournal journal,
      VersionedStateStore store,
      PollerHealthRegistry healthRegistry,
      RetryAfterParser retryAfterParser,
      TaskScheduler scheduler,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.properties = properties;
    this.journal = journal;
    this.store = store;
    this.rateLimiter = rateLimiter;
    this.healthRegistry = healthRegistry;
    for (ResourceKind kind : ResourceKind.values()) {
      if (!properties.resource(kind).isEnabled()) {
        log.info("Metadata poller disabled by configuration kind={}", kind.slug());
        continue;
      }
      pollers.put(
          kind,
          new ResourcePoller(
              PollerSettings.from(kind, properties),
              client,
              rateLimiter,
              journal,
              store,
              healthRegistry,
              retryAfterParser,
              scheduler,
              meterRegistry,
              clock));
    }
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onApplicationReady() {
    if (properties.isWarmStartEnabled()) {
      warmStart();
    }
    if (!properties.isEnabled()) {
      log.info("Metadata polling disabled; pollers not scheduled kinds={}", pollers.keySet());
      return;
    }
    pollers.values().forEach(ResourcePoller::start);
  }

  public void warmStart() {
    for (ResourcePoller poller : pollers.values()) {
      ResourceKind kind = poller.kind();
      try {
        OptionalLong lastSequence = journal.lastSequence(kind);
        lastSequence.ifPresent(poller::resumeSequenceFrom);
        Optional<ResourceSnapshot> latest =
            journal
                .findLatest(kind, entry -> entry.snapshot().isSuccess())
                .map(JournalEntry::snapshot);
        latest.ifPresent(this::seed);
        log.info(
            "Metadata warm start kind={} lastSequence={} seededSequence={}",
            kind.slug(),
            lastSequence.isPresent() ? lastSequence.getAsLong() : 0L,
            latest.map(ResourceSnapshot::sequence).orElse(0L));
      } catch (RuntimeException ex) {
        log.warn("Metadata warm start failed kind={}; starting cold", kind.slug(), ex);
      }
    }
  }

  private void seed(ResourceSnapshot snapshot) {
    StoreUpdateResult result = store.update(snapshot);
    if (result == StoreUpdateResult.APPLIED
        && snapshot.payload() instanceof ExchangeInfo exchangeInfo
        && !exchangeInfo.rateLimits().isEmpty()) {
      rateLimiter.updateRules(exchangeInfo.rateLimits());
    }
  }

  @PreDestroy
  public void stop() {
    pollers.values().forEach(ResourcePoller::stop);
  }

  public Optional<ResourcePoller> poller(ResourceKind kind) {
    return Optional.ofNullable(pollers.get(kind));
  }

  public RefreshOutcome refresh(ResourceKind kind) {
    ResourcePoller poller = poller(kind).orElseThrow(() -> new PollerNotFoundException(kind));
    RefreshOutcome outcome = poller.triggerNow();
    log.info("Manual metadata refresh requested kind={} outcome={}", kind.slug(), outcome);
    return outcome;
  }

  public Collection<ResourcePoller> pollers() {
    return Collections.unmodifiableCollection(pollers.values());
  }

  public List<PollerHealthState> health() {
    return healthRegistry.findAll();
  }
}

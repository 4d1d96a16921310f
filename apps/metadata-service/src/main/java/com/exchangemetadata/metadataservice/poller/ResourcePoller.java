package com.exchangemetadata.metadataservice.poller;

import com.exchangemetadata.domain.metadata.ExchangeInfo;
import com.exchangemetadata.domain.metadata.FailureKind;
import com.exchangemetadata.domain.metadata.MetadataDomainException;
import com.exchangemetadata.domain.metadata.MetadataPayload;
import com.exchangemetadata.domain.metadata.PollFailure;
import com.exchangemetadata.domain.metadata.ResourceKind;
import com.exchangemetadata.domain.metadata.ResourceSnapshot;
import com.exchangemetadata.infra.journal.writer.JournalWriteException;
import com.exchangemetadata.infra.journal.writer.SnapshotJournal;
import com.exchangemetadata.integration.binance.BinanceConnectorException;
import com.exchangemetadata.integration.binance.BinanceMetadataClient;
import com.exchangemetadata.integration.binance.RetryAfterParser;
import com.exchangemetadata.metadataservice.ratelimit.RateLimitDecision;
import com.exchangemetadata.metadataservice.ratelimit.RateLimiter;
import com.exchangemetadata.metadataservice.state.StoreUpdateResult;
import com.exchangemetadata.metadataservice.state.VersionedStateStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

/**
 * Polls one resource kind on a self-rescheduling chain.
 *
 * <p>A cycle acquires rate limiter capacity, fetches, assigns the next sequence, appends the
 * snapshot to the journal and only then publishes it to the state store. At most one cycle runs at
 * a time; a tick that arrives while a cycle is in flight is skipped and counted.
 */
public class ResourcePoller {
  private static final Logger log = LoggerFactory.getLogger(ResourcePoller.class);

  static final String POLL_TOTAL_METRIC = "metadata.poller.poll.total";
  static final String POLL_DURATION_METRIC = "metadata.poller.poll.duration";
  static final String COALESCED_METRIC = "metadata.poller.tick.coalesced.total";
  static final String RATE_LIMITED_METRIC = "metadata.poller.rate_limited.total";
  static final String JOURNAL_FAILURE_METRIC = "metadata.poller.journal.failures.total";
  static final String JOURNAL_WRITE_ERROR_CODE = "JOURNAL_WRITE_FAILED";

  private final PollerSettings settings;
  private final BinanceMetadataClient client;
  private final RateLimiter rateLimiter;
  private final SnapshotJournal journal;
  private final VersionedStateStore store;
  private final PollerHealthRegistry healthRegistry;
  private final RetryAfterParser retryAfterParser;
  private final TaskScheduler scheduler;
  private final MeterRegistry meterRegistry;
  private final Clock clock;
  private final AtomicBoolean inFlight = new AtomicBoolean(false);
  private final AtomicBoolean running = new AtomicBoolean(false);
  private final AtomicLong lastSequence = new AtomicLong(0L);
  private final AtomicLong chain = new AtomicLong(0L);
  private volatile ScheduledFuture<?> nextTick;

  public ResourcePoller(
      PollerSettings settings,
      BinanceMetadataClient client,
      RateLimiter rateLimiter,
      SnapshotJournal journal,
      VersionedStateStore store,
      PollerHealthRegistry healthRegistry,
      RetryAfterParser retryAfterParser,
      TaskScheduler scheduler,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.settings = Objects.requireNonNull(settings, "settings must not be null");
    this.client = Objects.requireNonNull(client, "client must not be null");
    this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter must not be null");
    this.journal = Objects.requireNonNull(journal, "journal must not be null");
    this.store = Objects.requireNonNull(store, "store must not be null");
    this.healthRegistry = Objects.requireNonNull(healthRegistry, "healthRegistry must not be null");
    this.retryAfterParser =
        Objects.requireNonNull(retryAfterParser, "retryAfterParser must not be null");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    healthRegistry.upsert(PollerHealthState.initial(settings.kind(), clock.instant()));
  }

  public ResourceKind kind() {
    return settings.kind();
  }

  public PollerSettings settings() {
    return settings;
  }

  public long lastSequence() {
    return lastSequence.get();
  }

  public boolean isInFlight() {
    return inFlight.get();
  }

  public boolean isRunning() {
    return running.get();
  }

  public void resumeSequenceFrom(long sequence) {
    lastSequence.accumulateAndGet(sequence, Math::max);
  }

  public void start() {
    if (!running.compareAndSet(false, true)) {
      return;
    }
    log.info(
        "Metadata poller started kind={} intervalMs={} bucket={} weight={} resumeSequence={}",
        kind().slug(),
        settings.interval().toMillis(),
        settings.bucket(),
        settings.weight(),
        lastSequence.get());
    scheduleNext(chain.incrementAndGet(), settings.initialDelay());
  }

  public void stop() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    chain.incrementAndGet();
    ScheduledFuture<?> pending = nextTick;
    if (pending != null) {
      pending.cancel(false);
    }
    log.info("Metadata poller stopped kind={} lastSequence={}", kind().slug(), lastSequence.get());
  }

  public RefreshOutcome triggerNow() {
    if (inFlight.get()) {
      countCoalesced(PollTrigger.MANUAL);
      return RefreshOutcome.COALESCED;
    }
    scheduler.schedule(() -> pollOnce(PollTrigger.MANUAL), scheduler.getClock().instant());
    return RefreshOutcome.ACCEPTED;
  }

  public PollCycleResult pollOnce(PollTrigger trigger) {
    if (!inFlight.compareAndSet(false, true)) {
      countCoalesced(trigger);
      log.info(
          "Skipping metadata poll kind={} trigger={} because another cycle is in flight",
          kind().slug(),
          trigger);
      return new PollCycleResult(PollCycleOutcome.COALESCED, 0L, settings.interval());
    }
    Instant startedAt = clock.instant();
    try {
      return executeCycle(trigger, startedAt);
    } catch (RuntimeException ex) {
      Instant completedAt = clock.instant();
      String errorCode = errorCode(ex);
      PollerHealthState previous = currentHealth(completedAt);
      healthRegistry.upsert(
          previous.failed(
              failureStatus(previous.lastSuccessAt(), completedAt),
              completedAt,
              0L,
              errorCode,
              sanitizeMessage(ex)));
      resyncSequence();
      incrementTotal(PollCycleOutcome.UNEXPECTED);
      recordDuration(startedAt, completedAt);
      log.error(
          "Metadata poll failed unexpectedly kind={} trigger={} error={}",
          kind().slug(),
          trigger,
          errorCode,
          ex);
      return new PollCycleResult(PollCycleOutcome.UNEXPECTED, 0L, settings.interval());
    } finally {
      inFlight.set(false);
    }
  }

  private PollCycleResult executeCycle(PollTrigger trigger, Instant startedAt) {
    PollerHealthState previous = currentHealth(startedAt);
    RateLimitDecision decision = rateLimiter.tryAcquire(settings.bucket(), settings.weight());
    if (decision.denied()) {
      healthRegistry.upsert(previous.withState(PollerState.WAITING, startedAt));
      meterRegistry.counter(RATE_LIMITED_METRIC, "kind", kind().slug()).increment();
      incrementTotal(PollCycleOutcome.RATE_LIMITED);
      log.info(
          "Metadata poll deferred by rate limiter kind={} trigger={} bucket={} retryAfterMs={}",
          kind().slug(),
          trigger,
          settings.bucket(),
          decision.retryAfter().toMillis());
      return new PollCycleResult(PollCycleOutcome.RATE_LIMITED, 0L, decision.retryAfter());
    }

    healthRegistry.upsert(previous.started(startedAt));
    Duration nextDelay = settings.interval();
    MetadataPayload payload = null;
    PollFailure failure = null;
    String errorCode = null;
    try {
      payload = client.fetch(kind());
    } catch (BinanceConnectorException ex) {
      errorCode = errorCode(ex);
      failure = new PollFailure(ex.failureKind(), ex.getMessage());
      nextDelay = longest(nextDelay, retryAfter(ex));
    } catch (MetadataDomainException ex) {
      errorCode = errorCode(ex);
      failure = new PollFailure(FailureKind.PARSE, ex.getMessage());
    } catch (RuntimeException ex) {
      errorCode = errorCode(ex);
      failure = new PollFailure(FailureKind.UNEXPECTED, sanitizeMessage(ex));
      log.error(
          "Unexpected error fetching metadata kind={} trigger={} error={}",
          kind().slug(),
          trigger,
          errorCode,
          ex);
    }

    long sequence = lastSequence.incrementAndGet();
    Instant fetchedAt = clock.instant();
    ResourceSnapshot snapshot =
        failure == null
            ? ResourceSnapshot.success(kind(), fetchedAt, sequence, payload)
            : ResourceSnapshot.failure(kind(), fetchedAt, sequence, failure);
    if (snapshot.isSuccess()) {
      healthRegistry.upsert(currentHealth(fetchedAt).withState(PollerState.APPLYING, fetchedAt));
    }

    boolean journaled = appendToJournal(snapshot);
    boolean published = false;
    if (snapshot.isSuccess() && (journaled || settings.publishOnJournalFailure())) {
      publish(snapshot);
      published = true;
    }
    if (!journaled) {
      resyncSequence();
    }

    Instant completedAt = clock.instant();
    PollerHealthState current = currentHealth(completedAt);
    PollCycleOutcome outcome;
    if (published) {
      healthRegistry.upsert(current.succeeded(completedAt, sequence, !journaled));
      outcome = journaled ? PollCycleOutcome.SUCCESS : PollCycleOutcome.JOURNAL_FAILURE;
      log.debug(
          "Metadata poll applied kind={} trigger={} sequence={} journaled={}",
          kind().slug(),
          trigger,
          sequence,
          journaled);
    } else {
      String code = journaled ? errorCode : JOURNAL_WRITE_ERROR_CODE;
      String message = journaled ? failure.message() : "journal append failed";
      healthRegistry.upsert(
          current.failed(
              failureStatus(current.lastSuccessAt(), completedAt),
              completedAt,
              journaled ? sequence : 0L,
              code,
              message));
      outcome = journaled ? PollCycleOutcome.FAILURE : PollCycleOutcome.JOURNAL_FAILURE;
      if (failure != null) {
        log.warn(
            "Metadata poll failed kind={} trigger={} sequence={} failureKind={} error={} message={}",
            kind().slug(),
            trigger,
            sequence,
            failure.kind(),
            errorCode,
            failure.message());
      }
    }
    incrementTotal(outcome);
    recordDuration(startedAt, completedAt);
    return new PollCycleResult(outcome, sequence, nextDelay);
  }

  private boolean appendToJournal(ResourceSnapshot snapshot) {
    try {
      journal.append(snapshot);
      return true;
    } catch (JournalWriteException ex) {
      meterRegistry.counter(JOURNAL_FAILURE_METRIC, "kind", kind().slug()).increment();
      log.error(
          "Journal append failed kind={} sequence={} outcome={} publishAnyway={}",
          kind().slug(),
          snapshot.sequence(),
          snapshot.outcome(),
          snapshot.isSuccess() && settings.publishOnJournalFailure(),
          ex);
      return false;
    }
  }

  private void publish(ResourceSnapshot snapshot) {
    StoreUpdateResult result = store.update(snapshot);
    if (result == StoreUpdateResult.APPLIED
        && snapshot.payload() instanceof ExchangeInfo exchangeInfo
        && !exchangeInfo.rateLimits().isEmpty()) {
      rateLimiter.updateRules(exchangeInfo.rateLimits());
    }
  }

  // Realigns after an entry failed to reach the journal; never drops below the store sequence.
  private void resyncSequence() {
    try {
      long durable = journal.lastSequence(kind()).orElse(0L);
      long visible = store.read(kind()).map(ResourceSnapshot::sequence).orElse(0L);
      lastSequence.set(Math.max(durable, visible));
    } catch (RuntimeException ex) {
      log.warn(
          "Unable to resync sequence from journal kind={} lastSequence={}",
          kind().slug(),
          lastSequence.get(),
          ex);
    }
  }

  private void scheduledTick(long generation) {
    Duration delay = settings.interval();
    try {
      delay = pollOnce(PollTrigger.SCHEDULED).nextDelay();
    } finally {
      scheduleNext(generation, delay);
    }
  }

  // A tick from a chain that was stopped (and possibly restarted) must not reschedule.
  private void scheduleNext(long generation, Duration delay) {
    if (!running.get() || chain.get() != generation) {
      return;
    }
    nextTick =
        scheduler.schedule(
            () -> scheduledTick(generation), scheduler.getClock().instant().plus(delay));
  }

  private PollerHealthState currentHealth(Instant now) {
    return healthRegistry.findByKind(kind()).orElse(PollerHealthState.initial(kind(), now));
  }

  private Duration retryAfter(BinanceConnectorException ex) {
    return ex.retryAfterHeader().flatMap(retryAfterParser::parse).orElse(Duration.ZERO);
  }

  private void countCoalesced(PollTrigger trigger) {
    meterRegistry
        .counter(
            COALESCED_METRIC,
            "kind",
            kind().slug(),
            "trigger",
            trigger.name().toLowerCase())
        .increment();
  }

  private void incrementTotal(PollCycleOutcome outcome) {
    meterRegistry
        .counter(POLL_TOTAL_METRIC, "kind", kind().slug(), "outcome", outcome.metricTag())
        .increment();
  }

  private void recordDuration(Instant startedAt, Instant completedAt) {
    Timer.builder(POLL_DURATION_METRIC)
        .description("Metadata poll cycle latency")
        .tag("kind", kind().slug())
        .register(meterRegistry)
        .record(Duration.between(startedAt, completedAt).abs());
  }

  private PollerHealthStatus failureStatus(Instant lastSuccessAt, Instant now) {
    if (lastSuccessAt == null) {
      return PollerHealthStatus.DOWN;
    }
    if (Duration.between(lastSuccessAt, now).compareTo(settings.downThreshold()) >= 0) {
      return PollerHealthStatus.DOWN;
    }
    return PollerHealthStatus.DEGRADED;
  }

  private static Duration longest(Duration a, Duration b) {
    return a.compareTo(b) >= 0 ? a : b;
  }

  static String errorCode(Throwable error) {
    if (error instanceof BinanceConnectorException ex) {
      if (ex.httpStatus() > 0) {
        return "HTTP_" + ex.httpStatus();
      }
      return ex.failureKind().name();
    }
    String simpleName = error.getClass().getSimpleName();
    return simpleName == null || simpleName.isBlank() ? "UnknownError" : simpleName;
  }

  private static String sanitizeMessage(Throwable error) {
    String message = error.getMessage();
    if (message == null || message.isBlank()) {
      return errorCode(error);
    }
    String compact = message.replaceAll("\\s+", " ").trim();
    if (compact.length() <= 500) {
      return compact;
    }
    return compact.substring(0, 500);
  }
}

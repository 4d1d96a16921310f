package com.exchangemetadata.infra.journal.observability;

import com.exchangemetadata.domain.metadata.ResourceKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;

public class MicrometerJournalTelemetry implements JournalTelemetry {
  private final MeterRegistry meterRegistry;

  public MicrometerJournalTelemetry(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void onAppendSuccess(ResourceKind kind, int bytes, long durationNanos) {
    Counter.builder("metadata.journal.append.total")
        .description("Total journal appends by outcome")
        .tag("kind", safeKind(kind))
        .tag("outcome", "success")
        .register(meterRegistry)
        .increment();

    Timer.builder("metadata.journal.append.duration")
        .description("Journal append latency including fsync")
        .tag("kind", safeKind(kind))
        .register(meterRegistry)
        .record(Math.max(0L, durationNanos), TimeUnit.NANOSECONDS);

    DistributionSummary.builder("metadata.journal.append.bytes")
        .description("Size of appended journal records")
        .baseUnit("bytes")
        .tag("kind", safeKind(kind))
        .register(meterRegistry)
        .record(Math.max(0, bytes));
  }

  @Override
  public void onAppendFailure(ResourceKind kind, Throwable error) {
    Counter.builder("metadata.journal.append.total")
        .description("Total journal appends by outcome")
        .tag("kind", safeKind(kind))
        .tag("outcome", "failure")
        .tag("error", safeError(error))
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void onTailTruncated(ResourceKind kind, long discardedBytes) {
    Counter.builder("metadata.journal.recovery.truncated.total")
        .description("Torn tail records discarded while opening a journal")
        .tag("kind", safeKind(kind))
        .register(meterRegistry)
        .increment();
  }

  private static String safeKind(ResourceKind kind) {
    if (kind == null) {
      return "unknown";
    }
    return kind.slug();
  }

  private static String safeError(Throwable error) {
    if (error == null) {
      return "none";
    }
    return error.getClass().getSimpleName();
  }
}

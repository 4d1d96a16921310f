package com.exchangemetadata.infra.journal.observability;

import com.exchangemetadata.domain.metadata.ResourceKind;

public class NoOpJournalTelemetry implements JournalTelemetry {
  @Override
  public void onAppendSuccess(ResourceKind kind, int bytes, long durationNanos) {
  }

  @Override
  public void onAppendFailure(ResourceKind kind, Throwable error) {
  }

  @Override
  public void onTailTruncated(ResourceKind kind, long discardedBytes) {
  }
}

package com.exchangemetadata.infra.journal.observability;

import com.exchangemetadata.domain.metadata.ResourceKind;

public interface JournalTelemetry {
  void onAppendSuccess(ResourceKind kind, int bytes, long durationNanos);

  void onAppendFailure(ResourceKind kind, Throwable error);

  void onTailTruncated(ResourceKind kind, long discardedBytes);
}

package com.exchangemetadata.infra.journal.serde;

import com.exchangemetadata.domain.metadata.PollFailure;
import com.exchangemetadata.domain.metadata.PollOutcome;
import com.exchangemetadata.domain.metadata.ResourceKind;
import java.time.Instant;

public record JournalRecord<T>(
    ResourceKind kind,
    long sequence,
    Instant fetchedAt,
    Instant writtenAt,
    PollOutcome outcome,
    T payload,
    PollFailure failure) {}

package com.exchangemetadata.infra.journal.writer;

import com.exchangemetadata.domain.metadata.ResourceKind;

public class JournalWriteException extends RuntimeException {
  private final ResourceKind kind;
  private final long sequence;

  public JournalWriteException(ResourceKind kind, long sequence, String message) {
    this(kind, sequence, message, null);
  }

  public JournalWriteException(
      ResourceKind kind, long sequence, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.sequence = sequence;
  }

  public ResourceKind getKind() {
    return kind;
  }

  public long getSequence() {
    return sequence;
  }
}

package com.exchangemetadata.infra.journal.writer;

import com.exchangemetadata.domain.metadata.ResourceKind;

public class JournalReadException extends RuntimeException {
  private final ResourceKind kind;
  private final String segment;

  public JournalReadException(ResourceKind kind, String segment, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.segment = segment;
  }

  public ResourceKind getKind() {
    return kind;
  }

  public String getSegment() {
    return segment;
  }
}

package com.exchangemetadata.domain.metadata;

public class MetadataDomainException extends RuntimeException {
  public MetadataDomainException(String message) {
    super(message);
  }
}

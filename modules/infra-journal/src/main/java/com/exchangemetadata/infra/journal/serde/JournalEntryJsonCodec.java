package com.exchangemetadata.infra.journal.serde;

import com.exchangemetadata.domain.metadata.MetadataPayload;
import com.exchangemetadata.domain.metadata.ResourceKind;
import com.exchangemetadata.domain.metadata.ResourceSnapshot;
import com.exchangemetadata.infra.journal.contract.JournalEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Objects;

public class JournalEntryJsonCodec {
  private final ObjectMapper objectMapper;

  public JournalEntryJsonCodec(ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
  }

  public String encode(JournalEntry entry) {
    ResourceSnapshot snapshot = entry.snapshot();
    JournalRecord<MetadataPayload> record =
        new JournalRecord<>(
            snapshot.kind(),
            snapshot.sequence(),
            snapshot.fetchedAt(),
            entry.writtenAt(),
            snapshot.outcome(),
            snapshot.payload(),
            snapshot.failure());
    try {
      return objectMapper.writeValueAsString(record);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException(
          "Failed to encode journal entry " + snapshot.kind() + "#" + snapshot.sequence(), ex);
    }
  }

  public JournalEntry decode(String json) {
    try {
      ResourceKind kind = readKind(json);
      JavaType recordType =
          objectMapper
              .getTypeFactory()
              .constructParametricType(JournalRecord.class, kind.payloadType());
      JournalRecord<? extends MetadataPayload> record = objectMapper.readValue(json, recordType);
      ResourceSnapshot snapshot =
          new ResourceSnapshot(
              kind,
              record.fetchedAt(),
              record.sequence(),
              record.payload(),
              record.outcome(),
              record.failure());
      return new JournalEntry(snapshot, record.writtenAt());
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to decode journal entry", ex);
    } catch (RuntimeException ex) {
      throw new IllegalStateException("Invalid journal entry: " + ex.getMessage(), ex);
    }
  }

  private ResourceKind readKind(String json) throws JsonProcessingException {
    JsonNode kindNode = objectMapper.readTree(json).path("kind");
    if (!kindNode.isTextual()) {
      throw new IllegalStateException("Journal entry is missing kind");
    }
    return ResourceKind.valueOf(kindNode.asText());
  }
}

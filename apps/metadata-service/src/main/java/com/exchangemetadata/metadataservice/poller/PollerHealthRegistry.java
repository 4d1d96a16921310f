package com.exchangemetadata.metadataservice.poller;

import com.exchangemetadata.domain.metadata.ResourceKind;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class PollerHealthRegistry {
  private final Map<ResourceKind, PollerHealthState> states = new ConcurrentHashMap<>();

  public Optional<PollerHealthState> findByKind(ResourceKind kind) {
    return Optional.ofNullable(states.get(kind));
  }

  public void upsert(PollerHealthState state) {
    Objects.requireNonNull(state, "state must not be null");
    states.put(state.kind(), state);
  }

  public List<PollerHealthState> findAll() {
    return states.values().stream()
        .sorted(Comparator.comparing(PollerHealthState::kind))
        .toList();
  }
}

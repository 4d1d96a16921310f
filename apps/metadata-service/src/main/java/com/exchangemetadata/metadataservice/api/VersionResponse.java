package com.exchangemetadata.metadataservice.api;

import java.time.Instant;
import java.util.List;

public record VersionResponse(
    String application,
    String version,
    Instant buildTime,
    List<String> pollers,
    boolean scheduledPolling,
    String journalDir) {}

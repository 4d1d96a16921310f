package com.exchangemetadata.metadataservice.api;

import com.exchangemetadata.domain.metadata.ResourceKind;
import com.exchangemetadata.metadataservice.config.MetadataPollerProperties;
import com.exchangemetadata.metadataservice.poller.PollingCoordinator;
import com.exchangemetadata.metadataservice.poller.RefreshOutcome;
import com.exchangemetadata.metadataservice.ratelimit.RateLimiter;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/admin")
public class AdminPollerController {
  private final PollingCoordinator pollingCoordinator;
  private final RateLimiter rateLimiter;
  private final MetadataPollerProperties pollerProperties;
  private final Clock clock;

  @Autowired
  public AdminPollerController(
      PollingCoordinator pollingCoordinator,
      RateLimiter rateLimiter,
      MetadataPollerProperties pollerProperties) {
    this(pollingCoordinator, rateLimiter, pollerProperties, Clock.systemUTC());
  }

  AdminPollerController(
      PollingCoordinator pollingCoordinator,
      RateLimiter rateLimiter,
      MetadataPollerProperties pollerProperties,
      Clock clock) {
    this.pollingCoordinator = pollingCoordinator;
    this.rateLimiter = rateLimiter;
    this.pollerProperties = pollerProperties;
    this.clock = clock;
  }

  @GetMapping("/pollers/health")
  public List<PollerHealthResponse> pollerHealth() {
    Instant now = clock.instant();
    return pollingCoordinator.health().stream()
        .map(state -> PollerHealthResponse.from(state, now, pollerProperties.downThreshold()))
        .toList();
  }

  @PostMapping("/pollers/{kind}/refresh")
  public ResponseEntity<RefreshResponse> refresh(@PathVariable("kind") String kind) {
    ResourceKind resourceKind = ResourceKindPaths.parse(kind);
    RefreshOutcome outcome = pollingCoordinator.refresh(resourceKind);
    return ResponseEntity.accepted().body(new RefreshResponse(resourceKind.slug(), outcome.name()));
  }

  @GetMapping("/rate-limits/usage")
  public List<RateLimitUsageResponse> rateLimitUsage() {
    return rateLimiter.usage().stream().map(RateLimitUsageResponse::from).toList();
  }
}

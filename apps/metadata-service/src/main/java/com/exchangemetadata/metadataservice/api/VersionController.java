package com.exchangemetadata.metadataservice.api;

import com.exchangemetadata.infra.journal.config.InfraJournalProperties;
import com.exchangemetadata.metadataservice.config.MetadataPollerProperties;
import com.exchangemetadata.metadataservice.poller.PollingCoordinator;
import java.nio.file.Path;
import java.util.List;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.info.BuildProperties;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
public class VersionController {
  private static final String UNKNOWN = "unknown";

  private final ObjectProvider<BuildProperties> buildPropertiesProvider;
  private final PollingCoordinator pollingCoordinator;
  private final MetadataPollerProperties pollerProperties;
  private final InfraJournalProperties journalProperties;
  private final String applicationName;

  public VersionController(
      ObjectProvider<BuildProperties> buildPropertiesProvider,
      PollingCoordinator pollingCoordinator,
      MetadataPollerProperties pollerProperties,
      InfraJournalProperties journalProperties,
      @Value("${spring.application.name:metadata-service}") String applicationName) {
    this.buildPropertiesProvider = buildPropertiesProvider;
    this.pollingCoordinator = pollingCoordinator;
    this.pollerProperties = pollerProperties;
    this.journalProperties = journalProperties;
    this.applicationName = applicationName;
  }

  @GetMapping("/version")
  public VersionResponse version() {
    List<String> pollers =
        pollingCoordinator.pollers().stream().map(poller -> poller.kind().slug()).toList();
    String journalDir = Path.of(journalProperties.effectiveBaseDir()).toAbsolutePath().toString();

    BuildProperties build = buildPropertiesProvider.getIfAvailable();
    String version = build == null || isBlank(build.getVersion()) ? UNKNOWN : build.getVersion();
    return new VersionResponse(
        applicationName,
        version,
        build == null ? null : build.getTime(),
        pollers,
        pollerProperties.isEnabled(),
        journalDir);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}

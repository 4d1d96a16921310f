package com.exchangemetadata.infra.journal.config;

import com.exchangemetadata.infra.journal.observability.JournalTelemetry;
import com.exchangemetadata.infra.journal.observability.MicrometerJournalTelemetry;
import com.exchangemetadata.infra.journal.observability.NoOpJournalTelemetry;
import com.exchangemetadata.infra.journal.serde.JournalEntryJsonCodec;
import com.exchangemetadata.infra.journal.serde.JournalObjectMapperFactory;
import com.exchangemetadata.infra.journal.writer.FileSnapshotJournal;
import com.exchangemetadata.infra.journal.writer.SnapshotJournal;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration(
    after = JacksonAutoConfiguration.class,
    afterName =
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@EnableConfigurationProperties(InfraJournalProperties.class)
@ConditionalOnProperty(
    prefix = "infra.journal",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class InfraJournalAutoConfiguration {
  @Bean
  @ConditionalOnMissingBean(name = "journalObjectMapper")
  public ObjectMapper journalObjectMapper() {
    return JournalObjectMapperFactory.create();
  }

  @Bean
  @ConditionalOnMissingBean
  public JournalEntryJsonCodec journalEntryJsonCodec(
      @Qualifier("journalObjectMapper") ObjectMapper journalObjectMapper) {
    return new JournalEntryJsonCodec(journalObjectMapper);
  }

  @Bean
  @ConditionalOnClass(MeterRegistry.class)
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(JournalTelemetry.class)
  public JournalTelemetry micrometerJournalTelemetry(MeterRegistry meterRegistry) {
    return new MicrometerJournalTelemetry(meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean(JournalTelemetry.class)
  public JournalTelemetry noOpJournalTelemetry() {
    return new NoOpJournalTelemetry();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(SnapshotJournal.class)
  public FileSnapshotJournal snapshotJournal(
      InfraJournalProperties properties,
      JournalEntryJsonCodec journalEntryJsonCodec,
      JournalTelemetry journalTelemetry) {
    return new FileSnapshotJournal(
        Path.of(properties.effectiveBaseDir()),
        properties.isFsync(),
        properties.effectiveMaxSegmentBytes(),
        journalEntryJsonCodec,
        journalTelemetry,
        Clock.systemUTC());
  }
}

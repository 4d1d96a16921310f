package com.exchangemetadata.metadataservice.config;

import com.exchangemetadata.metadataservice.poller.PollerHealthRegistry;
import com.exchangemetadata.metadataservice.ratelimit.RateLimiter;
import com.exchangemetadata.metadataservice.ratelimit.SlidingWindowRateLimiter;
import com.exchangemetadata.metadataservice.state.VersionedStateStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
@EnableConfigurationProperties(MetadataPollerProperties.class)
public class MetadataPollerConfiguration {

  @Bean(name = "metadataPollerScheduler")
  public ThreadPoolTaskScheduler metadataPollerScheduler(MetadataPollerProperties properties) {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(Math.max(1, properties.getSchedulerPoolSize()));
    scheduler.setThreadNamePrefix("metadata-poller-");
    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.setAwaitTerminationSeconds(30);
    scheduler.setRemoveOnCancelPolicy(true);
    return scheduler;
  }

  @Bean
  @ConditionalOnMissingBean
  public RateLimiter metadataRateLimiter(MetadataPollerProperties properties) {
    return new SlidingWindowRateLimiter(properties.rateLimitRules(), Clock.systemUTC());
  }

  @Bean
  @ConditionalOnMissingBean
  public VersionedStateStore versionedStateStore(MeterRegistry meterRegistry) {
    return new VersionedStateStore(meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean
  public PollerHealthRegistry pollerHealthRegistry() {
    return new PollerHealthRegistry();
  }
}

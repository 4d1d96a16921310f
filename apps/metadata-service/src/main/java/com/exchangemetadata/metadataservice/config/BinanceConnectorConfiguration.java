package com.exchangemetadata.metadataservice.config;

import com.exchangemetadata.integration.binance.BinanceApiConfig;
import com.exchangemetadata.integration.binance.BinanceConnectorProperties;
import com.exchangemetadata.integration.binance.BinanceMetadataClient;
import com.exchangemetadata.integration.binance.BinanceMetadataParser;
import com.exchangemetadata.integration.binance.BinanceRequestSigner;
import com.exchangemetadata.integration.binance.BinanceSignatureType;
import com.exchangemetadata.integration.binance.Ed25519KeyLoader;
import com.exchangemetadata.integration.binance.HttpBinanceRestClient;
import com.exchangemetadata.integration.binance.JitteredExponentialBackoff;
import com.exchangemetadata.integration.binance.RateLimitRetryExecutor;
import com.exchangemetadata.integration.binance.RetryAfterParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(BinanceConnectorProperties.class)
public class BinanceConnectorConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public Clock binanceConnectorClock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public BinanceRequestSigner binanceRequestSigner(
      BinanceConnectorProperties properties, Clock binanceConnectorClock) {
    if (properties.getSignatureType() == BinanceSignatureType.ED25519) {
      String keyFile = properties.getEd25519PrivateKeyFile();
      if (keyFile == null || keyFile.isBlank()) {
        throw new IllegalArgumentException(
            "connector.binance.ed25519-private-key-file is required for signature-type ED25519");
      }
      return BinanceRequestSigner.ed25519(
          Ed25519KeyLoader.load(Path.of(keyFile)),
          properties.getRecvWindowMs(),
          binanceConnectorClock);
    }
    String apiSecret =
        resolveOptionalSecret(
            properties.getApiSecret(),
            properties.getApiSecretFile(),
            "connector.binance.api-secret-file");
    return BinanceRequestSigner.hmac(
        apiSecret, properties.getRecvWindowMs(), binanceConnectorClock);
  }

  @Bean
  @ConditionalOnMissingBean
  public RetryAfterParser retryAfterParser(Clock binanceConnectorClock) {
    return new RetryAfterParser(binanceConnectorClock);
  }

  @Bean
  @ConditionalOnMissingBean
  public JitteredExponentialBackoff jitteredExponentialBackoff(BinanceConnectorProperties properties) {
    BinanceConnectorProperties.Retry retry = properties.getRetry();
    return new JitteredExponentialBackoff(
        Duration.ofMillis(retry.getBaseBackoffMs()),
        Duration.ofMillis(retry.getMaxBackoffMs()),
        retry.isJitterEnabled());
  }

  @Bean
  @ConditionalOnMissingBean
  public RateLimitRetryExecutor rateLimitRetryExecutor(
      BinanceConnectorProperties properties,
      RetryAfterParser retryAfterParser,
      JitteredExponentialBackoff jitteredExponentialBackoff,
      MeterRegistry meterRegistry) {
    return new RateLimitRetryExecutor(
        properties.getRetry().getMaxAttempts(),
        retryAfterParser,
        jitteredExponentialBackoff,
        meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean(name = "binanceHttpClient")
  public HttpClient binanceHttpClient(BinanceConnectorProperties properties) {
    return HttpClient.newBuilder()
        .connectTimeout(Duration.ofMillis(Math.max(100L, properties.getTimeoutMs())))
        .followRedirects(HttpClient.Redirect.NEVER)
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public BinanceMetadataParser binanceMetadataParser() {
    return new BinanceMetadataParser();
  }

  @Bean
  @ConditionalOnMissingBean
  public BinanceMetadataClient binanceMetadataClient(
      HttpClient binanceHttpClient,
      ObjectMapper objectMapper,
      BinanceConnectorProperties properties,
      BinanceRequestSigner binanceRequestSigner,
      BinanceMetadataParser binanceMetadataParser,
      RateLimitRetryExecutor rateLimitRetryExecutor) {
    String apiKey =
        resolveOptionalSecret(
            properties.getApiKey(), properties.getApiKeyFile(), "connector.binance.api-key-file");
    BinanceApiConfig config =
        new BinanceApiConfig(
            URI.create(properties.getBaseUrl()),
            apiKey,
            Duration.ofMillis(Math.max(100L, properties.getTimeoutMs())));
    return new HttpBinanceRestClient(
        binanceHttpClient,
        objectMapper,
        config,
        binanceRequestSigner,
        binanceMetadataParser,
        rateLimitRetryExecutor);
  }

  private static String resolveOptionalSecret(String value, String filePath, String propertyName) {
    if (filePath == null || filePath.isBlank()) {
      return value;
    }
    try {
      String fromFile = Files.readString(Path.of(filePath), StandardCharsets.UTF_8).trim();
      return fromFile.isBlank() ? value : fromFile;
    } catch (IOException ex) {
      throw new IllegalArgumentException(propertyName + " cannot be read: " + filePath, ex);
    }
  }
}

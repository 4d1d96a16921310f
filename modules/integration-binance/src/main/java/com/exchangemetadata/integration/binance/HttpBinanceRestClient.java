package com.exchangemetadata.integration.binance;

import com.exchangemetadata.domain.metadata.AccountProfile;
import com.exchangemetadata.domain.metadata.ExchangeInfo;
import com.exchangemetadata.domain.metadata.FailureKind;
import com.exchangemetadata.domain.metadata.SystemStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

public class HttpBinanceRestClient implements BinanceMetadataClient {
  static final String EXCHANGE_INFO_PATH = "/api/v3/exchangeInfo";
  static final String ACCOUNT_PATH = "/api/v3/account";
  static final String SYSTEM_STATUS_PATH = "/sapi/v1/system/status";
  private static final String API_KEY_HEADER = "X-MBX-APIKEY";
  private static final int MAX_BODY_IN_MESSAGE = 300;

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final BinanceApiConfig config;
  private final BinanceRequestSigner signer;
  private final BinanceMetadataParser parser;
  private final RateLimitRetryExecutor retryExecutor;

  public HttpBinanceRestClient(
      HttpClient httpClient,
      ObjectMapper objectMapper,
      BinanceApiConfig config,
      BinanceRequestSigner signer,
      BinanceMetadataParser parser,
      RateLimitRetryExecutor retryExecutor) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    this.config = Objects.requireNonNull(config, "config must not be null");
    this.signer = Objects.requireNonNull(signer, "signer must not be null");
    this.parser = Objects.requireNonNull(parser, "parser must not be null");
    this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor must not be null");
  }

  @Override
  public ExchangeInfo fetchExchangeInfo() {
    return retryExecutor.execute(
        "exchange_info",
        () -> {
          HttpRequest request =
              HttpRequest.newBuilder(resolve(EXCHANGE_INFO_PATH))
                  .timeout(config.timeout())
                  .GET()
                  .build();
          return parser.parseExchangeInfo(parseJson(execute(request, "exchangeInfo").body()));
        });
  }

  @Override
  public AccountProfile fetchAccountProfile() {
    if (!config.hasApiKey() || !signer.hasCredentials()) {
      throw new BinanceConnectorException(
          FailureKind.HTTP_STATUS,
          "Binance account endpoint requires an API key and signing credentials",
          401,
          null,
          null,
          null);
    }
    return retryExecutor.execute(
        "account",
        () -> {
          URI uri = resolve(ACCOUNT_PATH + "?" + signer.sign(Map.of()).signedQuery());
          HttpRequest request =
              HttpRequest.newBuilder(uri)
                  .timeout(config.timeout())
                  .header(API_KEY_HEADER, config.apiKey())
                  .GET()
                  .build();
          return parser.parseAccountProfile(parseJson(execute(request, "account").body()));
        });
  }

  @Override
  public SystemStatus fetchSystemStatus() {
    return retryExecutor.execute(
        "system_status",
        () -> {
          HttpRequest.Builder builder =
              HttpRequest.newBuilder(resolve(SYSTEM_STATUS_PATH)).timeout(config.timeout()).GET();
          if (config.hasApiKey()) {
            builder.header(API_KEY_HEADER, config.apiKey());
          }
          return parser.parseSystemStatus(parseJson(execute(builder.build(), "system status").body()));
        });
  }

  private HttpResponse<String> execute(HttpRequest request, String action) {
    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw transportFailure(FailureKind.TRANSPORT, "Binance " + action + " request was interrupted", ex);
    } catch (HttpTimeoutException ex) {
      throw transportFailure(FailureKind.TIMEOUT, "Binance " + action + " request timed out", ex);
    } catch (IOException ex) {
      throw transportFailure(
          FailureKind.TRANSPORT, "Failed to call Binance " + action + " endpoint: " + ex.getMessage(), ex);
    }

    if (response.statusCode() >= 200 && response.statusCode() < 300) {
      return response;
    }
    throw parseFailure(
        response.statusCode(),
        response.body(),
        response.headers().firstValue("Retry-After").orElse(null));
  }

  private BinanceConnectorException parseFailure(int statusCode, String responseBody, String retryAfter) {
    Integer code = null;
    String msg = "Unknown Binance error";
    try {
      JsonNode node = objectMapper.readTree(responseBody);
      if (node != null && node.hasNonNull("code")) {
        code = node.get("code").intValue();
      }
      if (node != null && node.hasNonNull("msg")) {
        msg = node.get("msg").asText();
      }
    } catch (IOException ex) {
      msg = "body=" + abbreviate(responseBody);
    }
    return new BinanceConnectorException(
        BinanceConnectorException.classifyStatus(statusCode, code),
        "Binance API error status=" + statusCode + " code=" + (code == null ? "null" : code) + " message=" + msg,
        statusCode,
        code,
        retryAfter,
        null);
  }

  private JsonNode parseJson(String responseBody) {
    try {
      return objectMapper.readTree(responseBody);
    } catch (IOException ex) {
      throw BinanceConnectorException.parse(
          "Failed to parse Binance response JSON: " + abbreviate(responseBody), ex);
    }
  }

  private URI resolve(String path) {
    return config.baseUri().resolve(path);
  }

  private static BinanceConnectorException transportFailure(
      FailureKind kind, String message, Throwable cause) {
    return new BinanceConnectorException(
        kind, message, BinanceConnectorException.IO_FAILURE_STATUS, null, null, cause);
  }

  private static String abbreviate(String body) {
    if (body == null) {
      return "";
    }
    return body.length() <= MAX_BODY_IN_MESSAGE ? body : body.substring(0, MAX_BODY_IN_MESSAGE) + "...";
  }
}

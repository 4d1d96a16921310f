package com.exchangemetadata.integration.binance;

import com.exchangemetadata.domain.metadata.AccountProfile;
import com.exchangemetadata.domain.metadata.AssetBalance;
import com.exchangemetadata.domain.metadata.CommissionRates;
import com.exchangemetadata.domain.metadata.ExchangeInfo;
import com.exchangemetadata.domain.metadata.MetadataDomainException;
import com.exchangemetadata.domain.metadata.RateLimitRule;
import com.exchangemetadata.domain.metadata.SymbolRule;
import com.exchangemetadata.domain.metadata.SystemStatus;
import com.exchangemetadata.domain.metadata.SystemStatusValue;
import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class BinanceMetadataParser {
  private static final Logger log = LoggerFactory.getLogger(BinanceMetadataParser.class);

  private static final Map<String, ChronoUnit> INTERVAL_UNITS =
      Map.of(
          "SECOND", ChronoUnit.SECONDS,
          "MINUTE", ChronoUnit.MINUTES,
          "HOUR", ChronoUnit.HOURS,
          "DAY", ChronoUnit.DAYS);

  public ExchangeInfo parseExchangeInfo(JsonNode node) {
    requireObject(node, "exchangeInfo");
    Instant serverTime = Instant.ofEpochMilli(requiredLong(node, "serverTime"));
    String timezone = node.path("timezone").asText("UTC");

    List<RateLimitRule> rateLimits = new ArrayList<>();
    for (JsonNode limitNode : node.path("rateLimits")) {
      rateLimits.add(parseRateLimit(limitNode));
    }

    JsonNode symbolsNode = node.path("symbols");
    if (!symbolsNode.isArray()) {
      throw BinanceConnectorException.parse("Binance exchangeInfo missing symbols array", null);
    }
    List<SymbolRule> symbols = new ArrayList<>();
    int skipped = 0;
    for (JsonNode symbolNode : symbolsNode) {
      try {
        symbols.add(parseSymbol(symbolNode));
      } catch (MetadataDomainException | IllegalArgumentException ex) {
        skipped++;
        log.warn(
            "Skipping symbol with invalid trading rules symbol={} reason={}",
            symbolNode.path("symbol").asText("?"),
            ex.getMessage());
      }
    }
    if (skipped > 0) {
      log.info("Parsed exchangeInfo symbols={} skipped={}", symbols.size(), skipped);
    }
    return new ExchangeInfo(serverTime, timezone, rateLimits, symbols);
  }

  public AccountProfile parseAccountProfile(JsonNode node) {
    requireObject(node, "account");
    try {
      JsonNode rates = node.path("commissionRates");
      CommissionRates commissionRates =
          rates.isObject()
              ? new CommissionRates(
                  decimal(rates, "maker"),
                  decimal(rates, "taker"),
                  decimal(rates, "buyer"),
                  decimal(rates, "seller"))
              : CommissionRates.zero();

      Set<String> permissions = new LinkedHashSet<>();
      for (JsonNode permission : node.path("permissions")) {
        if (!permission.asText("").isBlank()) {
          permissions.add(permission.asText());
        }
      }

      Map<String, AssetBalance> balances = new LinkedHashMap<>();
      for (JsonNode balanceNode : node.path("balances")) {
        String asset = balanceNode.path("asset").asText("");
        if (asset.isBlank()) {
          continue;
        }
        balances.put(
            asset, new AssetBalance(decimal(balanceNode, "free"), decimal(balanceNode, "locked")));
      }

      return new AccountProfile(
          node.path("accountType").asText(""),
          node.path("canTrade").asBoolean(false),
          node.path("canWithdraw").asBoolean(false),
          node.path("canDeposit").asBoolean(false),
          commissionRates,
          permissions,
          balances);
    } catch (MetadataDomainException | IllegalArgumentException ex) {
      throw BinanceConnectorException.parse(
          "Binance account response is invalid: " + ex.getMessage(), ex);
    }
  }

  public SystemStatus parseSystemStatus(JsonNode node) {
    requireObject(node, "system status");
    int status = (int) requiredLong(node, "status");
    String message = node.path("msg").asText("");
    if (status == 0) {
      return new SystemStatus(SystemStatusValue.NORMAL, message);
    }
    if (status == 1) {
      return new SystemStatus(SystemStatusValue.MAINTENANCE, message);
    }
    throw BinanceConnectorException.parse("Unknown Binance system status: " + status, null);
  }

  private RateLimitRule parseRateLimit(JsonNode node) {
    String type = node.path("rateLimitType").asText("");
    String interval = node.path("interval").asText("").toUpperCase(Locale.ROOT);
    ChronoUnit unit = INTERVAL_UNITS.get(interval);
    long intervalNum = node.path("intervalNum").asLong(1L);
    if (unit == null) {
      throw BinanceConnectorException.parse("Unknown rate limit interval: " + interval, null);
    }
    try {
      return new RateLimitRule(
          type, Duration.of(intervalNum, unit), node.path("limit").asLong(0L));
    } catch (MetadataDomainException ex) {
      throw BinanceConnectorException.parse("Invalid rate limit " + type + ": " + ex.getMessage(), ex);
    }
  }

  private SymbolRule parseSymbol(JsonNode node) {
    JsonNode priceFilter = null;
    JsonNode lotSizeFilter = null;
    JsonNode marketLotSizeFilter = null;
    for (JsonNode filter : node.path("filters")) {
      String filterType = filter.path("filterType").asText("");
      if ("PRICE_FILTER".equals(filterType)) {
        priceFilter = filter;
      } else if ("LOT_SIZE".equals(filterType)) {
        lotSizeFilter = filter;
      } else if ("MARKET_LOT_SIZE".equals(filterType)) {
        marketLotSizeFilter = filter;
      }
    }
    if (priceFilter == null || lotSizeFilter == null) {
      throw new MetadataDomainException("PRICE_FILTER and LOT_SIZE filters are required");
    }

    BigDecimal lotSize = decimal(lotSizeFilter, "stepSize");
    BigDecimal stepSize = lotSize;
    if (marketLotSizeFilter != null) {
      BigDecimal marketStep = decimal(marketLotSizeFilter, "stepSize");
      if (marketStep.signum() > 0) {
        stepSize = marketStep;
      }
    }

    return new SymbolRule(
        node.path("symbol").asText(""),
        node.path("status").asText(""),
        node.path("baseAsset").asText(""),
        node.path("quoteAsset").asText(""),
        decimal(priceFilter, "tickSize"),
        lotSize,
        stepSize,
        decimal(priceFilter, "minPrice"),
        decimal(priceFilter, "maxPrice"),
        decimal(lotSizeFilter, "minQty"),
        decimal(lotSizeFilter, "maxQty"));
  }

  private static BigDecimal decimal(JsonNode node, String field) {
    JsonNode value = node.path(field);
    if (value.isMissingNode() || value.isNull() || value.asText("").isBlank()) {
      return BigDecimal.ZERO;
    }
    return new BigDecimal(value.asText().trim());
  }

  private static long requiredLong(JsonNode node, String field) {
    JsonNode value = node.path(field);
    if (!value.canConvertToLong()) {
      throw BinanceConnectorException.parse("Binance response missing field: " + field, null);
    }
    return value.asLong();
  }

  private static void requireObject(JsonNode node, String what) {
    if (node == null || !node.isObject()) {
      throw BinanceConnectorException.parse("Binance " + what + " response is not a JSON object", null);
    }
  }
}

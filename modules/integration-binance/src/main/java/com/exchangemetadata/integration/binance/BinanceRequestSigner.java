package com.exchangemetadata.integration.binance;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.Signature;
import java.time.Clock;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

public class BinanceRequestSigner {
  private final BinanceSignatureType signatureType;
  private final String apiSecret;
  private final PrivateKey ed25519Key;
  private final long recvWindowMs;
  private final Clock clock;

  private BinanceRequestSigner(
      BinanceSignatureType signatureType,
      String apiSecret,
      PrivateKey ed25519Key,
      long recvWindowMs,
      Clock clock) {
    this.signatureType = signatureType;
    this.apiSecret = apiSecret;
    this.ed25519Key = ed25519Key;
    this.recvWindowMs = Math.max(1L, recvWindowMs);
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  public static BinanceRequestSigner hmac(String apiSecret, long recvWindowMs, Clock clock) {
    return new BinanceRequestSigner(
        BinanceSignatureType.HMAC_SHA256,
        Objects.requireNonNullElse(apiSecret, ""),
        null,
        recvWindowMs,
        clock);
  }

  public static BinanceRequestSigner ed25519(PrivateKey privateKey, long recvWindowMs, Clock clock) {
    return new BinanceRequestSigner(
        BinanceSignatureType.ED25519,
        "",
        Objects.requireNonNull(privateKey, "privateKey must not be null"),
        recvWindowMs,
        clock);
  }

  public BinanceSignatureType signatureType() {
    return signatureType;
  }

  public boolean hasCredentials() {
    return signatureType == BinanceSignatureType.ED25519 || !apiSecret.isBlank();
  }

  public SignedRequest sign(Map<String, String> queryParams) {
    LinkedHashMap<String, String> normalized = new LinkedHashMap<>();
    if (queryParams != null) {
      queryParams.forEach(
          (key, value) -> {
            if (hasText(value)) {
              normalized.put(key, value);
            }
          });
    }
    normalized.put("timestamp", String.valueOf(clock.millis()));
    normalized.put("recvWindow", String.valueOf(recvWindowMs));

    String unsignedQuery = toQueryString(normalized);
    String signature =
        signatureType == BinanceSignatureType.ED25519
            ? ed25519Base64(unsignedQuery)
            : hmacSha256Hex(unsignedQuery);
    String signedQuery = unsignedQuery + "&signature=" + urlEncode(signature);
    return new SignedRequest(unsignedQuery, signature, signedQuery);
  }

  private String hmacSha256Hex(String payload) {
    try {
      Mac mac = Mac.getInstance("HmacSHA256");
      mac.init(new SecretKeySpec(apiSecret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
      byte[] signatureBytes = mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
      StringBuilder hex = new StringBuilder(signatureBytes.length * 2);
      for (byte b : signatureBytes) {
        hex.append(Character.forDigit((b >> 4) & 0xF, 16));
        hex.append(Character.forDigit(b & 0xF, 16));
      }
      return hex.toString();
    } catch (GeneralSecurityException | IllegalArgumentException ex) {
      throw new IllegalStateException("Failed to sign Binance request", ex);
    }
  }

  private String ed25519Base64(String payload) {
    try {
      Signature signer = Signature.getInstance("Ed25519");
      signer.initSign(ed25519Key);
      signer.update(payload.getBytes(StandardCharsets.UTF_8));
      return Base64.getEncoder().encodeToString(signer.sign());
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("Failed to sign Binance request with Ed25519 key", ex);
    }
  }

  private static String toQueryString(Map<String, String> queryParams) {
    StringBuilder query = new StringBuilder();
    boolean first = true;
    for (Map.Entry<String, String> entry : queryParams.entrySet()) {
      if (!first) {
        query.append('&');
      }
      query.append(urlEncode(entry.getKey())).append('=').append(urlEncode(entry.getValue()));
      first = false;
    }
    return query.toString();
  }

  private static String urlEncode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }

  public record SignedRequest(String unsignedQuery, String signature, String signedQuery) {}
}

package com.exchangemetadata.domain.metadata;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

public record AccountProfile(
    String accountType,
    boolean canTrade,
    boolean canWithdraw,
    boolean canDeposit,
    CommissionRates commissionRates,
    Set<String> permissions,
    Map<String, AssetBalance> balances)
    implements MetadataPayload {
  public AccountProfile {
    if (accountType == null || accountType.isBlank()) {
      accountType = "UNKNOWN";
    }
    Objects.requireNonNull(commissionRates, "commissionRates must not be null");
    permissions = Set.copyOf(Objects.requireNonNull(permissions, "permissions must not be null"));
    balances = Map.copyOf(Objects.requireNonNull(balances, "balances must not be null"));
  }

  @Override
  public ResourceKind kind() {
    return ResourceKind.ACCOUNT_INFO;
  }

  public boolean hasPermission(String permission) {
    return permission != null && permissions.contains(permission);
  }
}

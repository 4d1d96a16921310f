package com.exchangemetadata.metadataservice.api;

import com.exchangemetadata.domain.metadata.AccountProfile;
import com.exchangemetadata.domain.metadata.ExchangeInfo;
import com.exchangemetadata.domain.metadata.ResourceKind;
import com.exchangemetadata.metadataservice.query.MetadataQueryService;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
public class MetadataController {
  private final MetadataQueryService queryService;

  public MetadataController(MetadataQueryService queryService) {
    this.queryService = queryService;
  }

  @GetMapping("/resources/{kind}")
  public ResourceSnapshotResponse resource(@PathVariable("kind") String kind) {
    return ResourceSnapshotResponse.from(queryService.require(ResourceKindPaths.parse(kind)));
  }

  @GetMapping("/exchange-info")
  public ResourceSnapshotResponse exchangeInfo() {
    return ResourceSnapshotResponse.from(queryService.require(ResourceKind.EXCHANGE_INFO));
  }

  @GetMapping("/account")
  public AccountProfile account() {
    return queryService.accountProfile();
  }

  @GetMapping("/system-status")
  public SystemStatusResponse systemStatus() {
    return SystemStatusResponse.from(queryService.require(ResourceKind.SYSTEM_STATUS));
  }

  @GetMapping("/symbols")
  public SymbolListResponse symbols() {
    return SymbolListResponse.from(queryService.require(ResourceKind.EXCHANGE_INFO));
  }

  @GetMapping("/symbols/{symbol}")
  public SymbolRuleResponse symbol(@PathVariable("symbol") String symbol) {
    return SymbolRuleResponse.from(queryService.symbol(symbol));
  }

  @GetMapping("/rate-limits")
  public List<RateLimitRuleResponse> rateLimits() {
    ExchangeInfo exchangeInfo = queryService.exchangeInfo();
    return exchangeInfo.rateLimits().stream().map(RateLimitRuleResponse::from).toList();
  }
}

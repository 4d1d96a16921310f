package com.exchangemetadata.metadataservice.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.exchangemetadata.domain.metadata.ResourceKind;
import com.exchangemetadata.integration.binance.BinanceMetadataClient;
import com.exchangemetadata.metadataservice.poller.PollerHealthState;
import com.exchangemetadata.metadataservice.poller.PollerHealthStatus;
import com.exchangemetadata.metadataservice.poller.PollerNotFoundException;
import com.exchangemetadata.metadataservice.poller.PollerState;
import com.exchangemetadata.metadataservice.poller.PollingCoordinator;
import com.exchangemetadata.metadataservice.poller.RefreshOutcome;
import com.exchangemetadata.metadataservice.state.VersionedStateStore;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest(properties = "infra.journal.base-dir=target/test-journal/${random.uuid}")
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AdminPollerControllerTest {
  @Autowired private MockMvc mockMvc;
  @MockBean private VersionedStateStore stateStore;
  @MockBean private PollingCoordinator pollingCoordinator;
  @MockBean private BinanceMetadataClient binanceMetadataClient;

  @Test
  void refreshShouldBeAcceptedForKnownKind() throws Exception {
    when(pollingCoordinator.refresh(ResourceKind.SYSTEM_STATUS))
        .thenReturn(RefreshOutcome.ACCEPTED);

    mockMvc
        .perform(post("/v1/admin/pollers/system-status/refresh"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.kind").value("system-status"))
        .andExpect(jsonPath("$.outcome").value("ACCEPTED"));
  }

  @Test
  void refreshWhileInFlightShouldReportCoalesced() throws Exception {
    when(pollingCoordinator.refresh(ResourceKind.EXCHANGE_INFO))
        .thenReturn(RefreshOutcome.COALESCED);

    mockMvc
        .perform(post("/v1/admin/pollers/exchange_info/refresh"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.outcome").value("COALESCED"));
  }

  @Test
  void refreshOfDisabledPollerShouldReturnNotFound() throws Exception {
    when(pollingCoordinator.refresh(ResourceKind.ACCOUNT_INFO))
        .thenThrow(new PollerNotFoundException(ResourceKind.ACCOUNT_INFO));

    mockMvc
        .perform(post("/v1/admin/pollers/account-info/refresh"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.type").value("/problems/poller-not-found"))
        .andExpect(jsonPath("$.kind").value("account-info"));
  }

  @Test
  void refreshOfUnknownKindShouldReturnBadRequest() throws Exception {
    mockMvc
        .perform(post("/v1/admin/pollers/tickers/refresh"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void refreshShouldRejectGet() throws Exception {
    mockMvc
        .perform(get("/v1/admin/pollers/system-status/refresh"))
        .andExpect(status().isMethodNotAllowed());
  }

  @Test
  void pollerHealthShouldExposeEffectiveStatus() throws Exception {
    Instant now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
    PollerHealthState healthy =
        new PollerHealthState(
            ResourceKind.SYSTEM_STATUS,
            PollerHealthStatus.UP,
            PollerState.IDLE,
            now,
            now,
            now,
            null,
            null,
            null,
            0L,
            42L,
            false,
            now);
    when(pollingCoordinator.health())
        .thenReturn(List.of(PollerHealthState.initial(ResourceKind.EXCHANGE_INFO, now), healthy));

    mockMvc
        .perform(get("/v1/admin/pollers/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].kind").value("exchange-info"))
        .andExpect(jsonPath("$[0].status").value("DOWN"))
        .andExpect(jsonPath("$[1].status").value("UP"))
        .andExpect(jsonPath("$[1].lastSequence").value(42))
        .andExpect(jsonPath("$[1].inFlight").value(false));
  }

  @Test
  void rateLimitUsageShouldListConfiguredBuckets() throws Exception {
    mockMvc
        .perform(get("/v1/admin/rate-limits/usage"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].bucket").value("REQUEST_WEIGHT"))
        .andExpect(jsonPath("$[0].limit").value(6000))
        .andExpect(jsonPath("$[0].remaining").value(6000))
        .andExpect(jsonPath("$[1].bucket").value("SAPI_IP_WEIGHT"));
  }
}

package com.securityops.devicesync.controller;

import com.securityops.devicesync.exception.CrossSyncException;
import com.securityops.devicesync.exception.CrossSyncInProgressException;
import com.securityops.devicesync.exception.InvalidQueryException;
import com.securityops.devicesync.exception.SourceUnavailableException;
import com.securityops.devicesync.model.dto.CrossSyncResult;
import com.securityops.devicesync.model.dto.SyncError;
import com.securityops.devicesync.model.dto.SyncRecordPage;
import com.securityops.devicesync.service.query.SyncQueryService;
import com.securityops.devicesync.service.sync.CrossSyncService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.IntStream;

import static com.securityops.devicesync.helper.TestDevices.matchedRecord;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(DeviceSyncController.class)
@Import(DeviceSyncControllerTest.FixedClockConfig.class)
@DisplayName("DeviceSyncController Tests")
class DeviceSyncControllerTest {

    static class FixedClockConfig {
        @Bean
        Clock clock() {
            return Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CrossSyncService crossSyncService;

    @MockBean
    private SyncQueryService syncQueryService;

    private static CrossSyncResult result(int failureCount, List<SyncError> errors) {
        return new CrossSyncResult(2, 1, 1, 4, 250, 17.456, 40, 60, 3, 20, 100, 2.0, 1.0, 5.0, 9.456,
                6, 4 - failureCount, failureCount, "2024-06-01T12:00:00Z", errors);
    }

    @Nested
    @DisplayName("POST /api/devices/sync-cross")
    class SyncCross {

        @Test
        @DisplayName("Should return statistics, percentages and costs of a clean run")
        void shouldReturnRunStatistics() throws Exception {
            when(crossSyncService.executeCrossSync()).thenReturn(result(0, List.of()));

            mockMvc.perform(post("/api/devices/sync-cross"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.status").value("success"))
                    .andExpect(jsonPath("$.data.statistics.totalProcessed").value(4))
                    .andExpect(jsonPath("$.data.statistics.matched").value(2))
                    .andExpect(jsonPath("$.data.percentages.matched").value(50.0))
                    .andExpect(jsonPath("$.data.percentages.onlyIntune").value(25.0))
                    .andExpect(jsonPath("$.data.performance.phases.upsertMs").value(100))
                    .andExpect(jsonPath("$.data.resourceUsage.totalCost").value(17.46))
                    .andExpect(jsonPath("$.data.resourceUsage.breakdown.clearCost").value(5.0))
                    .andExpect(jsonPath("$.data.errors").doesNotExist())
                    .andExpect(jsonPath("$.timestamp").value("2024-06-01T12:00:00Z"));
        }

        @Test
        @DisplayName("Should flag a run with failed records as partial and cap the error list")
        void shouldReportPartialRun() throws Exception {
            List<SyncError> errors = IntStream.range(0, 150)
                    .mapToObj(i -> new SyncError("K" + i, "Document too large"))
                    .toList();
            when(crossSyncService.executeCrossSync()).thenReturn(result(2, errors));

            mockMvc.perform(post("/api/devices/sync-cross"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("partial"))
                    .andExpect(jsonPath("$.data.errors", hasSize(100)))
                    .andExpect(jsonPath("$.data.errors[0].syncKey").value("K0"));
        }

        @Test
        @DisplayName("Should answer 409 while another run is in progress")
        void shouldRejectConcurrentRun() throws Exception {
            when(crossSyncService.executeCrossSync())
                    .thenThrow(new CrossSyncInProgressException("A device cross-sync is already in progress"));

            mockMvc.perform(post("/api/devices/sync-cross"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.error.code").value("SYNC_IN_PROGRESS"));
        }

        @Test
        @DisplayName("Should answer 500 with the failure message when a phase fails")
        void shouldReportPhaseFailure() throws Exception {
            when(crossSyncService.executeCrossSync()).thenThrow(new CrossSyncException("fetch-defender",
                    new SourceUnavailableException("Failed to fetch devices from Defender: 403 Forbidden", null)));

            mockMvc.perform(post("/api/devices/sync-cross"))
                    .andExpect(status().isInternalServerError())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.error.code").value("CROSS_SYNC_FAILED"))
                    .andExpect(jsonPath("$.error.message").value(
                            "Cross-sync operation failed during fetch-defender: Failed to fetch devices from Defender: 403 Forbidden"));
        }
    }

    @Nested
    @DisplayName("GET /api/devices/sync-all")
    class SyncAll {

        @Test
        @DisplayName("Should return devices with pagination details")
        void shouldReturnPage() throws Exception {
            when(syncQueryService.getSyncedDevices("matched", 1, null))
                    .thenReturn(new SyncRecordPage(List.of(matchedRecord("K1")), true, "1", 1.0));

            mockMvc.perform(get("/api/devices/sync-all").param("syncState", "matched").param("pageSize", "1"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.devices", hasSize(1)))
                    .andExpect(jsonPath("$.devices[0].syncKey").value("K1"))
                    .andExpect(jsonPath("$.devices[0].syncState").value("matched"))
                    .andExpect(jsonPath("$.devices[0].intune.azureADDeviceId").value("K1"))
                    .andExpect(jsonPath("$.pagination.count").value(1))
                    .andExpect(jsonPath("$.pagination.hasMore").value(true))
                    .andExpect(jsonPath("$.pagination.continuationToken").value("1"));
        }

        @Test
        @DisplayName("Should answer 400 for invalid query parameters")
        void shouldRejectInvalidQuery() throws Exception {
            when(syncQueryService.getSyncedDevices(isNull(), any(), isNull()))
                    .thenThrow(new InvalidQueryException("pageSize must be between 1 and 100"));

            mockMvc.perform(get("/api/devices/sync-all").param("pageSize", "500"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"))
                    .andExpect(jsonPath("$.error.message").value("pageSize must be between 1 and 100"));
        }

        @Test
        @DisplayName("Should answer 400 for a non-numeric page size")
        void shouldRejectNonNumericPageSize() throws Exception {
            mockMvc.perform(get("/api/devices/sync-all").param("pageSize", "lots"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"));
        }
    }
}

package com.securityops.devicesync.controller;

import com.securityops.devicesync.model.domain.SyncRecord;
import com.securityops.devicesync.model.dto.CrossSyncResult;
import com.securityops.devicesync.model.dto.SyncRecordPage;
import com.securityops.devicesync.service.query.SyncQueryService;
import com.securityops.devicesync.service.sync.CrossSyncService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Manual cross-sync trigger and read access to the synced device snapshot.
 */
@Slf4j
@RestController
@RequestMapping("/api/devices")
@RequiredArgsConstructor
public class DeviceSyncController {

    static final int MAX_RETURNED_ERRORS = 100;

    private final CrossSyncService crossSyncService;
    private final SyncQueryService syncQueryService;
    private final Clock clock;

    /**
     * Runs a cross-sync and waits for it to finish.
     */
    @PostMapping("/sync-cross")
    public ResponseEntity<Map<String, Object>> syncCross() {
        log.info("🔄 Manual device cross-sync requested");
        long start = System.currentTimeMillis();
        CrossSyncResult result = crossSyncService.executeCrossSync();
        long totalExecutionTime = System.currentTimeMillis() - start;

        Map<String, Object> statistics = new LinkedHashMap<>();
        statistics.put("totalProcessed", result.totalProcessed());
        statistics.put("matched", result.matched());
        statistics.put("onlyIntune", result.onlyIntune());
        statistics.put("onlyDefender", result.onlyDefender());
        statistics.put("deleted", result.deletedCount());
        statistics.put("written", result.successCount());
        statistics.put("errorCount", result.failureCount());

        Map<String, Object> percentages = new LinkedHashMap<>();
        percentages.put("matched", percentage(result.matched(), result.totalProcessed()));
        percentages.put("onlyIntune", percentage(result.onlyIntune(), result.totalProcessed()));
        percentages.put("onlyDefender", percentage(result.onlyDefender(), result.totalProcessed()));

        Map<String, Object> phases = new LinkedHashMap<>();
        phases.put("fetchIntuneMs", result.fetchIntuneMs());
        phases.put("fetchDefenderMs", result.fetchDefenderMs());
        phases.put("matchingMs", result.matchingMs());
        phases.put("clearMs", result.clearMs());
        phases.put("upsertMs", result.upsertMs());
        Map<String, Object> performance = new LinkedHashMap<>();
        performance.put("totalExecutionTimeMs", totalExecutionTime);
        performance.put("serviceExecutionTimeMs", result.executionTimeMs());
        performance.put("phases", phases);

        Map<String, Object> breakdown = new LinkedHashMap<>();
        breakdown.put("fetchIntuneCost", round(result.fetchIntuneCost()));
        breakdown.put("fetchDefenderCost", round(result.fetchDefenderCost()));
        breakdown.put("clearCost", round(result.clearCost()));
        breakdown.put("upsertCost", round(result.upsertCost()));
        Map<String, Object> resourceUsage = new LinkedHashMap<>();
        resourceUsage.put("totalCost", round(result.totalCost()));
        resourceUsage.put("breakdown", breakdown);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("syncTimestamp", result.syncTimestamp());
        data.put("statistics", statistics);
        data.put("percentages", percentages);
        data.put("performance", performance);
        data.put("resourceUsage", resourceUsage);
        if (!result.errors().isEmpty()) {
            data.put("errors", result.errors().subList(0, Math.min(MAX_RETURNED_ERRORS, result.errors().size())));
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("status", result.hasFailures() ? "partial" : "success");
        body.put("message", result.hasFailures()
                ? "Device cross-sync completed with " + result.failureCount() + " failed records"
                : "Device cross-sync completed successfully");
        body.put("data", data);
        body.put("timestamp", Instant.now(clock).toString());

        log.info("✅ Manual device cross-sync finished in {}ms with status {}", totalExecutionTime, body.get("status"));
        return ResponseEntity.ok(body);
    }

    /**
     * Lists synced devices, optionally filtered by state.
     */
    @GetMapping("/sync-all")
    public ResponseEntity<Map<String, Object>> getSyncedDevices(
            @RequestParam(name = "syncState", required = false) String syncState,
            @RequestParam(name = "pageSize", required = false) Integer pageSize,
            @RequestParam(name = "continuationToken", required = false) String continuationToken) {
        SyncRecordPage page = syncQueryService.getSyncedDevices(syncState, pageSize, continuationToken);
        List<SyncRecord> devices = page.records();

        Map<String, Object> pagination = new LinkedHashMap<>();
        pagination.put("count", page.count());
        pagination.put("hasMore", page.hasMore());
        pagination.put("continuationToken", page.continuationToken());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("devices", devices);
        body.put("pagination", pagination);
        body.put("timestamp", Instant.now(clock).toString());
        return ResponseEntity.ok(body);
    }

    private static double percentage(long part, int total) {
        if (total == 0) {
            return 0;
        }
        return round(part * 100.0 / total);
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}

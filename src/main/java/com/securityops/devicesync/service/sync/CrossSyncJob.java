package com.securityops.devicesync.service.sync;

import com.securityops.devicesync.config.SyncProperties;
import com.securityops.devicesync.exception.CrossSyncInProgressException;
import com.securityops.devicesync.model.dto.CrossSyncResult;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled cross-sync, three times a day by default.
 *
 * A run that fails with a transient error (see {@link RetryableErrorClassifier}) gets one more
 * attempt after {@code devicesync.cross-sync.run-retry-delay}. The final failure is logged and
 * not rethrown so the scheduler keeps its next trigger.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "devicesync.cross-sync", name = "scheduler-enabled", havingValue = "true", matchIfMissing = true)
public class CrossSyncJob {

    private final CrossSyncService crossSyncService;
    private final Retry runRetry;

    public CrossSyncJob(CrossSyncService crossSyncService,
                        RetryableErrorClassifier errorClassifier,
                        SyncProperties properties,
                        RetryRegistry retryRegistry) {
        this.crossSyncService = crossSyncService;

        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(properties.getCrossSync().getRunRetryDelay())
                .retryOnException(errorClassifier::isRetryable)
                .build();
        this.runRetry = retryRegistry.retry("crossSyncRun", retryConfig);
        this.runRetry.getEventPublisher().onRetry(event ->
                log.warn("⏳ Scheduled cross-sync failed with a transient error, retrying in {}s: {}",
                        event.getWaitInterval().toSeconds(), event.getLastThrowable().getMessage()));
    }

    @Scheduled(cron = "${devicesync.cross-sync.cron:0 0 6,12,18 * * *}")
    public void runScheduledCrossSync() {
        log.info("🌙 Scheduled device cross-sync triggered");
        try {
            CrossSyncResult result = runRetry.executeSupplier(crossSyncService::executeCrossSync);
            if (result.hasFailures()) {
                log.warn("Scheduled cross-sync finished with {} failed records out of {}",
                        result.failureCount(), result.totalProcessed());
            } else {
                log.info("Scheduled cross-sync finished: {} records written in {}ms",
                        result.successCount(), result.executionTimeMs());
            }
        } catch (CrossSyncInProgressException e) {
            log.warn("Skipping scheduled cross-sync: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("💥 Scheduled cross-sync failed: {}", e.getMessage(), e);
        }
    }
}

package com.securityops.devicesync.service.sync;

import com.securityops.devicesync.client.DefenderDeviceClient;
import com.securityops.devicesync.client.ManagedDeviceClient;
import com.securityops.devicesync.exception.CrossSyncException;
import com.securityops.devicesync.exception.CrossSyncInProgressException;
import com.securityops.devicesync.model.domain.SyncState;
import com.securityops.devicesync.model.dto.BulkUpsertResult;
import com.securityops.devicesync.model.dto.ClearResult;
import com.securityops.devicesync.model.dto.CrossSyncResult;
import com.securityops.devicesync.model.dto.DefenderDevice;
import com.securityops.devicesync.model.dto.ManagedDevice;
import com.securityops.devicesync.model.dto.MatchOutcome;
import com.securityops.devicesync.model.dto.SourceFetchResult;
import com.securityops.devicesync.service.logic.DeviceMatcher;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Runs a full cross-sync between Intune and Defender.
 *
 * Phases:
 * 1. Fetch both device catalogs concurrently and wait for both
 * 2. Match them into sync records
 * 3. Clear the previous snapshot from the sync store
 * 4. Upsert the new snapshot
 *
 * A failure in any phase aborts the run with a {@link CrossSyncException}. Records that fail to
 * write are reported in the result instead.
 */
@Slf4j
@Service
public class CrossSyncService {

    private final ManagedDeviceClient managedDeviceClient;
    private final DefenderDeviceClient defenderDeviceClient;
    private final DeviceMatcher deviceMatcher;
    private final SyncRecordWriter syncRecordWriter;
    private final CrossSyncRunGuard runGuard;
    private final Executor fetchExecutor;
    private final MeterRegistry meterRegistry;
    private final Timer runTimer;

    public CrossSyncService(ManagedDeviceClient managedDeviceClient,
                            DefenderDeviceClient defenderDeviceClient,
                            DeviceMatcher deviceMatcher,
                            SyncRecordWriter syncRecordWriter,
                            CrossSyncRunGuard runGuard,
                            @Qualifier("sourceFetchExecutor") Executor fetchExecutor,
                            MeterRegistry meterRegistry) {
        this.managedDeviceClient = managedDeviceClient;
        this.defenderDeviceClient = defenderDeviceClient;
        this.deviceMatcher = deviceMatcher;
        this.syncRecordWriter = syncRecordWriter;
        this.runGuard = runGuard;
        this.fetchExecutor = fetchExecutor;
        this.meterRegistry = meterRegistry;
        this.runTimer = meterRegistry.timer("devicesync.crosssync.duration");
    }

    /**
     * @throws CrossSyncInProgressException when another run holds the guard
     * @throws CrossSyncException when a phase fails
     */
    public CrossSyncResult executeCrossSync() {
        if (!runGuard.tryAcquire()) {
            throw new CrossSyncInProgressException("A device cross-sync is already in progress");
        }
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            return runPhases();
        } finally {
            sample.stop(runTimer);
            runGuard.release();
        }
    }

    private CrossSyncResult runPhases() {
        long start = System.currentTimeMillis();
        RunProgress progress = new RunProgress();
        log.info("🔄 Starting device cross-sync");

        try {
            // 1. Both catalogs, side by side
            progress.phase = "fetch";
            CompletableFuture<TimedFetch<ManagedDevice>> intuneFetch =
                    CompletableFuture.supplyAsync(() -> timedFetch(managedDeviceClient::fetchAllDevices), fetchExecutor);
            CompletableFuture<TimedFetch<DefenderDevice>> defenderFetch =
                    CompletableFuture.supplyAsync(() -> timedFetch(defenderDeviceClient::fetchAllDevices), fetchExecutor);
            CompletableFuture.allOf(intuneFetch, defenderFetch).exceptionally(error -> null).join();

            progress.phase = "fetch-intune";
            TimedFetch<ManagedDevice> intune = await(intuneFetch);
            progress.phase = "fetch-defender";
            TimedFetch<DefenderDevice> defender = await(defenderFetch);
            progress.fetchIntuneMs = intune.durationMs();
            progress.fetchDefenderMs = defender.durationMs();
            log.info("📥 Fetched {} Intune devices ({}ms, {} units) and {} Defender devices ({}ms, {} units)",
                    intune.result().count(), intune.durationMs(), intune.result().cost(),
                    defender.result().count(), defender.durationMs(), defender.result().cost());

            // 2. Match
            progress.phase = "match";
            long matchStart = System.currentTimeMillis();
            MatchOutcome outcome = deviceMatcher.match(intune.result().devices(), defender.result().devices());
            progress.matchingMs = System.currentTimeMillis() - matchStart;

            // 3. Drop the previous snapshot
            progress.phase = "clear";
            long clearStart = System.currentTimeMillis();
            ClearResult clearResult = syncRecordWriter.clearAll();
            progress.clearMs = System.currentTimeMillis() - clearStart;
            if (clearResult.failureCount() > 0) {
                log.warn("{} previous sync records could not be deleted and will remain in the store",
                        clearResult.failureCount());
            }

            // 4. Write the new snapshot
            progress.phase = "upsert";
            long upsertStart = System.currentTimeMillis();
            BulkUpsertResult upsertResult = syncRecordWriter.bulkUpsert(outcome.records());
            progress.upsertMs = System.currentTimeMillis() - upsertStart;

            CrossSyncResult result = new CrossSyncResult(
                    outcome.count(SyncState.MATCHED),
                    outcome.count(SyncState.ONLY_INTUNE),
                    outcome.count(SyncState.ONLY_DEFENDER),
                    outcome.records().size(),
                    System.currentTimeMillis() - start,
                    intune.result().cost() + defender.result().cost() + clearResult.cost() + upsertResult.cost(),
                    progress.fetchIntuneMs,
                    progress.fetchDefenderMs,
                    progress.matchingMs,
                    progress.clearMs,
                    progress.upsertMs,
                    intune.result().cost(),
                    defender.result().cost(),
                    clearResult.cost(),
                    upsertResult.cost(),
                    clearResult.deletedCount(),
                    upsertResult.successCount(),
                    upsertResult.failureCount(),
                    outcome.syncTimestamp(),
                    upsertResult.errors());

            meterRegistry.counter("devicesync.crosssync.runs", "outcome", "success").increment();
            log.info("✅ Device cross-sync complete: {} records (matched={}, only_intune={}, only_defender={}), "
                            + "{} written, {} failed, {} units, {}ms",
                    result.totalProcessed(), result.matched(), result.onlyIntune(), result.onlyDefender(),
                    result.successCount(), result.failureCount(), result.totalCost(), result.executionTimeMs());
            return result;

        } catch (RuntimeException e) {
            meterRegistry.counter("devicesync.crosssync.runs", "outcome", "failure").increment();
            log.error("💥 Device cross-sync failed during {} after {}ms (fetchIntune={}ms, fetchDefender={}ms, "
                            + "matching={}ms, clear={}ms, upsert={}ms)",
                    progress.phase, System.currentTimeMillis() - start, progress.fetchIntuneMs,
                    progress.fetchDefenderMs, progress.matchingMs, progress.clearMs, progress.upsertMs, e);
            throw new CrossSyncException(progress.phase, e);
        }
    }

    private static <T> TimedFetch<T> timedFetch(Supplier<SourceFetchResult<T>> fetch) {
        long start = System.currentTimeMillis();
        SourceFetchResult<T> result = fetch.get();
        return new TimedFetch<>(result, System.currentTimeMillis() - start);
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException(cause.getMessage(), cause);
        }
    }

    private record TimedFetch<T>(SourceFetchResult<T> result, long durationMs) {}

    /**
     * Where the run got to, kept for the failure log.
     */
    private static final class RunProgress {
        private String phase;
        private long fetchIntuneMs;
        private long fetchDefenderMs;
        private long matchingMs;
        private long clearMs;
        private long upsertMs;
    }
}

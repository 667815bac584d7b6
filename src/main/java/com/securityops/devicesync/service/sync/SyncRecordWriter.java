package com.securityops.devicesync.service.sync;

import com.securityops.devicesync.config.SyncProperties;
import com.securityops.devicesync.exception.StoreThrottledException;
import com.securityops.devicesync.model.domain.SyncRecord;
import com.securityops.devicesync.model.dto.BulkUpsertResult;
import com.securityops.devicesync.model.dto.ClearResult;
import com.securityops.devicesync.model.dto.SyncError;
import com.securityops.devicesync.store.IdListing;
import com.securityops.devicesync.store.StoreItemResult;
import com.securityops.devicesync.store.SyncDocumentStore;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;

/**
 * Writes sync record snapshots to the {@link SyncDocumentStore}.
 *
 * Records (and ids, for the clear phase) are split into fixed-size batches which run
 * concurrently on a bounded executor. Batches are isolated from each other: a failing batch
 * only fails its own items. Inside a batch every item is accounted for individually.
 *
 * Throttled items are resubmitted with exponential backoff (1s, 2s, 4s by default) and only
 * recorded as failures once the retries are exhausted. Terminal failures are recorded at once.
 */
@Slf4j
@Service
public class SyncRecordWriter {

    private static final int LOGGED_ERROR_SAMPLE = 5;

    private final SyncDocumentStore syncDocumentStore;
    private final Executor writeExecutor;
    private final SyncProperties.CrossSync settings;
    private final Retry throttleRetry;
    private final Counter writtenCounter;
    private final Counter failedCounter;

    public SyncRecordWriter(SyncDocumentStore syncDocumentStore,
                            @Qualifier("syncWriteExecutor") Executor writeExecutor,
                            SyncProperties properties,
                            RetryRegistry retryRegistry,
                            MeterRegistry meterRegistry) {
        this.syncDocumentStore = syncDocumentStore;
        this.writeExecutor = writeExecutor;
        this.settings = properties.getCrossSync();

        RetryConfig retryConfig = RetryConfig.<List<?>>custom()
                .maxAttempts(settings.getMaxThrottleRetries() + 1)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(settings.getInitialBackoff(), 2.0))
                .retryOnResult(stillThrottled -> !stillThrottled.isEmpty())
                .retryExceptions(StoreThrottledException.class)
                .build();
        this.throttleRetry = retryRegistry.retry("syncStoreWrite", retryConfig);
        this.throttleRetry.getEventPublisher().onRetry(event ->
                log.warn("Sync store throttled, retry {} of {} in {}ms",
                        event.getNumberOfRetryAttempts(), settings.getMaxThrottleRetries(),
                        event.getWaitInterval().toMillis()));

        this.writtenCounter = meterRegistry.counter("devicesync.records.written");
        this.failedCounter = meterRegistry.counter("devicesync.records.failed");
    }

    /**
     * Removes every stored sync record.
     */
    public ClearResult clearAll() {
        long start = System.currentTimeMillis();
        IdListing listing = syncDocumentStore.listRecordIds();
        log.info("Clearing {} existing sync records (listing cost {} units)", listing.ids().size(), listing.cost());

        if (listing.ids().isEmpty()) {
            return ClearResult.empty(listing.cost());
        }

        BatchOutcome outcome = runBatches("delete", listing.ids(), syncDocumentStore::deleteBatch, Function.identity());
        ClearResult result = new ClearResult(outcome.successCount, outcome.errors.size(), listing.cost() + outcome.cost);

        log.info("Cleared {} sync records, {} failed, {} units, {}ms",
                result.deletedCount(), result.failureCount(), result.cost(), System.currentTimeMillis() - start);
        if (result.failureCount() > 0) {
            log.warn("Some sync records could not be deleted: {}", sample(outcome.errors));
        }
        return result;
    }

    /**
     * Upserts a full snapshot of sync records. Per-record failures are reported in the result,
     * never thrown.
     */
    public BulkUpsertResult bulkUpsert(List<SyncRecord> records) {
        if (records.isEmpty()) {
            log.warn("Bulk upsert called with no sync records");
            return BulkUpsertResult.empty();
        }
        long start = System.currentTimeMillis();
        log.info("Upserting {} sync records in batches of {}", records.size(), batchSize());

        BatchOutcome outcome = runBatches("upsert", records, syncDocumentStore::upsertBatch, SyncRecord::syncKey);
        long executionTime = System.currentTimeMillis() - start;
        writtenCounter.increment(outcome.successCount);
        failedCounter.increment(outcome.errors.size());

        log.info("Bulk upsert completed: {} succeeded, {} failed, {} units, {}ms",
                outcome.successCount, outcome.errors.size(), outcome.cost, executionTime);
        if (!outcome.errors.isEmpty()) {
            log.warn("Some sync records failed to upsert: {}", sample(outcome.errors));
        }
        return new BulkUpsertResult(outcome.successCount, outcome.errors.size(), outcome.cost,
                executionTime, List.copyOf(outcome.errors));
    }

    private <T> BatchOutcome runBatches(String operation,
                                        List<T> items,
                                        Function<List<T>, List<StoreItemResult>> storeCall,
                                        Function<T, String> errorKey) {
        int batchSize = batchSize();
        int totalBatches = (items.size() + batchSize - 1) / batchSize;

        List<CompletableFuture<BatchOutcome>> futures = new ArrayList<>(totalBatches);
        for (int from = 0; from < items.size(); from += batchSize) {
            List<T> batch = List.copyOf(items.subList(from, Math.min(from + batchSize, items.size())));
            int batchNumber = from / batchSize + 1;
            try {
                futures.add(CompletableFuture
                        .supplyAsync(() -> runBatch(operation, batchNumber, totalBatches, batch, storeCall, errorKey), writeExecutor)
                        .exceptionally(error -> failedBatch(operation, batchNumber, batch, errorKey, error)));
            } catch (RejectedExecutionException e) {
                futures.add(CompletableFuture.completedFuture(failedBatch(operation, batchNumber, batch, errorKey, e)));
            }
        }

        BatchOutcome total = new BatchOutcome();
        futures.forEach(future -> total.merge(future.join()));
        return total;
    }

    private int batchSize() {
        return Math.max(1, settings.getBatchSize());
    }

    private <T> BatchOutcome runBatch(String operation,
                                      int batchNumber,
                                      int totalBatches,
                                      List<T> batch,
                                      Function<List<T>, List<StoreItemResult>> storeCall,
                                      Function<T, String> errorKey) {
        log.debug("Processing {} batch {}/{} ({} items)", operation, batchNumber, totalBatches, batch.size());
        BatchOutcome outcome = new BatchOutcome();
        PendingItems<T> pending = new PendingItems<>(batch);

        try {
            List<T> stillThrottled = throttleRetry.executeSupplier(() -> {
                List<StoreItemResult> results = storeCall.apply(pending.items);
                if (results.size() != pending.items.size()) {
                    throw new IllegalStateException("Store returned " + results.size()
                            + " results for " + pending.items.size() + " items");
                }
                List<T> throttled = new ArrayList<>();
                for (int i = 0; i < results.size(); i++) {
                    StoreItemResult result = results.get(i);
                    T item = pending.items.get(i);
                    outcome.cost += result.cost();
                    if (result.isSuccess()) {
                        outcome.successCount++;
                    } else if (result.isThrottled()) {
                        throttled.add(item);
                        pending.lastThrottleError = result.error();
                    } else {
                        outcome.errors.add(new SyncError(errorKey.apply(item), result.error()));
                    }
                }
                pending.items = throttled;
                return throttled;
            });
            for (T item : stillThrottled) {
                outcome.errors.add(new SyncError(errorKey.apply(item),
                        "Throttled after " + settings.getMaxThrottleRetries() + " retries: " + pending.lastThrottleError));
            }
        } catch (StoreThrottledException e) {
            log.warn("{} batch {}/{} still throttled after {} retries", operation, batchNumber, totalBatches,
                    settings.getMaxThrottleRetries());
            failAll(pending.items, errorKey, "Throttled after " + settings.getMaxThrottleRetries() + " retries: " + e.getMessage(), outcome);
        } catch (RuntimeException e) {
            log.error("{} batch {}/{} failed: {}", operation, batchNumber, totalBatches, e.getMessage(), e);
            failAll(pending.items, errorKey, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), outcome);
        }
        return outcome;
    }

    private <T> BatchOutcome failedBatch(String operation, int batchNumber, List<T> batch,
                                         Function<T, String> errorKey, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        log.error("{} batch {} did not complete: {}", operation, batchNumber, message);
        BatchOutcome outcome = new BatchOutcome();
        failAll(batch, errorKey, message, outcome);
        return outcome;
    }

    private static <T> void failAll(List<T> items, Function<T, String> errorKey, String message, BatchOutcome outcome) {
        for (T item : items) {
            outcome.errors.add(new SyncError(errorKey.apply(item), message));
        }
    }

    private static List<SyncError> sample(List<SyncError> errors) {
        return errors.subList(0, Math.min(LOGGED_ERROR_SAMPLE, errors.size()));
    }

    /**
     * Items of a batch that still need a store round trip.
     */
    private static final class PendingItems<T> {
        private List<T> items;
        private String lastThrottleError;

        private PendingItems(List<T> items) {
            this.items = items;
        }
    }

    private static final class BatchOutcome {
        private int successCount;
        private double cost;
        private final List<SyncError> errors = new ArrayList<>();

        private void merge(BatchOutcome other) {
            successCount += other.successCount;
            cost += other.cost;
            errors.addAll(other.errors);
        }
    }
}

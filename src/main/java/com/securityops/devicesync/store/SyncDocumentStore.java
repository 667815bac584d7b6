package com.securityops.devicesync.store;

import com.securityops.devicesync.model.domain.SyncRecord;
import com.securityops.devicesync.model.domain.SyncState;
import com.securityops.devicesync.model.dto.SyncRecordPage;

import java.util.List;

/**
 * Document store holding the current sync record snapshot.
 * Allows swapping the backing store without touching the sync pipeline.
 *
 * Batch operations return exactly one {@link StoreItemResult} per input item, in input order.
 * A batch may also fail as a whole: {@link com.securityops.devicesync.exception.StoreThrottledException}
 * signals backpressure, any other runtime exception is terminal for the batch.
 */
public interface SyncDocumentStore {

    /**
     * Lists the ids of every stored record.
     */
    IdListing listRecordIds();

    List<StoreItemResult> upsertBatch(List<SyncRecord> records);

    List<StoreItemResult> deleteBatch(List<String> ids);

    /**
     * Reads one page of records, newest sync first.
     *
     * @param syncState         optional filter, null for all states
     * @param pageSize          records per page
     * @param continuationToken token from the previous page, null for the first page
     */
    SyncRecordPage findPage(SyncState syncState, int pageSize, String continuationToken);
}

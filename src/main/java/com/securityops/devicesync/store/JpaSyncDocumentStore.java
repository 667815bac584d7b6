package com.securityops.devicesync.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.securityops.devicesync.exception.InvalidQueryException;
import com.securityops.devicesync.model.domain.SyncRecord;
import com.securityops.devicesync.model.domain.SyncRecordEntity;
import com.securityops.devicesync.model.domain.SyncState;
import com.securityops.devicesync.model.dto.SyncRecordPage;
import com.securityops.devicesync.repository.SyncRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link SyncDocumentStore} backed by the {@code sync_record} table.
 *
 * Every row is written in its own transaction so that one bad record cannot roll back
 * its batch siblings. Cost is counted as one unit per row written or deleted and one unit
 * per page of rows read. Transient database errors (lock timeouts, pool exhaustion) are
 * reported as throttling.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaSyncDocumentStore implements SyncDocumentStore {

    static final int ID_PAGE_SIZE = 100;
    private static final double ROW_COST = 1.0;

    private final SyncRecordRepository syncRecordRepository;
    private final SyncRecordMapper syncRecordMapper;

    @Override
    public IdListing listRecordIds() {
        List<String> ids = syncRecordRepository.findAllIds();
        double cost = Math.max(1, (int) Math.ceil(ids.size() / (double) ID_PAGE_SIZE));
        log.debug("Listed {} sync record ids ({} units)", ids.size(), cost);
        return new IdListing(ids, cost);
    }

    @Override
    public List<StoreItemResult> upsertBatch(List<SyncRecord> records) {
        List<StoreItemResult> results = new ArrayList<>(records.size());
        for (SyncRecord record : records) {
            results.add(upsertOne(record));
        }
        return results;
    }

    private StoreItemResult upsertOne(SyncRecord record) {
        SyncRecordEntity entity;
        try {
            entity = syncRecordMapper.toEntity(record);
        } catch (JsonProcessingException e) {
            log.warn("Sync record {} has a malformed payload: {}", record.syncKey(), e.getOriginalMessage());
            return StoreItemResult.failed(record.id(), "Malformed payload: " + e.getOriginalMessage());
        }
        try {
            syncRecordRepository.save(entity);
            return StoreItemResult.succeeded(record.id(), ROW_COST);
        } catch (TransientDataAccessException e) {
            return StoreItemResult.throttled(record.id(), "Throttled: " + e.getMessage());
        } catch (DataAccessException e) {
            return StoreItemResult.failed(record.id(), e.getMostSpecificCause().getMessage());
        }
    }

    @Override
    public List<StoreItemResult> deleteBatch(List<String> ids) {
        List<StoreItemResult> results = new ArrayList<>(ids.size());
        for (String id : ids) {
            try {
                syncRecordRepository.deleteById(id);
                results.add(StoreItemResult.succeeded(id, ROW_COST));
            } catch (TransientDataAccessException e) {
                results.add(StoreItemResult.throttled(id, "Throttled: " + e.getMessage()));
            } catch (DataAccessException e) {
                results.add(StoreItemResult.failed(id, e.getMostSpecificCause().getMessage()));
            }
        }
        return results;
    }

    @Override
    public SyncRecordPage findPage(SyncState syncState, int pageSize, String continuationToken) {
        int pageIndex = parseToken(continuationToken);
        PageRequest pageRequest = PageRequest.of(pageIndex, pageSize,
                Sort.by(Sort.Order.desc("syncTimestamp"), Sort.Order.asc("id")));

        Page<SyncRecordEntity> page = syncState == null
                ? syncRecordRepository.findAll(pageRequest)
                : syncRecordRepository.findBySyncState(syncState, pageRequest);

        List<SyncRecord> records = page.getContent().stream()
                .map(syncRecordMapper::toRecord)
                .toList();
        String nextToken = page.hasNext() ? String.valueOf(pageIndex + 1) : null;
        return new SyncRecordPage(records, page.hasNext(), nextToken, ROW_COST);
    }

    private int parseToken(String continuationToken) {
        if (continuationToken == null || continuationToken.isBlank()) {
            return 0;
        }
        try {
            int pageIndex = Integer.parseInt(continuationToken.trim());
            if (pageIndex < 0) {
                throw new InvalidQueryException("Invalid continuation token");
            }
            return pageIndex;
        } catch (NumberFormatException e) {
            throw new InvalidQueryException("Invalid continuation token", e);
        }
    }
}

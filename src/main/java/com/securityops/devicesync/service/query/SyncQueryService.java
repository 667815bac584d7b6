package com.securityops.devicesync.service.query;

import com.securityops.devicesync.config.SyncProperties;
import com.securityops.devicesync.exception.InvalidQueryException;
import com.securityops.devicesync.model.domain.SyncState;
import com.securityops.devicesync.model.dto.SyncRecordPage;
import com.securityops.devicesync.store.SyncDocumentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Paged read access to the current sync record snapshot.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyncQueryService {

    private final SyncDocumentStore syncDocumentStore;
    private final SyncProperties properties;

    /**
     * @param syncState         {@code matched}, {@code only_intune}, {@code only_defender} or null for all
     * @param pageSize          null for the configured default
     * @param continuationToken token from the previous page, null for the first page
     * @throws InvalidQueryException on an unknown state, an out-of-range page size or a malformed token
     */
    public SyncRecordPage getSyncedDevices(String syncState, Integer pageSize, String continuationToken) {
        SyncState state = parseState(syncState);
        int size = resolvePageSize(pageSize);

        SyncRecordPage page = syncDocumentStore.findPage(state, size, continuationToken);
        log.info("Retrieved {} sync records (state={}, pageSize={}, hasMore={})",
                page.count(), state != null ? state.getValue() : "all", size, page.hasMore());
        return page;
    }

    private SyncState parseState(String syncState) {
        if (syncState == null || syncState.isBlank()) {
            return null;
        }
        return SyncState.fromValue(syncState.trim())
                .orElseThrow(() -> new InvalidQueryException(
                        "Invalid syncState '" + syncState + "', expected one of: matched, only_intune, only_defender"));
    }

    private int resolvePageSize(Integer pageSize) {
        SyncProperties.Query query = properties.getQuery();
        if (pageSize == null) {
            return query.getDefaultPageSize();
        }
        if (pageSize < 1 || pageSize > query.getMaxPageSize()) {
            throw new InvalidQueryException("pageSize must be between 1 and " + query.getMaxPageSize());
        }
        return pageSize;
    }
}

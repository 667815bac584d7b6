package com.securityops.devicesync.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.securityops.devicesync.model.domain.SyncRecord;
import com.securityops.devicesync.model.domain.SyncRecordEntity;
import com.securityops.devicesync.model.dto.DefenderDevice;
import com.securityops.devicesync.model.dto.ManagedDevice;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Converts between {@link SyncRecord} and its JPA row, serializing device payloads as JSON.
 */
@Component
@RequiredArgsConstructor
public class SyncRecordMapper {

    private final ObjectMapper objectMapper;

    public SyncRecordEntity toEntity(SyncRecord record) throws JsonProcessingException {
        SyncRecordEntity entity = new SyncRecordEntity();
        entity.setId(record.id());
        entity.setSyncKey(record.syncKey());
        entity.setSyncState(record.syncState());
        entity.setSyncTimestamp(record.syncTimestamp());
        entity.setIntunePayload(record.intune() != null ? objectMapper.writeValueAsString(record.intune()) : null);
        entity.setDefenderPayload(record.defender() != null ? objectMapper.writeValueAsString(record.defender()) : null);
        return entity;
    }

    public SyncRecord toRecord(SyncRecordEntity entity) {
        try {
            ManagedDevice intune = entity.getIntunePayload() != null
                    ? objectMapper.readValue(entity.getIntunePayload(), ManagedDevice.class) : null;
            DefenderDevice defender = entity.getDefenderPayload() != null
                    ? objectMapper.readValue(entity.getDefenderPayload(), DefenderDevice.class) : null;
            return new SyncRecord(entity.getId(), entity.getSyncKey(), entity.getSyncState(),
                    entity.getSyncTimestamp(), intune, defender);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored payload of sync record " + entity.getId() + " is not readable", e);
        }
    }
}

package com.securityops.devicesync.model.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.util.Objects;

/**
 * JPA row for a {@link SyncRecord}. Device payloads are stored as JSON text;
 * a null column means the device was not present in that source.
 */
@Getter
@Setter
@Entity
@Table(name = "sync_record", indexes = {
        @Index(name = "idx_sync_record_key", columnList = "sync_key"),
        @Index(name = "idx_sync_record_state", columnList = "sync_state")
})
public class SyncRecordEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "sync_key", nullable = false)
    private String syncKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "sync_state", nullable = false, length = 16)
    private SyncState syncState;

    @Column(name = "sync_timestamp", nullable = false, length = 40)
    private String syncTimestamp;

    @Lob
    @Column(name = "intune_payload")
    private String intunePayload;

    @Lob
    @Column(name = "defender_payload")
    private String defenderPayload;

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SyncRecordEntity that = (SyncRecordEntity) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "SyncRecordEntity{" +
                "id='" + id + '\'' +
                ", syncKey='" + syncKey + '\'' +
                ", syncState=" + syncState +
                ", syncTimestamp='" + syncTimestamp + '\'' +
                '}';
    }
}

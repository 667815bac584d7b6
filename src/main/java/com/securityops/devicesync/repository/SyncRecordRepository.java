package com.securityops.devicesync.repository;

import com.securityops.devicesync.model.domain.SyncRecordEntity;
import com.securityops.devicesync.model.domain.SyncState;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SyncRecordRepository extends JpaRepository<SyncRecordEntity, String> {

    /**
     * Ids of every stored sync record. Used by the clear phase so that deletes can be
     * batched without loading the payload columns.
     */
    @Query("select r.id from SyncRecordEntity r")
    List<String> findAllIds();

    Page<SyncRecordEntity> findBySyncState(SyncState syncState, Pageable pageable);
}

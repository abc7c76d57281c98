package com.nosota.landmarket.repository;

import com.nosota.landmarket.model.LockedAsset;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.UUID;

/**
 * Repository for escrow rows, keyed by buy request ID.
 */
@Repository
public interface LockedAssetRepository extends JpaRepository<LockedAsset, UUID> {

    /**
     * Deletes the lock of a buy request.
     *
     * @return Number of deleted rows, 0 when already released
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM LockedAsset l WHERE l.buyRequestId = :buyRequestId")
    int deleteByBuyRequestId(@Param("buyRequestId") UUID buyRequestId);
}

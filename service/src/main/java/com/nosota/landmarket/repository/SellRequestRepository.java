package com.nosota.landmarket.repository;

import com.nosota.landmarket.api.model.SellRequestStatus;
import com.nosota.landmarket.model.SellRequest;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for {@link SellRequest} listings.
 */
@Repository
public interface SellRequestRepository extends JpaRepository<SellRequest, UUID> {

    boolean existsByFeatureIdAndStatus(Long featureId, SellRequestStatus status);

    List<SellRequest> findBySellerIdOrderByCreatedAtDesc(Long sellerId);

    /**
     * Finds the seller's most recent listing in the given status priced below the given percentage.
     *
     * @param sellerId  The seller
     * @param status    Listing status, {@link SellRequestStatus#COMPLETED} for sold listings
     * @param threshold Exclusive percentage bound (100 for "underpriced")
     * @return Latest matching listing, if any
     */
    Optional<SellRequest> findFirstBySellerIdAndStatusAndFloorPercentageLessThanOrderByCreatedAtDesc(
            Long sellerId, SellRequestStatus status, Integer threshold);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE SellRequest s SET s.status = :to WHERE s.featureId = :featureId AND s.status = :from")
    int transitionAllForFeature(@Param("featureId") Long featureId,
                                @Param("from") SellRequestStatus from,
                                @Param("to") SellRequestStatus to);
}

package com.nosota.landmarket.repository;

import com.nosota.landmarket.api.model.BuyRequestStatus;
import com.nosota.landmarket.model.BuyRequest;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Repository for {@link BuyRequest} entity operations.
 */
@Repository
public interface BuyRequestRepository extends JpaRepository<BuyRequest, UUID> {

    /**
     * Moves a request from one status to another if it is still in the expected one.
     * <p>
     * Used to claim a request before money moves, so that accept, reject,
     * cancel and supersede of the same request are mutually exclusive.
     * </p>
     *
     * @param id   Request ID
     * @param from Expected current status
     * @param to   Target status
     * @param now  Update timestamp
     * @return 1 if the transition happened, 0 otherwise
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE BuyRequest r SET r.status = :to, r.updatedAt = :now " +
            "WHERE r.id = :id AND r.status = :from")
    int transitionStatus(@Param("id") UUID id,
                         @Param("from") BuyRequestStatus from,
                         @Param("to") BuyRequestStatus to,
                         @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE BuyRequest r SET r.deletedAt = :now, r.updatedAt = :now WHERE r.id = :id")
    int markDeleted(@Param("id") UUID id, @Param("now") LocalDateTime now);

    boolean existsByBuyerIdAndFeatureIdAndStatus(Long buyerId, Long featureId, BuyRequestStatus status);

    List<BuyRequest> findByFeatureIdAndStatus(Long featureId, BuyRequestStatus status);

    List<BuyRequest> findByBuyerIdAndStatusAndDeletedAtIsNullOrderByCreatedAtDesc(Long buyerId, BuyRequestStatus status);

    List<BuyRequest> findBySellerIdAndStatusAndDeletedAtIsNullOrderByCreatedAtDesc(Long sellerId, BuyRequestStatus status);
}

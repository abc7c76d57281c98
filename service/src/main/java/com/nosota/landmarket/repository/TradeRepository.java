package com.nosota.landmarket.repository;

import com.nosota.landmarket.model.Trade;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for {@link Trade} history. Insert-only.
 */
@Repository
public interface TradeRepository extends JpaRepository<Trade, UUID> {

    Optional<Trade> findFirstBySellerIdAndFeatureIdOrderByCreatedAtDesc(Long sellerId, Long featureId);

    List<Trade> findByFeatureIdOrderByCreatedAtDesc(Long featureId);
}

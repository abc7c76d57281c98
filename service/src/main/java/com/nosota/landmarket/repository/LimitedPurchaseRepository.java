package com.nosota.landmarket.repository;

import com.nosota.landmarket.model.LimitedPurchase;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface LimitedPurchaseRepository extends JpaRepository<LimitedPurchase, UUID> {

    long countByUserIdAndFeatureLimitId(Long userId, Long featureLimitId);
}

package com.nosota.landmarket.repository;

import com.nosota.landmarket.model.HourlyProfit;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface HourlyProfitRepository extends JpaRepository<HourlyProfit, UUID> {

    /**
     * Finds the profit record of a feature with a pessimistic write lock, so the
     * flush does not race the external accrual job.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM HourlyProfit p WHERE p.featureId = :featureId")
    Optional<HourlyProfit> findByFeatureIdForUpdate(@Param("featureId") Long featureId);

    Optional<HourlyProfit> findByFeatureId(Long featureId);
}

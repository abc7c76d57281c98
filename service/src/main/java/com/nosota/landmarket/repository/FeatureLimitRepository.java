package com.nosota.landmarket.repository;

import com.nosota.landmarket.model.FeatureLimit;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface FeatureLimitRepository extends JpaRepository<FeatureLimit, Long> {

    /**
     * Finds campaigns that cover the feature and are running at {@code now}.
     */
    @Query("SELECT l FROM FeatureLimit l WHERE l.expired = false " +
            "AND :featureId BETWEEN l.startFeatureId AND l.endFeatureId " +
            "AND :now BETWEEN l.startsAt AND l.endsAt " +
            "ORDER BY l.id DESC")
    List<FeatureLimit> findActiveCovering(@Param("featureId") Long featureId, @Param("now") LocalDateTime now);
}

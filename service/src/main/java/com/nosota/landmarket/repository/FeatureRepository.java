package com.nosota.landmarket.repository;

import com.nosota.landmarket.model.Feature;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * Repository for {@link Feature} catalog entries.
 */
@Repository
public interface FeatureRepository extends JpaRepository<Feature, Long> {

    /**
     * Moves ownership of a feature, but only if it is still owned by {@code expectedOwnerId}.
     * <p>
     * This is the single writer of {@code owner_id}: of two concurrent settlements
     * on the same feature exactly one sees an updated row.
     * </p>
     *
     * @param featureId       The feature ID
     * @param expectedOwnerId Owner the caller observed before settling
     * @param newOwnerId      The buyer
     * @return Number of updated rows, 0 if the owner has changed meanwhile
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Feature f SET f.ownerId = :newOwnerId, f.version = f.version + 1 " +
            "WHERE f.id = :featureId AND f.ownerId = :expectedOwnerId")
    int transferOwnership(@Param("featureId") Long featureId,
                          @Param("expectedOwnerId") Long expectedOwnerId,
                          @Param("newOwnerId") Long newOwnerId);
}

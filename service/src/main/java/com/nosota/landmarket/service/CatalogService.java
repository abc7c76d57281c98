package com.nosota.landmarket.service;

import com.nosota.landmarket.dto.FeatureUpdate;
import com.nosota.landmarket.error.FeatureNotFoundException;
import com.nosota.landmarket.error.MarketplaceException;
import com.nosota.landmarket.error.OwnershipConflictException;
import com.nosota.landmarket.model.Feature;
import com.nosota.landmarket.repository.FeatureRepository;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;

/**
 * Access to the feature catalog.
 *
 * <p>{@link #transferOwnership} is the only code path that changes a feature's owner.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CatalogService {

    private final FeatureRepository featureRepository;

    public Feature getFeature(Long featureId) throws FeatureNotFoundException {
        return featureRepository.findById(featureId)
                .orElseThrow(() -> new FeatureNotFoundException("Feature not found: " + featureId));
    }

    /**
     * Moves the feature to the new owner if it still belongs to the expected one,
     * and applies the post-transfer update in the same transaction.
     *
     * @throws OwnershipConflictException if the feature no longer belongs to {@code expectedOwnerId}
     */
    @Transactional(rollbackOn = MarketplaceException.class)
    public Feature transferOwnership(Long featureId, Long expectedOwnerId, Long newOwnerId, FeatureUpdate update)
            throws OwnershipConflictException, FeatureNotFoundException {
        int updated;
        try {
            updated = featureRepository.transferOwnership(featureId, expectedOwnerId, newOwnerId);
        } catch (ConcurrencyFailureException e) {
            throw new OwnershipConflictException("Feature " + featureId + " is being transferred concurrently", e);
        }
        if (updated == 0) {
            throw new OwnershipConflictException(
                    "Feature " + featureId + " is no longer owned by user " + expectedOwnerId);
        }

        Feature feature = getFeature(featureId);
        apply(feature, update);
        log.info("Feature {} transferred from {} to {}", featureId, expectedOwnerId, newOwnerId);
        return featureRepository.save(feature);
    }

    @Transactional(rollbackOn = MarketplaceException.class)
    public Feature applyUpdate(Long featureId, FeatureUpdate update) throws FeatureNotFoundException {
        Feature feature = getFeature(featureId);
        apply(feature, update);
        return featureRepository.save(feature);
    }

    private void apply(Feature feature, FeatureUpdate update) {
        if (update.marketStatus() != null) {
            feature.setMarketStatus(update.marketStatus());
        }
        if (update.clearListedPrices()) {
            feature.setListedPricePsc(null);
            feature.setListedPriceIrr(null);
        } else {
            if (update.listedPricePsc() != null) {
                feature.setListedPricePsc(update.listedPricePsc());
            }
            if (update.listedPriceIrr() != null) {
                feature.setListedPriceIrr(update.listedPriceIrr());
            }
        }
        if (update.minimumPricePercentage() != null) {
            feature.setMinimumPricePercentage(update.minimumPricePercentage());
        }
        if (update.label() != null) {
            feature.setLabel(update.label());
        }
    }
}

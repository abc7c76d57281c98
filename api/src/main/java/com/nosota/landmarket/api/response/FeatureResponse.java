package com.nosota.landmarket.api.response;

import com.nosota.landmarket.api.model.MarketStatus;
import com.nosota.landmarket.api.model.PropertyCategory;

import java.math.BigDecimal;

/**
 * Catalog view of a land feature.
 */
public record FeatureResponse(
        Long id,
        Long ownerId,
        PropertyCategory category,
        BigDecimal stabilityValue,
        BigDecimal listedPricePsc,
        BigDecimal listedPriceIrr,
        Integer minimumPricePercentage,
        MarketStatus marketStatus,
        String label
) {
}

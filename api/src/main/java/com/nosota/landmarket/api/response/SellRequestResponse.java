package com.nosota.landmarket.api.response;

import com.nosota.landmarket.api.model.SellRequestStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Sell request (listing) of a feature.
 *
 * @param id              request UUID
 * @param sellerId        owner who listed the feature
 * @param featureId       listed feature
 * @param askPsc          asking PSC
 * @param askIrr          asking IRR
 * @param floorPercentage asking price as percentage of the valuation; below 100 is underpriced
 * @param status          current status
 * @param createdAt       creation time
 */
public record SellRequestResponse(
        UUID id,
        Long sellerId,
        Long featureId,
        BigDecimal askPsc,
        BigDecimal askIrr,
        Integer floorPercentage,
        SellRequestStatus status,
        LocalDateTime createdAt
) {
}

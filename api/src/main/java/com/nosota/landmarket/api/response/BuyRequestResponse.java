package com.nosota.landmarket.api.response;

import com.nosota.landmarket.api.model.BuyRequestStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Buy request as seen by buyer and seller.
 *
 * @param id                  request UUID
 * @param buyerId             user who made the offer
 * @param sellerId            owner of the feature when the offer was made
 * @param featureId           feature the offer is for
 * @param pricePsc            nominal offered PSC (fees excluded)
 * @param priceIrr            nominal offered IRR (fees excluded)
 * @param note                buyer's message
 * @param status              current status
 * @param gracePeriodDeadline seller-set extension window, null if never set
 * @param createdAt           creation time
 */
public record BuyRequestResponse(
        UUID id,
        Long buyerId,
        Long sellerId,
        Long featureId,
        BigDecimal pricePsc,
        BigDecimal priceIrr,
        String note,
        BuyRequestStatus status,
        LocalDateTime gracePeriodDeadline,
        LocalDateTime createdAt
) {
}

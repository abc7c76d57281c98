package com.nosota.landmarket.api.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * Offer on a feature. At least one of the prices must be greater than zero.
 *
 * @param pricePsc offered amount in PSC
 * @param priceIrr offered amount in IRR
 * @param note     optional message to the owner
 */
public record SendBuyRequestRequest(
        @NotNull @PositiveOrZero BigDecimal pricePsc,
        @NotNull @PositiveOrZero BigDecimal priceIrr,
        @Size(max = 500) String note
) {
}

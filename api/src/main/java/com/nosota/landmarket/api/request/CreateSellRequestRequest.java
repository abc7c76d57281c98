package com.nosota.landmarket.api.request;

import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

/**
 * Listing of an owned feature.
 *
 * <p>Either both explicit prices or a percentage of the feature's valuation
 * must be given, never both.
 *
 * @param pricePsc               asking amount in PSC (explicit mode)
 * @param priceIrr               asking amount in IRR (explicit mode)
 * @param minimumPricePercentage asking percentage of the valuation (percentage mode)
 */
public record CreateSellRequestRequest(
        @PositiveOrZero BigDecimal pricePsc,
        @PositiveOrZero BigDecimal priceIrr,
        Integer minimumPricePercentage
) {
}

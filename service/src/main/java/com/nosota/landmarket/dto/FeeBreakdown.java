package com.nosota.landmarket.dto;

import java.math.BigDecimal;

/**
 * Fee split of one nominal price in one currency.
 *
 * <p>{@code buyerCharge == sellerPayment + platformFee} always holds.
 *
 * @param price         Nominal price
 * @param buyerCharge   Debited from (or locked for) the buyer
 * @param sellerPayment Credited to the seller
 * @param platformFee   Credited to the platform
 */
public record FeeBreakdown(
        BigDecimal price,
        BigDecimal buyerCharge,
        BigDecimal sellerPayment,
        BigDecimal platformFee
) {
}

package com.nosota.landmarket.service;

import com.nosota.landmarket.dto.FeeBreakdown;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Marketplace fee rules.
 *
 * <p>Both parties pay a fee on the nominal price: the buyer on top of it, the
 * seller out of it. The platform receives both fees. Every amount is derived
 * from the same two rounded fees, so
 * {@code buyerCharge == sellerPayment + platformFee} holds exactly.
 *
 * <p>Example with default rates (5% + 5%):
 * <pre>
 * price          1000.00
 * buyerCharge    1050.00
 * sellerPayment   950.00
 * platformFee     100.00
 * </pre>
 */
@Component
public class FeeSchedule {

    /**
     * Scale of every monetary amount handled by the marketplace.
     */
    public static final int AMOUNT_SCALE = 8;

    private final BigDecimal buyerFeeRate;
    private final BigDecimal sellerFeeRate;

    public FeeSchedule(@Value("${marketplace.fees.buyer-rate}") BigDecimal buyerFeeRate,
                       @Value("${marketplace.fees.seller-rate}") BigDecimal sellerFeeRate) {
        requireRate("buyer", buyerFeeRate);
        requireRate("seller", sellerFeeRate);
        this.buyerFeeRate = buyerFeeRate;
        this.sellerFeeRate = sellerFeeRate;
    }

    public BigDecimal buyerFee(BigDecimal price) {
        return fee(price, buyerFeeRate);
    }

    public BigDecimal sellerFee(BigDecimal price) {
        return fee(price, sellerFeeRate);
    }

    public BigDecimal buyerCharge(BigDecimal price) {
        return normalize(price).add(buyerFee(price));
    }

    public BigDecimal sellerPayment(BigDecimal price) {
        return normalize(price).subtract(sellerFee(price));
    }

    public BigDecimal platformFee(BigDecimal price) {
        return buyerFee(price).add(sellerFee(price));
    }

    public FeeBreakdown breakdown(BigDecimal price) {
        return new FeeBreakdown(normalize(price), buyerCharge(price), sellerPayment(price), platformFee(price));
    }

    private BigDecimal fee(BigDecimal price, BigDecimal rate) {
        return normalize(price).multiply(rate).setScale(AMOUNT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Brings an amount to {@link #AMOUNT_SCALE}.
     *
     * @throws IllegalArgumentException if the amount is null or negative
     */
    public static BigDecimal normalize(BigDecimal amount) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("Amount must be a non-negative number, got " + amount);
        }
        return amount.setScale(AMOUNT_SCALE, RoundingMode.HALF_UP);
    }

    private static void requireRate(String party, BigDecimal rate) {
        if (rate == null || rate.signum() < 0 || rate.compareTo(BigDecimal.ONE) >= 0) {
            throw new IllegalArgumentException("Invalid " + party + " fee rate: " + rate);
        }
    }
}

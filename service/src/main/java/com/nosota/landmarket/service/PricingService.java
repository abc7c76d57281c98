package com.nosota.landmarket.service;

import com.nosota.landmarket.api.model.Asset;
import com.nosota.landmarket.dto.PricePair;
import com.nosota.landmarket.model.Feature;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Valuation of features and price floors.
 *
 * <p>A feature's valuation in IRR is {@code stabilityValue * rate(color)}.
 * A price pair is worth {@code irr + psc * rate(PSC)}. Percentages compare the two.
 */
@Service
@RequiredArgsConstructor
public class PricingService {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal TWO = BigDecimal.valueOf(2);
    private static final BigDecimal MAX_PERCENTAGE = BigDecimal.valueOf(Integer.MAX_VALUE);

    private final RateSource rateSource;
    private final IdentityLookup identityLookup;

    @Value("${marketplace.pricing.public-floor-percentage}")
    private int publicFloorPercentage;

    @Value("${marketplace.pricing.minor-floor-percentage}")
    private int minorFloorPercentage;

    public BigDecimal valuation(Feature feature) {
        return feature.getStabilityValue().multiply(rateSource.rateOf(feature.getCategory().colorResource()));
    }

    public BigDecimal worth(BigDecimal psc, BigDecimal irr) {
        return irr.add(psc.multiply(rateSource.rateOf(Asset.PSC)));
    }

    /**
     * Percentage of the valuation a price pair represents, truncated to an integer
     * and capped at {@link Integer#MAX_VALUE}.
     * A feature without valuation counts every price as 100%.
     */
    public int percentageOf(Feature feature, BigDecimal psc, BigDecimal irr) {
        BigDecimal valuation = valuation(feature);
        if (valuation.signum() <= 0) {
            return 100;
        }
        BigDecimal percentage = worth(psc, irr)
                .multiply(HUNDRED)
                .divide(valuation, 0, RoundingMode.DOWN);
        return percentage.compareTo(MAX_PERCENTAGE) > 0 ? Integer.MAX_VALUE : percentage.intValue();
    }

    /**
     * Price pair worth {@code percentage} of the valuation, split evenly between PSC and IRR.
     */
    public PricePair pricesForPercentage(Feature feature, int percentage) {
        BigDecimal total = valuation(feature)
                .multiply(BigDecimal.valueOf(percentage))
                .divide(HUNDRED, FeeSchedule.AMOUNT_SCALE, RoundingMode.HALF_UP);
        BigDecimal half = total.divide(TWO, FeeSchedule.AMOUNT_SCALE, RoundingMode.HALF_UP);
        BigDecimal psc = half.divide(rateSource.rateOf(Asset.PSC), FeeSchedule.AMOUNT_SCALE, RoundingMode.HALF_UP);
        return new PricePair(psc, half);
    }

    /**
     * Lowest percentage a user may list at, and the offer floor of features they own.
     */
    public int floorFor(Long userId) {
        return identityLookup.isMinor(userId) ? minorFloorPercentage : publicFloorPercentage;
    }

    public int getPublicFloorPercentage() {
        return publicFloorPercentage;
    }
}

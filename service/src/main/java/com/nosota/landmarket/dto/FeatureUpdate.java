package com.nosota.landmarket.dto;

import com.nosota.landmarket.api.model.MarketStatus;
import lombok.Builder;

import java.math.BigDecimal;

/**
 * Typed change set applied to a feature's market properties.
 *
 * <p>Null fields are left untouched. Listed prices are cleared only when
 * {@code clearListedPrices} is set.
 *
 * @param marketStatus           New market status
 * @param listedPricePsc         New asking PSC
 * @param listedPriceIrr         New asking IRR
 * @param clearListedPrices      Removes the asking prices
 * @param minimumPricePercentage New floor for offers
 * @param label                  New display label
 */
@Builder
public record FeatureUpdate(
        MarketStatus marketStatus,
        BigDecimal listedPricePsc,
        BigDecimal listedPriceIrr,
        boolean clearListedPrices,
        Integer minimumPricePercentage,
        String label
) {

    /**
     * State of a feature right after it changed hands.
     */
    public static FeatureUpdate afterSale(int buyerFloorPercentage, String buyerLabel) {
        return FeatureUpdate.builder()
                .marketStatus(MarketStatus.LISTED_UNPRICED)
                .clearListedPrices(true)
                .minimumPricePercentage(buyerFloorPercentage)
                .label(buyerLabel)
                .build();
    }

    public static FeatureUpdate listed(PricePair ask, int percentage) {
        return FeatureUpdate.builder()
                .marketStatus(MarketStatus.LISTED_PRICED)
                .listedPricePsc(ask.psc())
                .listedPriceIrr(ask.irr())
                .minimumPricePercentage(percentage)
                .build();
    }

    public static FeatureUpdate status(MarketStatus marketStatus) {
        return FeatureUpdate.builder()
                .marketStatus(marketStatus)
                .build();
    }
}

package com.nosota.landmarket.error;

import lombok.Getter;

/**
 * Offered or asked price is below the allowed percentage of the feature's valuation.
 */
@Getter
public class PriceBelowFloorException extends MarketplaceException {

    private final int floorPercentage;
    private final int actualPercentage;

    public PriceBelowFloorException(int floorPercentage, int actualPercentage) {
        super("Price is " + actualPercentage + "% of the valuation, at least " + floorPercentage + "% is required");
        this.floorPercentage = floorPercentage;
        this.actualPercentage = actualPercentage;
    }
}

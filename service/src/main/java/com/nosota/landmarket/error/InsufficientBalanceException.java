package com.nosota.landmarket.error;

import com.nosota.landmarket.api.model.Asset;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * The user's balance of an asset does not cover the required amount.
 */
@Getter
public class InsufficientBalanceException extends MarketplaceException {

    private final Asset asset;
    private final BigDecimal required;

    public InsufficientBalanceException(Asset asset, BigDecimal required) {
        super("Insufficient " + asset.symbol() + " balance, required " + required.toPlainString());
        this.asset = asset;
        this.required = required;
    }

    public InsufficientBalanceException(Asset asset, BigDecimal required, Throwable cause) {
        super("Insufficient " + asset.symbol() + " balance, required " + required.toPlainString(), cause);
        this.asset = asset;
        this.required = required;
    }
}

package com.nosota.landmarket.error;

/**
 * The feature can not be acquired through the requested path in its current state.
 */
public class FeatureNotForSaleException extends MarketplaceException {
    public FeatureNotForSaleException() {
    }

    public FeatureNotForSaleException(String message) {
        super(message);
    }

    public FeatureNotForSaleException(String message, Throwable cause) {
        super(message, cause);
    }

    public FeatureNotForSaleException(Throwable cause) {
        super(cause);
    }

    public FeatureNotForSaleException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}

package com.nosota.landmarket.error;

/**
 * The buyer has used up the individual quota of a rationing campaign.
 */
public class PurchaseQuotaExceededException extends MarketplaceException {
    public PurchaseQuotaExceededException() {
    }

    public PurchaseQuotaExceededException(String message) {
        super(message);
    }

    public PurchaseQuotaExceededException(String message, Throwable cause) {
        super(message, cause);
    }

    public PurchaseQuotaExceededException(Throwable cause) {
        super(cause);
    }

    public PurchaseQuotaExceededException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}

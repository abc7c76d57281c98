package com.nosota.landmarket.error;

/**
 * Reversal of an already applied debit failed. Attached as suppressed exception
 * to the failure that triggered the compensation and recorded as incident.
 */
public class CompensationFailedException extends MarketplaceException {
    public CompensationFailedException() {
    }

    public CompensationFailedException(String message) {
        super(message);
    }

    public CompensationFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    public CompensationFailedException(Throwable cause) {
        super(cause);
    }

    public CompensationFailedException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}

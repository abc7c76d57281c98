package com.nosota.landmarket.error;

/**
 * Base of all business failures raised by marketplace operations.
 */
public abstract class MarketplaceException extends Exception {
    protected MarketplaceException() {
    }

    protected MarketplaceException(String message) {
        super(message);
    }

    protected MarketplaceException(String message, Throwable cause) {
        super(message, cause);
    }

    protected MarketplaceException(Throwable cause) {
        super(cause);
    }

    protected MarketplaceException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}

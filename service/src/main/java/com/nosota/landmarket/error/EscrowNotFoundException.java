package com.nosota.landmarket.error;

/**
 * A pending buy request has no escrow row. Indicates a broken invariant.
 */
public class EscrowNotFoundException extends MarketplaceException {
    public EscrowNotFoundException() {
    }

    public EscrowNotFoundException(String message) {
        super(message);
    }

    public EscrowNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    public EscrowNotFoundException(Throwable cause) {
        super(cause);
    }

    public EscrowNotFoundException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}

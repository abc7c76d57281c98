package com.nosota.landmarket.error;

/**
 * Escrow already exists for the buy request.
 */
public class DuplicateLockException extends MarketplaceException {
    public DuplicateLockException() {
    }

    public DuplicateLockException(String message) {
        super(message);
    }

    public DuplicateLockException(String message, Throwable cause) {
        super(message, cause);
    }

    public DuplicateLockException(Throwable cause) {
        super(cause);
    }

    public DuplicateLockException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}

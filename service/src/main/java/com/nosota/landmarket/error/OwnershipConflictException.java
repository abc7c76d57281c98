package com.nosota.landmarket.error;

/**
 * The feature changed owner between observation and the ownership update.
 * Another settlement won; this one was compensated.
 */
public class OwnershipConflictException extends MarketplaceException {
    public OwnershipConflictException() {
    }

    public OwnershipConflictException(String message) {
        super(message);
    }

    public OwnershipConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    public OwnershipConflictException(Throwable cause) {
        super(cause);
    }

    public OwnershipConflictException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}

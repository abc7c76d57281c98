package com.nosota.landmarket.error;

/**
 * An equivalent active request already exists (pending offer by the same buyer,
 * or an active listing of the feature).
 */
public class DuplicateRequestException extends MarketplaceException {
    public DuplicateRequestException() {
    }

    public DuplicateRequestException(String message) {
        super(message);
    }

    public DuplicateRequestException(String message, Throwable cause) {
        super(message, cause);
    }

    public DuplicateRequestException(Throwable cause) {
        super(cause);
    }

    public DuplicateRequestException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}

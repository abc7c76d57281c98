package com.nosota.landmarket.error;

/**
 * The ledger definitely rejected an operation for a reason other than balance.
 * No money moved.
 */
public class LedgerOperationFailedException extends MarketplaceException {
    public LedgerOperationFailedException() {
    }

    public LedgerOperationFailedException(String message) {
        super(message);
    }

    public LedgerOperationFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    public LedgerOperationFailedException(Throwable cause) {
        super(cause);
    }

    public LedgerOperationFailedException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}

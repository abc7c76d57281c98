package com.nosota.landmarket.error;

/**
 * The outcome of a ledger call is unknown (timeout, unexpected response).
 * The call must not be retried blindly; it was recorded for reconciliation.
 */
public class AmbiguousLedgerFailureException extends MarketplaceException {
    public AmbiguousLedgerFailureException() {
    }

    public AmbiguousLedgerFailureException(String message) {
        super(message);
    }

    public AmbiguousLedgerFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    public AmbiguousLedgerFailureException(Throwable cause) {
        super(cause);
    }

    public AmbiguousLedgerFailureException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}

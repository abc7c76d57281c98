package com.nosota.landmarket.client;

/**
 * Failure of a call to the external ledger.
 */
public class LedgerClientException extends Exception {
    public LedgerClientException() {
    }

    public LedgerClientException(String message) {
        super(message);
    }

    public LedgerClientException(String message, Throwable cause) {
        super(message, cause);
    }

    public LedgerClientException(Throwable cause) {
        super(cause);
    }

    public LedgerClientException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}

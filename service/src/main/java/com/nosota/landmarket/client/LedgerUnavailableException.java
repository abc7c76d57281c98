package com.nosota.landmarket.client;

/**
 * The ledger could not be reached or refused service before processing the call.
 * Nothing was applied and the call may be retried.
 */
public class LedgerUnavailableException extends LedgerClientException {
    public LedgerUnavailableException(String message) {
        super(message);
    }

    public LedgerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

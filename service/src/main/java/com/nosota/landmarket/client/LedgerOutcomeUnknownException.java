package com.nosota.landmarket.client;

/**
 * The call reached the ledger but its outcome was not observed (timeout,
 * dropped connection, unexpected server error).
 */
public class LedgerOutcomeUnknownException extends LedgerClientException {
    public LedgerOutcomeUnknownException(String message) {
        super(message);
    }

    public LedgerOutcomeUnknownException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.nosota.landmarket.client;

import lombok.Getter;

/**
 * The ledger processed the call and refused it. Nothing was applied.
 */
@Getter
public class LedgerRejectedException extends LedgerClientException {

    private final LedgerRejectReason reason;

    public LedgerRejectedException(LedgerRejectReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public LedgerRejectedException(LedgerRejectReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}

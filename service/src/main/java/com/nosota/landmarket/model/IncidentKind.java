package com.nosota.landmarket.model;

/**
 * Reason a {@link ReconciliationIncident} was opened.
 */
public enum IncidentKind {
    /**
     * Reversal of an applied debit failed after the operation was aborted.
     */
    COMPENSATION_FAILED,

    /**
     * Payout to seller, platform or owner failed after the transfer committed.
     */
    PAYOUT_FAILED,

    /**
     * Escrow refund to a buyer failed.
     */
    REFUND_FAILED,

    /**
     * Ledger outcome unknown (timeout or unexpected response).
     */
    AMBIGUOUS_LEDGER_OUTCOME
}

package com.nosota.landmarket.client;

public enum LedgerRejectReason {
    /**
     * Balance does not cover the debit.
     */
    INSUFFICIENT_FUNDS,

    /**
     * Any other business rejection (unknown user, frozen account, invalid amount).
     */
    REJECTED
}

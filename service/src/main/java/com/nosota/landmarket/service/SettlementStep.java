package com.nosota.landmarket.service;

/**
 * Progress markers of a settlement, logged as the orchestration advances.
 */
public enum SettlementStep {
    REQUESTED,
    FUNDS_LOCKED,
    PRICE_VERIFIED,
    FUNDS_SETTLED,
    OWNERSHIP_TRANSFERRED,
    PROFIT_REASSIGNED,
    REQUESTS_RECONCILED,
    DONE
}

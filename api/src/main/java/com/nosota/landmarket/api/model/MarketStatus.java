package com.nosota.landmarket.api.model;

/**
 * Market state of a land feature.
 */
public enum MarketStatus {
    /**
     * UNLISTED: feature is owned and not offered. Buy requests are still accepted.
     */
    UNLISTED,

    /**
     * LISTED_UNPRICED: feature is open to offers but has no asking price.
     * Default state after every settlement.
     */
    LISTED_UNPRICED,

    /**
     * LISTED_PRICED: owner published an asking price through a sell request.
     * Only in this state can the feature be bought immediately.
     */
    LISTED_PRICED,

    /**
     * SOLD_PENDING: a transfer is being settled.
     */
    SOLD_PENDING,

    /**
     * TRADING_LIMITED: feature belongs to a rationed campaign and is bought
     * under the campaign's quota rules.
     */
    TRADING_LIMITED,

    /**
     * NOT_FOR_SALE: feature is withdrawn from the market.
     */
    NOT_FOR_SALE
}

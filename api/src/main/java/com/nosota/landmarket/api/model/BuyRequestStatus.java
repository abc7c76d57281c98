package com.nosota.landmarket.api.model;

/**
 * Lifecycle of a buy request (an offer on a feature).
 *
 * <p>Only {@link #PENDING} requests hold escrowed funds. Every other state is final.
 */
public enum BuyRequestStatus {
    /**
     * PENDING: buyer's funds are locked in escrow, seller has not answered yet.
     */
    PENDING,

    /**
     * ACCEPTED: seller accepted, the feature was transferred to the buyer.
     */
    ACCEPTED,

    /**
     * REJECTED: seller rejected the offer, escrow was refunded to the buyer.
     */
    REJECTED,

    /**
     * CANCELLED: withdrawn by the buyer or superseded by another settlement.
     * Escrow was refunded to the buyer.
     */
    CANCELLED
}

package com.nosota.landmarket.api.model;

/**
 * Lifecycle of a sell request (an owner's public listing).
 */
public enum SellRequestStatus {
    /**
     * PENDING: listing is active.
     */
    PENDING,

    /**
     * COMPLETED: the feature changed owner while the listing was active.
     */
    COMPLETED
}

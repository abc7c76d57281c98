package com.nosota.landmarket.service;

/**
 * Read-only facts about users owned by the identity service.
 */
public interface IdentityLookup {

    boolean isMinor(Long userId);

    String displayName(Long userId);

    /**
     * Days a new owner waits before withdrawing a feature's passive income.
     */
    int withdrawProfitDays(Long userId);
}

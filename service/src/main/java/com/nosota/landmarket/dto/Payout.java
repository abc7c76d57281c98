package com.nosota.landmarket.dto;

import com.nosota.landmarket.api.model.Asset;

import java.math.BigDecimal;

/**
 * Credit owed to a party once the feature has changed owner.
 *
 * @param userId Receiver
 * @param asset  Credited asset
 * @param amount Credited amount, zero payouts are skipped
 * @param role   Short receiver role used in idempotency keys (seller, platform)
 */
public record Payout(Long userId, Asset asset, BigDecimal amount, String role) {
}

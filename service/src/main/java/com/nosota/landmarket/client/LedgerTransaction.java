package com.nosota.landmarket.client;

import com.nosota.landmarket.api.model.Asset;
import lombok.Builder;

import java.math.BigDecimal;

/**
 * History entry shown to a user for a money movement.
 *
 * @param userId            Owner of the entry
 * @param asset             Moved asset
 * @param amount            Moved amount
 * @param direction         Withdraw or deposit, from the user's point of view
 * @param relatedEntityType Kind of business object (buy_request, trade, feature)
 * @param relatedEntityId   ID of the business object
 * @param idempotencyKey    Key of the movement being described
 */
@Builder
public record LedgerTransaction(
        Long userId,
        Asset asset,
        BigDecimal amount,
        TransactionDirection direction,
        String relatedEntityType,
        String relatedEntityId,
        String idempotencyKey
) {
}

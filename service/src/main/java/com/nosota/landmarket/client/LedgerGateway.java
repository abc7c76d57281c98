package com.nosota.landmarket.client;

import com.nosota.landmarket.api.model.Asset;

import java.math.BigDecimal;

/**
 * Port to the external ledger that holds users' balances.
 *
 * <p>Every mutating call carries an idempotency key. Replaying a call with the
 * same key must not move money twice, so callers may safely repeat a call whose
 * outcome they did not observe.
 *
 * <p>Failures are split into two families:
 * <ul>
 *   <li>{@link LedgerRejectedException} and {@link LedgerUnavailableException}:
 *       the ledger definitely did not apply the call</li>
 *   <li>{@link LedgerOutcomeUnknownException}: the call may or may not have been applied</li>
 * </ul>
 */
public interface LedgerGateway {

    /**
     * @return true if the user's balance of {@code asset} is at least {@code amount}
     */
    boolean checkBalance(Long userId, Asset asset, BigDecimal amount) throws LedgerClientException;

    void debit(Long userId, Asset asset, BigDecimal amount, String idempotencyKey) throws LedgerClientException;

    void credit(Long userId, Asset asset, BigDecimal amount, String idempotencyKey) throws LedgerClientException;

    /**
     * Writes a user-visible history entry. Does not move money.
     */
    void recordTransaction(LedgerTransaction transaction) throws LedgerClientException;
}

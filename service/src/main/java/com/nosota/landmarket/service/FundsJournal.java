package com.nosota.landmarket.service;

import com.nosota.landmarket.api.model.Asset;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.UUID;

/**
 * Debits applied during one marketplace operation, in order.
 *
 * <p>If the operation fails before its outcome is committed, the journal is
 * replayed backwards by {@link SettlementLedger#compensate(FundsJournal, Exception)}.
 * The journal also derives the idempotency keys of the operation's ledger calls.
 */
public class FundsJournal {

    private final String reference;
    private final Deque<AppliedDebit> debits = new ArrayDeque<>();

    private FundsJournal(String reference) {
        this.reference = reference;
    }

    /**
     * Starts a journal for a new operation with a random reference.
     *
     * @param operation Operation name, first segment of every key
     */
    public static FundsJournal start(String operation) {
        return new FundsJournal(operation + ":" + UUID.randomUUID());
    }

    public String reference() {
        return reference;
    }

    public String key(String step, Asset asset) {
        return reference + ":" + step + ":" + asset.symbol();
    }

    void recordDebit(Long userId, Asset asset, BigDecimal amount, String idempotencyKey) {
        debits.push(new AppliedDebit(userId, asset, amount, idempotencyKey));
    }

    /**
     * Removes and returns the most recent applied debit, null when none is left.
     */
    AppliedDebit pollNewest() {
        return debits.poll();
    }

    record AppliedDebit(Long userId, Asset asset, BigDecimal amount, String idempotencyKey) {
    }
}

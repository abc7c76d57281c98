package com.nosota.landmarket.service;

import com.nosota.landmarket.api.model.Asset;
import com.nosota.landmarket.client.*;
import com.nosota.landmarket.error.AmbiguousLedgerFailureException;
import com.nosota.landmarket.error.CompensationFailedException;
import com.nosota.landmarket.error.InsufficientBalanceException;
import com.nosota.landmarket.error.LedgerOperationFailedException;
import com.nosota.landmarket.model.IncidentKind;
import com.nosota.landmarket.service.FundsJournal.AppliedDebit;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Marketplace view of the external ledger.
 *
 * <p>Translates ledger failures into marketplace errors and applies the
 * money-movement policy:
 * <ul>
 *   <li>debits are never retried; applied ones are journaled for compensation</li>
 *   <li>credits are retried only while the ledger definitely did not apply them</li>
 *   <li>credits that still fail, and every ambiguous outcome, become reconciliation incidents</li>
 *   <li>history records are best-effort</li>
 * </ul>
 * Zero amounts are skipped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettlementLedger {

    private final LedgerGateway ledgerGateway;
    private final Retry payoutRetry;
    private final ReconciliationIncidentService incidentService;

    /**
     * @throws InsufficientBalanceException if the user's balance does not cover {@code amount}
     */
    public void requireBalance(Long userId, Asset asset, BigDecimal amount)
            throws InsufficientBalanceException, LedgerOperationFailedException {
        if (amount.signum() <= 0) {
            return;
        }
        boolean sufficient;
        try {
            sufficient = ledgerGateway.checkBalance(userId, asset, amount);
        } catch (LedgerClientException e) {
            throw new LedgerOperationFailedException("Balance check failed for user " + userId, e);
        }
        if (!sufficient) {
            throw new InsufficientBalanceException(asset, amount);
        }
    }

    /**
     * Debits the user and journals the debit for compensation.
     */
    public void debit(FundsJournal journal, Long userId, Asset asset, BigDecimal amount, String step)
            throws InsufficientBalanceException, LedgerOperationFailedException, AmbiguousLedgerFailureException {
        if (amount.signum() <= 0) {
            return;
        }
        String key = journal.key(step, asset);
        try {
            ledgerGateway.debit(userId, asset, amount, key);
        } catch (LedgerRejectedException e) {
            if (e.getReason() == LedgerRejectReason.INSUFFICIENT_FUNDS) {
                throw new InsufficientBalanceException(asset, amount, e);
            }
            throw new LedgerOperationFailedException("Ledger rejected debit " + key, e);
        } catch (LedgerOutcomeUnknownException e) {
            incidentService.record(IncidentKind.AMBIGUOUS_LEDGER_OUTCOME, userId, asset, amount, key,
                    null, journal.reference(), "Debit outcome unknown: " + e.getMessage());
            throw new AmbiguousLedgerFailureException("Outcome of debit " + key + " is unknown", e);
        } catch (LedgerClientException e) {
            throw new LedgerOperationFailedException("Ledger did not apply debit " + key, e);
        }
        journal.recordDebit(userId, asset, amount, key);
        log.debug("Debited {} {} from user {} [{}]", amount, asset, userId, key);
    }

    /**
     * Credits back every journaled debit, newest first.
     *
     * <p>A reversal that fails is attached to {@code cause} as a suppressed
     * {@link CompensationFailedException} and recorded as incident; the
     * remaining reversals are still attempted.
     */
    public void compensate(FundsJournal journal, Exception cause) {
        AppliedDebit debit;
        while ((debit = journal.pollNewest()) != null) {
            String key = debit.idempotencyKey() + ":reverse";
            try {
                creditWithRetry(debit.userId(), debit.asset(), debit.amount(), key);
                log.info("Reversed debit {} of {} {} for user {}", debit.idempotencyKey(),
                        debit.amount(), debit.asset(), debit.userId());
            } catch (LedgerClientException | RuntimeException e) {
                cause.addSuppressed(new CompensationFailedException("Could not reverse debit " + debit.idempotencyKey(), e));
                incidentService.record(IncidentKind.COMPENSATION_FAILED, debit.userId(), debit.asset(),
                        debit.amount(), key, null, journal.reference(), e.getMessage());
            }
        }
    }

    /**
     * Credits a party after a committed transfer. Never throws: a failed payout
     * is recorded as incident and the settlement stays committed.
     *
     * @return true if the credit was applied
     */
    public boolean payout(Long userId, Asset asset, BigDecimal amount, String key,
                          String relatedEntityType, String relatedEntityId) {
        if (amount.signum() <= 0) {
            return true;
        }
        try {
            creditWithRetry(userId, asset, amount, key);
            record(LedgerTransaction.builder()
                    .userId(userId)
                    .asset(asset)
                    .amount(amount)
                    .direction(TransactionDirection.DEPOSIT)
                    .relatedEntityType(relatedEntityType)
                    .relatedEntityId(relatedEntityId)
                    .idempotencyKey(key)
                    .build());
            return true;
        } catch (LedgerOutcomeUnknownException e) {
            incidentService.record(IncidentKind.AMBIGUOUS_LEDGER_OUTCOME, userId, asset, amount, key,
                    relatedEntityType, relatedEntityId, "Payout outcome unknown: " + e.getMessage());
        } catch (LedgerClientException | RuntimeException e) {
            incidentService.record(IncidentKind.PAYOUT_FAILED, userId, asset, amount, key,
                    relatedEntityType, relatedEntityId, e.getMessage());
        }
        return false;
    }

    /**
     * Returns escrowed funds to a buyer. Keys are stable per request, so a
     * failed refund can be replayed without paying twice.
     */
    public void refund(Long userId, Asset asset, BigDecimal amount, String key,
                       String relatedEntityType, String relatedEntityId)
            throws LedgerOperationFailedException, AmbiguousLedgerFailureException {
        if (amount.signum() <= 0) {
            return;
        }
        try {
            creditWithRetry(userId, asset, amount, key);
        } catch (LedgerOutcomeUnknownException e) {
            incidentService.record(IncidentKind.AMBIGUOUS_LEDGER_OUTCOME, userId, asset, amount, key,
                    relatedEntityType, relatedEntityId, "Refund outcome unknown: " + e.getMessage());
            throw new AmbiguousLedgerFailureException("Outcome of refund " + key + " is unknown", e);
        } catch (LedgerClientException e) {
            incidentService.record(IncidentKind.REFUND_FAILED, userId, asset, amount, key,
                    relatedEntityType, relatedEntityId, e.getMessage());
            throw new LedgerOperationFailedException("Ledger did not apply refund " + key, e);
        }
        record(LedgerTransaction.builder()
                .userId(userId)
                .asset(asset)
                .amount(amount)
                .direction(TransactionDirection.DEPOSIT)
                .relatedEntityType(relatedEntityType)
                .relatedEntityId(relatedEntityId)
                .idempotencyKey(key)
                .build());
    }

    /**
     * Writes a history entry, logging instead of failing.
     */
    public void record(LedgerTransaction transaction) {
        try {
            ledgerGateway.recordTransaction(transaction);
        } catch (LedgerClientException | RuntimeException e) {
            // History is informational. Don't fail the operation
            log.warn("Failed to record ledger transaction {} for user {}: {}",
                    transaction.idempotencyKey(), transaction.userId(), e.getMessage());
        }
    }

    private void creditWithRetry(Long userId, Asset asset, BigDecimal amount, String key) throws LedgerClientException {
        try {
            payoutRetry.executeCheckedSupplier(() -> {
                ledgerGateway.credit(userId, asset, amount, key);
                return null;
            });
        } catch (LedgerClientException | RuntimeException | Error e) {
            throw e;
        } catch (Throwable t) {
            throw new LedgerOutcomeUnknownException("Unexpected failure of credit " + key, t);
        }
        log.debug("Credited {} {} to user {} [{}]", amount, asset, userId, key);
    }
}

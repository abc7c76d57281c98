package com.nosota.landmarket.service;

import com.nosota.landmarket.api.model.Asset;
import com.nosota.landmarket.api.model.BuyRequestStatus;
import com.nosota.landmarket.error.AmbiguousLedgerFailureException;
import com.nosota.landmarket.error.LedgerOperationFailedException;
import com.nosota.landmarket.error.RequestNotPendingException;
import com.nosota.landmarket.model.BuyRequest;
import com.nosota.landmarket.model.LockedAsset;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Returns escrowed funds of buy requests that end without a sale.
 *
 * <p>A request is claimed (moved out of PENDING) before any credit, so it is
 * refunded at most once even if reject, cancel and a competing settlement race.
 * If the ledger definitely applied nothing, the claim is reverted and the request
 * stays pending. After a partial or ambiguous refund the request keeps its final
 * status and its escrow row until reconciled; replaying the refund uses the same
 * idempotency keys.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BuyRequestRefundService {

    static final String RELATED_TYPE = "buy_request";

    private final BuyRequestStore buyRequestStore;
    private final EscrowStore escrowStore;
    private final SettlementLedger settlementLedger;

    /**
     * Claims a pending request into {@code terminal} and refunds its escrow.
     *
     * @throws RequestNotPendingException if the request is no longer pending
     */
    public void refundAndClose(BuyRequest request, BuyRequestStatus terminal)
            throws RequestNotPendingException, LedgerOperationFailedException, AmbiguousLedgerFailureException {
        if (!buyRequestStore.transition(request.getId(), BuyRequestStatus.PENDING, terminal)) {
            throw new RequestNotPendingException("Buy request " + request.getId() + " is no longer pending");
        }
        refundClaimed(request, terminal);
    }

    /**
     * Refunds a request already claimed into {@code claimedStatus}.
     */
    public void refundClaimed(BuyRequest request, BuyRequestStatus claimedStatus)
            throws LedgerOperationFailedException, AmbiguousLedgerFailureException {
        Optional<LockedAsset> lock = escrowStore.find(request.getId());
        if (lock.isEmpty()) {
            log.error("Buy request {} was pending without escrow, closing without refund", request.getId());
            buyRequestStore.close(request.getId());
            return;
        }

        String keyPrefix = "buy-request:" + request.getId() + ":refund:";
        String relatedId = request.getId().toString();
        boolean pscRefunded = false;
        try {
            settlementLedger.refund(request.getBuyerId(), Asset.PSC, lock.get().getLockedPsc(),
                    keyPrefix + Asset.PSC.symbol(), RELATED_TYPE, relatedId);
            pscRefunded = lock.get().getLockedPsc().signum() > 0;
            settlementLedger.refund(request.getBuyerId(), Asset.IRR, lock.get().getLockedIrr(),
                    keyPrefix + Asset.IRR.symbol(), RELATED_TYPE, relatedId);
        } catch (LedgerOperationFailedException e) {
            if (!pscRefunded) {
                buyRequestStore.transition(request.getId(), claimedStatus, BuyRequestStatus.PENDING);
                log.warn("Refund of buy request {} was not applied, request stays pending: {}",
                        request.getId(), e.getMessage());
            } else {
                log.error("Buy request {} partially refunded, escrow kept for reconciliation", request.getId());
            }
            throw e;
        } catch (AmbiguousLedgerFailureException e) {
            log.error("Refund of buy request {} has unknown outcome, escrow kept for reconciliation", request.getId());
            throw e;
        }

        buyRequestStore.close(request.getId());
        log.info("Buy request {} {} and refunded to buyer {}", request.getId(), claimedStatus, request.getBuyerId());
    }

    /**
     * Refunds and cancels every pending request on a feature that just changed owner.
     *
     * @return Number of requests cancelled
     */
    public int cancelPendingRequests(Long featureId) {
        List<BuyRequest> pending = buyRequestStore.pendingForFeature(featureId);
        int cancelled = 0;
        for (BuyRequest request : pending) {
            try {
                refundAndClose(request, BuyRequestStatus.CANCELLED);
                cancelled++;
            } catch (RequestNotPendingException e) {
                log.debug("Buy request {} was closed concurrently", request.getId());
            } catch (LedgerOperationFailedException | AmbiguousLedgerFailureException e) {
                // Recorded as incident. Don't fail the settlement
                log.error("Could not cancel buy request {} of feature {}: {}", request.getId(), featureId, e.getMessage());
            }
        }
        return cancelled;
    }
}

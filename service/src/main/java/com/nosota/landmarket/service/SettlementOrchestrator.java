package com.nosota.landmarket.service;

import com.nosota.landmarket.dto.FeatureUpdate;
import com.nosota.landmarket.dto.Payout;
import com.nosota.landmarket.dto.SettlementPlan;
import com.nosota.landmarket.error.FeatureNotFoundException;
import com.nosota.landmarket.error.OwnershipConflictException;
import com.nosota.landmarket.model.Feature;
import com.nosota.landmarket.model.Trade;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Steps shared by every acquisition path once the buyer's funds are captured.
 *
 * <p>Settlement workflow:
 * <pre>
 * FUNDS_SETTLED          buyer debited, or funds held in escrow (done by the caller)
 * OWNERSHIP_TRANSFERRED  conditional owner update; a loser gets OwnershipConflictException
 * payouts                seller / platform / owner credits, retried, never rolled back
 * records                Trade and Commission
 * PROFIT_REASSIGNED      accrued income flushed to the seller
 * REQUESTS_RECONCILED    other pending offers refunded and cancelled, listings completed
 * DONE
 * </pre>
 *
 * <p>Nothing leaves the platform before the ownership update commits, so a losing
 * concurrent settlement only has to give the buyer their money back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettlementOrchestrator {

    private final CatalogService catalogService;
    private final PricingService pricingService;
    private final IdentityLookup identityLookup;
    private final SettlementLedger settlementLedger;
    private final TradeLedgerService tradeLedgerService;
    private final ProfitContinuityService profitContinuityService;
    private final BuyRequestStore buyRequestStore;
    private final BuyRequestRefundService buyRequestRefundService;
    private final SellRequestService sellRequestService;

    /**
     * Moves the feature to the buyer and resets its market properties for the new owner.
     *
     * @throws OwnershipConflictException if the seller no longer owns the feature
     */
    public Feature transferOwnership(SettlementPlan plan) throws OwnershipConflictException, FeatureNotFoundException {
        logStep(plan, SettlementStep.FUNDS_SETTLED);

        FeatureUpdate update = FeatureUpdate.afterSale(
                pricingService.floorFor(plan.buyerId()),
                identityLookup.displayName(plan.buyerId()));
        Feature feature = catalogService.transferOwnership(plan.featureId(), plan.sellerId(), plan.buyerId(), update);

        logStep(plan, SettlementStep.OWNERSHIP_TRANSFERRED);
        return feature;
    }

    /**
     * Completes a settlement whose ownership update has committed.
     *
     * @param plan    The settlement
     * @param feature Feature as returned by {@link #transferOwnership}
     * @return Recorded trade
     */
    public Trade finish(SettlementPlan plan, Feature feature) {
        String relatedId = String.valueOf(plan.featureId());
        for (Payout payout : plan.payouts()) {
            String key = plan.reference() + ":payout:" + payout.role() + ":" + payout.asset().symbol();
            if (!settlementLedger.payout(payout.userId(), payout.asset(), payout.amount(), key, "feature", relatedId)) {
                log.error("[{}] Payout to {} {} failed, settlement stays committed", plan.reference(),
                        payout.role(), payout.userId());
            }
        }

        if (plan.acceptedRequestId() != null) {
            buyRequestStore.close(plan.acceptedRequestId());
        }

        Trade trade;
        try {
            trade = tradeLedgerService.recordTrade(plan.featureId(), plan.buyerId(), plan.sellerId(),
                    plan.settledPsc(), plan.settledIrr());
            if (plan.hasCommission()) {
                tradeLedgerService.recordCommission(trade.getId(), plan.feePsc(), plan.feeIrr());
            }
        } catch (RuntimeException e) {
            log.error("[{}] Failed to record trade of feature {} after transfer to {}",
                    plan.reference(), plan.featureId(), plan.buyerId(), e);
            throw e;
        }

        try {
            profitContinuityService.flushAndReassign(plan.featureId(), plan.sellerId(), plan.buyerId(),
                    feature.getCategory().colorResource(), plan.reference());
            logStep(plan, SettlementStep.PROFIT_REASSIGNED);
        } catch (RuntimeException e) {
            // Accrued income is recoverable from the profit record. Don't fail the settlement
            log.error("[{}] Failed to reassign profit of feature {}", plan.reference(), plan.featureId(), e);
        }

        int cancelled = buyRequestRefundService.cancelPendingRequests(plan.featureId());
        int completed = sellRequestService.completeListings(plan.featureId());
        log.info("[{}] Cancelled {} competing offers and completed {} listings of feature {}",
                plan.reference(), cancelled, completed, plan.featureId());
        logStep(plan, SettlementStep.REQUESTS_RECONCILED);

        logStep(plan, SettlementStep.DONE);
        return trade;
    }

    private void logStep(SettlementPlan plan, SettlementStep step) {
        log.info("[{}] {} {}: feature={}, seller={}, buyer={}",
                plan.reference(), plan.path(), step, plan.featureId(), plan.sellerId(), plan.buyerId());
    }
}

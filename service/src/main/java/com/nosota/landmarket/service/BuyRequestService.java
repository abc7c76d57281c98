package com.nosota.landmarket.service;

import com.nosota.landmarket.api.model.Asset;
import com.nosota.landmarket.api.model.BuyRequestStatus;
import com.nosota.landmarket.api.model.MarketStatus;
import com.nosota.landmarket.client.LedgerTransaction;
import com.nosota.landmarket.client.TransactionDirection;
import com.nosota.landmarket.dto.FeeBreakdown;
import com.nosota.landmarket.dto.Payout;
import com.nosota.landmarket.dto.PricePair;
import com.nosota.landmarket.dto.SettlementPlan;
import com.nosota.landmarket.error.*;
import com.nosota.landmarket.model.BuyRequest;
import com.nosota.landmarket.model.Feature;
import com.nosota.landmarket.model.LockedAsset;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Negotiated purchase of peer-owned features.
 *
 * <p>Buy request lifecycle:
 * <pre>
 * send    -> buyer debited (price + buyer fee), funds held in escrow, PENDING
 * accept  -> feature transferred, escrow paid out to seller and platform, ACCEPTED
 * reject  -> escrow refunded, REJECTED
 * delete  -> escrow refunded, CANCELLED
 * another settlement of the feature -> escrow refunded, CANCELLED
 * </pre>
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class BuyRequestService {

    private static final String OPERATION = "buy-request";
    private static final int MIN_GRACE_DAYS = 1;
    private static final int MAX_GRACE_DAYS = 30;

    private final CatalogService catalogService;
    private final PricingService pricingService;
    private final FeeSchedule feeSchedule;
    private final SettlementLedger settlementLedger;
    private final BuyRequestStore buyRequestStore;
    private final EscrowStore escrowStore;
    private final BuyRequestRefundService buyRequestRefundService;
    private final UnderpricedCooldownChecker cooldownChecker;
    private final SettlementOrchestrator settlementOrchestrator;
    private final Clock clock;

    @Value("${marketplace.platform-user-id}")
    private Long platformUserId;

    /**
     * Makes an offer on a feature and locks the buyer's funds.
     *
     * @param buyerId   Buyer
     * @param featureId Feature the offer is for
     * @param pricePsc  Offered PSC
     * @param priceIrr  Offered IRR
     * @param note      Optional message to the owner
     * @return Pending buy request
     */
    public BuyRequest sendBuyRequest(@NotNull Long buyerId, @NotNull Long featureId,
                                     @NotNull BigDecimal pricePsc, @NotNull BigDecimal priceIrr, String note)
            throws MarketplaceException {
        BigDecimal psc = FeeSchedule.normalize(pricePsc);
        BigDecimal irr = FeeSchedule.normalize(priceIrr);
        if (psc.signum() == 0 && irr.signum() == 0) {
            throw new IllegalArgumentException("Offer can not be zero in both currencies");
        }

        Feature feature = catalogService.getFeature(featureId);
        if (feature.getOwnerId().equals(buyerId)) {
            throw new FeatureNotForSaleException("User " + buyerId + " already owns feature " + featureId);
        }
        if (feature.getMarketStatus() == MarketStatus.NOT_FOR_SALE
                || feature.getMarketStatus() == MarketStatus.TRADING_LIMITED
                || feature.getOwnerId().equals(platformUserId)) {
            throw new FeatureNotForSaleException("Feature " + featureId + " does not accept offers");
        }
        if (buyRequestStore.hasPending(buyerId, featureId)) {
            throw new DuplicateRequestException("User " + buyerId + " already has a pending offer on feature " + featureId);
        }

        int offered = pricingService.percentageOf(feature, psc, irr);
        if (offered < feature.getMinimumPricePercentage()) {
            throw new PriceBelowFloorException(feature.getMinimumPricePercentage(), offered);
        }
        log.info("Offer on feature {} by {} verified at {}%", featureId, buyerId, offered);

        PricePair locked = new PricePair(feeSchedule.buyerCharge(psc), feeSchedule.buyerCharge(irr));
        settlementLedger.requireBalance(buyerId, Asset.PSC, locked.psc());
        settlementLedger.requireBalance(buyerId, Asset.IRR, locked.irr());

        FundsJournal journal = FundsJournal.start(OPERATION);
        BuyRequest request;
        try {
            settlementLedger.debit(journal, buyerId, Asset.PSC, locked.psc(), "lock");
            settlementLedger.debit(journal, buyerId, Asset.IRR, locked.irr(), "lock");

            BuyRequest draft = new BuyRequest();
            draft.setBuyerId(buyerId);
            draft.setSellerId(feature.getOwnerId());
            draft.setFeatureId(featureId);
            draft.setPricePsc(psc);
            draft.setPriceIrr(irr);
            draft.setNote(note);
            request = buyRequestStore.openPending(draft, locked);
        } catch (MarketplaceException | RuntimeException e) {
            settlementLedger.compensate(journal, e);
            throw e;
        }

        recordLock(request, journal, Asset.PSC, locked.psc());
        recordLock(request, journal, Asset.IRR, locked.irr());
        log.info("[{}] {} buy request {}: psc={}, irr={}", journal.reference(), SettlementStep.FUNDS_LOCKED,
                request.getId(), locked.psc(), locked.irr());
        return request;
    }

    /**
     * Accepts an offer: the feature goes to the buyer and the escrow is paid out.
     *
     * @param sellerId  Caller, must be the request's seller
     * @param requestId Offer to accept
     * @return Accepted request
     */
    public BuyRequest acceptBuyRequest(@NotNull Long sellerId, @NotNull UUID requestId) throws MarketplaceException {
        BuyRequest request = buyRequestStore.get(requestId);
        if (!request.getSellerId().equals(sellerId)) {
            throw new UnauthorizedActionException("Only the seller can accept buy request " + requestId);
        }
        if (request.getStatus() != BuyRequestStatus.PENDING) {
            throw new RequestNotPendingException("Buy request " + requestId + " is " + request.getStatus());
        }
        cooldownChecker.ensureNotRestricted(sellerId);
        LockedAsset locked = escrowStore.get(requestId);

        if (!buyRequestStore.transition(requestId, BuyRequestStatus.PENDING, BuyRequestStatus.ACCEPTED)) {
            throw new RequestNotPendingException("Buy request " + requestId + " was closed concurrently");
        }

        FeeBreakdown psc = feeSchedule.breakdown(request.getPricePsc());
        FeeBreakdown irr = feeSchedule.breakdown(request.getPriceIrr());
        if (psc.buyerCharge().compareTo(locked.getLockedPsc()) != 0
                || irr.buyerCharge().compareTo(locked.getLockedIrr()) != 0) {
            log.warn("Escrow of buy request {} (psc={}, irr={}) differs from current buyer charge (psc={}, irr={})",
                    requestId, locked.getLockedPsc(), locked.getLockedIrr(), psc.buyerCharge(), irr.buyerCharge());
        }

        BigDecimal platformPsc = locked.getLockedPsc().subtract(psc.sellerPayment());
        BigDecimal platformIrr = locked.getLockedIrr().subtract(irr.sellerPayment());
        SettlementPlan plan = SettlementPlan.builder()
                .featureId(request.getFeatureId())
                .sellerId(sellerId)
                .buyerId(request.getBuyerId())
                .path(AcquisitionPath.PEER_NEGOTIATED)
                .reference(OPERATION + ":" + requestId)
                .acceptedRequestId(requestId)
                .payouts(List.of(
                        new Payout(sellerId, Asset.PSC, psc.sellerPayment(), "seller"),
                        new Payout(sellerId, Asset.IRR, irr.sellerPayment(), "seller"),
                        new Payout(platformUserId, Asset.PSC, platformPsc, "platform"),
                        new Payout(platformUserId, Asset.IRR, platformIrr, "platform")))
                .settledPsc(psc.price())
                .settledIrr(irr.price())
                .feePsc(platformPsc)
                .feeIrr(platformIrr)
                .build();

        Feature transferred;
        try {
            transferred = settlementOrchestrator.transferOwnership(plan);
        } catch (MarketplaceException | RuntimeException e) {
            abandonAccepted(request, e);
            throw e;
        }

        settlementOrchestrator.finish(plan, transferred);
        return buyRequestStore.get(requestId);
    }

    /**
     * Rejects an offer and refunds the buyer.
     */
    public void rejectBuyRequest(@NotNull Long sellerId, @NotNull UUID requestId) throws MarketplaceException {
        BuyRequest request = buyRequestStore.get(requestId);
        if (!request.getSellerId().equals(sellerId)) {
            throw new UnauthorizedActionException("Only the seller can reject buy request " + requestId);
        }
        if (request.getStatus() != BuyRequestStatus.PENDING) {
            throw new RequestNotPendingException("Buy request " + requestId + " is " + request.getStatus());
        }
        buyRequestRefundService.refundAndClose(request, BuyRequestStatus.REJECTED);
    }

    /**
     * Withdraws an offer and refunds the buyer.
     */
    public void deleteBuyRequest(@NotNull Long buyerId, @NotNull UUID requestId) throws MarketplaceException {
        BuyRequest request = buyRequestStore.get(requestId);
        if (!request.getBuyerId().equals(buyerId)) {
            throw new UnauthorizedActionException("Only the buyer can delete buy request " + requestId);
        }
        if (request.getStatus() != BuyRequestStatus.PENDING) {
            throw new RequestNotPendingException("Buy request " + requestId + " is " + request.getStatus());
        }
        buyRequestRefundService.refundAndClose(request, BuyRequestStatus.CANCELLED);
    }

    /**
     * Sets how many days from now the seller keeps the offer under consideration.
     */
    public BuyRequest updateGracePeriod(@NotNull Long sellerId, @NotNull UUID requestId, int days)
            throws MarketplaceException {
        if (days < MIN_GRACE_DAYS || days > MAX_GRACE_DAYS) {
            throw new IllegalArgumentException("Grace period must be between " + MIN_GRACE_DAYS
                    + " and " + MAX_GRACE_DAYS + " days");
        }
        BuyRequest request = buyRequestStore.get(requestId);
        if (!request.getSellerId().equals(sellerId)) {
            throw new UnauthorizedActionException("Only the seller can set the grace period of " + requestId);
        }
        return buyRequestStore.updateGracePeriod(requestId, LocalDateTime.now(clock).plusDays(days));
    }

    public List<BuyRequest> listBuyRequests(@NotNull Long buyerId) {
        return buyRequestStore.pendingSentBy(buyerId);
    }

    public List<BuyRequest> listReceivedBuyRequests(@NotNull Long sellerId) {
        return buyRequestStore.pendingReceivedBy(sellerId);
    }

    /**
     * Gives the buyer their escrow back after the ownership update of an accepted request failed.
     * The update runs in its own transaction, so a failure means the feature did not move.
     */
    private void abandonAccepted(BuyRequest request, Exception cause) {
        log.warn("Buy request {} lost the transfer of feature {}: {}", request.getId(), request.getFeatureId(),
                cause.getMessage());
        if (!buyRequestStore.transition(request.getId(), BuyRequestStatus.ACCEPTED, BuyRequestStatus.CANCELLED)) {
            return;
        }
        try {
            buyRequestRefundService.refundClaimed(request, BuyRequestStatus.CANCELLED);
        } catch (LedgerOperationFailedException | AmbiguousLedgerFailureException e) {
            cause.addSuppressed(e);
        }
    }

    private void recordLock(BuyRequest request, FundsJournal journal, Asset asset, BigDecimal amount) {
        if (amount.signum() <= 0) {
            return;
        }
        settlementLedger.record(LedgerTransaction.builder()
                .userId(request.getBuyerId())
                .asset(asset)
                .amount(amount)
                .direction(TransactionDirection.WITHDRAW)
                .relatedEntityType(BuyRequestRefundService.RELATED_TYPE)
                .relatedEntityId(request.getId().toString())
                .idempotencyKey(journal.key("lock", asset))
                .build());
    }
}

package com.nosota.landmarket.service;

import com.nosota.landmarket.api.model.Asset;
import com.nosota.landmarket.api.model.MarketStatus;
import com.nosota.landmarket.dto.FeeBreakdown;
import com.nosota.landmarket.dto.Payout;
import com.nosota.landmarket.dto.SettlementPlan;
import com.nosota.landmarket.error.*;
import com.nosota.landmarket.model.Feature;
import com.nosota.landmarket.model.FeatureLimit;
import com.nosota.landmarket.model.LimitedPurchase;
import com.nosota.landmarket.repository.FeatureLimitRepository;
import com.nosota.landmarket.repository.LimitedPurchaseRepository;
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

/**
 * Immediate purchase of a feature.
 *
 * <p>The acquisition path is chosen from the feature's state:
 * <ol>
 *   <li>{@link MarketStatus#TRADING_LIMITED} - rationed campaign purchase</li>
 *   <li>owned by the platform account - paid at stability value in the color resource</li>
 *   <li>otherwise - listed peer-owned feature bought at its asking price plus fees</li>
 * </ol>
 *
 * <p>Every path debits the buyer first, then updates the owner conditionally, then
 * pays out. If the owner update loses a race the debits are reversed.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class FeaturePurchaseService {

    private static final String OPERATION = "buy-feature";

    private final CatalogService catalogService;
    private final FeeSchedule feeSchedule;
    private final SettlementLedger settlementLedger;
    private final SettlementOrchestrator settlementOrchestrator;
    private final UnderpricedCooldownChecker cooldownChecker;
    private final FeatureLimitRepository featureLimitRepository;
    private final LimitedPurchaseRepository limitedPurchaseRepository;
    private final Clock clock;

    @Value("${marketplace.platform-user-id}")
    private Long platformUserId;

    /**
     * Buys a feature right away.
     *
     * @param buyerId   Buyer
     * @param featureId Feature to buy
     * @return Feature after the transfer
     */
    public Feature buyFeature(@NotNull Long buyerId, @NotNull Long featureId) throws MarketplaceException {
        Feature feature = catalogService.getFeature(featureId);
        if (feature.getOwnerId().equals(buyerId)) {
            throw new FeatureNotForSaleException("User " + buyerId + " already owns feature " + featureId);
        }
        if (feature.getMarketStatus() == MarketStatus.NOT_FOR_SALE) {
            throw new FeatureNotForSaleException("Feature " + featureId + " is not for sale");
        }

        if (feature.getMarketStatus() == MarketStatus.TRADING_LIMITED) {
            return buyLimited(buyerId, feature);
        }
        if (feature.getOwnerId().equals(platformUserId)) {
            return buyFromPlatform(buyerId, feature);
        }
        return buyListed(buyerId, feature);
    }

    private Feature buyLimited(Long buyerId, Feature feature) throws MarketplaceException {
        LocalDateTime now = LocalDateTime.now(clock);
        List<FeatureLimit> limits = featureLimitRepository.findActiveCovering(feature.getId(), now);
        if (limits.isEmpty()) {
            throw new FeatureNotForSaleException("Feature " + feature.getId() + " has no active trading campaign");
        }
        FeatureLimit limit = limits.get(0);

        if (limit.isIndividualBuyLimited()) {
            long bought = limitedPurchaseRepository.countByUserIdAndFeatureLimitId(buyerId, limit.getId());
            if (bought >= limit.getIndividualBuyCount()) {
                throw new PurchaseQuotaExceededException("User " + buyerId + " already bought " + bought
                        + " features of campaign " + limit.getId());
            }
        }

        Asset resource = feature.getCategory().colorResource();
        BigDecimal price = limit.isPriceEnforced() ? FeeSchedule.normalize(feature.getStabilityValue()) : BigDecimal.ZERO;
        FundsJournal journal = FundsJournal.start(OPERATION);

        SettlementPlan plan = SettlementPlan.builder()
                .featureId(feature.getId())
                .sellerId(feature.getOwnerId())
                .buyerId(buyerId)
                .path(AcquisitionPath.LIMITED)
                .reference(journal.reference())
                .payouts(List.of(new Payout(feature.getOwnerId(), resource, price, "seller")))
                .settledPsc(BigDecimal.ZERO)
                .settledIrr(BigDecimal.ZERO)
                .build();

        settlementLedger.requireBalance(buyerId, resource, price);
        Feature transferred = captureAndTransfer(journal, plan, resource, price);

        limitedPurchaseRepository.save(new LimitedPurchase(null, buyerId, feature.getId(), limit.getId(), now));
        settlementOrchestrator.finish(plan, transferred);
        return transferred;
    }

    private Feature buyFromPlatform(Long buyerId, Feature feature) throws MarketplaceException {
        Asset resource = feature.getCategory().colorResource();
        BigDecimal price = FeeSchedule.normalize(feature.getStabilityValue());
        FundsJournal journal = FundsJournal.start(OPERATION);

        SettlementPlan plan = SettlementPlan.builder()
                .featureId(feature.getId())
                .sellerId(platformUserId)
                .buyerId(buyerId)
                .path(AcquisitionPath.PLATFORM_OWNED)
                .reference(journal.reference())
                .payouts(List.of(new Payout(platformUserId, resource, price, "platform")))
                .settledPsc(BigDecimal.ZERO)
                .settledIrr(BigDecimal.ZERO)
                .build();

        settlementLedger.requireBalance(buyerId, resource, price);
        Feature transferred = captureAndTransfer(journal, plan, resource, price);

        settlementOrchestrator.finish(plan, transferred);
        return transferred;
    }

    private Feature buyListed(Long buyerId, Feature feature) throws MarketplaceException {
        if (feature.getMarketStatus() != MarketStatus.LISTED_PRICED
                || feature.getListedPricePsc() == null || feature.getListedPriceIrr() == null) {
            throw new FeatureNotForSaleException("Feature " + feature.getId() + " has no asking price");
        }
        cooldownChecker.ensureNotRestricted(feature.getOwnerId());

        FeeBreakdown psc = feeSchedule.breakdown(feature.getListedPricePsc());
        FeeBreakdown irr = feeSchedule.breakdown(feature.getListedPriceIrr());
        FundsJournal journal = FundsJournal.start(OPERATION);

        SettlementPlan plan = SettlementPlan.builder()
                .featureId(feature.getId())
                .sellerId(feature.getOwnerId())
                .buyerId(buyerId)
                .path(AcquisitionPath.PEER_IMMEDIATE)
                .reference(journal.reference())
                .payouts(List.of(
                        new Payout(feature.getOwnerId(), Asset.PSC, psc.sellerPayment(), "seller"),
                        new Payout(feature.getOwnerId(), Asset.IRR, irr.sellerPayment(), "seller"),
                        new Payout(platformUserId, Asset.PSC, psc.platformFee(), "platform"),
                        new Payout(platformUserId, Asset.IRR, irr.platformFee(), "platform")))
                .settledPsc(psc.price())
                .settledIrr(irr.price())
                .feePsc(psc.platformFee())
                .feeIrr(irr.platformFee())
                .build();

        settlementLedger.requireBalance(buyerId, Asset.PSC, psc.buyerCharge());
        settlementLedger.requireBalance(buyerId, Asset.IRR, irr.buyerCharge());

        Feature transferred;
        try {
            settlementLedger.debit(journal, buyerId, Asset.PSC, psc.buyerCharge(), "debit");
            settlementLedger.debit(journal, buyerId, Asset.IRR, irr.buyerCharge(), "debit");
            transferred = settlementOrchestrator.transferOwnership(plan);
        } catch (MarketplaceException | RuntimeException e) {
            settlementLedger.compensate(journal, e);
            throw e;
        }

        settlementOrchestrator.finish(plan, transferred);
        return transferred;
    }

    /**
     * Debits a single-asset price and moves the feature, reversing the debit if the move fails.
     */
    private Feature captureAndTransfer(FundsJournal journal, SettlementPlan plan, Asset resource, BigDecimal price)
            throws MarketplaceException {
        try {
            settlementLedger.debit(journal, plan.buyerId(), resource, price, "debit");
            return settlementOrchestrator.transferOwnership(plan);
        } catch (MarketplaceException | RuntimeException e) {
            settlementLedger.compensate(journal, e);
            throw e;
        }
    }
}

package com.nosota.landmarket.service;

import com.nosota.landmarket.api.model.MarketStatus;
import com.nosota.landmarket.api.model.SellRequestStatus;
import com.nosota.landmarket.dto.FeatureUpdate;
import com.nosota.landmarket.dto.PricePair;
import com.nosota.landmarket.error.*;
import com.nosota.landmarket.model.Feature;
import com.nosota.landmarket.model.SellRequest;
import com.nosota.landmarket.repository.SellRequestRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Listings of features by their owners.
 *
 * <p>A listing is priced in one of two ways:
 * <ul>
 *   <li>explicit PSC and IRR prices, whose worth must reach the owner's floor</li>
 *   <li>a percentage of the valuation, split evenly between PSC and IRR</li>
 * </ul>
 * Listing puts the feature into {@link MarketStatus#LISTED_PRICED}, which enables
 * immediate purchase at the asking price.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class SellRequestService {

    private final SellRequestRepository sellRequestRepository;
    private final CatalogService catalogService;
    private final PricingService pricingService;
    private final Clock clock;

    /**
     * Lists a feature.
     *
     * @param sellerId   Caller, must own the feature
     * @param featureId  Feature to list
     * @param pricePsc   Asking PSC (explicit mode), null in percentage mode
     * @param priceIrr   Asking IRR (explicit mode), null in percentage mode
     * @param percentage Asking percentage of the valuation, null in explicit mode
     * @return Created listing
     */
    @Transactional(rollbackOn = MarketplaceException.class)
    public SellRequest createSellRequest(@NotNull Long sellerId, @NotNull Long featureId,
                                         BigDecimal pricePsc, BigDecimal priceIrr, Integer percentage)
            throws FeatureNotFoundException, UnauthorizedActionException, FeatureNotForSaleException,
            DuplicateRequestException, PriceBelowFloorException {
        Feature feature = catalogService.getFeature(featureId);
        if (!feature.getOwnerId().equals(sellerId)) {
            throw new UnauthorizedActionException("Only the owner can list feature " + featureId);
        }
        if (feature.getMarketStatus() == MarketStatus.NOT_FOR_SALE
                || feature.getMarketStatus() == MarketStatus.TRADING_LIMITED) {
            throw new FeatureNotForSaleException("Feature " + featureId + " can not be listed while "
                    + feature.getMarketStatus());
        }
        if (sellRequestRepository.existsByFeatureIdAndStatus(featureId, SellRequestStatus.PENDING)) {
            throw new DuplicateRequestException("Feature " + featureId + " is already listed");
        }

        int floor = Math.max(pricingService.getPublicFloorPercentage(), pricingService.floorFor(sellerId));
        PricePair ask;
        int askPercentage;
        if (percentage != null) {
            if (pricePsc != null || priceIrr != null) {
                throw new IllegalArgumentException("Give either prices or a percentage, not both");
            }
            if (percentage < floor) {
                throw new PriceBelowFloorException(floor, percentage);
            }
            ask = pricingService.pricesForPercentage(feature, percentage);
            askPercentage = percentage;
        } else {
            if (pricePsc == null || priceIrr == null) {
                throw new IllegalArgumentException("Both PSC and IRR prices are required without a percentage");
            }
            ask = new PricePair(FeeSchedule.normalize(pricePsc), FeeSchedule.normalize(priceIrr));
            if (ask.psc().signum() == 0 && ask.irr().signum() == 0) {
                throw new IllegalArgumentException("Asking price can not be zero");
            }
            askPercentage = pricingService.percentageOf(feature, ask.psc(), ask.irr());
            if (askPercentage < floor) {
                throw new PriceBelowFloorException(floor, askPercentage);
            }
        }

        SellRequest request = new SellRequest(null, sellerId, featureId, ask.psc(), ask.irr(), askPercentage,
                SellRequestStatus.PENDING, LocalDateTime.now(clock));
        SellRequest saved = sellRequestRepository.save(request);
        catalogService.applyUpdate(featureId, FeatureUpdate.listed(ask, askPercentage));

        log.info("Feature {} listed by {} at {}% (psc={}, irr={})",
                featureId, sellerId, askPercentage, ask.psc(), ask.irr());
        return saved;
    }

    /**
     * Removes an active listing and returns the feature to the unpriced state.
     */
    @Transactional(rollbackOn = MarketplaceException.class)
    public void deleteSellRequest(@NotNull Long sellerId, @NotNull UUID requestId)
            throws SellRequestNotFoundException, UnauthorizedActionException, RequestNotPendingException,
            FeatureNotFoundException {
        SellRequest request = sellRequestRepository.findById(requestId)
                .orElseThrow(() -> new SellRequestNotFoundException("Sell request not found: " + requestId));
        if (!request.getSellerId().equals(sellerId)) {
            throw new UnauthorizedActionException("Only the seller can delete sell request " + requestId);
        }
        if (request.getStatus() != SellRequestStatus.PENDING) {
            throw new RequestNotPendingException("Sell request " + requestId + " is " + request.getStatus());
        }

        sellRequestRepository.delete(request);

        Feature feature = catalogService.getFeature(request.getFeatureId());
        if (feature.getOwnerId().equals(sellerId) && feature.getMarketStatus() == MarketStatus.LISTED_PRICED) {
            catalogService.applyUpdate(feature.getId(), FeatureUpdate.status(MarketStatus.LISTED_UNPRICED));
        }
        log.info("Sell request {} of feature {} deleted", requestId, request.getFeatureId());
    }

    public List<SellRequest> listSellRequests(@NotNull Long sellerId) {
        return sellRequestRepository.findBySellerIdOrderByCreatedAtDesc(sellerId);
    }

    /**
     * Marks every active listing of a feature completed after it changed owner.
     *
     * @return Number of completed listings
     */
    @Transactional
    public int completeListings(Long featureId) {
        return sellRequestRepository.transitionAllForFeature(featureId, SellRequestStatus.PENDING,
                SellRequestStatus.COMPLETED);
    }
}

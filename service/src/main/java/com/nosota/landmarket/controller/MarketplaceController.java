package com.nosota.landmarket.controller;

import com.nosota.landmarket.api.MarketplaceApi;
import com.nosota.landmarket.api.request.CreateSellRequestRequest;
import com.nosota.landmarket.api.request.GracePeriodRequest;
import com.nosota.landmarket.api.request.SendBuyRequestRequest;
import com.nosota.landmarket.api.response.BuyRequestResponse;
import com.nosota.landmarket.api.response.FeatureResponse;
import com.nosota.landmarket.api.response.SellRequestResponse;
import com.nosota.landmarket.error.MarketplaceException;
import com.nosota.landmarket.mapper.MarketplaceMapper;
import com.nosota.landmarket.model.BuyRequest;
import com.nosota.landmarket.model.Feature;
import com.nosota.landmarket.model.SellRequest;
import com.nosota.landmarket.service.BuyRequestService;
import com.nosota.landmarket.service.FeaturePurchaseService;
import com.nosota.landmarket.service.SellRequestService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for marketplace operations.
 *
 * <p>Implements {@link MarketplaceApi}. Business failures propagate as
 * {@link MarketplaceException} subclasses and are rendered by the global handler.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class MarketplaceController implements MarketplaceApi {

    private final FeaturePurchaseService featurePurchaseService;
    private final BuyRequestService buyRequestService;
    private final SellRequestService sellRequestService;

    private final MarketplaceMapper mapper = MarketplaceMapper.INSTANCE;

    // ==================== Immediate Purchase ====================

    @Override
    public ResponseEntity<FeatureResponse> buyFeature(Long userId, Long featureId) throws MarketplaceException {
        log.info("Buy feature: userId={}, featureId={}", userId, featureId);
        Feature feature = featurePurchaseService.buyFeature(userId, featureId);
        return ResponseEntity.ok(mapper.toResponse(feature));
    }

    // ==================== Buy Requests ====================

    @Override
    public ResponseEntity<BuyRequestResponse> sendBuyRequest(Long userId, Long featureId,
                                                             SendBuyRequestRequest request) throws MarketplaceException {
        log.info("Send buy request: userId={}, featureId={}", userId, featureId);
        BuyRequest buyRequest = buyRequestService.sendBuyRequest(userId, featureId,
                request.pricePsc(), request.priceIrr(), request.note());
        return ResponseEntity.status(HttpStatus.CREATED).body(mapper.toResponse(buyRequest));
    }

    @Override
    public ResponseEntity<BuyRequestResponse> acceptBuyRequest(Long userId, UUID requestId) throws MarketplaceException {
        log.info("Accept buy request: userId={}, requestId={}", userId, requestId);
        BuyRequest buyRequest = buyRequestService.acceptBuyRequest(userId, requestId);
        return ResponseEntity.ok(mapper.toResponse(buyRequest));
    }

    @Override
    public ResponseEntity<Void> rejectBuyRequest(Long userId, UUID requestId) throws MarketplaceException {
        log.info("Reject buy request: userId={}, requestId={}", userId, requestId);
        buyRequestService.rejectBuyRequest(userId, requestId);
        return ResponseEntity.noContent().build();
    }

    @Override
    public ResponseEntity<Void> deleteBuyRequest(Long userId, UUID requestId) throws MarketplaceException {
        log.info("Delete buy request: userId={}, requestId={}", userId, requestId);
        buyRequestService.deleteBuyRequest(userId, requestId);
        return ResponseEntity.noContent().build();
    }

    @Override
    public ResponseEntity<BuyRequestResponse> updateGracePeriod(Long userId, UUID requestId,
                                                                GracePeriodRequest request) throws MarketplaceException {
        BuyRequest buyRequest = buyRequestService.updateGracePeriod(userId, requestId, request.days());
        return ResponseEntity.ok(mapper.toResponse(buyRequest));
    }

    @Override
    public ResponseEntity<List<BuyRequestResponse>> listBuyRequests(Long userId) {
        List<BuyRequest> requests = buyRequestService.listBuyRequests(userId);
        return ResponseEntity.ok(mapper.toBuyRequestResponses(requests));
    }

    @Override
    public ResponseEntity<List<BuyRequestResponse>> listReceivedBuyRequests(Long userId) {
        List<BuyRequest> requests = buyRequestService.listReceivedBuyRequests(userId);
        return ResponseEntity.ok(mapper.toBuyRequestResponses(requests));
    }

    // ==================== Sell Requests ====================

    @Override
    public ResponseEntity<SellRequestResponse> createSellRequest(Long userId, Long featureId,
                                                                 CreateSellRequestRequest request) throws MarketplaceException {
        log.info("Create sell request: userId={}, featureId={}", userId, featureId);
        SellRequest sellRequest = sellRequestService.createSellRequest(userId, featureId,
                request.pricePsc(), request.priceIrr(), request.minimumPricePercentage());
        return ResponseEntity.status(HttpStatus.CREATED).body(mapper.toResponse(sellRequest));
    }

    @Override
    public ResponseEntity<Void> deleteSellRequest(Long userId, UUID requestId) throws MarketplaceException {
        log.info("Delete sell request: userId={}, requestId={}", userId, requestId);
        sellRequestService.deleteSellRequest(userId, requestId);
        return ResponseEntity.noContent().build();
    }

    @Override
    public ResponseEntity<List<SellRequestResponse>> listSellRequests(Long userId) {
        List<SellRequest> requests = sellRequestService.listSellRequests(userId);
        return ResponseEntity.ok(mapper.toSellRequestResponses(requests));
    }
}

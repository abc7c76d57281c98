package com.nosota.landmarket.api;

import com.nosota.landmarket.api.request.CreateSellRequestRequest;
import com.nosota.landmarket.api.request.GracePeriodRequest;
import com.nosota.landmarket.api.request.SendBuyRequestRequest;
import com.nosota.landmarket.api.response.BuyRequestResponse;
import com.nosota.landmarket.api.response.FeatureResponse;
import com.nosota.landmarket.api.response.SellRequestResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Marketplace API of the land market service.
 *
 * <p>Defines REST endpoints for trading land features:
 * <ul>
 *   <li>Immediate purchase (limited, platform-owned or listed peer-owned features)</li>
 *   <li>Negotiated purchase: buy requests with escrowed funds</li>
 *   <li>Listings: sell requests that publish an asking price</li>
 * </ul>
 *
 * <p>The calling user is identified by the {@value #USER_HEADER} header.
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>MarketplaceController - in service module (server-side implementation)</li>
 *   <li>MarketplaceClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/marketplace")
public interface MarketplaceApi {

    String USER_HEADER = "X-User-Id";

    // ==================== Immediate Purchase ====================

    /**
     * Buys a feature right away at its current terms.
     *
     * @param userId    buyer
     * @param featureId feature to buy
     * @return the feature after the transfer
     */
    @PostMapping("/features/{featureId}/buy")
    ResponseEntity<FeatureResponse> buyFeature(
            @RequestHeader(USER_HEADER) @NotNull Long userId,
            @PathVariable("featureId") Long featureId) throws Exception;

    // ==================== Buy Requests ====================

    /**
     * Makes an offer on a feature. Offered amounts plus buyer fees are locked in escrow.
     *
     * @param userId    buyer
     * @param featureId feature the offer is for
     * @param request   offered prices
     * @return created buy request
     */
    @PostMapping("/features/{featureId}/buy-requests")
    ResponseEntity<BuyRequestResponse> sendBuyRequest(
            @RequestHeader(USER_HEADER) @NotNull Long userId,
            @PathVariable("featureId") Long featureId,
            @RequestBody @Valid SendBuyRequestRequest request) throws Exception;

    /**
     * Accepts an offer. Only the seller may accept.
     */
    @PostMapping("/buy-requests/{requestId}/accept")
    ResponseEntity<BuyRequestResponse> acceptBuyRequest(
            @RequestHeader(USER_HEADER) @NotNull Long userId,
            @PathVariable("requestId") UUID requestId) throws Exception;

    /**
     * Rejects an offer and refunds the buyer. Only the seller may reject.
     */
    @PostMapping("/buy-requests/{requestId}/reject")
    ResponseEntity<Void> rejectBuyRequest(
            @RequestHeader(USER_HEADER) @NotNull Long userId,
            @PathVariable("requestId") UUID requestId) throws Exception;

    /**
     * Withdraws an offer and refunds the buyer. Only the buyer may withdraw.
     */
    @DeleteMapping("/buy-requests/{requestId}")
    ResponseEntity<Void> deleteBuyRequest(
            @RequestHeader(USER_HEADER) @NotNull Long userId,
            @PathVariable("requestId") UUID requestId) throws Exception;

    /**
     * Sets the grace period of a pending offer. Only the seller may set it.
     */
    @PostMapping("/buy-requests/{requestId}/grace-period")
    ResponseEntity<BuyRequestResponse> updateGracePeriod(
            @RequestHeader(USER_HEADER) @NotNull Long userId,
            @PathVariable("requestId") UUID requestId,
            @RequestBody @Valid GracePeriodRequest request) throws Exception;

    /**
     * Lists pending offers sent by the caller, newest first.
     */
    @GetMapping("/buy-requests")
    ResponseEntity<List<BuyRequestResponse>> listBuyRequests(
            @RequestHeader(USER_HEADER) @NotNull Long userId);

    /**
     * Lists pending offers received by the caller, newest first.
     */
    @GetMapping("/buy-requests/received")
    ResponseEntity<List<BuyRequestResponse>> listReceivedBuyRequests(
            @RequestHeader(USER_HEADER) @NotNull Long userId);

    // ==================== Sell Requests ====================

    /**
     * Lists an owned feature at an asking price.
     */
    @PostMapping("/features/{featureId}/sell-requests")
    ResponseEntity<SellRequestResponse> createSellRequest(
            @RequestHeader(USER_HEADER) @NotNull Long userId,
            @PathVariable("featureId") Long featureId,
            @RequestBody @Valid CreateSellRequestRequest request) throws Exception;

    /**
     * Removes a listing. Only the seller may remove it.
     */
    @DeleteMapping("/sell-requests/{requestId}")
    ResponseEntity<Void> deleteSellRequest(
            @RequestHeader(USER_HEADER) @NotNull Long userId,
            @PathVariable("requestId") UUID requestId) throws Exception;

    /**
     * Lists the caller's sell requests, newest first.
     */
    @GetMapping("/sell-requests")
    ResponseEntity<List<SellRequestResponse>> listSellRequests(
            @RequestHeader(USER_HEADER) @NotNull Long userId);
}

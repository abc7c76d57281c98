package com.nosota.landmarket.api;

import com.nosota.landmarket.api.request.CreateSellRequestRequest;
import com.nosota.landmarket.api.request.GracePeriodRequest;
import com.nosota.landmarket.api.request.SendBuyRequestRequest;
import com.nosota.landmarket.api.response.BuyRequestResponse;
import com.nosota.landmarket.api.response.FeatureResponse;
import com.nosota.landmarket.api.response.SellRequestResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.UUID;

/**
 * WebClient-based implementation of MarketplaceApi for consuming the land market service.
 *
 * <p><b>IMPORTANT:</b> This client is NOT a Spring @Component. Consuming services must
 * register it as a bean themselves:
 * <pre>
 * {@code
 * @Bean
 * public MarketplaceClient marketplaceClient(WebClient.Builder builder,
 *                                            @Value("${services.landmarket.url}") String baseUrl) {
 *     return new MarketplaceClient(builder.baseUrl(baseUrl).build());
 * }
 * }
 * </pre>
 *
 * <p>Error responses surface as {@code WebClientResponseException}.
 */
@RequiredArgsConstructor
@Slf4j
public class MarketplaceClient implements MarketplaceApi {

    private static final String BASE_PATH = "/api/v1/marketplace";

    private final WebClient webClient;

    @Override
    public ResponseEntity<FeatureResponse> buyFeature(Long userId, Long featureId) {
        log.debug("Calling buyFeature: userId={}, featureId={}", userId, featureId);

        return webClient.post()
                .uri(BASE_PATH + "/features/{featureId}/buy", featureId)
                .header(USER_HEADER, String.valueOf(userId))
                .retrieve()
                .toEntity(FeatureResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<BuyRequestResponse> sendBuyRequest(Long userId, Long featureId, SendBuyRequestRequest request) {
        log.debug("Calling sendBuyRequest: userId={}, featureId={}", userId, featureId);

        return webClient.post()
                .uri(BASE_PATH + "/features/{featureId}/buy-requests", featureId)
                .header(USER_HEADER, String.valueOf(userId))
                .bodyValue(request)
                .retrieve()
                .toEntity(BuyRequestResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<BuyRequestResponse> acceptBuyRequest(Long userId, UUID requestId) {
        log.debug("Calling acceptBuyRequest: userId={}, requestId={}", userId, requestId);

        return webClient.post()
                .uri(BASE_PATH + "/buy-requests/{requestId}/accept", requestId)
                .header(USER_HEADER, String.valueOf(userId))
                .retrieve()
                .toEntity(BuyRequestResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<Void> rejectBuyRequest(Long userId, UUID requestId) {
        log.debug("Calling rejectBuyRequest: userId={}, requestId={}", userId, requestId);

        return webClient.post()
                .uri(BASE_PATH + "/buy-requests/{requestId}/reject", requestId)
                .header(USER_HEADER, String.valueOf(userId))
                .retrieve()
                .toBodilessEntity()
                .block();
    }

    @Override
    public ResponseEntity<Void> deleteBuyRequest(Long userId, UUID requestId) {
        log.debug("Calling deleteBuyRequest: userId={}, requestId={}", userId, requestId);

        return webClient.delete()
                .uri(BASE_PATH + "/buy-requests/{requestId}", requestId)
                .header(USER_HEADER, String.valueOf(userId))
                .retrieve()
                .toBodilessEntity()
                .block();
    }

    @Override
    public ResponseEntity<BuyRequestResponse> updateGracePeriod(Long userId, UUID requestId, GracePeriodRequest request) {
        log.debug("Calling updateGracePeriod: userId={}, requestId={}, days={}", userId, requestId, request.days());

        return webClient.post()
                .uri(BASE_PATH + "/buy-requests/{requestId}/grace-period", requestId)
                .header(USER_HEADER, String.valueOf(userId))
                .bodyValue(request)
                .retrieve()
                .toEntity(BuyRequestResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<BuyRequestResponse>> listBuyRequests(Long userId) {
        log.debug("Calling listBuyRequests: userId={}", userId);

        return webClient.get()
                .uri(BASE_PATH + "/buy-requests")
                .header(USER_HEADER, String.valueOf(userId))
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<BuyRequestResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<List<BuyRequestResponse>> listReceivedBuyRequests(Long userId) {
        log.debug("Calling listReceivedBuyRequests: userId={}", userId);

        return webClient.get()
                .uri(BASE_PATH + "/buy-requests/received")
                .header(USER_HEADER, String.valueOf(userId))
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<BuyRequestResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<SellRequestResponse> createSellRequest(Long userId, Long featureId, CreateSellRequestRequest request) {
        log.debug("Calling createSellRequest: userId={}, featureId={}", userId, featureId);

        return webClient.post()
                .uri(BASE_PATH + "/features/{featureId}/sell-requests", featureId)
                .header(USER_HEADER, String.valueOf(userId))
                .bodyValue(request)
                .retrieve()
                .toEntity(SellRequestResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<Void> deleteSellRequest(Long userId, UUID requestId) {
        log.debug("Calling deleteSellRequest: userId={}, requestId={}", userId, requestId);

        return webClient.delete()
                .uri(BASE_PATH + "/sell-requests/{requestId}", requestId)
                .header(USER_HEADER, String.valueOf(userId))
                .retrieve()
                .toBodilessEntity()
                .block();
    }

    @Override
    public ResponseEntity<List<SellRequestResponse>> listSellRequests(Long userId) {
        log.debug("Calling listSellRequests: userId={}", userId);

        return webClient.get()
                .uri(BASE_PATH + "/sell-requests")
                .header(USER_HEADER, String.valueOf(userId))
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<SellRequestResponse>>() {})
                .block();
    }
}

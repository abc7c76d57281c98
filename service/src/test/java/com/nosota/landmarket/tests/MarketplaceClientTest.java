package com.nosota.landmarket.tests;

import com.nosota.landmarket.TestBase;
import com.nosota.landmarket.api.MarketplaceClient;
import com.nosota.landmarket.api.model.BuyRequestStatus;
import com.nosota.landmarket.api.request.CreateSellRequestRequest;
import com.nosota.landmarket.api.request.GracePeriodRequest;
import com.nosota.landmarket.api.request.SendBuyRequestRequest;
import com.nosota.landmarket.api.response.BuyRequestResponse;
import com.nosota.landmarket.api.response.FeatureResponse;
import com.nosota.landmarket.api.response.SellRequestResponse;
import com.nosota.landmarket.model.Feature;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests of the api module's WebClient client against the running service.
 */
@DisplayName("Marketplace Client Tests")
public class MarketplaceClientTest extends TestBase {

    @LocalServerPort
    private int port;

    @Autowired
    private WebClient.Builder webClientBuilder;

    private MarketplaceClient client;

    @BeforeEach
    void setupClient() {
        client = new MarketplaceClient(webClientBuilder.baseUrl("http://localhost:" + port).build());
    }

    @Test
    @DisplayName("CLI-001: Offer lifecycle through the client")
    void testOfferLifecycle() {
        Long sellerId = newUser();
        Long buyerId = newUser();
        Feature feature = createFeature(sellerId);
        fund(buyerId, "0", "1000000");

        ResponseEntity<BuyRequestResponse> sent = client.sendBuyRequest(buyerId, feature.getId(),
                new SendBuyRequestRequest(BigDecimal.ZERO, new BigDecimal("820000"), "please"));
        assertThat(sent.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        BuyRequestResponse offer = sent.getBody();
        assertThat(offer).isNotNull();
        assertThat(offer.note()).isEqualTo("please");

        BuyRequestResponse extended = client.updateGracePeriod(sellerId, offer.id(), new GracePeriodRequest(5)).getBody();
        assertThat(extended).isNotNull();
        assertThat(extended.gracePeriodDeadline()).isNotNull();

        List<BuyRequestResponse> sentList = client.listBuyRequests(buyerId).getBody();
        assertThat(sentList).extracting(BuyRequestResponse::id).containsExactly(offer.id());

        BuyRequestResponse accepted = client.acceptBuyRequest(sellerId, offer.id()).getBody();
        assertThat(accepted).isNotNull();
        assertThat(accepted.status()).isEqualTo(BuyRequestStatus.ACCEPTED);
        assertThat(client.listReceivedBuyRequests(sellerId).getBody()).isEmpty();
    }

    @Test
    @DisplayName("CLI-002: Listing and immediate purchase through the client")
    void testListingAndPurchase() {
        Long sellerId = newUser();
        Long buyerId = newUser();
        Feature feature = createFeature(sellerId);
        fund(buyerId, "5250", "525000");

        SellRequestResponse listing = client.createSellRequest(sellerId, feature.getId(),
                new CreateSellRequestRequest(null, null, 100)).getBody();
        assertThat(listing).isNotNull();
        assertThat(client.listSellRequests(sellerId).getBody()).hasSize(1);

        FeatureResponse bought = client.buyFeature(buyerId, feature.getId()).getBody();
        assertThat(bought).isNotNull();
        assertThat(bought.ownerId()).isEqualTo(buyerId);
    }

    @Test
    @DisplayName("CLI-003: Errors surface as WebClientResponseException")
    void testErrors() {
        Long sellerId = newUser();
        Long buyerId = newUser();
        Feature feature = createFeature(sellerId);
        fund(buyerId, "0", "1000000");
        BuyRequestResponse offer = client.sendBuyRequest(buyerId, feature.getId(),
                new SendBuyRequestRequest(BigDecimal.ZERO, new BigDecimal("800000"), null)).getBody();
        assertThat(offer).isNotNull();

        assertThatThrownBy(() -> client.rejectBuyRequest(buyerId, offer.id()))
                .isInstanceOf(WebClientResponseException.Forbidden.class);

        client.deleteBuyRequest(buyerId, offer.id());

        assertThatThrownBy(() -> client.deleteBuyRequest(buyerId, offer.id()))
                .isInstanceOf(WebClientResponseException.Conflict.class);
    }
}

package com.nosota.landmarket.tests;

import com.nosota.landmarket.TestBase;
import com.nosota.landmarket.api.MarketplaceApi;
import com.nosota.landmarket.api.model.Asset;
import com.nosota.landmarket.api.model.BuyRequestStatus;
import com.nosota.landmarket.api.request.CreateSellRequestRequest;
import com.nosota.landmarket.api.request.GracePeriodRequest;
import com.nosota.landmarket.api.request.SendBuyRequestRequest;
import com.nosota.landmarket.api.response.BuyRequestResponse;
import com.nosota.landmarket.api.response.SellRequestResponse;
import com.nosota.landmarket.config.CorrelationIdFilter;
import com.nosota.landmarket.model.Feature;
import com.nosota.landmarket.support.InMemoryLedger.FailureMode;
import com.nosota.landmarket.support.InMemoryLedger.Operation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;

import java.math.BigDecimal;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration tests for MarketplaceController via REST API with MockMvc.
 *
 * <p>Covers the happy paths of each endpoint family and the mapping of
 * marketplace errors to HTTP responses.
 */
@DisplayName("Marketplace Controller Tests")
public class MarketplaceControllerTest extends TestBase {

    private static final String BASE = "/api/v1/marketplace";

    private Long sellerId;
    private Long buyerId;
    private Feature feature;

    @BeforeEach
    void setupFeature() {
        sellerId = newUser();
        buyerId = newUser();
        feature = createFeature(sellerId);
        fund(buyerId, "50", "1000000");
    }

    private BuyRequestResponse sendOffer(String psc, String irr) throws Exception {
        MvcResult result = mockMvc.perform(post(BASE + "/features/{featureId}/buy-requests", feature.getId())
                        .header(MarketplaceApi.USER_HEADER, buyerId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new SendBuyRequestRequest(new BigDecimal(psc), new BigDecimal(irr), "offer"))))
                .andExpect(status().isCreated())
                .andReturn();
        return objectMapper.readValue(result.getResponse().getContentAsString(), BuyRequestResponse.class);
    }

    @Test
    @DisplayName("API-001: Offer, list and accept through REST")
    void testOfferAndAccept() throws Exception {
        BuyRequestResponse offer = sendOffer("40", "896000");
        assertThat(offer.status()).isEqualTo(BuyRequestStatus.PENDING);
        assertThat(offer.pricePsc()).isEqualByComparingTo("40");

        mockMvc.perform(get(BASE + "/buy-requests/received").header(MarketplaceApi.USER_HEADER, sellerId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].id").value(offer.id().toString()));

        mockMvc.perform(post(BASE + "/buy-requests/{requestId}/accept", offer.id())
                        .header(MarketplaceApi.USER_HEADER, sellerId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ACCEPTED"));

        assertThat(reload(feature).getOwnerId()).isEqualTo(buyerId);
        assertThat(balance(sellerId, Asset.IRR)).isEqualByComparingTo("851200");
    }

    @Test
    @DisplayName("API-002: Reject and delete answer 204")
    void testRejectAndDelete() throws Exception {
        BuyRequestResponse rejected = sendOffer("0", "800000");

        mockMvc.perform(post(BASE + "/buy-requests/{requestId}/reject", rejected.id())
                        .header(MarketplaceApi.USER_HEADER, sellerId))
                .andExpect(status().isNoContent());

        BuyRequestResponse withdrawn = sendOffer("0", "800000");

        mockMvc.perform(delete(BASE + "/buy-requests/{requestId}", withdrawn.id())
                        .header(MarketplaceApi.USER_HEADER, buyerId))
                .andExpect(status().isNoContent());

        mockMvc.perform(get(BASE + "/buy-requests").header(MarketplaceApi.USER_HEADER, buyerId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
        assertThat(balance(buyerId, Asset.IRR)).isEqualByComparingTo("1000000");
    }

    @Test
    @DisplayName("API-003: Offer below floor answers 400 with floor details")
    void testBelowFloor() throws Exception {
        mockMvc.perform(post(BASE + "/features/{featureId}/buy-requests", feature.getId())
                        .header(MarketplaceApi.USER_HEADER, buyerId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new SendBuyRequestRequest(BigDecimal.ZERO, new BigDecimal("500000"), null))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Price Below Floor"))
                .andExpect(jsonPath("$.details.floorPercentage").value(80))
                .andExpect(jsonPath("$.details.actualPercentage").value(50));
    }

    @Test
    @DisplayName("API-004: Insufficient balance answers 400 with asset details")
    void testInsufficientBalance() throws Exception {
        mockMvc.perform(post(BASE + "/features/{featureId}/buy-requests", feature.getId())
                        .header(MarketplaceApi.USER_HEADER, buyerId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new SendBuyRequestRequest(new BigDecimal("100"), new BigDecimal("800000"), null))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.asset").value("psc"));
    }

    @Test
    @DisplayName("API-005: Missing caller header and invalid body answer 400")
    void testInvalidRequests() throws Exception {
        mockMvc.perform(get(BASE + "/buy-requests"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post(BASE + "/features/{featureId}/buy-requests", feature.getId())
                        .header(MarketplaceApi.USER_HEADER, buyerId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pricePsc\": -1, \"priceIrr\": 800000}"))
                .andExpect(status().isBadRequest());

        BuyRequestResponse offer = sendOffer("0", "800000");
        mockMvc.perform(post(BASE + "/buy-requests/{requestId}/grace-period", offer.id())
                        .header(MarketplaceApi.USER_HEADER, sellerId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new GracePeriodRequest(45))))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("API-006: Business errors map to 403, 404 and 409")
    void testErrorStatuses() throws Exception {
        BuyRequestResponse offer = sendOffer("0", "800000");

        mockMvc.perform(post(BASE + "/buy-requests/{requestId}/accept", offer.id())
                        .header(MarketplaceApi.USER_HEADER, buyerId))
                .andExpect(status().isForbidden());

        mockMvc.perform(post(BASE + "/buy-requests/{requestId}/accept", UUID.randomUUID())
                        .header(MarketplaceApi.USER_HEADER, sellerId))
                .andExpect(status().isNotFound());

        mockMvc.perform(post(BASE + "/features/{featureId}/buy-requests", feature.getId())
                        .header(MarketplaceApi.USER_HEADER, buyerId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new SendBuyRequestRequest(BigDecimal.ZERO, new BigDecimal("800000"), null))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Duplicate Request"));
    }

    @Test
    @DisplayName("API-007: Ambiguous ledger outcome answers 502 with the correlation id")
    void testAmbiguousLedgerFailure() throws Exception {
        ledger.failNext(Operation.DEBIT, Asset.PSC, FailureMode.UNKNOWN_NOT_APPLIED, 1);

        mockMvc.perform(post(BASE + "/features/{featureId}/buy-requests", feature.getId())
                        .header(MarketplaceApi.USER_HEADER, buyerId)
                        .header(CorrelationIdFilter.HEADER, "trace-42")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new SendBuyRequestRequest(new BigDecimal("40"), new BigDecimal("896000"), null))))
                .andExpect(status().isBadGateway())
                .andExpect(header().string(CorrelationIdFilter.HEADER, "trace-42"))
                .andExpect(jsonPath("$.message").value(containsString("trace-42")));
    }

    @Test
    @DisplayName("API-008: Listing lifecycle through REST")
    void testSellRequests() throws Exception {
        MvcResult created = mockMvc.perform(post(BASE + "/features/{featureId}/sell-requests", feature.getId())
                        .header(MarketplaceApi.USER_HEADER, sellerId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new CreateSellRequestRequest(null, null, 100))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.floorPercentage").value(100))
                .andReturn();
        SellRequestResponse listing = objectMapper.readValue(created.getResponse().getContentAsString(),
                SellRequestResponse.class);
        assertThat(listing.askPsc()).isEqualByComparingTo("5000");
        assertThat(listing.askIrr()).isEqualByComparingTo("500000");

        mockMvc.perform(get(BASE + "/sell-requests").header(MarketplaceApi.USER_HEADER, sellerId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)));

        fund(buyerId, "5200", "0");
        mockMvc.perform(post(BASE + "/features/{featureId}/buy", feature.getId())
                        .header(MarketplaceApi.USER_HEADER, buyerId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ownerId").value(buyerId))
                .andExpect(jsonPath("$.marketStatus").value("LISTED_UNPRICED"));

        mockMvc.perform(delete(BASE + "/sell-requests/{requestId}", listing.id())
                        .header(MarketplaceApi.USER_HEADER, sellerId))
                .andExpect(status().isConflict());
    }
}

package com.nosota.landmarket.tests;

import com.nosota.landmarket.TestBase;
import com.nosota.landmarket.api.model.MarketStatus;
import com.nosota.landmarket.error.*;
import com.nosota.landmarket.model.Feature;
import com.nosota.landmarket.model.SellRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for listings. The reference feature is worth 1,000,000 IRR and 1 PSC is worth 100 IRR.
 */
@DisplayName("Sell Request Tests")
public class SellRequestTest extends TestBase {

    @Test
    @DisplayName("SEL-001: Percentage listing splits the asking price evenly between PSC and IRR")
    void testPercentageListing() throws Exception {
        Long sellerId = newUser();
        Feature feature = createFeature(sellerId);

        SellRequest listing = sellRequestService.createSellRequest(sellerId, feature.getId(), null, null, 90);

        assertThat(listing.getAskPsc()).isEqualByComparingTo("4500");
        assertThat(listing.getAskIrr()).isEqualByComparingTo("450000");
        assertThat(listing.getFloorPercentage()).isEqualTo(90);

        Feature listed = reload(feature);
        assertThat(listed.getMarketStatus()).isEqualTo(MarketStatus.LISTED_PRICED);
        assertThat(listed.getListedPricePsc()).isEqualByComparingTo("4500");
        assertThat(listed.getListedPriceIrr()).isEqualByComparingTo("450000");
        assertThat(listed.getMinimumPricePercentage()).isEqualTo(90);
    }

    @Test
    @DisplayName("SEL-002: Explicit prices are stored with their implied percentage")
    void testExplicitListing() throws Exception {
        Long sellerId = newUser();
        Feature feature = createFeature(sellerId);

        SellRequest listing = sellRequestService.createSellRequest(sellerId, feature.getId(),
                new BigDecimal("3000"), new BigDecimal("700000"), null);

        assertThat(listing.getFloorPercentage()).isEqualTo(100);
        assertThat(reload(feature).getListedPriceIrr()).isEqualByComparingTo("700000");
    }

    @Test
    @DisplayName("SEL-003: Listings below 80% are refused in both modes")
    void testPublicFloor() {
        Long sellerId = newUser();
        Feature feature = createFeature(sellerId);

        assertThatThrownBy(() -> sellRequestService.createSellRequest(sellerId, feature.getId(), null, null, 79))
                .isInstanceOfSatisfying(PriceBelowFloorException.class, e -> {
                    assertThat(e.getFloorPercentage()).isEqualTo(80);
                    assertThat(e.getActualPercentage()).isEqualTo(79);
                });
        assertThatThrownBy(() -> sellRequestService.createSellRequest(sellerId, feature.getId(),
                BigDecimal.ZERO, new BigDecimal("500000"), null))
                .isInstanceOfSatisfying(PriceBelowFloorException.class,
                        e -> assertThat(e.getActualPercentage()).isEqualTo(50));

        assertThat(reload(feature).getMarketStatus()).isEqualTo(MarketStatus.LISTED_UNPRICED);
        assertThat(sellRequestService.listSellRequests(sellerId)).isEmpty();
    }

    @Test
    @DisplayName("SEL-004: Minors list at 110% or more")
    void testMinorFloor() throws Exception {
        Long sellerId = newMinor("Young Owner");
        Feature feature = createFeature(sellerId);

        assertThatThrownBy(() -> sellRequestService.createSellRequest(sellerId, feature.getId(), null, null, 100))
                .isInstanceOfSatisfying(PriceBelowFloorException.class,
                        e -> assertThat(e.getFloorPercentage()).isEqualTo(110));

        SellRequest listing = sellRequestService.createSellRequest(sellerId, feature.getId(), null, null, 110);
        assertThat(listing.getFloorPercentage()).isEqualTo(110);
    }

    @Test
    @DisplayName("SEL-005: Feature bought by a minor refuses offers below 110%")
    void testMinorOwnerOfferFloor() throws Exception {
        Long sellerId = newUser();
        Long minorId = newMinor("Young Buyer");
        Long bidderId = newUser();
        Feature feature = createFeature(sellerId);
        sellRequestService.createSellRequest(sellerId, feature.getId(), null, null, 100);
        fund(minorId, "5250", "525000");
        fund(bidderId, "0", "2000000");

        featurePurchaseService.buyFeature(minorId, feature.getId());

        Feature owned = reload(feature);
        assertThat(owned.getMinimumPricePercentage()).isEqualTo(110);
        assertThat(owned.getLabel()).isEqualTo("Young Buyer");
        assertThatThrownBy(() -> buyRequestService.sendBuyRequest(bidderId, feature.getId(),
                BigDecimal.ZERO, new BigDecimal("1000000"), null))
                .isInstanceOfSatisfying(PriceBelowFloorException.class,
                        e -> assertThat(e.getFloorPercentage()).isEqualTo(110));
    }

    @Test
    @DisplayName("SEL-006: Only the owner lists, once, in exactly one pricing mode")
    void testListingRefusals() throws Exception {
        Long sellerId = newUser();
        Feature feature = createFeature(sellerId);

        assertThatThrownBy(() -> sellRequestService.createSellRequest(newUser(), feature.getId(), null, null, 90))
                .isInstanceOf(UnauthorizedActionException.class);
        assertThatThrownBy(() -> sellRequestService.createSellRequest(sellerId, feature.getId(),
                BigDecimal.ONE, BigDecimal.ONE, 90))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> sellRequestService.createSellRequest(sellerId, feature.getId(), null, null, null))
                .isInstanceOf(IllegalArgumentException.class);

        sellRequestService.createSellRequest(sellerId, feature.getId(), null, null, 90);

        assertThatThrownBy(() -> sellRequestService.createSellRequest(sellerId, feature.getId(), null, null, 95))
                .isInstanceOf(DuplicateRequestException.class);
    }

    @Test
    @DisplayName("SEL-007: Deleting a listing returns the feature to unpriced")
    void testDeleteListing() throws Exception {
        Long sellerId = newUser();
        Long buyerId = newUser();
        Feature feature = createFeature(sellerId);
        SellRequest listing = sellRequestService.createSellRequest(sellerId, feature.getId(), null, null, 90);

        assertThatThrownBy(() -> sellRequestService.deleteSellRequest(buyerId, listing.getId()))
                .isInstanceOf(UnauthorizedActionException.class);

        sellRequestService.deleteSellRequest(sellerId, listing.getId());

        assertThat(reload(feature).getMarketStatus()).isEqualTo(MarketStatus.LISTED_UNPRICED);
        assertThat(sellRequestService.listSellRequests(sellerId)).isEmpty();
        assertThatThrownBy(() -> sellRequestService.deleteSellRequest(sellerId, listing.getId()))
                .isInstanceOf(SellRequestNotFoundException.class);

        fund(buyerId, "10000", "1000000");
        assertThatThrownBy(() -> featurePurchaseService.buyFeature(buyerId, feature.getId()))
                .isInstanceOf(FeatureNotForSaleException.class);
    }

    @Test
    @DisplayName("SEL-008: Listings of a seller are returned newest first")
    void testListNewestFirst() throws Exception {
        Long sellerId = newUser();
        Feature older = createFeature(sellerId);
        Feature newer = createFeature(sellerId);

        SellRequest first = sellRequestService.createSellRequest(sellerId, older.getId(), null, null, 90);
        clock.advance(Duration.ofMinutes(1));
        SellRequest second = sellRequestService.createSellRequest(sellerId, newer.getId(), null, null, 120);

        assertThat(sellRequestService.listSellRequests(sellerId))
                .extracting(SellRequest::getId)
                .containsExactly(second.getId(), first.getId());
    }

    @Test
    @DisplayName("SEL-009: Explicit prices far above the valuation cap the implied percentage")
    void testExplicitListingFarAboveValuation() throws Exception {
        Long sellerId = newUser();
        Feature feature = createFeature(sellerId);

        SellRequest listing = sellRequestService.createSellRequest(sellerId, feature.getId(),
                BigDecimal.ZERO, new BigDecimal("50000000000000000"), null);

        assertThat(listing.getFloorPercentage()).isEqualTo(Integer.MAX_VALUE);
        assertThat(reload(feature).getMarketStatus()).isEqualTo(MarketStatus.LISTED_PRICED);
    }
}

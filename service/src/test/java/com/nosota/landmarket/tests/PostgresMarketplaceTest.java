package com.nosota.landmarket.tests;

import com.nosota.landmarket.TestBase;
import com.nosota.landmarket.api.model.Asset;
import com.nosota.landmarket.api.model.BuyRequestStatus;
import com.nosota.landmarket.api.model.SellRequestStatus;
import com.nosota.landmarket.container.PostgresContainer;
import com.nosota.landmarket.error.FeatureNotForSaleException;
import com.nosota.landmarket.model.BuyRequest;
import com.nosota.landmarket.model.Feature;
import com.nosota.landmarket.model.SellRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Settlement flows against PostgreSQL, the production database.
 * Skipped when Docker is not available.
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("PostgreSQL Marketplace Tests")
public class PostgresMarketplaceTest extends TestBase {

    @DynamicPropertySource
    static void postgresProperties(DynamicPropertyRegistry registry) {
        PostgresContainer postgres = PostgresContainer.getInstance();
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.datasource.driver-class-name", () -> "org.postgresql.Driver");
    }

    @Test
    @DisplayName("PG-001: Accepted offer settles and closes competing offers")
    void testAcceptOnPostgres() throws Exception {
        Long sellerId = newUser();
        Long buyerId = newUser();
        Long rivalId = newUser();
        Feature feature = createFeature(sellerId);
        fund(buyerId, "0", "1000000");
        fund(rivalId, "0", "1000000");

        BuyRequest offer = buyRequestService.sendBuyRequest(buyerId, feature.getId(),
                BigDecimal.ZERO, new BigDecimal("800000"), null);
        BuyRequest rival = buyRequestService.sendBuyRequest(rivalId, feature.getId(),
                BigDecimal.ZERO, new BigDecimal("850000"), null);

        BuyRequest accepted = buyRequestService.acceptBuyRequest(sellerId, offer.getId());

        assertThat(accepted.getStatus()).isEqualTo(BuyRequestStatus.ACCEPTED);
        assertThat(reload(feature).getOwnerId()).isEqualTo(buyerId);
        assertThat(balance(sellerId, Asset.IRR)).isEqualByComparingTo("760000");
        assertThat(balance(rivalId, Asset.IRR)).isEqualByComparingTo("1000000");
        assertThat(buyRequestRepository.findById(rival.getId()).orElseThrow().getStatus())
                .isEqualTo(BuyRequestStatus.CANCELLED);
    }

    @Test
    @DisplayName("PG-002: Second purchase of a sold listing is refused")
    void testSoldListingOnPostgres() throws Exception {
        Long sellerId = newUser();
        Long buyerId = newUser();
        Long lateBuyer = newUser();
        Feature feature = createFeature(sellerId);
        sellRequestService.createSellRequest(sellerId, feature.getId(), null, null, 100);
        fund(buyerId, "5250", "525000");
        fund(lateBuyer, "5250", "525000");

        featurePurchaseService.buyFeature(buyerId, feature.getId());

        assertThat(reload(feature).getOwnerId()).isEqualTo(buyerId);
        assertThat(sellRequestService.listSellRequests(sellerId))
                .extracting(SellRequest::getStatus)
                .containsExactly(SellRequestStatus.COMPLETED);

        assertThatThrownBy(() -> featurePurchaseService.buyFeature(lateBuyer, feature.getId()))
                .isInstanceOf(FeatureNotForSaleException.class);
        assertThat(balance(lateBuyer, Asset.PSC)).isEqualByComparingTo("5250");
        assertThat(balance(lateBuyer, Asset.IRR)).isEqualByComparingTo("525000");
    }
}

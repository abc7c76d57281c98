package com.nosota.landmarket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nosota.landmarket.api.model.Asset;
import com.nosota.landmarket.api.model.MarketStatus;
import com.nosota.landmarket.api.model.PropertyCategory;
import com.nosota.landmarket.model.Feature;
import com.nosota.landmarket.model.MarketVariable;
import com.nosota.landmarket.model.UserProfile;
import com.nosota.landmarket.repository.*;
import com.nosota.landmarket.service.*;
import com.nosota.landmarket.support.InMemoryLedger;
import com.nosota.landmarket.support.MutableClock;
import com.nosota.landmarket.support.TestMarketplaceConfig;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicLong;

@SpringBootTest(
        classes = LandMarketApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {"spring.main.allow-bean-definition-overriding=true"}
)
@AutoConfigureMockMvc
@Import(TestMarketplaceConfig.class)
@ActiveProfiles("test")
public abstract class TestBase {

    /**
     * IRR value of one unit of PSC in tests.
     */
    protected static final BigDecimal PSC_RATE = new BigDecimal("100");

    /**
     * IRR value of one unit of any color resource in tests.
     */
    protected static final BigDecimal COLOR_RATE = new BigDecimal("1000");

    @Autowired
    protected FeaturePurchaseService featurePurchaseService;

    @Autowired
    protected BuyRequestService buyRequestService;

    @Autowired
    protected SellRequestService sellRequestService;

    @Autowired
    protected EscrowStore escrowStore;

    @Autowired
    protected TradeLedgerService tradeLedgerService;

    @Autowired
    protected UnderpricedCooldownChecker cooldownChecker;

    @Autowired
    protected FeatureRepository featureRepository;

    @Autowired
    protected BuyRequestRepository buyRequestRepository;

    @Autowired
    protected SellRequestRepository sellRequestRepository;

    @Autowired
    protected ReconciliationIncidentRepository incidentRepository;

    @Autowired
    protected MarketVariableRepository marketVariableRepository;

    @Autowired
    protected UserProfileRepository userProfileRepository;

    @Autowired
    protected InMemoryLedger ledger;

    @Autowired
    protected MutableClock clock;

    @Autowired
    protected MockMvc mockMvc;

    @Autowired
    protected ObjectMapper objectMapper;

    @Value("${marketplace.platform-user-id}")
    protected Long platformUserId;

    // Counter for generating unique user IDs in tests, clear of the platform account
    private static final AtomicLong userIdCounter = new AtomicLong(1000);

    @BeforeEach
    void resetMarket() {
        ledger.reset();
        clock.reset();
        marketVariableRepository.save(new MarketVariable(Asset.PSC.symbol(), PSC_RATE));
        marketVariableRepository.save(new MarketVariable(Asset.YELLOW.symbol(), COLOR_RATE));
        marketVariableRepository.save(new MarketVariable(Asset.RED.symbol(), COLOR_RATE));
        marketVariableRepository.save(new MarketVariable(Asset.BLUE.symbol(), COLOR_RATE));
    }

    protected Long newUser() {
        return userIdCounter.getAndIncrement();
    }

    protected Long newMinor(String displayName) {
        Long userId = newUser();
        userProfileRepository.save(new UserProfile(userId, displayName, LocalDate.now(clock).minusYears(12), null));
        return userId;
    }

    protected Long newAdult(String displayName, Integer withdrawProfitDays) {
        Long userId = newUser();
        userProfileRepository.save(new UserProfile(userId, displayName, LocalDate.now(clock).minusYears(30),
                withdrawProfitDays));
        return userId;
    }

    /**
     * Helper method to create a residential feature worth 1,000,000 IRR with the default 80% offer floor.
     */
    protected Feature createFeature(Long ownerId) {
        return createFeature(ownerId, PropertyCategory.RESIDENTIAL, new BigDecimal("1000"), MarketStatus.LISTED_UNPRICED);
    }

    protected Feature createFeature(Long ownerId, PropertyCategory category, BigDecimal stabilityValue,
                                    MarketStatus status) {
        Feature feature = new Feature();
        feature.setOwnerId(ownerId);
        feature.setCategory(category);
        feature.setStabilityValue(stabilityValue);
        feature.setMinimumPricePercentage(80);
        feature.setMarketStatus(status);
        feature.setLabel(String.valueOf(ownerId));
        return featureRepository.save(feature);
    }

    protected Feature reload(Feature feature) {
        return featureRepository.findById(feature.getId()).orElseThrow();
    }

    protected void fund(Long userId, String psc, String irr) {
        ledger.deposit(userId, Asset.PSC, new BigDecimal(psc));
        ledger.deposit(userId, Asset.IRR, new BigDecimal(irr));
    }

    protected BigDecimal balance(Long userId, Asset asset) {
        return ledger.balanceOf(userId, asset);
    }
}

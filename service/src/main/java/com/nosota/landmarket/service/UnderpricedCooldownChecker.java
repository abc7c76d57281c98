package com.nosota.landmarket.service;

import com.nosota.landmarket.api.model.SellRequestStatus;
import com.nosota.landmarket.dto.CooldownStatus;
import com.nosota.landmarket.error.UnderpricedCooldownActiveException;
import com.nosota.landmarket.model.SellRequest;
import com.nosota.landmarket.model.Trade;
import com.nosota.landmarket.repository.SellRequestRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Blocks a seller from selling again shortly after an underpriced sale.
 *
 * <p>The seller's most recent completed listing below 100% of the valuation is
 * looked up, then the seller's latest trade of that listing's feature. Listings
 * still pending are ignored. If that trade is
 * younger than the cooldown window the seller is restricted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UnderpricedCooldownChecker {

    static final int UNDERPRICED_THRESHOLD = 100;

    private final SellRequestRepository sellRequestRepository;
    private final TradeLedgerService tradeLedgerService;
    private final Clock clock;

    @Value("${marketplace.cooldown.underpriced-hours}")
    private long underpricedHours;

    public CooldownStatus check(Long sellerId) {
        Optional<SellRequest> underpriced = sellRequestRepository
                .findFirstBySellerIdAndStatusAndFloorPercentageLessThanOrderByCreatedAtDesc(
                        sellerId, SellRequestStatus.COMPLETED, UNDERPRICED_THRESHOLD);
        if (underpriced.isEmpty()) {
            return CooldownStatus.unrestricted();
        }

        Optional<Trade> trade = tradeLedgerService.latestTradeForSeller(sellerId, underpriced.get().getFeatureId());
        if (trade.isEmpty()) {
            return CooldownStatus.unrestricted();
        }

        Duration window = Duration.ofHours(underpricedHours);
        Duration elapsed = Duration.between(trade.get().getCreatedAt(), LocalDateTime.now(clock));
        if (elapsed.compareTo(window) >= 0) {
            return CooldownStatus.unrestricted();
        }
        return new CooldownStatus(true, window.minus(elapsed));
    }

    public void ensureNotRestricted(Long sellerId) throws UnderpricedCooldownActiveException {
        CooldownStatus status = check(sellerId);
        if (status.restricted()) {
            log.info("Seller {} is in underpriced cooldown for another {}", sellerId, status.remaining());
            throw new UnderpricedCooldownActiveException(status.remaining());
        }
    }
}

package com.nosota.landmarket.service;

import com.nosota.landmarket.api.model.Asset;
import com.nosota.landmarket.model.HourlyProfit;
import com.nosota.landmarket.repository.HourlyProfitRepository;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Row-level operations on {@link HourlyProfit} records.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HourlyProfitService {

    private final HourlyProfitRepository hourlyProfitRepository;
    private final Clock clock;

    /**
     * Re-points the feature's profit record to the new holder with a zero balance,
     * creating the record if the feature has none.
     *
     * @return What was accrued for the previous holder and must be paid out
     */
    @Transactional
    public ProfitHandover reassign(Long featureId, Long newHolderId, int withdrawDays, Asset resource) {
        LocalDateTime now = LocalDateTime.now(clock);
        Optional<HourlyProfit> existing = hourlyProfitRepository.findByFeatureIdForUpdate(featureId);

        if (existing.isEmpty()) {
            HourlyProfit created = new HourlyProfit(
                    null, featureId, newHolderId, resource, BigDecimal.ZERO,
                    now.plusDays(withdrawDays), true, now);
            hourlyProfitRepository.save(created);
            log.info("Created profit record of feature {} for holder {}", featureId, newHolderId);
            return new ProfitHandover(null, resource, BigDecimal.ZERO);
        }

        HourlyProfit profit = existing.get();
        ProfitHandover handover = new ProfitHandover(profit.getHolderId(), profit.getAsset(), profit.getAccruedAmount());

        profit.setHolderId(newHolderId);
        profit.setAccruedAmount(BigDecimal.ZERO);
        profit.setWithdrawDeadline(now.plusDays(withdrawDays));
        profit.setActive(true);
        profit.setUpdatedAt(now);
        hourlyProfitRepository.save(profit);

        log.info("Profit record of feature {} moved from {} to {}, flushed {} {}",
                featureId, handover.previousHolderId(), newHolderId, handover.amount(), handover.asset());
        return handover;
    }

    public Optional<HourlyProfit> findByFeature(Long featureId) {
        return hourlyProfitRepository.findByFeatureId(featureId);
    }

    /**
     * Balance taken from the previous holder during a reassignment.
     */
    public record ProfitHandover(Long previousHolderId, Asset asset, BigDecimal amount) {

        public boolean hasBalance() {
            return previousHolderId != null && amount != null && amount.signum() > 0;
        }
    }
}

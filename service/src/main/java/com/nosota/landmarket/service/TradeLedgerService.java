package com.nosota.landmarket.service;

import com.nosota.landmarket.model.Commission;
import com.nosota.landmarket.model.Trade;
import com.nosota.landmarket.repository.CommissionRepository;
import com.nosota.landmarket.repository.TradeRepository;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Insert-only history of completed transfers and the fees collected on them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TradeLedgerService {

    private final TradeRepository tradeRepository;
    private final CommissionRepository commissionRepository;
    private final Clock clock;

    @Transactional
    public Trade recordTrade(Long featureId, Long buyerId, Long sellerId, BigDecimal settledPsc, BigDecimal settledIrr) {
        Trade trade = new Trade(null, featureId, buyerId, sellerId, settledPsc, settledIrr, LocalDateTime.now(clock));
        Trade saved = tradeRepository.save(trade);
        log.info("Recorded trade {}: feature={}, seller={}, buyer={}, psc={}, irr={}",
                saved.getId(), featureId, sellerId, buyerId, settledPsc, settledIrr);
        return saved;
    }

    @Transactional
    public Commission recordCommission(UUID tradeId, BigDecimal feePsc, BigDecimal feeIrr) {
        Commission commission = new Commission(null, tradeId, feePsc, feeIrr, LocalDateTime.now(clock));
        Commission saved = commissionRepository.save(commission);
        log.info("Recorded commission for trade {}: psc={}, irr={}", tradeId, feePsc, feeIrr);
        return saved;
    }

    /**
     * Latest sale of a feature by a seller, used by the underpriced cooldown.
     */
    public Optional<Trade> latestTradeForSeller(Long sellerId, Long featureId) {
        return tradeRepository.findFirstBySellerIdAndFeatureIdOrderByCreatedAtDesc(sellerId, featureId);
    }

    public List<Trade> tradesOf(Long featureId) {
        return tradeRepository.findByFeatureIdOrderByCreatedAtDesc(featureId);
    }

    public Optional<Commission> commissionOf(UUID tradeId) {
        return commissionRepository.findByTradeId(tradeId);
    }
}

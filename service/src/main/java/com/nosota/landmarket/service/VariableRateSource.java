package com.nosota.landmarket.service;

import com.nosota.landmarket.api.model.Asset;
import com.nosota.landmarket.model.MarketVariable;
import com.nosota.landmarket.repository.MarketVariableRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * {@link RateSource} reading rates from the {@code market_variable} table,
 * keyed by the asset symbol. IRR is the unit of account and always rates 1.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VariableRateSource implements RateSource {

    private final MarketVariableRepository marketVariableRepository;

    @Override
    public BigDecimal rateOf(Asset asset) {
        if (asset == Asset.IRR) {
            return BigDecimal.ONE;
        }
        return marketVariableRepository.findById(asset.symbol())
                .map(MarketVariable::getValue)
                .orElseGet(() -> {
                    log.warn("No rate configured for {}, using 1", asset.symbol());
                    return BigDecimal.ONE;
                });
    }
}

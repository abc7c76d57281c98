package com.nosota.landmarket.service;

import com.nosota.landmarket.api.model.Asset;

import java.math.BigDecimal;

/**
 * Conversion rates of assets into IRR.
 */
public interface RateSource {

    BigDecimal rateOf(Asset asset);
}

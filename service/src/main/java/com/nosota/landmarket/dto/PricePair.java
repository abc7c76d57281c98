package com.nosota.landmarket.dto;

import java.math.BigDecimal;

/**
 * Amount expressed in both trading currencies.
 */
public record PricePair(BigDecimal psc, BigDecimal irr) {
}

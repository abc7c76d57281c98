package com.nosota.landmarket.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * Named numeric market parameter, e.g. the conversion rate of an asset into IRR.
 */
@Entity
@Table(name = "market_variable")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class MarketVariable {

    @Id
    @Column(name = "variable_name", updatable = false, nullable = false)
    private String name;

    @Column(name = "variable_value", nullable = false, precision = 38, scale = 8)
    private BigDecimal value;
}

package com.nosota.landmarket.model;

import com.nosota.landmarket.api.model.MarketStatus;
import com.nosota.landmarket.api.model.PropertyCategory;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * Land parcel traded on the marketplace.
 *
 * <p>The owner is changed only through a conditional update on the expected
 * current owner (see {@code FeatureRepository#transferOwnership}), never by
 * setting {@link #ownerId} on a loaded entity.
 */
@Entity
@Table(name = "feature")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Feature {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false)
    private PropertyCategory category;

    /**
     * Valuation of the feature in units of its category's color resource.
     */
    @Column(name = "stability_value", nullable = false, precision = 38, scale = 8)
    private BigDecimal stabilityValue;

    @Column(name = "listed_price_psc", precision = 38, scale = 8)
    private BigDecimal listedPricePsc;

    @Column(name = "listed_price_irr", precision = 38, scale = 8)
    private BigDecimal listedPriceIrr;

    /**
     * Lowest acceptable offer as a percentage of the valuation.
     */
    @Column(name = "minimum_price_percentage", nullable = false)
    private Integer minimumPricePercentage;

    @Enumerated(EnumType.STRING)
    @Column(name = "market_status", nullable = false)
    private MarketStatus marketStatus;

    /**
     * Display label, set to the owner's name on every transfer.
     */
    @Column(name = "label")
    private String label;

    @Version
    @Column(name = "version")
    private Long version;
}

package com.nosota.landmarket.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Rationing campaign over a range of feature ids.
 *
 * <p>While active, features in {@code [startFeatureId, endFeatureId]} are bought
 * from their owner at their stability value (when {@link #priceEnforced}) or for
 * free, and each user may buy at most {@link #individualBuyCount} of them when
 * {@link #individualBuyLimited} is set.
 */
@Entity
@Table(name = "feature_limit")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class FeatureLimit {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "title")
    private String title;

    @Column(name = "start_feature_id", nullable = false)
    private Long startFeatureId;

    @Column(name = "end_feature_id", nullable = false)
    private Long endFeatureId;

    @Column(name = "starts_at", nullable = false)
    private LocalDateTime startsAt;

    @Column(name = "ends_at", nullable = false)
    private LocalDateTime endsAt;

    @Column(name = "price_enforced", nullable = false)
    private boolean priceEnforced;

    @Column(name = "individual_buy_limited", nullable = false)
    private boolean individualBuyLimited;

    @Column(name = "individual_buy_count", nullable = false)
    private Integer individualBuyCount;

    @Column(name = "expired", nullable = false)
    private boolean expired;
}

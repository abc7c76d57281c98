package com.nosota.landmarket.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.GenericGenerator;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Completed transfer of a feature. Insert-only.
 *
 * <p>Settled amounts are the nominal price (fees excluded). Limited and
 * platform-owned purchases are recorded with zero settled amounts.
 */
@Entity
@Table(name = "trade", indexes = {
        @Index(name = "idx_trade_seller_feature", columnList = "seller_id, feature_id, created_at")
})
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Trade {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "feature_id", nullable = false)
    private Long featureId;

    @Column(name = "buyer_id", nullable = false)
    private Long buyerId;

    @Column(name = "seller_id", nullable = false)
    private Long sellerId;

    @Column(name = "settled_psc", nullable = false, precision = 38, scale = 8)
    private BigDecimal settledPsc;

    @Column(name = "settled_irr", nullable = false, precision = 38, scale = 8)
    private BigDecimal settledIrr;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}

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
 * Platform fee collected on a {@link Trade} (buyer fee plus seller fee). Insert-only.
 */
@Entity
@Table(name = "commission")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Commission {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "trade_id", nullable = false, unique = true)
    private UUID tradeId;

    @Column(name = "fee_psc", nullable = false, precision = 38, scale = 8)
    private BigDecimal feePsc;

    @Column(name = "fee_irr", nullable = false, precision = 38, scale = 8)
    private BigDecimal feeIrr;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}

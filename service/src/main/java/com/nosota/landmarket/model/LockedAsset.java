package com.nosota.landmarket.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Funds held in escrow for a pending buy request.
 *
 * <p>Keyed by the buy request id, so a request can never hold two locks.
 * Amounts are what was actually debited from the buyer: offered price plus buyer fee.
 */
@Entity
@Table(name = "locked_asset")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class LockedAsset {

    @Id
    @Column(name = "buy_request_id", updatable = false, nullable = false)
    private UUID buyRequestId;

    @Column(name = "feature_id", nullable = false)
    private Long featureId;

    @Column(name = "locked_psc", nullable = false, precision = 38, scale = 8)
    private BigDecimal lockedPsc;

    @Column(name = "locked_irr", nullable = false, precision = 38, scale = 8)
    private BigDecimal lockedIrr;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}

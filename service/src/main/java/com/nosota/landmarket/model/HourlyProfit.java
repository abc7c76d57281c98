package com.nosota.landmarket.model;

import com.nosota.landmarket.api.model.Asset;
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
 * Passive income accrued by a feature for its current holder.
 *
 * <p>The accrual itself is done elsewhere. This service only flushes the balance
 * to the previous owner and re-points the record when the feature changes hands.
 */
@Entity
@Table(name = "hourly_profit")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class HourlyProfit {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "feature_id", nullable = false, unique = true)
    private Long featureId;

    @Column(name = "holder_id", nullable = false)
    private Long holderId;

    @Enumerated(EnumType.STRING)
    @Column(name = "asset", nullable = false)
    private Asset asset;

    @Column(name = "accrued_amount", nullable = false, precision = 38, scale = 8)
    private BigDecimal accruedAmount;

    @Column(name = "withdraw_deadline", nullable = false)
    private LocalDateTime withdrawDeadline;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}

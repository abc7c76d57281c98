package com.nosota.landmarket.model;

import com.nosota.landmarket.api.model.SellRequestStatus;
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
 * Public listing of a feature by its owner.
 *
 * <p>A listing with {@code floorPercentage < 100} is underpriced: once the
 * feature is sold, the seller may not accept another offer until the
 * underpriced cooldown has elapsed.
 */
@Entity
@Table(name = "sell_request", indexes = {
        @Index(name = "idx_sell_request_seller_created", columnList = "seller_id, created_at"),
        @Index(name = "idx_sell_request_feature", columnList = "feature_id")
})
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class SellRequest {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "seller_id", nullable = false)
    private Long sellerId;

    @Column(name = "feature_id", nullable = false)
    private Long featureId;

    @Column(name = "ask_psc", nullable = false, precision = 38, scale = 8)
    private BigDecimal askPsc;

    @Column(name = "ask_irr", nullable = false, precision = 38, scale = 8)
    private BigDecimal askIrr;

    @Column(name = "floor_percentage", nullable = false)
    private Integer floorPercentage;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private SellRequestStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}

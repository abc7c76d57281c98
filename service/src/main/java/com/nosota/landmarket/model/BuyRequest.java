package com.nosota.landmarket.model;

import com.nosota.landmarket.api.model.BuyRequestStatus;
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
 * Offer of a buyer on a feature owned by someone else.
 *
 * <p>Prices are nominal: the escrowed amounts additionally include the buyer fee
 * and live in {@link LockedAsset}. A {@link BuyRequestStatus#PENDING} request
 * always has exactly one LockedAsset, any other status has none.
 *
 * <p>Status transitions go through conditional updates in
 * {@code BuyRequestRepository#transitionStatus} so concurrent accept, reject
 * and cancel can not both win.
 */
@Entity
@Table(name = "buy_request", indexes = {
        @Index(name = "idx_buy_request_feature_status", columnList = "feature_id, status"),
        @Index(name = "idx_buy_request_buyer", columnList = "buyer_id"),
        @Index(name = "idx_buy_request_seller", columnList = "seller_id")
})
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class BuyRequest {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "buyer_id", nullable = false)
    private Long buyerId;

    /**
     * Owner of the feature at the moment the offer was made.
     */
    @Column(name = "seller_id", nullable = false)
    private Long sellerId;

    @Column(name = "feature_id", nullable = false)
    private Long featureId;

    @Column(name = "price_psc", nullable = false, precision = 38, scale = 8)
    private BigDecimal pricePsc;

    @Column(name = "price_irr", nullable = false, precision = 38, scale = 8)
    private BigDecimal priceIrr;

    @Column(name = "note", length = 500)
    private String note;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private BuyRequestStatus status;

    @Column(name = "grace_period_deadline")
    private LocalDateTime gracePeriodDeadline;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /**
     * Soft delete marker, set when the request reaches a final status.
     */
    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;
}

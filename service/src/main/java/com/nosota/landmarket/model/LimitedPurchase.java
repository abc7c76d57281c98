package com.nosota.landmarket.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.GenericGenerator;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Purchase made under a {@link FeatureLimit} campaign. Counts towards the buyer's quota.
 */
@Entity
@Table(name = "limited_purchase", indexes = {
        @Index(name = "idx_limited_purchase_user_limit", columnList = "user_id, feature_limit_id")
})
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class LimitedPurchase {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "feature_id", nullable = false)
    private Long featureId;

    @Column(name = "feature_limit_id", nullable = false)
    private Long featureLimitId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}

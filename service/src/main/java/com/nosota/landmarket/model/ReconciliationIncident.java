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
 * Money movement that could not be completed automatically and needs manual
 * reconciliation against the ledger. The idempotency key lets operators
 * replay or look up the exact ledger call.
 */
@Entity
@Table(name = "reconciliation_incident")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class ReconciliationIncident {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false)
    private IncidentKind kind;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "asset", nullable = false)
    private Asset asset;

    @Column(name = "amount", nullable = false, precision = 38, scale = 8)
    private BigDecimal amount;

    @Column(name = "idempotency_key", nullable = false)
    private String idempotencyKey;

    @Column(name = "related_entity_type")
    private String relatedEntityType;

    @Column(name = "related_entity_id")
    private String relatedEntityId;

    @Column(name = "detail", length = 1000)
    private String detail;

    @Column(name = "resolved", nullable = false)
    private boolean resolved;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}

package com.nosota.landmarket.service;

import com.nosota.landmarket.api.model.Asset;
import com.nosota.landmarket.model.IncidentKind;
import com.nosota.landmarket.model.ReconciliationIncident;
import com.nosota.landmarket.repository.ReconciliationIncidentRepository;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Persists money movements that need manual reconciliation.
 *
 * <p>Incidents are written in their own transaction so they survive a rollback
 * of the operation that produced them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationIncidentService {

    private final ReconciliationIncidentRepository incidentRepository;
    private final Clock clock;

    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public void record(IncidentKind kind, Long userId, Asset asset, BigDecimal amount, String idempotencyKey,
                       String relatedEntityType, String relatedEntityId, String detail) {
        log.error("Reconciliation incident {}: user={}, asset={}, amount={}, key={}, related={}:{}, detail={}",
                kind, userId, asset, amount, idempotencyKey, relatedEntityType, relatedEntityId, detail);

        ReconciliationIncident incident = new ReconciliationIncident(
                null,
                kind,
                userId,
                asset,
                amount,
                idempotencyKey,
                relatedEntityType,
                relatedEntityId,
                truncate(detail),
                false,
                LocalDateTime.now(clock)
        );
        incidentRepository.save(incident);
    }

    private static String truncate(String detail) {
        if (detail == null || detail.length() <= 1000) {
            return detail;
        }
        return detail.substring(0, 1000);
    }
}

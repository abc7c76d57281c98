package com.nosota.landmarket.repository;

import com.nosota.landmarket.model.IncidentKind;
import com.nosota.landmarket.model.ReconciliationIncident;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ReconciliationIncidentRepository extends JpaRepository<ReconciliationIncident, UUID> {

    List<ReconciliationIncident> findByRelatedEntityId(String relatedEntityId);

    List<ReconciliationIncident> findByUserIdAndKind(Long userId, IncidentKind kind);
}

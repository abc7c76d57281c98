package com.nosota.landmarket.repository;

import com.nosota.landmarket.model.Commission;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface CommissionRepository extends JpaRepository<Commission, UUID> {

    Optional<Commission> findByTradeId(UUID tradeId);
}

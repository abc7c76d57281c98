package com.nosota.landmarket.repository;

import com.nosota.landmarket.model.MarketVariable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface MarketVariableRepository extends JpaRepository<MarketVariable, String> {
}

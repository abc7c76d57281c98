package com.nosota.landmarket.service;

import com.nosota.landmarket.error.DuplicateLockException;
import com.nosota.landmarket.error.EscrowNotFoundException;
import com.nosota.landmarket.model.LockedAsset;
import com.nosota.landmarket.repository.LockedAssetRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.PersistenceException;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Escrow bookkeeping of pending buy requests.
 *
 * <p>The store only records what was debited from the buyer; the money itself
 * sits with the platform on the external ledger. A lock exists exactly while its
 * buy request is pending.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class EscrowStore {

    private final LockedAssetRepository lockedAssetRepository;
    private final Clock clock;

    @PersistenceContext
    private EntityManager entityManager;

    /**
     * Records the amounts held for a buy request.
     *
     * @throws DuplicateLockException if the request already holds a lock
     */
    @Transactional(rollbackOn = DuplicateLockException.class)
    public LockedAsset lock(@NotNull UUID buyRequestId, @NotNull Long featureId,
                            @NotNull BigDecimal lockedPsc, @NotNull BigDecimal lockedIrr) throws DuplicateLockException {
        LockedAsset lockedAsset = new LockedAsset(buyRequestId, featureId, lockedPsc, lockedIrr, LocalDateTime.now(clock));
        try {
            // Insert only: the primary key on buy_request_id rejects a second lock
            entityManager.persist(lockedAsset);
            entityManager.flush();
        } catch (PersistenceException e) {
            throw new DuplicateLockException("Escrow already exists for buy request " + buyRequestId, e);
        }
        log.info("Locked escrow for buy request {}: psc={}, irr={}", buyRequestId, lockedPsc, lockedIrr);
        return lockedAsset;
    }

    public LockedAsset get(@NotNull UUID buyRequestId) throws EscrowNotFoundException {
        return lockedAssetRepository.findById(buyRequestId)
                .orElseThrow(() -> new EscrowNotFoundException("No escrow for buy request " + buyRequestId));
    }

    public Optional<LockedAsset> find(@NotNull UUID buyRequestId) {
        return lockedAssetRepository.findById(buyRequestId);
    }

    public boolean exists(@NotNull UUID buyRequestId) {
        return lockedAssetRepository.existsById(buyRequestId);
    }

    /**
     * Deletes the lock of a buy request. Releasing an absent lock is a no-op.
     *
     * @return true if a lock was deleted
     */
    @Transactional
    public boolean release(@NotNull UUID buyRequestId) {
        boolean released = lockedAssetRepository.deleteByBuyRequestId(buyRequestId) > 0;
        if (released) {
            log.info("Released escrow of buy request {}", buyRequestId);
        } else {
            log.debug("Escrow of buy request {} already released", buyRequestId);
        }
        return released;
    }
}

package com.nosota.landmarket.service;

import com.nosota.landmarket.api.model.BuyRequestStatus;
import com.nosota.landmarket.dto.PricePair;
import com.nosota.landmarket.error.BuyRequestNotFoundException;
import com.nosota.landmarket.error.DuplicateLockException;
import com.nosota.landmarket.error.MarketplaceException;
import com.nosota.landmarket.error.RequestNotPendingException;
import com.nosota.landmarket.model.BuyRequest;
import com.nosota.landmarket.repository.BuyRequestRepository;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Local, atomic writes on buy requests and their escrow rows.
 *
 * <p>No method here talks to the ledger, so no transaction is held open while
 * money moves.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BuyRequestStore {

    private final BuyRequestRepository buyRequestRepository;
    private final EscrowStore escrowStore;
    private final Clock clock;

    public BuyRequest get(UUID id) throws BuyRequestNotFoundException {
        return buyRequestRepository.findById(id)
                .orElseThrow(() -> new BuyRequestNotFoundException("Buy request not found: " + id));
    }

    /**
     * Persists a pending request together with its escrow row.
     *
     * @param draft  Request without id, status and timestamps
     * @param locked Amounts debited from the buyer
     */
    @Transactional(rollbackOn = MarketplaceException.class)
    public BuyRequest openPending(BuyRequest draft, PricePair locked) throws DuplicateLockException {
        LocalDateTime now = LocalDateTime.now(clock);
        draft.setStatus(BuyRequestStatus.PENDING);
        draft.setCreatedAt(now);
        draft.setUpdatedAt(now);

        BuyRequest saved = buyRequestRepository.saveAndFlush(draft);
        escrowStore.lock(saved.getId(), saved.getFeatureId(), locked.psc(), locked.irr());
        log.info("Opened buy request {}: buyer={}, feature={}", saved.getId(), saved.getBuyerId(), saved.getFeatureId());
        return saved;
    }

    /**
     * Conditionally moves a request between statuses.
     *
     * @return true if the request was in {@code from} and now is in {@code to}
     */
    @Transactional
    public boolean transition(UUID id, BuyRequestStatus from, BuyRequestStatus to) {
        boolean moved = buyRequestRepository.transitionStatus(id, from, to, LocalDateTime.now(clock)) == 1;
        if (moved) {
            log.debug("Buy request {} moved {} -> {}", id, from, to);
        }
        return moved;
    }

    /**
     * Releases the escrow of a request that reached a final status and soft-deletes it.
     */
    @Transactional
    public void close(UUID id) {
        escrowStore.release(id);
        buyRequestRepository.markDeleted(id, LocalDateTime.now(clock));
    }

    @Transactional(rollbackOn = MarketplaceException.class)
    public BuyRequest updateGracePeriod(UUID id, LocalDateTime deadline)
            throws BuyRequestNotFoundException, RequestNotPendingException {
        BuyRequest request = get(id);
        if (request.getStatus() != BuyRequestStatus.PENDING) {
            throw new RequestNotPendingException("Buy request " + id + " is " + request.getStatus());
        }
        request.setGracePeriodDeadline(deadline);
        request.setUpdatedAt(LocalDateTime.now(clock));
        return buyRequestRepository.save(request);
    }

    public boolean hasPending(Long buyerId, Long featureId) {
        return buyRequestRepository.existsByBuyerIdAndFeatureIdAndStatus(buyerId, featureId, BuyRequestStatus.PENDING);
    }

    public List<BuyRequest> pendingForFeature(Long featureId) {
        return buyRequestRepository.findByFeatureIdAndStatus(featureId, BuyRequestStatus.PENDING);
    }

    public List<BuyRequest> pendingSentBy(Long buyerId) {
        return buyRequestRepository.findByBuyerIdAndStatusAndDeletedAtIsNullOrderByCreatedAtDesc(
                buyerId, BuyRequestStatus.PENDING);
    }

    public List<BuyRequest> pendingReceivedBy(Long sellerId) {
        return buyRequestRepository.findBySellerIdAndStatusAndDeletedAtIsNullOrderByCreatedAtDesc(
                sellerId, BuyRequestStatus.PENDING);
    }
}

package com.nosota.landmarket.tests;

import com.nosota.landmarket.TestBase;
import com.nosota.landmarket.error.DuplicateLockException;
import com.nosota.landmarket.error.EscrowNotFoundException;
import com.nosota.landmarket.model.LockedAsset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Escrow Store Tests")
public class EscrowStoreTest extends TestBase {

    @Test
    @DisplayName("ESC-001: Lock records the held amounts")
    void testLockAndGet() throws Exception {
        UUID requestId = UUID.randomUUID();

        escrowStore.lock(requestId, 7L, new BigDecimal("42"), new BigDecimal("940800"));

        LockedAsset locked = escrowStore.get(requestId);
        assertThat(locked.getFeatureId()).isEqualTo(7L);
        assertThat(locked.getLockedPsc()).isEqualByComparingTo("42");
        assertThat(locked.getLockedIrr()).isEqualByComparingTo("940800");
        assertThat(escrowStore.exists(requestId)).isTrue();
    }

    @Test
    @DisplayName("ESC-002: A request can not hold two locks")
    void testDuplicateLock() throws Exception {
        UUID requestId = UUID.randomUUID();
        escrowStore.lock(requestId, 7L, BigDecimal.ONE, BigDecimal.ONE);

        assertThatThrownBy(() -> escrowStore.lock(requestId, 7L, BigDecimal.TEN, BigDecimal.TEN))
                .isInstanceOf(DuplicateLockException.class);

        assertThat(escrowStore.get(requestId).getLockedPsc()).isEqualByComparingTo("1");
    }

    @Test
    @DisplayName("ESC-003: Release is idempotent")
    void testReleaseIdempotent() throws Exception {
        UUID requestId = UUID.randomUUID();
        escrowStore.lock(requestId, 7L, BigDecimal.ONE, BigDecimal.ONE);

        assertThat(escrowStore.release(requestId)).isTrue();
        assertThat(escrowStore.release(requestId)).isFalse();
        assertThat(escrowStore.exists(requestId)).isFalse();
    }

    @Test
    @DisplayName("ESC-004: Getting a missing lock fails")
    void testMissingLock() {
        UUID requestId = UUID.randomUUID();

        assertThatThrownBy(() -> escrowStore.get(requestId))
                .isInstanceOf(EscrowNotFoundException.class);
        assertThat(escrowStore.find(requestId)).isEmpty();
    }

    @Test
    @DisplayName("ESC-005: Concurrent locks of one request keep one and refuse the other")
    void testConcurrentLocks() throws Exception {
        UUID requestId = UUID.randomUUID();
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<Exception> small = executor.submit(() -> lockAfter(start, requestId, BigDecimal.ONE));
            Future<Exception> large = executor.submit(() -> lockAfter(start, requestId, BigDecimal.TEN));
            start.countDown();

            List<Exception> errors = new ArrayList<>();
            errors.add(small.get(30, TimeUnit.SECONDS));
            errors.add(large.get(30, TimeUnit.SECONDS));

            assertThat(errors).filteredOn(Objects::isNull).hasSize(1);
            assertThat(errors).filteredOn(Objects::nonNull)
                    .singleElement()
                    .isInstanceOf(DuplicateLockException.class);

            BigDecimal expected = errors.get(0) == null ? BigDecimal.ONE : BigDecimal.TEN;
            assertThat(escrowStore.get(requestId).getLockedPsc()).isEqualByComparingTo(expected);
        } finally {
            executor.shutdownNow();
        }
    }

    private Exception lockAfter(CountDownLatch start, UUID requestId, BigDecimal amount) throws InterruptedException {
        start.await();
        try {
            escrowStore.lock(requestId, 7L, amount, amount);
            return null;
        } catch (Exception e) {
            return e;
        }
    }
}

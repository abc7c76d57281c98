package com.nosota.landmarket.client;

import com.nosota.landmarket.api.model.Asset;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.net.ConnectException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * WebClient-based {@link LedgerGateway} talking to the commercial (wallet) service.
 *
 * <p>Failure mapping:
 * <ul>
 *   <li>422 - {@link LedgerRejectedException} with {@link LedgerRejectReason#INSUFFICIENT_FUNDS}</li>
 *   <li>other 4xx - {@link LedgerRejectedException} with {@link LedgerRejectReason#REJECTED}</li>
 *   <li>503, connection refused - {@link LedgerUnavailableException}</li>
 *   <li>timeout, other 5xx, broken connection - {@link LedgerOutcomeUnknownException}</li>
 * </ul>
 */
@RequiredArgsConstructor
@Slf4j
public class CommercialLedgerClient implements LedgerGateway {

    public static final String IDEMPOTENCY_HEADER = "Idempotency-Key";

    private final WebClient webClient;
    private final Duration timeout;

    @Override
    public boolean checkBalance(Long userId, Asset asset, BigDecimal amount) throws LedgerClientException {
        log.debug("Calling checkBalance: userId={}, asset={}, amount={}", userId, asset, amount);

        BalanceCheckResponse response = execute("checkBalance", webClient.post()
                .uri("/api/v1/balances/check")
                .bodyValue(new MovementRequest(userId, asset.symbol(), amount))
                .retrieve()
                .bodyToMono(BalanceCheckResponse.class));
        return response != null && response.sufficient();
    }

    @Override
    public void debit(Long userId, Asset asset, BigDecimal amount, String idempotencyKey) throws LedgerClientException {
        log.debug("Calling debit: userId={}, asset={}, amount={}, key={}", userId, asset, amount, idempotencyKey);

        execute("debit", webClient.post()
                .uri("/api/v1/debits")
                .header(IDEMPOTENCY_HEADER, idempotencyKey)
                .bodyValue(new MovementRequest(userId, asset.symbol(), amount))
                .retrieve()
                .toBodilessEntity());
    }

    @Override
    public void credit(Long userId, Asset asset, BigDecimal amount, String idempotencyKey) throws LedgerClientException {
        log.debug("Calling credit: userId={}, asset={}, amount={}, key={}", userId, asset, amount, idempotencyKey);

        execute("credit", webClient.post()
                .uri("/api/v1/credits")
                .header(IDEMPOTENCY_HEADER, idempotencyKey)
                .bodyValue(new MovementRequest(userId, asset.symbol(), amount))
                .retrieve()
                .toBodilessEntity());
    }

    @Override
    public void recordTransaction(LedgerTransaction transaction) throws LedgerClientException {
        log.debug("Calling recordTransaction: userId={}, related={}:{}",
                transaction.userId(), transaction.relatedEntityType(), transaction.relatedEntityId());

        execute("recordTransaction", webClient.post()
                .uri("/api/v1/transactions")
                .header(IDEMPOTENCY_HEADER, transaction.idempotencyKey() + ":record")
                .bodyValue(new TransactionRecordRequest(
                        transaction.userId(),
                        transaction.asset().symbol(),
                        transaction.amount(),
                        transaction.direction().name().toLowerCase(),
                        transaction.relatedEntityType(),
                        transaction.relatedEntityId()))
                .retrieve()
                .toBodilessEntity());
    }

    private <T> T execute(String operation, Mono<T> call) throws LedgerClientException {
        try {
            return call.timeout(timeout).block();
        } catch (WebClientResponseException e) {
            throw translate(operation, e);
        } catch (WebClientRequestException e) {
            if (isConnectFailure(e)) {
                throw new LedgerUnavailableException("Ledger " + operation + " could not connect", e);
            }
            throw new LedgerOutcomeUnknownException("Ledger " + operation + " connection failed mid-call", e);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                throw new LedgerOutcomeUnknownException("Ledger " + operation + " timed out after " + timeout, cause);
            }
            throw new LedgerOutcomeUnknownException("Ledger " + operation + " failed unexpectedly", cause);
        }
    }

    private LedgerClientException translate(String operation, WebClientResponseException e) {
        HttpStatus status = HttpStatus.resolve(e.getStatusCode().value());
        String detail = "Ledger " + operation + " answered " + e.getStatusCode().value();

        if (status == HttpStatus.UNPROCESSABLE_ENTITY) {
            return new LedgerRejectedException(LedgerRejectReason.INSUFFICIENT_FUNDS, detail, e);
        }
        if (e.getStatusCode().is4xxClientError()) {
            return new LedgerRejectedException(LedgerRejectReason.REJECTED, detail, e);
        }
        if (status == HttpStatus.SERVICE_UNAVAILABLE) {
            return new LedgerUnavailableException(detail, e);
        }
        return new LedgerOutcomeUnknownException(detail, e);
    }

    private static boolean isConnectFailure(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof ConnectException) {
                return true;
            }
        }
        return false;
    }

    public record MovementRequest(Long userId, String asset, BigDecimal amount) {
    }

    public record BalanceCheckResponse(boolean sufficient) {
    }

    public record TransactionRecordRequest(
            Long userId,
            String asset,
            BigDecimal amount,
            String action,
            String relatedEntityType,
            String relatedEntityId) {
    }
}

package com.nosota.landmarket.client;

import com.nosota.landmarket.api.model.Asset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.ConnectException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests of the HTTP ledger client's failure classification.
 */
@DisplayName("Commercial Ledger Client Tests")
public class CommercialLedgerClientTest {

    private static final BigDecimal AMOUNT = new BigDecimal("10");

    private final List<ClientRequest> requests = new ArrayList<>();

    private CommercialLedgerClient clientAnswering(ExchangeFunction exchange) {
        WebClient webClient = WebClient.builder()
                .baseUrl("http://ledger.local")
                .exchangeFunction(request -> {
                    requests.add(request);
                    return exchange.exchange(request);
                })
                .build();
        return new CommercialLedgerClient(webClient, Duration.ofMillis(200));
    }

    private CommercialLedgerClient clientAnswering(HttpStatus status) {
        return clientAnswering(request -> Mono.just(ClientResponse.create(status).build()));
    }

    @Test
    @DisplayName("LDG-001: Balance check reads the sufficiency flag")
    void testCheckBalance() throws Exception {
        CommercialLedgerClient client = clientAnswering(request -> Mono.just(ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body("{\"sufficient\":true}")
                .build()));

        assertThat(client.checkBalance(7L, Asset.PSC, AMOUNT)).isTrue();
        assertThat(requests).hasSize(1);
        assertThat(requests.get(0).url().getPath()).isEqualTo("/api/v1/balances/check");
    }

    @Test
    @DisplayName("LDG-002: Movements carry the idempotency key")
    void testIdempotencyHeader() throws Exception {
        CommercialLedgerClient client = clientAnswering(HttpStatus.OK);

        client.debit(7L, Asset.IRR, AMOUNT, "buy-request:1:lock:irr");
        client.credit(7L, Asset.IRR, AMOUNT, "buy-request:1:lock:irr:reverse");

        assertThat(requests).extracting(r -> r.headers().getFirst(CommercialLedgerClient.IDEMPOTENCY_HEADER))
                .containsExactly("buy-request:1:lock:irr", "buy-request:1:lock:irr:reverse");
        assertThat(requests).extracting(r -> r.url().getPath())
                .containsExactly("/api/v1/debits", "/api/v1/credits");
    }

    @Test
    @DisplayName("LDG-003: 422 is a definite insufficient funds rejection")
    void testInsufficientFunds() {
        CommercialLedgerClient client = clientAnswering(HttpStatus.UNPROCESSABLE_ENTITY);

        assertThatThrownBy(() -> client.debit(7L, Asset.PSC, AMOUNT, "k"))
                .isInstanceOfSatisfying(LedgerRejectedException.class,
                        e -> assertThat(e.getReason()).isEqualTo(LedgerRejectReason.INSUFFICIENT_FUNDS));
    }

    @Test
    @DisplayName("LDG-004: Other 4xx answers are plain rejections")
    void testRejected() {
        CommercialLedgerClient client = clientAnswering(HttpStatus.BAD_REQUEST);

        assertThatThrownBy(() -> client.credit(7L, Asset.PSC, AMOUNT, "k"))
                .isInstanceOfSatisfying(LedgerRejectedException.class,
                        e -> assertThat(e.getReason()).isEqualTo(LedgerRejectReason.REJECTED));
    }

    @Test
    @DisplayName("LDG-005: 503 means the ledger did not apply the call")
    void testServiceUnavailable() {
        CommercialLedgerClient client = clientAnswering(HttpStatus.SERVICE_UNAVAILABLE);

        assertThatThrownBy(() -> client.credit(7L, Asset.PSC, AMOUNT, "k"))
                .isInstanceOf(LedgerUnavailableException.class);
    }

    @Test
    @DisplayName("LDG-006: Other 5xx answers leave the outcome unknown")
    void testServerError() {
        CommercialLedgerClient client = clientAnswering(HttpStatus.INTERNAL_SERVER_ERROR);

        assertThatThrownBy(() -> client.debit(7L, Asset.PSC, AMOUNT, "k"))
                .isInstanceOf(LedgerOutcomeUnknownException.class);
    }

    @Test
    @DisplayName("LDG-007: Timeout leaves the outcome unknown")
    void testTimeout() {
        CommercialLedgerClient client = clientAnswering(request -> Mono.never());

        assertThatThrownBy(() -> client.debit(7L, Asset.PSC, AMOUNT, "k"))
                .isInstanceOf(LedgerOutcomeUnknownException.class);
    }

    @Test
    @DisplayName("LDG-008: Refused connection is unavailability, broken connection is unknown")
    void testConnectionFailures() {
        CommercialLedgerClient refused = clientAnswering(request -> Mono.error(new ConnectException("Connection refused")));
        assertThatThrownBy(() -> refused.credit(7L, Asset.PSC, AMOUNT, "k"))
                .isInstanceOf(LedgerUnavailableException.class);

        CommercialLedgerClient reset = clientAnswering(request -> Mono.error(new IOException("Connection reset")));
        assertThatThrownBy(() -> reset.credit(7L, Asset.PSC, AMOUNT, "k"))
                .isInstanceOf(LedgerOutcomeUnknownException.class);
    }
}

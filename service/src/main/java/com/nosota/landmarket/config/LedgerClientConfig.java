package com.nosota.landmarket.config;

import com.nosota.landmarket.client.CommercialLedgerClient;
import com.nosota.landmarket.client.LedgerGateway;
import com.nosota.landmarket.client.LedgerUnavailableException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wiring of the external ledger client and its payout retry policy.
 */
@Configuration
@Slf4j
public class LedgerClientConfig {

    @Bean
    public WebClient ledgerWebClient(WebClient.Builder builder,
                                     @Value("${marketplace.ledger.base-url}") String baseUrl) {
        return builder.baseUrl(baseUrl).build();
    }

    @Bean
    public LedgerGateway ledgerGateway(WebClient ledgerWebClient,
                                       @Value("${marketplace.ledger.timeout}") Duration timeout) {
        return new CommercialLedgerClient(ledgerWebClient, timeout);
    }

    /**
     * Retry of credits the ledger definitely did not apply. Ambiguous outcomes and
     * business rejections are not retried.
     */
    @Bean
    public Retry payoutRetry(@Value("${marketplace.ledger.payout-retry.max-attempts}") int maxAttempts,
                             @Value("${marketplace.ledger.payout-retry.wait}") Duration wait) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .waitDuration(wait)
                .retryExceptions(LedgerUnavailableException.class)
                .build();
        Retry retry = RetryRegistry.of(config).retry("ledger-payout");
        retry.getEventPublisher().onRetry(event ->
                log.warn("Retrying ledger credit, attempt {}: {}", event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        return retry;
    }
}

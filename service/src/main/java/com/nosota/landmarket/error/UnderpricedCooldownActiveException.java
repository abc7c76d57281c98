package com.nosota.landmarket.error;

import lombok.Getter;

import java.time.Duration;

/**
 * The seller recently sold a feature through an underpriced listing and may
 * not accept offers until the cooldown has elapsed.
 */
@Getter
public class UnderpricedCooldownActiveException extends MarketplaceException {

    private final Duration remaining;

    public UnderpricedCooldownActiveException(Duration remaining) {
        super(String.format("Selling is locked after an underpriced sale, try again in %d hours %d minutes",
                remaining.toHours(), remaining.toMinutesPart()));
        this.remaining = remaining;
    }
}

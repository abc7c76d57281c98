package com.nosota.landmarket.api.model;

/**
 * Assets moved by the marketplace through the external ledger.
 *
 * <p>{@link #PSC} and {@link #IRR} are the two currencies a feature is priced in.
 * The color resources are the stability assets of each property category.
 */
public enum Asset {
    /**
     * PSC: platform token, "currency A" of a price pair.
     */
    PSC("psc"),

    /**
     * IRR: fiat currency, "currency B" of a price pair. Rate is 1 by convention.
     */
    IRR("irr"),

    /**
     * YELLOW: color resource of residential features.
     */
    YELLOW("yellow"),

    /**
     * RED: color resource of commercial features.
     */
    RED("red"),

    /**
     * BLUE: color resource of educational features.
     */
    BLUE("blue");

    private final String symbol;

    Asset(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Lower-case code used on the ledger wire and as rate key.
     */
    public String symbol() {
        return symbol;
    }
}

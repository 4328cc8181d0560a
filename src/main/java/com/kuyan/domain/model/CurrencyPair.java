package com.kuyan.domain.model;

/**
 * Ordered currency pair - key of a {@link RateMap}
 * (from, to) means "1 unit of from is worth rate units of to"
 */
public record CurrencyPair(String from, String to) {

    public CurrencyPair {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Currency pair requires both currencies");
        }
    }

    public static CurrencyPair of(String from, String to) {
        return new CurrencyPair(from, to);
    }

    @Override
    public String toString() {
        return from + "_" + to;
    }
}

package com.kuyan.domain.model;

import java.math.BigDecimal;

/**
 * Outcome of converting one amount.
 * On a miss the amount is returned unconverted and the caller decides how to surface it.
 */
public record ConversionResult(BigDecimal amount, String from, String to, ConversionPath path) {

    public boolean isMiss() {
        return path == ConversionPath.MISS;
    }

    public CurrencyPair pair() {
        return CurrencyPair.of(from, to);
    }
}

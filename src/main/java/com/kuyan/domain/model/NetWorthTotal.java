package com.kuyan.domain.model;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Sum of balances in one target currency.
 * {@code misses} lists the pairs that could not be converted and were added unconverted.
 */
@Value
public class NetWorthTotal {
    String currency;
    BigDecimal amount;
    List<CurrencyPair> misses;

    public boolean isDegraded() {
        return !misses.isEmpty();
    }
}

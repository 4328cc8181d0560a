package com.kuyan.application.port.out;

import io.vertx.core.Future;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.Set;

/**
 * Output port for fetching exchange rates from an external source
 * Part of hexagonal architecture - defines what the application needs
 */
public interface ExchangeRateProvider {

    /**
     * Fetch rates from one base currency to a set of target currencies
     * @param baseCurrency Base currency code
     * @param targetCurrencies Target currency codes, never containing the base
     * @param date Date the rates should be effective for, null for the most recent rates
     * @return Map of target currency code to rate (1 base = rate target)
     */
    Future<Map<String, BigDecimal>> fetchRates(String baseCurrency, Set<String> targetCurrencies, LocalDate date);
}

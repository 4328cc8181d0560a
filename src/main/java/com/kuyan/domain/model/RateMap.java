package com.kuyan.domain.model;

import com.kuyan.domain.exception.MalformedRateMapException;
import lombok.EqualsAndHashCode;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Exchange rate table scoped to one as-of date.
 * <p>
 * Immutable once built. Every currency that appears in any key must carry a self pair
 * {@code (code, code) -> 1}; the table is otherwise allowed to be asymmetric or incomplete.
 */
@EqualsAndHashCode
public final class RateMap {

    private final LocalDate asOfDate;
    private final Map<CurrencyPair, BigDecimal> rates;

    private RateMap(LocalDate asOfDate, Map<CurrencyPair, BigDecimal> rates) {
        this.asOfDate = asOfDate;
        this.rates = Collections.unmodifiableMap(new LinkedHashMap<>(rates));
        verify();
    }

    public static RateMap of(LocalDate asOfDate, Map<CurrencyPair, BigDecimal> rates) {
        return new RateMap(asOfDate, rates);
    }

    public static Builder builder(LocalDate asOfDate) {
        return new Builder(asOfDate);
    }

    /**
     * Date the rates are effective for, null when they were fetched as "latest"
     */
    public LocalDate getAsOfDate() {
        return asOfDate;
    }

    public Optional<BigDecimal> rate(String from, String to) {
        return Optional.ofNullable(rates.get(CurrencyPair.of(from, to)));
    }

    public boolean contains(String from, String to) {
        return rates.containsKey(CurrencyPair.of(from, to));
    }

    public Set<String> currencies() {
        Set<String> codes = new LinkedHashSet<>();
        for (CurrencyPair pair : rates.keySet()) {
            codes.add(pair.from());
            codes.add(pair.to());
        }
        return codes;
    }

    public Map<CurrencyPair, BigDecimal> asMap() {
        return rates;
    }

    public int size() {
        return rates.size();
    }

    private void verify() {
        for (Map.Entry<CurrencyPair, BigDecimal> entry : rates.entrySet()) {
            BigDecimal rate = entry.getValue();
            if (rate == null || rate.signum() <= 0) {
                throw new MalformedRateMapException(
                        "Rate for " + entry.getKey() + " must be positive but was " + rate);
            }
        }
        for (String code : currencies()) {
            BigDecimal self = rates.get(CurrencyPair.of(code, code));
            if (self == null) {
                throw new MalformedRateMapException("Missing self pair for " + code + " in rate map as of " + asOfDate);
            }
            if (self.compareTo(BigDecimal.ONE) != 0) {
                throw new MalformedRateMapException("Self pair for " + code + " must be 1 but was " + self);
            }
        }
    }

    @Override
    public String toString() {
        return "RateMap{asOfDate=" + asOfDate + ", rates=" + rates + "}";
    }

    /**
     * Collects rates and seals them into an immutable {@link RateMap}
     */
    public static final class Builder {

        private final LocalDate asOfDate;
        private final Map<CurrencyPair, BigDecimal> rates = new LinkedHashMap<>();

        private Builder(LocalDate asOfDate) {
            this.asOfDate = asOfDate;
        }

        public Builder rate(String from, String to, BigDecimal rate) {
            rates.put(CurrencyPair.of(from, to), rate);
            return this;
        }

        public Builder selfPair(String code) {
            rates.put(CurrencyPair.of(code, code), BigDecimal.ONE);
            return this;
        }

        public RateMap build() {
            return new RateMap(asOfDate, rates);
        }
    }
}

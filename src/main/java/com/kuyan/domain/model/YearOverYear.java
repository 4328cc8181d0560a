package com.kuyan.domain.model;

import java.math.BigDecimal;
import java.time.Month;
import java.time.Year;
import java.util.Collections;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Series bucketed by year, each year laid out on a common January..December axis.
 * Only months with a recorded value are present.
 */
public final class YearOverYear {

    private final String currency;
    private final SortedMap<Year, SortedMap<Month, BigDecimal>> years;

    public YearOverYear(String currency, SortedMap<Year, SortedMap<Month, BigDecimal>> years) {
        this.currency = currency;
        SortedMap<Year, SortedMap<Month, BigDecimal>> copy = new TreeMap<>();
        years.forEach((year, months) -> copy.put(year, Collections.unmodifiableSortedMap(new TreeMap<>(months))));
        this.years = Collections.unmodifiableSortedMap(copy);
    }

    public String getCurrency() {
        return currency;
    }

    public Set<Year> years() {
        return years.keySet();
    }

    public SortedMap<Month, BigDecimal> monthsOf(Year year) {
        return years.getOrDefault(year, Collections.emptySortedMap());
    }

    public Optional<BigDecimal> valueAt(Year year, Month month) {
        return Optional.ofNullable(monthsOf(year).get(month));
    }

    public SortedMap<Year, SortedMap<Month, BigDecimal>> asMap() {
        return years;
    }

    public boolean isEmpty() {
        return years.isEmpty();
    }
}

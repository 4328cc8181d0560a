package com.kuyan.application.service;

import com.kuyan.domain.model.GrowthSeries;
import com.kuyan.domain.model.SeriesPoint;
import com.kuyan.domain.model.TimeSeries;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Rebases per-currency holdings to a baseline period (baseline = 100%).
 * <p>
 * Each currency is normalized on its own native totals. A zero baseline is replaced by 1,
 * so later values come out as {@code total * 100}: a known approximation of "infinite growth".
 * Periods before the baseline are not emitted.
 */
@Slf4j
public class GrowthNormalizer {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public GrowthSeries normalize(TimeSeries<Map<String, BigDecimal>> series, LocalDate baselineDate) {
        Set<String> currencies = new LinkedHashSet<>();
        for (SeriesPoint<Map<String, BigDecimal>> point : series.points()) {
            currencies.addAll(point.value().keySet());
        }
        return normalize(series, baselineDate, new ArrayList<>(currencies));
    }

    public GrowthSeries normalize(TimeSeries<Map<String, BigDecimal>> series, LocalDate baselineDate,
                                  List<String> currencies) {
        Map<String, BigDecimal> baselineTotals = series.valueAt(baselineDate)
                .orElseThrow(() -> new IllegalArgumentException("Baseline period " + baselineDate + " has no data"));

        Map<String, BigDecimal> baselines = new LinkedHashMap<>();
        Set<String> zeroBaselines = new LinkedHashSet<>();
        for (String currency : currencies) {
            BigDecimal baseline = baselineTotals.getOrDefault(currency, BigDecimal.ZERO);
            if (baseline.signum() <= 0) {
                log.debug("Zero baseline for {} on {}, substituting 1", currency, baselineDate);
                zeroBaselines.add(currency);
                baseline = BigDecimal.ONE;
            }
            baselines.put(currency, baseline);
        }

        Map<LocalDate, Map<String, BigDecimal>> normalized = new TreeMap<>();
        for (SeriesPoint<Map<String, BigDecimal>> point : series.points()) {
            if (point.date().isBefore(baselineDate)) {
                continue;
            }
            Map<String, BigDecimal> percentages = new LinkedHashMap<>();
            for (String currency : currencies) {
                BigDecimal total = point.value().getOrDefault(currency, BigDecimal.ZERO);
                percentages.put(currency, percentOf(total, baselines.get(currency)));
            }
            normalized.put(point.date(), Collections.unmodifiableMap(percentages));
        }

        log.debug("Normalized {} periods for {} against {}", normalized.size(), currencies, baselineDate);
        return new GrowthSeries(baselineDate, TimeSeries.of(normalized), Collections.unmodifiableSet(zeroBaselines));
    }

    private static BigDecimal percentOf(BigDecimal total, BigDecimal baseline) {
        return total.divide(baseline, ConversionEngine.PRECISION).multiply(HUNDRED);
    }
}

package com.kuyan.application.service;

import com.kuyan.application.port.out.ExchangeRateProvider;
import com.kuyan.domain.exception.RateSourceUnavailableException;
import com.kuyan.domain.model.RateMap;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the pairwise rate table for a set of currencies.
 * <p>
 * The rate source is asked once per base currency, sequentially. Results are merged and
 * every currency gets its self pair. A base whose request fails is skipped; only when every
 * request fails does the build fail with {@link RateSourceUnavailableException}.
 */
@Slf4j
public class RateTableBuilder {

    private final ExchangeRateProvider rateProvider;

    public RateTableBuilder(ExchangeRateProvider rateProvider) {
        this.rateProvider = rateProvider;
    }

    /**
     * @param currencies Currency codes to cover
     * @param asOfDate Date the rates should be effective for, null for latest
     */
    public Future<RateMap> build(Collection<String> currencies, LocalDate asOfDate) {
        Set<String> codes = new LinkedHashSet<>(currencies);
        if (codes.isEmpty()) {
            return Future.failedFuture(new IllegalArgumentException("At least one currency is required"));
        }

        log.info("Building rate table for {} as of {}", codes, asOfDate != null ? asOfDate : "latest");

        RateMap.Builder table = RateMap.builder(asOfDate);
        codes.forEach(table::selfPair);

        if (codes.size() == 1) {
            return Future.succeededFuture(table.build());
        }

        List<String> failedBases = new ArrayList<>();
        List<Throwable> failures = new ArrayList<>();

        // One attempt per base, issued one after another
        Future<Void> future = Future.succeededFuture();
        for (String base : codes) {
            Set<String> others = new LinkedHashSet<>(codes);
            others.remove(base);

            future = future.compose(v -> fetch(base, others, asOfDate)
                    .map(rates -> {
                        merge(table, base, others, rates);
                        return (Void) null;
                    })
                    .recover(error -> {
                        log.warn("Failed to fetch rates for base {} as of {}: {}", base, asOfDate, error.getMessage());
                        failedBases.add(base);
                        failures.add(error);
                        return Future.succeededFuture();
                    }));
        }

        return future.compose(v -> {
            if (failedBases.size() == codes.size()) {
                Throwable lastCause = failures.get(failures.size() - 1);
                return Future.failedFuture(new RateSourceUnavailableException(failedBases, asOfDate, lastCause));
            }
            RateMap rateMap = table.build();
            if (!failedBases.isEmpty()) {
                log.warn("Rate table as of {} is partial, missing bases {}", asOfDate, failedBases);
            }
            log.info("Built rate table with {} pairs as of {}", rateMap.size(), asOfDate);
            return Future.succeededFuture(rateMap);
        });
    }

    private Future<Map<String, BigDecimal>> fetch(String base, Set<String> targets, LocalDate asOfDate) {
        try {
            return rateProvider.fetchRates(base, targets, asOfDate);
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }
    }

    private void merge(RateMap.Builder table, String base, Set<String> requested, Map<String, BigDecimal> rates) {
        if (rates == null) {
            return;
        }
        for (Map.Entry<String, BigDecimal> entry : rates.entrySet()) {
            String target = entry.getKey();
            BigDecimal rate = entry.getValue();
            if (base.equals(target)) {
                continue;
            }
            if (!requested.contains(target)) {
                log.debug("Ignoring unrequested rate {}_{}", base, target);
                continue;
            }
            if (rate == null || rate.signum() <= 0) {
                log.warn("Discarding non-positive rate {}_{}: {}", base, target, rate);
                continue;
            }
            table.rate(base, target, rate);
        }
        log.debug("Merged {} rates for base {}", rates.size(), base);
    }
}

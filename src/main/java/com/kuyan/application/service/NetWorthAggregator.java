package com.kuyan.application.service;

import com.kuyan.domain.model.AccountValuation;
import com.kuyan.domain.model.Balance;
import com.kuyan.domain.model.ConversionResult;
import com.kuyan.domain.model.CurrencyPair;
import com.kuyan.domain.model.NetWorthTotal;
import com.kuyan.domain.model.RateMap;
import com.kuyan.domain.model.Snapshot;
import com.kuyan.domain.model.TimeSeries;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Sums balances into net worth figures.
 * <p>
 * Every balance is converted with the rate map pinned to its own snapshot, so a historical
 * total always recomputes to the same value whatever the current rates are.
 */
@Slf4j
public class NetWorthAggregator {

    private final ConversionEngine conversionEngine;

    public NetWorthAggregator(ConversionEngine conversionEngine) {
        this.conversionEngine = conversionEngine;
    }

    /**
     * Total of balances that all belong to the snapshot pinned to {@code pinnedRates}
     */
    public NetWorthTotal total(List<Balance> balances, String targetCurrency, RateMap pinnedRates) {
        BigDecimal sum = BigDecimal.ZERO;
        Set<CurrencyPair> misses = new LinkedHashSet<>();

        for (Balance balance : balances) {
            ConversionResult result = conversionEngine.convert(
                    balance.getAmount(), balance.getCurrency(), targetCurrency, pinnedRates);
            if (result.isMiss()) {
                misses.add(result.pair());
            }
            sum = sum.add(result.amount());
        }

        return new NetWorthTotal(targetCurrency, sum, List.copyOf(misses));
    }

    public NetWorthTotal total(Snapshot snapshot, String targetCurrency) {
        return total(snapshot.getBalances(), targetCurrency, snapshot.getRates());
    }

    /**
     * Combined total across several snapshots, each converted with its own pinned rates
     */
    public NetWorthTotal total(Collection<Snapshot> snapshots, String targetCurrency) {
        BigDecimal sum = BigDecimal.ZERO;
        Set<CurrencyPair> misses = new LinkedHashSet<>();

        for (Snapshot snapshot : snapshots) {
            NetWorthTotal snapshotTotal = total(snapshot, targetCurrency);
            sum = sum.add(snapshotTotal.getAmount());
            misses.addAll(snapshotTotal.getMisses());
        }

        return new NetWorthTotal(targetCurrency, sum, List.copyOf(misses));
    }

    /**
     * The same snapshot valued in each currency, keyed in the order given
     */
    public Map<String, NetWorthTotal> totalsByCurrency(Snapshot snapshot, List<String> currencies) {
        Map<String, NetWorthTotal> totals = new LinkedHashMap<>();
        for (String currency : currencies) {
            totals.put(currency, total(snapshot, currency));
        }
        return totals;
    }

    public List<AccountValuation> breakdown(Snapshot snapshot, String targetCurrency) {
        List<AccountValuation> lines = new ArrayList<>(snapshot.getBalances().size());
        for (Balance balance : snapshot.getBalances()) {
            ConversionResult result = conversionEngine.convert(
                    balance.getAmount(), balance.getCurrency(), targetCurrency, snapshot.getRates());
            lines.add(AccountValuation.builder()
                    .accountId(balance.getAccountId())
                    .accountName(balance.getAccountName())
                    .owner(balance.getOwner())
                    .accountType(balance.getAccountType())
                    .nativeCurrency(balance.getCurrency())
                    .nativeAmount(balance.getAmount())
                    .targetCurrency(targetCurrency)
                    .convertedAmount(result.amount())
                    .path(result.path())
                    .build());
        }
        return lines;
    }

    /**
     * Net worth per snapshot date
     */
    public TimeSeries<BigDecimal> history(Collection<Snapshot> snapshots, String targetCurrency) {
        Map<LocalDate, BigDecimal> points = new TreeMap<>();
        for (Snapshot snapshot : snapshots) {
            NetWorthTotal snapshotTotal = total(snapshot, targetCurrency);
            if (snapshotTotal.isDegraded()) {
                log.warn("Net worth for {} in {} includes unconverted amounts for {}",
                        snapshot.getSnapshotDate(), targetCurrency, snapshotTotal.getMisses());
            }
            points.put(snapshot.getSnapshotDate(), snapshotTotal.getAmount());
        }
        return TimeSeries.of(points);
    }

    /**
     * Unconverted total held in each currency per snapshot date.
     * Currencies without balances count as zero; balances in other currencies are ignored.
     */
    public TimeSeries<Map<String, BigDecimal>> nativeHoldings(Collection<Snapshot> snapshots, List<String> currencies) {
        Map<LocalDate, Map<String, BigDecimal>> points = new TreeMap<>();
        for (Snapshot snapshot : snapshots) {
            Map<String, BigDecimal> totals = new LinkedHashMap<>();
            currencies.forEach(currency -> totals.put(currency, BigDecimal.ZERO));

            for (Balance balance : snapshot.getBalances()) {
                if (totals.containsKey(balance.getCurrency())) {
                    totals.merge(balance.getCurrency(), balance.getAmount(), BigDecimal::add);
                } else {
                    log.debug("Ignoring {} balance of account {}, currency not enabled",
                            balance.getCurrency(), balance.getAccountId());
                }
            }
            points.put(snapshot.getSnapshotDate(), totals);
        }
        return TimeSeries.of(points);
    }
}

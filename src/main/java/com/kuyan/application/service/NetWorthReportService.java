package com.kuyan.application.service;

import com.kuyan.application.port.in.NetWorthReportUseCase;
import com.kuyan.application.port.out.SnapshotRepository;
import com.kuyan.domain.model.AccountValuation;
import com.kuyan.domain.model.GrowthSeries;
import com.kuyan.domain.model.NetWorthTotal;
import com.kuyan.domain.model.TimeSeries;
import com.kuyan.domain.model.YearOverYear;
import com.kuyan.infrastructure.config.ReportingSettings;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Use case implementation for net worth reporting
 * Reads snapshots from the store and runs them through the aggregation engine
 */
@Slf4j
public class NetWorthReportService implements NetWorthReportUseCase {

    private final SnapshotRepository snapshotRepository;
    private final NetWorthAggregator aggregator;
    private final GrowthNormalizer growthNormalizer;
    private final YearOverYearGrouper yearOverYearGrouper;
    private final ReportingSettings settings;

    public NetWorthReportService(
            SnapshotRepository snapshotRepository,
            NetWorthAggregator aggregator,
            GrowthNormalizer growthNormalizer,
            YearOverYearGrouper yearOverYearGrouper,
            ReportingSettings settings
    ) {
        this.snapshotRepository = snapshotRepository;
        this.aggregator = aggregator;
        this.growthNormalizer = growthNormalizer;
        this.yearOverYearGrouper = yearOverYearGrouper;
        this.settings = settings;
    }

    @Override
    public Future<Map<String, NetWorthTotal>> currentNetWorth() {
        return snapshotRepository.findLatest()
                .map(latest -> latest
                        .map(snapshot -> aggregator.totalsByCurrency(snapshot, settings.getCurrencies()))
                        .orElse(Collections.emptyMap()));
    }

    @Override
    public Future<List<AccountValuation>> breakdown(String currency) {
        return resolve(currency).compose(target -> snapshotRepository.findLatest()
                .map(latest -> latest
                        .map(snapshot -> aggregator.breakdown(snapshot, target))
                        .orElse(Collections.emptyList())));
    }

    @Override
    public Future<TimeSeries<BigDecimal>> history(String currency) {
        return resolve(currency).compose(target -> snapshotRepository.findAll()
                .map(snapshots -> aggregator.history(snapshots, target)));
    }

    @Override
    public Future<GrowthSeries> growth(YearMonth baselineMonth) {
        return snapshotRepository.findAll().compose(snapshots -> {
            TimeSeries<Map<String, BigDecimal>> holdings =
                    aggregator.nativeHoldings(snapshots, settings.getCurrencies());
            if (holdings.isEmpty()) {
                return Future.succeededFuture(
                        new GrowthSeries(null, TimeSeries.<Map<String, BigDecimal>>empty(), Set.of()));
            }

            LocalDate baselineDate = baselineMonth != null
                    ? baselineMonth.atDay(1)
                    : holdings.firstDate().orElseThrow();
            if (holdings.valueAt(baselineDate).isEmpty()) {
                return Future.failedFuture(new IllegalArgumentException(
                        "No snapshot exists for baseline month " + YearMonth.from(baselineDate)));
            }

            GrowthSeries growth = growthNormalizer.normalize(holdings, baselineDate, settings.getCurrencies());
            if (!growth.getZeroBaselineCurrencies().isEmpty()) {
                log.info("Growth baseline {} has no holdings in {}, values approximated",
                        baselineDate, growth.getZeroBaselineCurrencies());
            }
            return Future.succeededFuture(growth);
        });
    }

    @Override
    public Future<YearOverYear> yearOverYear(String currency) {
        return resolve(currency).compose(target -> history(target)
                .map(series -> yearOverYearGrouper.groupByYear(target, series)));
    }

    private Future<String> resolve(String currency) {
        try {
            return Future.succeededFuture(settings.resolveCurrency(currency));
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }
    }
}

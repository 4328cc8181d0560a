package com.kuyan.application.service;

import com.kuyan.application.port.in.SnapshotHistoryUseCase;
import com.kuyan.application.port.out.SnapshotRepository;
import com.kuyan.domain.exception.SnapshotNotFoundException;
import com.kuyan.domain.model.Snapshot;
import com.kuyan.domain.model.SnapshotDetail;
import com.kuyan.infrastructure.config.ReportingSettings;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Use case implementation for the snapshot log
 * A month is always valued with its own pinned rates
 */
@Slf4j
public class SnapshotHistoryService implements SnapshotHistoryUseCase {

    private final SnapshotRepository snapshotRepository;
    private final NetWorthAggregator aggregator;
    private final ReportingSettings settings;

    public SnapshotHistoryService(
            SnapshotRepository snapshotRepository,
            NetWorthAggregator aggregator,
            ReportingSettings settings
    ) {
        this.snapshotRepository = snapshotRepository;
        this.aggregator = aggregator;
        this.settings = settings;
    }

    @Override
    public Future<List<YearMonth>> listMonths() {
        return snapshotRepository.findAllDates()
                .map(dates -> dates.stream()
                        .map(YearMonth::from)
                        .collect(Collectors.toList()));
    }

    @Override
    public Future<SnapshotDetail> monthDetail(YearMonth month, String currency) {
        String target;
        try {
            target = settings.resolveCurrency(currency);
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }

        return snapshotRepository.findByDate(month.atDay(1))
                .compose(found -> toDetail(month, found, target));
    }

    @Override
    public Future<Void> deleteMonth(YearMonth month) {
        LocalDate snapshotDate = month.atDay(1);
        return snapshotRepository.existsForDate(snapshotDate)
                .compose(exists -> {
                    if (!exists) {
                        return Future.<Void>failedFuture(new SnapshotNotFoundException(month));
                    }
                    return snapshotRepository.deleteByDate(snapshotDate).<Void>mapEmpty();
                })
                .onSuccess(v -> log.info("Deleted snapshot for {}", month));
    }

    private Future<SnapshotDetail> toDetail(YearMonth month, Optional<Snapshot> found, String target) {
        if (found.isEmpty()) {
            return Future.failedFuture(new SnapshotNotFoundException(month));
        }
        Snapshot snapshot = found.get();
        return Future.succeededFuture(new SnapshotDetail(
                snapshot.getSnapshotDate(),
                aggregator.total(snapshot, target),
                aggregator.breakdown(snapshot, target),
                snapshot.getRates()
        ));
    }
}

package com.kuyan.application.service;

import com.kuyan.application.port.in.RecordSnapshotUseCase;
import com.kuyan.application.port.out.SnapshotRepository;
import com.kuyan.domain.model.Balance;
import com.kuyan.domain.model.RateMap;
import com.kuyan.domain.model.Snapshot;
import com.kuyan.infrastructure.config.ReportingSettings;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Use case implementation for recording a monthly snapshot
 * Flow: validate, fetch rates for the 1st of the month, pin them, replace the stored month
 */
@Slf4j
public class SnapshotRecordingService implements RecordSnapshotUseCase {

    private final SnapshotValidator validator;
    private final RateTableBuilder rateTableBuilder;
    private final SnapshotRepository snapshotRepository;
    private final ReportingSettings settings;
    private final Clock clock;

    public SnapshotRecordingService(
            SnapshotValidator validator,
            RateTableBuilder rateTableBuilder,
            SnapshotRepository snapshotRepository,
            ReportingSettings settings,
            Clock clock
    ) {
        this.validator = validator;
        this.rateTableBuilder = rateTableBuilder;
        this.snapshotRepository = snapshotRepository;
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public Future<Snapshot> recordSnapshot(RecordSnapshotCommand command) {
        ValidationResult validation = validator.validate(command, LocalDate.now(clock));
        if (!validation.isValid()) {
            log.warn("Rejected snapshot: {}", validation.errors());
            return Future.failedFuture(new IllegalArgumentException(
                    "Validation failed: " + String.join(", ", validation.errors())));
        }

        LocalDate snapshotDate = LocalDate.of(command.year(), command.month(), 1);
        log.info("Recording snapshot for {} with {} balances", snapshotDate, command.balances().size());

        return rateTableBuilder.build(settings.getCurrencies(), snapshotDate)
                .map(rates -> toSnapshot(snapshotDate, rates, command.balances()))
                .compose(snapshot -> replace(snapshot).map(snapshot))
                .onSuccess(snapshot -> log.info("Snapshot for {} stored with {} pinned rates",
                        snapshotDate, snapshot.getRates().size()))
                .onFailure(error -> log.error("Failed to record snapshot for {}: {}", snapshotDate, error.getMessage()));
    }

    /**
     * Overwriting a month is delete-then-recreate, a pinned rate map is never edited
     */
    private Future<Void> replace(Snapshot snapshot) {
        return snapshotRepository.deleteByDate(snapshot.getSnapshotDate())
                .compose(deleted -> {
                    if (deleted) {
                        log.info("Replacing existing snapshot for {}", snapshot.getSnapshotDate());
                    }
                    return snapshotRepository.save(snapshot);
                });
    }

    private Snapshot toSnapshot(LocalDate snapshotDate, RateMap rates, List<BalanceEntry> entries) {
        List<Balance> balances = entries.stream()
                .map(entry -> Balance.builder()
                        .accountId(entry.accountId())
                        .accountName(entry.accountName())
                        .owner(entry.owner())
                        .accountType(entry.accountType())
                        .currency(entry.currency())
                        .amount(entry.amount())
                        .snapshotDate(snapshotDate)
                        .build())
                .collect(Collectors.toList());
        return new Snapshot(snapshotDate, rates, balances);
    }
}

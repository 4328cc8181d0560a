package com.kuyan.application.port.in;

import com.kuyan.domain.model.Snapshot;
import io.vertx.core.Future;

import java.math.BigDecimal;
import java.util.List;

/**
 * Input port for recording the monthly balance snapshot
 */
public interface RecordSnapshotUseCase {

    /**
     * Record (or overwrite) the snapshot for one month.
     * Rates for the 1st of the month are fetched and pinned to the new snapshot.
     * @param command Month and account balances
     * @return Future with the stored snapshot
     */
    Future<Snapshot> recordSnapshot(RecordSnapshotCommand command);

    /**
     * Command object for snapshot recording
     */
    record RecordSnapshotCommand(
            Integer year,
            Integer month,
            List<BalanceEntry> balances
    ) {}

    record BalanceEntry(
            String accountId,
            String accountName,
            String owner,
            String accountType,
            String currency,
            BigDecimal amount
    ) {}
}

package com.kuyan.application.port.in;

import com.kuyan.domain.model.SnapshotDetail;
import io.vertx.core.Future;

import java.time.YearMonth;
import java.util.List;

/**
 * Input port for browsing and removing recorded months
 */
public interface SnapshotHistoryUseCase {

    /**
     * Months with a recorded snapshot, newest first
     */
    Future<List<YearMonth>> listMonths();

    /**
     * Fails with SnapshotNotFoundException when the month has no snapshot
     * @param currency Reporting currency, null or blank for the configured default
     */
    Future<SnapshotDetail> monthDetail(YearMonth month, String currency);

    /**
     * Fails with SnapshotNotFoundException when the month has no snapshot
     */
    Future<Void> deleteMonth(YearMonth month);
}

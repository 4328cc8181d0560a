package com.kuyan.application.port.out;

import com.kuyan.domain.model.Snapshot;
import io.vertx.core.Future;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Output port for snapshot storage
 * Snapshots are stored and removed whole, never updated in place
 */
public interface SnapshotRepository {

    Future<Void> save(Snapshot snapshot);

    Future<Optional<Snapshot>> findByDate(LocalDate snapshotDate);

    /**
     * Most recent snapshot, if any
     */
    Future<Optional<Snapshot>> findLatest();

    /**
     * All snapshots in ascending date order
     */
    Future<List<Snapshot>> findAll();

    /**
     * All snapshot dates, newest first
     */
    Future<List<LocalDate>> findAllDates();

    Future<Boolean> existsForDate(LocalDate snapshotDate);

    /**
     * @return true if a snapshot was removed
     */
    Future<Boolean> deleteByDate(LocalDate snapshotDate);
}

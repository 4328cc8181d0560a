package com.kuyan.adapter.out.persistence;

import com.kuyan.application.port.out.SnapshotRepository;
import com.kuyan.domain.model.Snapshot;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-memory implementation of SnapshotRepository, one snapshot per date
 */
@Slf4j
public class InMemorySnapshotPersistenceAdapter implements SnapshotRepository {

    private final ConcurrentNavigableMap<LocalDate, Snapshot> snapshots = new ConcurrentSkipListMap<>();

    @Override
    public Future<Void> save(Snapshot snapshot) {
        Snapshot existing = snapshots.putIfAbsent(snapshot.getSnapshotDate(), snapshot);
        if (existing != null) {
            return Future.failedFuture(new IllegalStateException(
                    "Snapshot for " + snapshot.getSnapshotDate() + " already exists, delete it first"));
        }
        log.debug("Saved snapshot for {} with {} balances", snapshot.getSnapshotDate(), snapshot.getBalances().size());
        return Future.succeededFuture();
    }

    @Override
    public Future<Optional<Snapshot>> findByDate(LocalDate snapshotDate) {
        return Future.succeededFuture(Optional.ofNullable(snapshots.get(snapshotDate)));
    }

    @Override
    public Future<Optional<Snapshot>> findLatest() {
        Map.Entry<LocalDate, Snapshot> last = snapshots.lastEntry();
        return Future.succeededFuture(Optional.ofNullable(last).map(Map.Entry::getValue));
    }

    @Override
    public Future<List<Snapshot>> findAll() {
        return Future.succeededFuture(new ArrayList<>(snapshots.values()));
    }

    @Override
    public Future<List<LocalDate>> findAllDates() {
        return Future.succeededFuture(new ArrayList<>(snapshots.descendingKeySet()));
    }

    @Override
    public Future<Boolean> existsForDate(LocalDate snapshotDate) {
        return Future.succeededFuture(snapshots.containsKey(snapshotDate));
    }

    @Override
    public Future<Boolean> deleteByDate(LocalDate snapshotDate) {
        boolean removed = snapshots.remove(snapshotDate) != null;
        if (removed) {
            log.debug("Deleted snapshot for {}", snapshotDate);
        }
        return Future.succeededFuture(removed);
    }
}

package com.kuyan.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;
import java.util.List;

/**
 * All balances recorded for one date, bound to the rates that were effective on that date.
 * The pinned rate map never changes; replacing a month means deleting and recreating its snapshot.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Snapshot {

    private final LocalDate snapshotDate;
    private final RateMap rates;
    private final List<Balance> balances;

    public Snapshot(LocalDate snapshotDate, RateMap rates, List<Balance> balances) {
        if (snapshotDate == null) {
            throw new IllegalArgumentException("snapshotDate is required");
        }
        if (rates == null) {
            throw new IllegalArgumentException("Snapshot for " + snapshotDate + " must be pinned to a rate map");
        }
        for (Balance balance : balances) {
            if (!snapshotDate.equals(balance.getSnapshotDate())) {
                throw new IllegalArgumentException("Balance for account " + balance.getAccountId()
                        + " is dated " + balance.getSnapshotDate() + ", expected " + snapshotDate);
            }
        }
        this.snapshotDate = snapshotDate;
        this.rates = rates;
        this.balances = List.copyOf(balances);
    }

    public boolean isEmpty() {
        return balances.isEmpty();
    }
}

package com.kuyan.domain.exception;

import java.time.YearMonth;

/**
 * No snapshot is recorded for the requested month
 */
public class SnapshotNotFoundException extends RuntimeException {

    private final YearMonth month;

    public SnapshotNotFoundException(YearMonth month) {
        super("No snapshot recorded for " + month);
        this.month = month;
    }

    public YearMonth getMonth() {
        return month;
    }
}

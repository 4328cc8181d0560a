package com.kuyan.domain.exception;

import java.time.LocalDate;
import java.util.List;

/**
 * Every per-base request to the exchange rate source failed.
 * Retryable: callers should surface it to the user and try again later.
 */
public class RateSourceUnavailableException extends RuntimeException {

    private final List<String> failedBases;
    private final LocalDate asOfDate;

    public RateSourceUnavailableException(List<String> failedBases, LocalDate asOfDate, Throwable lastCause) {
        super("Unable to fetch exchange rates for " + failedBases
                + " as of " + (asOfDate != null ? asOfDate : "latest"), lastCause);
        this.failedBases = List.copyOf(failedBases);
        this.asOfDate = asOfDate;
    }

    public List<String> getFailedBases() {
        return failedBases;
    }

    public LocalDate getAsOfDate() {
        return asOfDate;
    }
}

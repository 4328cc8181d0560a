package com.kuyan.domain.model;

import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * One recorded month valued in a single currency with the rates pinned to it
 */
@Value
public class SnapshotDetail {
    LocalDate snapshotDate;
    NetWorthTotal total;
    List<AccountValuation> accounts;
    RateMap rates;
}

package com.kuyan.domain.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Balance of one account on one snapshot date, in the account's native currency
 */
@Value
@Builder(toBuilder = true)
public class Balance {
    @NonNull String accountId;
    String accountName;         // display only
    String owner;               // display only
    String accountType;         // Bank, Investment, Other
    @NonNull String currency;   // ISO 4217 code
    @NonNull BigDecimal amount; // full precision, 2 decimals for display
    @NonNull LocalDate snapshotDate;
}

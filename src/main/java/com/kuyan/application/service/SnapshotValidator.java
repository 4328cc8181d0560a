package com.kuyan.application.service;

import com.kuyan.application.port.in.RecordSnapshotUseCase.BalanceEntry;
import com.kuyan.application.port.in.RecordSnapshotUseCase.RecordSnapshotCommand;
import com.kuyan.infrastructure.config.ReportingSettings;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.Year;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Validates an incoming monthly snapshot
 */
public class SnapshotValidator {

    private static final BigDecimal MAX_AMOUNT = new BigDecimal("999999999999.99");
    private static final int MIN_YEAR = 1900;

    private final ReportingSettings settings;

    public SnapshotValidator(ReportingSettings settings) {
        this.settings = settings;
    }

    /**
     * @param today Used to reject snapshots for future months
     */
    public ValidationResult validate(RecordSnapshotCommand command, LocalDate today) {
        List<String> errors = new ArrayList<>();

        validateMonth(command, today, errors);
        validateBalances(command, errors);

        if (errors.isEmpty()) {
            return ValidationResult.valid();
        } else {
            return ValidationResult.invalid(errors);
        }
    }

    private void validateMonth(RecordSnapshotCommand command, LocalDate today, List<String> errors) {
        if (command.year() == null) {
            errors.add("year is required");
        } else if (command.year() < MIN_YEAR) {
            errors.add("year must be " + MIN_YEAR + " or later");
        } else if (command.year() > Year.MAX_VALUE) {
            errors.add("year must be " + Year.MAX_VALUE + " or earlier");
        }
        if (command.month() == null) {
            errors.add("month is required");
        } else if (command.month() < 1 || command.month() > 12) {
            errors.add("month must be between 1 and 12");
        }

        if (errors.isEmpty() && YearMonth.of(command.year(), command.month()).isAfter(YearMonth.from(today))) {
            errors.add("Cannot create snapshots for future months");
        }
    }

    private void validateBalances(RecordSnapshotCommand command, List<String> errors) {
        if (command.balances() == null || command.balances().isEmpty()) {
            errors.add("at least one balance is required");
            return;
        }

        Set<String> seenAccounts = new HashSet<>();
        for (int i = 0; i < command.balances().size(); i++) {
            BalanceEntry entry = command.balances().get(i);
            String prefix = "balances[" + i + "].";

            if (entry == null) {
                errors.add(prefix.substring(0, prefix.length() - 1) + " is null");
                continue;
            }
            if (isBlank(entry.accountId())) {
                errors.add(prefix + "accountId is required");
            } else if (!seenAccounts.add(entry.accountId())) {
                errors.add(prefix + "accountId " + entry.accountId() + " appears more than once");
            }

            if (isBlank(entry.currency())) {
                errors.add(prefix + "currency is required");
            } else if (!ReportingSettings.isValidCode(entry.currency())) {
                errors.add(prefix + "currency must be a 3-letter ISO 4217 code");
            } else if (!settings.isEnabled(entry.currency())) {
                errors.add(prefix + "currency " + entry.currency() + " is not enabled");
            }

            if (entry.amount() == null) {
                errors.add(prefix + "amount is required");
            } else {
                if (entry.amount().signum() < 0) {
                    errors.add(prefix + "amount must be non-negative");
                }
                if (entry.amount().compareTo(MAX_AMOUNT) > 0) {
                    errors.add(prefix + "amount exceeds maximum allowed value");
                }
            }
        }
    }

    private boolean isBlank(String str) {
        return str == null || str.trim().isEmpty();
    }
}

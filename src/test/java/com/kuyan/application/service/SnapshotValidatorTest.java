package com.kuyan.application.service;

import com.kuyan.application.port.in.RecordSnapshotUseCase.BalanceEntry;
import com.kuyan.application.port.in.RecordSnapshotUseCase.RecordSnapshotCommand;
import com.kuyan.infrastructure.config.ReportingSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SnapshotValidator
 */
class SnapshotValidatorTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 6, 15);

    private SnapshotValidator validator;

    @BeforeEach
    void setUp() {
        validator = new SnapshotValidator(ReportingSettings.builder()
                .currency("CAD")
                .currency("USD")
                .currency("INR")
                .defaultCurrency("CAD")
                .build());
    }

    @Test
    void testValidSnapshot() {
        RecordSnapshotCommand command = new RecordSnapshotCommand(2025, 6, List.of(
                entry("td", "CAD", "1000.00"),
                entry("chase", "USD", "0")
        ));

        ValidationResult result = validator.validate(command, TODAY);

        assertTrue(result.isValid(), "Valid snapshot should pass validation: " + result.errors());
        assertFalse(result.hasErrors());
    }

    @Test
    void testMissingFields() {
        RecordSnapshotCommand command = new RecordSnapshotCommand(null, null, null);

        ValidationResult result = validator.validate(command, TODAY);

        assertFalse(result.isValid());
        assertEquals(3, result.errors().size(), "year, month and balances are required: " + result.errors());
    }

    @Test
    void testFutureMonthIsRejected() {
        RecordSnapshotCommand command = new RecordSnapshotCommand(2025, 7, List.of(entry("td", "CAD", "1")));

        ValidationResult result = validator.validate(command, TODAY);

        assertFalse(result.isValid());
        assertTrue(result.errors().contains("Cannot create snapshots for future months"));
    }

    @Test
    void testCurrentMonthIsAccepted() {
        RecordSnapshotCommand command = new RecordSnapshotCommand(2025, 6, List.of(entry("td", "CAD", "1")));

        assertTrue(validator.validate(command, LocalDate.of(2025, 6, 1)).isValid());
    }

    @Test
    void testYearBeyondCalendarRange() {
        RecordSnapshotCommand command = new RecordSnapshotCommand(1_000_000_000, 1, List.of(entry("td", "CAD", "1")));

        ValidationResult result = validator.validate(command, TODAY);

        assertEquals(List.of("year must be 999999999 or earlier"), result.errors());
    }

    @Test
    void testInvalidMonth() {
        RecordSnapshotCommand command = new RecordSnapshotCommand(2025, 13, List.of(entry("td", "CAD", "1")));

        ValidationResult result = validator.validate(command, TODAY);

        assertEquals(List.of("month must be between 1 and 12"), result.errors());
    }

    @Test
    void testCurrencyRules() {
        RecordSnapshotCommand command = new RecordSnapshotCommand(2025, 1, List.of(
                entry("a", "EURO", "1"),
                entry("b", "EUR", "1"),
                entry("c", null, "1")
        ));

        ValidationResult result = validator.validate(command, TODAY);

        assertEquals(3, result.errors().size(), result.errors().toString());
        assertTrue(result.errors().contains("balances[1].currency EUR is not enabled"));
    }

    @Test
    void testNegativeAmountIsRejected() {
        RecordSnapshotCommand command = new RecordSnapshotCommand(2025, 1, List.of(entry("td", "CAD", "-0.01")));

        ValidationResult result = validator.validate(command, TODAY);

        assertEquals(List.of("balances[0].amount must be non-negative"), result.errors());
    }

    @Test
    void testFullPrecisionAmountIsAccepted() {
        RecordSnapshotCommand command = new RecordSnapshotCommand(2025, 1, List.of(entry("td", "CAD", "10.123456")));

        assertTrue(validator.validate(command, TODAY).isValid());
    }

    @Test
    void testDuplicateAccountIsRejected() {
        RecordSnapshotCommand command = new RecordSnapshotCommand(2025, 1, List.of(
                entry("td", "CAD", "1"),
                entry("td", "CAD", "2")
        ));

        ValidationResult result = validator.validate(command, TODAY);

        assertEquals(List.of("balances[1].accountId td appears more than once"), result.errors());
    }

    @Test
    void testNullBalanceEntry() {
        RecordSnapshotCommand command = new RecordSnapshotCommand(2025, 1, Arrays.asList(entry("td", "CAD", "1"), null));

        ValidationResult result = validator.validate(command, TODAY);

        assertEquals(List.of("balances[1] is null"), result.errors());
    }

    private static BalanceEntry entry(String accountId, String currency, String amount) {
        return new BalanceEntry(accountId, null, null, null, currency, new BigDecimal(amount));
    }
}

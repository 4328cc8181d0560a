package com.kuyan.application.service;

import com.kuyan.application.port.out.ExchangeRateProvider;
import com.kuyan.domain.exception.RateSourceUnavailableException;
import com.kuyan.domain.model.RateMap;
import io.vertx.core.Future;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit test for RateTableBuilder
 * The rate source is mocked with already completed futures
 */
class RateTableBuilderTest {

    private static final LocalDate AS_OF = LocalDate.of(2025, 3, 1);

    @Mock
    private ExchangeRateProvider rateProvider;

    private RateTableBuilder builder;
    private AutoCloseable mocks;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        builder = new RateTableBuilder(rateProvider);
    }

    @AfterEach
    void tearDown() throws Exception {
        mocks.close();
    }

    @Test
    void build_shouldMergeEveryBaseAndAddSelfPairs() {
        when(rateProvider.fetchRates(eq("USD"), eq(Set.of("CAD", "INR")), eq(AS_OF)))
                .thenReturn(Future.succeededFuture(Map.of("CAD", new BigDecimal("1.35"), "INR", new BigDecimal("83.5"))));
        when(rateProvider.fetchRates(eq("CAD"), eq(Set.of("USD", "INR")), eq(AS_OF)))
                .thenReturn(Future.succeededFuture(Map.of("USD", new BigDecimal("0.74"), "INR", new BigDecimal("61.8"))));
        when(rateProvider.fetchRates(eq("INR"), eq(Set.of("USD", "CAD")), eq(AS_OF)))
                .thenReturn(Future.succeededFuture(Map.of("USD", new BigDecimal("0.012"), "CAD", new BigDecimal("0.0162"))));

        Future<RateMap> future = builder.build(List.of("USD", "CAD", "INR"), AS_OF);

        assertTrue(future.succeeded());
        RateMap rates = future.result();
        assertEquals(9, rates.size(), "3 currencies give 9 ordered pairs");
        assertEquals(AS_OF, rates.getAsOfDate());
        assertEquals(new BigDecimal("1.35"), rates.rate("USD", "CAD").orElseThrow());
        assertEquals(new BigDecimal("0.74"), rates.rate("CAD", "USD").orElseThrow());
        assertEquals(new BigDecimal("0.0162"), rates.rate("INR", "CAD").orElseThrow());
        for (String code : List.of("USD", "CAD", "INR")) {
            assertEquals(BigDecimal.ONE, rates.rate(code, code).orElseThrow());
        }
        verify(rateProvider, times(3)).fetchRates(any(), any(), eq(AS_OF));
    }

    @Test
    void build_shouldNotDependOnBaseOrder() {
        when(rateProvider.fetchRates(eq("USD"), any(), any()))
                .thenReturn(Future.succeededFuture(Map.of("CAD", new BigDecimal("1.35"))));
        when(rateProvider.fetchRates(eq("CAD"), any(), any()))
                .thenReturn(Future.succeededFuture(Map.of("USD", new BigDecimal("0.74"))));

        RateMap forward = builder.build(List.of("USD", "CAD"), AS_OF).result();
        RateMap backward = builder.build(List.of("CAD", "USD"), AS_OF).result();

        assertEquals(forward.asMap(), backward.asMap());
    }

    @Test
    void build_shouldReturnPartialTableWhenSomeBasesFail() {
        when(rateProvider.fetchRates(eq("USD"), any(), any()))
                .thenReturn(Future.succeededFuture(Map.of("CAD", new BigDecimal("1.35"), "INR", new BigDecimal("83.5"))));
        when(rateProvider.fetchRates(eq("CAD"), any(), any()))
                .thenReturn(Future.failedFuture("timeout"));
        when(rateProvider.fetchRates(eq("INR"), any(), any()))
                .thenReturn(Future.failedFuture("HTTP 500"));

        Future<RateMap> future = builder.build(List.of("USD", "CAD", "INR"), AS_OF);

        assertTrue(future.succeeded());
        RateMap rates = future.result();
        assertTrue(rates.contains("USD", "CAD"));
        assertFalse(rates.contains("CAD", "USD"));
        assertTrue(rates.contains("CAD", "CAD"), "Self pairs are added even for failed bases");
        assertTrue(rates.contains("INR", "INR"));
        assertEquals(5, rates.size());
    }

    @Test
    void build_shouldTreatThrowingSourceAsFailedBase() {
        when(rateProvider.fetchRates(eq("USD"), any(), any()))
                .thenThrow(new IllegalStateException("connection refused"));
        when(rateProvider.fetchRates(eq("CAD"), any(), any()))
                .thenReturn(Future.succeededFuture(Map.of("USD", new BigDecimal("0.74"))));

        Future<RateMap> future = builder.build(List.of("CAD", "USD"), AS_OF);

        assertTrue(future.succeeded(), () -> String.valueOf(future.cause()));
        assertEquals(new BigDecimal("0.74"), future.result().rate("CAD", "USD").orElseThrow());
        assertFalse(future.result().contains("USD", "CAD"));
    }

    @Test
    void build_shouldFailWhenEveryBaseThrows() {
        when(rateProvider.fetchRates(any(), any(), any())).thenThrow(new IllegalStateException("connection refused"));

        Future<RateMap> future = builder.build(List.of("USD", "CAD"), AS_OF);

        assertTrue(future.failed());
        RateSourceUnavailableException error = assertInstanceOf(RateSourceUnavailableException.class, future.cause());
        assertEquals("connection refused", error.getCause().getMessage());
    }

    @Test
    void build_shouldFailWhenEveryBaseFails() {
        when(rateProvider.fetchRates(any(), any(), any())).thenReturn(Future.failedFuture("Network error"));

        Future<RateMap> future = builder.build(List.of("USD", "CAD"), AS_OF);

        assertTrue(future.failed());
        RateSourceUnavailableException error = assertInstanceOf(RateSourceUnavailableException.class, future.cause());
        assertEquals(List.of("USD", "CAD"), error.getFailedBases());
        assertEquals(AS_OF, error.getAsOfDate());
        assertEquals("Network error", error.getCause().getMessage());
    }

    @Test
    void build_shouldMakeOneAttemptPerBase() {
        when(rateProvider.fetchRates(any(), any(), any())).thenReturn(Future.failedFuture("Network error"));

        builder.build(List.of("USD", "CAD", "INR"), AS_OF);

        verify(rateProvider, times(1)).fetchRates(eq("USD"), any(), any());
        verify(rateProvider, times(1)).fetchRates(eq("CAD"), any(), any());
        verify(rateProvider, times(1)).fetchRates(eq("INR"), any(), any());
    }

    @Test
    void build_shouldNotQuerySourceForSingleCurrency() {
        Future<RateMap> future = builder.build(List.of("CAD"), AS_OF);

        assertTrue(future.succeeded());
        assertEquals(1, future.result().size());
        assertEquals(BigDecimal.ONE, future.result().rate("CAD", "CAD").orElseThrow());
        verifyNoInteractions(rateProvider);
    }

    @Test
    void build_shouldRejectEmptyCurrencySet() {
        Future<RateMap> future = builder.build(List.of(), AS_OF);

        assertTrue(future.failed());
        assertInstanceOf(IllegalArgumentException.class, future.cause());
    }

    @Test
    void build_shouldDiscardSelfAndNonPositiveRatesFromSource() {
        when(rateProvider.fetchRates(eq("USD"), any(), any()))
                .thenReturn(Future.succeededFuture(Map.of(
                        "USD", new BigDecimal("0.99"),
                        "CAD", BigDecimal.ZERO,
                        "GBP", new BigDecimal("0.79"))));
        when(rateProvider.fetchRates(eq("CAD"), any(), any()))
                .thenReturn(Future.succeededFuture(Map.of("USD", new BigDecimal("0.74"))));

        RateMap rates = builder.build(List.of("USD", "CAD"), AS_OF).result();

        assertEquals(BigDecimal.ONE, rates.rate("USD", "USD").orElseThrow());
        assertFalse(rates.contains("USD", "CAD"));
        assertFalse(rates.contains("USD", "GBP"), "Only requested currencies are kept");
        assertTrue(rates.contains("CAD", "USD"));
    }

    @Test
    void build_shouldPassNullDateForLatestRates() {
        when(rateProvider.fetchRates(any(), any(), isNull()))
                .thenReturn(Future.succeededFuture(Map.of()));

        Future<RateMap> future = builder.build(List.of("USD", "CAD"), null);

        assertTrue(future.succeeded());
        assertNull(future.result().getAsOfDate());
        verify(rateProvider, times(2)).fetchRates(any(), any(), isNull());
    }
}

package com.kuyan.application.service;

import com.kuyan.application.port.in.ExchangeRateQueryUseCase;
import com.kuyan.domain.model.RateMap;
import com.kuyan.infrastructure.config.ReportingSettings;
import io.vertx.core.Future;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Use case implementation for the exchange rate viewer
 * Rates are fetched on demand and not stored
 */
public class ExchangeRateQueryService implements ExchangeRateQueryUseCase {

    private final RateTableBuilder rateTableBuilder;
    private final ReportingSettings settings;
    private final Clock clock;

    public ExchangeRateQueryService(RateTableBuilder rateTableBuilder, ReportingSettings settings, Clock clock) {
        this.rateTableBuilder = rateTableBuilder;
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public Future<RateMap> rateTable(LocalDate date) {
        if (date != null && date.isAfter(LocalDate.now(clock))) {
            return Future.failedFuture(new IllegalArgumentException("Cannot fetch exchange rates for future dates"));
        }
        return rateTableBuilder.build(settings.getCurrencies(), date);
    }
}

package com.kuyan.application.port.in;

import com.kuyan.domain.model.RateMap;
import io.vertx.core.Future;

import java.time.LocalDate;

/**
 * Input port for looking up the cross-rate table of the enabled currencies
 */
public interface ExchangeRateQueryUseCase {

    /**
     * @param date Effective date, null for the most recent rates. Future dates are rejected.
     */
    Future<RateMap> rateTable(LocalDate date);
}

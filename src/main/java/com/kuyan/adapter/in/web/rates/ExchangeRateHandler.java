package com.kuyan.adapter.in.web.rates;

import com.kuyan.adapter.in.web.ApiResponse;
import com.kuyan.adapter.in.web.report.ReportJson;
import com.kuyan.application.port.in.ExchangeRateQueryUseCase;
import com.kuyan.infrastructure.config.ReportingSettings;
import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * HTTP handler for the exchange rate viewer
 * Handles GET /api/rates?date=yyyy-MM-dd, latest rates without a date
 */
@RequiredArgsConstructor
public class ExchangeRateHandler implements Handler<RoutingContext> {

    private final ExchangeRateQueryUseCase rateQueryUseCase;
    private final ReportingSettings settings;

    @Override
    public void handle(RoutingContext context) {
        String dateParam = context.queryParams().get("date");
        LocalDate date;
        try {
            date = dateParam == null || dateParam.isBlank() ? null : LocalDate.parse(dateParam);
        } catch (DateTimeParseException e) {
            ApiResponse.send(context, 400, ApiResponse.error("date must be in yyyy-MM-dd format"));
            return;
        }

        rateQueryUseCase.rateTable(date)
                .onSuccess(rates -> context.response()
                        .setStatusCode(200)
                        .putHeader("Content-Type", "application/json")
                        .end(ReportJson.rateTable(rates, settings.getCurrencies()).encode()))
                .onFailure(error -> ApiResponse.sendFailure(context, error));
    }
}

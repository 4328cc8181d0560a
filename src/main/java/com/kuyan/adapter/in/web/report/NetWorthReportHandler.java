package com.kuyan.adapter.in.web.report;

import com.kuyan.adapter.in.web.ApiResponse;
import com.kuyan.application.port.in.NetWorthReportUseCase;
import com.kuyan.infrastructure.config.ReportingSettings;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.function.Function;

/**
 * HTTP handlers for net worth reports
 * Handles GET /api/net-worth and its sub-resources; "currency" defaults to the configured one
 */
@Slf4j
@RequiredArgsConstructor
public class NetWorthReportHandler {

    private final NetWorthReportUseCase reportUseCase;
    private final ReportingSettings settings;

    public void currentNetWorth(RoutingContext context) {
        respond(context, reportUseCase.currentNetWorth().map(ReportJson::netWorth));
    }

    public void breakdown(RoutingContext context) {
        withCurrency(context, currency -> reportUseCase.breakdown(currency)
                .map(lines -> ReportJson.breakdown(currency, lines)));
    }

    public void history(RoutingContext context) {
        withCurrency(context, currency -> reportUseCase.history(currency)
                .map(series -> ReportJson.history(currency, series)));
    }

    public void yearOverYear(RoutingContext context) {
        withCurrency(context, currency -> reportUseCase.yearOverYear(currency)
                .map(ReportJson::yearOverYear));
    }

    public void growth(RoutingContext context) {
        String baseline = context.queryParams().get("baseline");
        YearMonth baselineMonth;
        try {
            baselineMonth = baseline == null || baseline.isBlank() ? null : YearMonth.parse(baseline);
        } catch (DateTimeParseException e) {
            ApiResponse.send(context, 400, ApiResponse.error("baseline must be in yyyy-MM format"));
            return;
        }
        respond(context, reportUseCase.growth(baselineMonth).map(ReportJson::growth));
    }

    private void withCurrency(RoutingContext context, Function<String, Future<JsonObject>> report) {
        String currency;
        try {
            currency = settings.resolveCurrency(context.queryParams().get("currency"));
        } catch (IllegalArgumentException e) {
            ApiResponse.send(context, 400, ApiResponse.error(e.getMessage()));
            return;
        }
        respond(context, report.apply(currency));
    }

    private void respond(RoutingContext context, Future<JsonObject> result) {
        result.onSuccess(json -> context.response()
                        .setStatusCode(200)
                        .putHeader("Content-Type", "application/json")
                        .end(json.encode()))
                .onFailure(error -> {
                    log.error("Report request {} failed: {}", context.request().path(), error.getMessage());
                    ApiResponse.sendFailure(context, error);
                });
    }
}

package com.kuyan.adapter.in.web.snapshot;

import com.kuyan.adapter.in.web.ApiResponse;
import com.kuyan.adapter.in.web.report.ReportJson;
import com.kuyan.application.port.in.SnapshotHistoryUseCase;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.YearMonth;
import java.time.format.DateTimeParseException;

/**
 * HTTP handlers for the snapshot log
 * Handles GET /api/snapshots, GET /api/snapshots/:month and DELETE /api/snapshots/:month
 */
@Slf4j
@RequiredArgsConstructor
public class SnapshotHistoryHandler {

    private final SnapshotHistoryUseCase historyUseCase;

    public void listMonths(RoutingContext context) {
        historyUseCase.listMonths()
                .onSuccess(months -> sendJson(context, 200, ReportJson.months(months).encode()))
                .onFailure(error -> ApiResponse.sendFailure(context, error));
    }

    public void monthDetail(RoutingContext context) {
        YearMonth month = parseMonth(context);
        if (month == null) {
            return;
        }
        historyUseCase.monthDetail(month, context.queryParams().get("currency"))
                .onSuccess(detail -> sendJson(context, 200, ReportJson.snapshotDetail(detail).encode()))
                .onFailure(error -> ApiResponse.sendFailure(context, error));
    }

    public void deleteMonth(RoutingContext context) {
        YearMonth month = parseMonth(context);
        if (month == null) {
            return;
        }
        log.info("Deleting snapshot for {}", month);
        historyUseCase.deleteMonth(month)
                .onSuccess(v -> ApiResponse.send(context, 200, ApiResponse.success("Deleted snapshot for " + month)))
                .onFailure(error -> ApiResponse.sendFailure(context, error));
    }

    private YearMonth parseMonth(RoutingContext context) {
        String month = context.pathParam("month");
        try {
            return YearMonth.parse(month);
        } catch (DateTimeParseException e) {
            ApiResponse.send(context, 400, ApiResponse.error("month must be in yyyy-MM format"));
            return null;
        }
    }

    private void sendJson(RoutingContext context, int statusCode, String body) {
        context.response()
                .setStatusCode(statusCode)
                .putHeader("Content-Type", "application/json")
                .end(body);
    }
}

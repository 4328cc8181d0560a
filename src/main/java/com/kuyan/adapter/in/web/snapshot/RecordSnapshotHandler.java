package com.kuyan.adapter.in.web.snapshot;

import com.kuyan.adapter.in.web.ApiResponse;
import com.kuyan.adapter.in.web.report.ReportJson;
import com.kuyan.application.port.in.RecordSnapshotUseCase;
import com.kuyan.application.port.in.RecordSnapshotUseCase.BalanceEntry;
import com.kuyan.application.port.in.RecordSnapshotUseCase.RecordSnapshotCommand;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.stream.Collectors;

/**
 * HTTP handler for snapshot recording
 * Handles POST /api/snapshots
 */
@Slf4j
@RequiredArgsConstructor
public class RecordSnapshotHandler implements Handler<RoutingContext> {

    private final RecordSnapshotUseCase recordSnapshotUseCase;

    @Override
    public void handle(RoutingContext context) {
        JsonObject requestBody = context.body().asJsonObject();

        if (requestBody == null) {
            log.warn("Request body is null");
            ApiResponse.send(context, 400, ApiResponse.error("Request body is required"));
            return;
        }

        RecordSnapshotCommand command;
        try {
            RecordSnapshotRequest request = requestBody.mapTo(RecordSnapshotRequest.class);
            command = toCommand(request);
        } catch (Exception e) {
            log.error("Error parsing request body", e);
            ApiResponse.send(context, 400, ApiResponse.error("Invalid request format: " + e.getMessage()));
            return;
        }

        log.info("Received snapshot for {}-{}", command.year(), command.month());

        recordSnapshotUseCase.recordSnapshot(command)
                .onSuccess(snapshot -> context.response()
                        .setStatusCode(201)
                        .putHeader("Content-Type", "application/json")
                        .end(ReportJson.snapshot(snapshot).encode()))
                .onFailure(error -> ApiResponse.sendFailure(context, error));
    }

    private RecordSnapshotCommand toCommand(RecordSnapshotRequest request) {
        List<BalanceEntry> balances = request.balances() == null ? null : request.balances().stream()
                .map(b -> b == null ? null : new BalanceEntry(
                        b.accountId(),
                        b.accountName(),
                        b.owner(),
                        b.accountType(),
                        b.currency(),
                        b.amount()))
                .collect(Collectors.toList());
        return new RecordSnapshotCommand(request.year(), request.month(), balances);
    }
}

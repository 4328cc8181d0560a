package com.kuyan.adapter.in.web;

import com.kuyan.adapter.in.web.rates.ExchangeRateHandler;
import com.kuyan.adapter.in.web.report.NetWorthReportHandler;
import com.kuyan.adapter.in.web.snapshot.RecordSnapshotHandler;
import com.kuyan.adapter.in.web.snapshot.SnapshotHistoryHandler;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import lombok.RequiredArgsConstructor;

/**
 * Router configuration for snapshot and report endpoints
 */
@RequiredArgsConstructor
public class WebRouter {

    private final Router router;
    private final RecordSnapshotHandler recordSnapshotHandler;
    private final SnapshotHistoryHandler snapshotHistoryHandler;
    private final NetWorthReportHandler reportHandler;
    private final ExchangeRateHandler exchangeRateHandler;

    public void setupRoutes() {
        // CORS headers
        router.route().handler(ctx -> {
            ctx.response()
                    .putHeader("Access-Control-Allow-Origin", "*")
                    .putHeader("Access-Control-Allow-Methods", "GET, POST, DELETE, OPTIONS")
                    .putHeader("Access-Control-Allow-Headers", "Content-Type, Authorization, X-Requested-With");
            ctx.next();
        });

        router.options("/api/*").handler(ctx -> ctx.response().setStatusCode(204).end());

        // Snapshot recording
        router.post("/api/snapshots")
                .handler(BodyHandler.create())
                .handler(recordSnapshotHandler);

        // Snapshot log
        router.get("/api/snapshots").handler(snapshotHistoryHandler::listMonths);
        router.get("/api/snapshots/:month").handler(snapshotHistoryHandler::monthDetail);
        router.delete("/api/snapshots/:month").handler(snapshotHistoryHandler::deleteMonth);

        // Reports
        router.get("/api/net-worth").handler(reportHandler::currentNetWorth);
        router.get("/api/net-worth/breakdown").handler(reportHandler::breakdown);
        router.get("/api/net-worth/history").handler(reportHandler::history);
        router.get("/api/net-worth/growth").handler(reportHandler::growth);
        router.get("/api/net-worth/year-over-year").handler(reportHandler::yearOverYear);

        // Exchange rate viewer
        router.get("/api/rates").handler(exchangeRateHandler);

        // Health check endpoint
        router.get("/health")
                .handler(ctx -> ctx.response()
                        .putHeader("Content-Type", "application/json")
                        .end("{\"status\":\"UP\",\"service\":\"net-worth-tracker\"}"));
    }
}

package com.kuyan.adapter.in.web;

import com.kuyan.adapter.in.web.rates.ExchangeRateHandler;
import com.kuyan.adapter.in.web.report.NetWorthReportHandler;
import com.kuyan.adapter.in.web.snapshot.RecordSnapshotHandler;
import com.kuyan.adapter.in.web.snapshot.SnapshotHistoryHandler;
import com.kuyan.adapter.out.http.FrankfurterExchangeRateAdapter;
import com.kuyan.adapter.out.persistence.InMemorySnapshotPersistenceAdapter;
import com.kuyan.application.port.in.ExchangeRateQueryUseCase;
import com.kuyan.application.port.in.NetWorthReportUseCase;
import com.kuyan.application.port.in.RecordSnapshotUseCase;
import com.kuyan.application.port.in.SnapshotHistoryUseCase;
import com.kuyan.application.port.out.ExchangeRateProvider;
import com.kuyan.application.port.out.SnapshotRepository;
import com.kuyan.application.service.ConversionEngine;
import com.kuyan.application.service.ExchangeRateQueryService;
import com.kuyan.application.service.GrowthNormalizer;
import com.kuyan.application.service.NetWorthAggregator;
import com.kuyan.application.service.NetWorthReportService;
import com.kuyan.application.service.RateTableBuilder;
import com.kuyan.application.service.SnapshotHistoryService;
import com.kuyan.application.service.SnapshotRecordingService;
import com.kuyan.application.service.SnapshotValidator;
import com.kuyan.application.service.YearOverYearGrouper;
import com.kuyan.infrastructure.config.RateSourceSettings;
import com.kuyan.infrastructure.config.ReportingSettings;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.handler.LoggerHandler;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

/**
 * HTTP Server Verticle - handles all HTTP requests
 * Infrastructure component that wires up the hexagonal architecture
 */
@Slf4j
public class HttpServerVerticle extends AbstractVerticle {

    private static final int DEFAULT_PORT = 8081;

    private WebClient webClient;
    private RecordSnapshotHandler recordSnapshotHandler;
    private SnapshotHistoryHandler snapshotHistoryHandler;
    private NetWorthReportHandler reportHandler;
    private ExchangeRateHandler exchangeRateHandler;

    @Override
    public void start(Promise<Void> startPromise) {
        log.info("Starting HTTP Server Verticle...");

        initializeServices()
                .compose(v -> {
                    log.info("All services initialized successfully");
                    return startHttpServer();
                })
                .onSuccess(v -> {
                    log.info("HTTP Server Verticle started successfully on port {}", getPort());
                    startPromise.complete();
                })
                .onFailure(error -> {
                    log.error("Failed to start HTTP Server Verticle", error);
                    startPromise.fail(error);
                });
    }

    @Override
    public void stop() {
        if (webClient != null) {
            webClient.close();
        }
        log.info("HTTP Server Verticle stopped");
    }

    private Future<Void> initializeServices() {
        ReportingSettings reportingSettings;
        RateSourceSettings rateSourceSettings;
        try {
            reportingSettings = ReportingSettings.fromConfig(config());
            rateSourceSettings = RateSourceSettings.fromConfig(config());
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }
        log.info("Reporting currencies {} (default {}, intermediary {})", reportingSettings.getCurrencies(),
                reportingSettings.getDefaultCurrency(), reportingSettings.getIntermediaryCurrency());

        // Output ports (adapters)
        webClient = WebClient.create(vertx);
        ExchangeRateProvider exchangeRateProvider = new FrankfurterExchangeRateAdapter(webClient, rateSourceSettings);
        SnapshotRepository snapshotRepository = new InMemorySnapshotPersistenceAdapter();

        // Engine
        ConversionEngine conversionEngine = new ConversionEngine(reportingSettings.getIntermediaryCurrency());
        NetWorthAggregator aggregator = new NetWorthAggregator(conversionEngine);
        RateTableBuilder rateTableBuilder = new RateTableBuilder(exchangeRateProvider);

        // Application services (use cases)
        Clock clock = Clock.systemDefaultZone();
        RecordSnapshotUseCase recordSnapshotUseCase = new SnapshotRecordingService(
                new SnapshotValidator(reportingSettings),
                rateTableBuilder,
                snapshotRepository,
                reportingSettings,
                clock
        );
        SnapshotHistoryUseCase snapshotHistoryUseCase =
                new SnapshotHistoryService(snapshotRepository, aggregator, reportingSettings);
        NetWorthReportUseCase reportUseCase = new NetWorthReportService(
                snapshotRepository,
                aggregator,
                new GrowthNormalizer(),
                new YearOverYearGrouper(),
                reportingSettings
        );
        ExchangeRateQueryUseCase rateQueryUseCase =
                new ExchangeRateQueryService(rateTableBuilder, reportingSettings, clock);

        // Input adapters (handlers)
        recordSnapshotHandler = new RecordSnapshotHandler(recordSnapshotUseCase);
        snapshotHistoryHandler = new SnapshotHistoryHandler(snapshotHistoryUseCase);
        reportHandler = new NetWorthReportHandler(reportUseCase, reportingSettings);
        exchangeRateHandler = new ExchangeRateHandler(rateQueryUseCase, reportingSettings);

        log.info("Services wired up (Hexagonal Architecture)");
        return Future.succeededFuture();
    }

    private Future<Void> startHttpServer() {
        Router router = Router.router(vertx);

        // Global handlers
        router.route().handler(LoggerHandler.create());

        WebRouter webRouter = new WebRouter(router, recordSnapshotHandler, snapshotHistoryHandler, reportHandler, exchangeRateHandler);
        webRouter.setupRoutes();

        // Default route - 404
        router.route().handler(ctx -> ApiResponse.send(ctx, 404, ApiResponse.error("Endpoint not found")));

        int port = getPort();

        return vertx.createHttpServer()
                .requestHandler(router)
                .listen(port)
                .onSuccess(server -> log.info("HTTP server listening on port {}", server.actualPort()))
                .mapEmpty();
    }

    private int getPort() {
        return config().getJsonObject("http", new JsonObject()).getInteger("port", DEFAULT_PORT);
    }
}

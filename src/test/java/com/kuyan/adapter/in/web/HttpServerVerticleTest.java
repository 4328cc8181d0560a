package com.kuyan.adapter.in.web;

import io.vertx.core.DeploymentOptions;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.net.ServerSocket;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end test of the HTTP API with the rate source replaced by a local stub
 */
class HttpServerVerticleTest {

    private Vertx vertx;
    private WebClient client;
    private int port;
    private volatile boolean rateSourceDown;

    @BeforeEach
    void setUp() throws Exception {
        vertx = Vertx.vertx();
        HttpServer rateSource = await(vertx.createHttpServer()
                .requestHandler(this::answerRates)
                .listen(0));

        port = freePort();
        JsonObject config = new JsonObject()
                .put("http", new JsonObject().put("port", port))
                .put("reporting", new JsonObject()
                        .put("currencies", new JsonArray().add("CAD").add("USD"))
                        .put("default-currency", "CAD"))
                .put("rates", new JsonObject()
                        .put("host", "localhost")
                        .put("port", rateSource.actualPort())
                        .put("ssl", false)
                        .put("timeout-ms", 5_000));

        await(vertx.deployVerticle(new HttpServerVerticle(), new DeploymentOptions().setConfig(config)));
        client = WebClient.create(vertx);
    }

    @AfterEach
    void tearDown() throws Exception {
        client.close();
        await(vertx.close());
    }

    @Test
    void health_shouldReportUp() throws Exception {
        HttpResponse<Buffer> response = await(client.get(port, "localhost", "/health").send());

        assertEquals(200, response.statusCode());
        assertEquals("UP", response.bodyAsJsonObject().getString("status"));
    }

    @Test
    void recordSnapshot_thenNetWorthShouldUsePinnedRates() throws Exception {
        HttpResponse<Buffer> created = await(client.post(port, "localhost", "/api/snapshots")
                .sendJsonObject(snapshotRequest()));

        assertEquals(201, created.statusCode());
        JsonObject snapshot = created.bodyAsJsonObject();
        assertEquals("2025-01-01", snapshot.getString("snapshotDate"));
        assertEquals(1.4, snapshot.getJsonObject("rates").getDouble("USD_CAD"));

        JsonArray totals = await(client.get(port, "localhost", "/api/net-worth").send())
                .bodyAsJsonObject().getJsonArray("netWorth");
        assertEquals("CAD", totals.getJsonObject(0).getString("currency"));
        assertAmount("1840.00", totals.getJsonObject(0).getValue("amount"));
        assertAmount("1310.00", totals.getJsonObject(1).getValue("amount"));

        JsonObject breakdown = await(client.get(port, "localhost", "/api/net-worth/breakdown")
                .addQueryParam("currency", "usd").send()).bodyAsJsonObject();
        assertEquals("USD", breakdown.getString("currency"));
        assertEquals(2, breakdown.getJsonArray("accounts").size());
    }

    @Test
    void recordSnapshot_shouldAnswer503WhenRateSourceIsDown() throws Exception {
        rateSourceDown = true;

        HttpResponse<Buffer> response = await(client.post(port, "localhost", "/api/snapshots")
                .sendJsonObject(snapshotRequest()));

        assertEquals(503, response.statusCode());
        assertTrue(response.bodyAsJsonObject().getBoolean("retryable"));
    }

    @Test
    void recordSnapshot_shouldAnswer400ForDisabledCurrency() throws Exception {
        JsonObject request = snapshotRequest();
        request.getJsonArray("balances").getJsonObject(0).put("currency", "EUR");

        HttpResponse<Buffer> response = await(client.post(port, "localhost", "/api/snapshots")
                .sendJsonObject(request));

        assertEquals(400, response.statusCode());
        assertTrue(response.bodyAsJsonObject().getString("message").contains("EUR is not enabled"));
    }

    @Test
    void reports_shouldAnswer400ForUnknownCurrencyOrBadBaseline() throws Exception {
        assertEquals(400, await(client.get(port, "localhost", "/api/net-worth/history")
                .addQueryParam("currency", "EUR").send()).statusCode());
        assertEquals(400, await(client.get(port, "localhost", "/api/net-worth/growth")
                .addQueryParam("baseline", "January").send()).statusCode());
    }

    @Test
    void snapshotLog_shouldListShowAndDeleteRecordedMonth() throws Exception {
        assertEquals(201, await(client.post(port, "localhost", "/api/snapshots")
                .sendJsonObject(snapshotRequest())).statusCode());

        JsonArray months = await(client.get(port, "localhost", "/api/snapshots").send())
                .bodyAsJsonObject().getJsonArray("months");
        assertEquals("2025-01", months.getJsonObject(0).getString("month"));
        assertEquals("JAN 2025", months.getJsonObject(0).getString("label"));

        JsonObject detail = await(client.get(port, "localhost", "/api/snapshots/2025-01")
                .addQueryParam("currency", "USD").send()).bodyAsJsonObject();
        assertEquals("2025-01-01", detail.getString("snapshotDate"));
        assertAmount("1310.00", detail.getValue("total"));
        assertEquals(2, detail.getJsonArray("accounts").size());

        assertEquals(200, await(client.delete(port, "localhost", "/api/snapshots/2025-01").send()).statusCode());
        assertEquals(404, await(client.get(port, "localhost", "/api/snapshots/2025-01").send()).statusCode());
        assertEquals(404, await(client.delete(port, "localhost", "/api/snapshots/2025-01").send()).statusCode());
        assertEquals(400, await(client.get(port, "localhost", "/api/snapshots/January").send()).statusCode());
    }

    @Test
    void rates_shouldReturnCrossRateTable() throws Exception {
        HttpResponse<Buffer> response = await(client.get(port, "localhost", "/api/rates")
                .addQueryParam("date", "2025-01-10").send());

        assertEquals(200, response.statusCode());
        JsonObject body = response.bodyAsJsonObject();
        assertEquals("2025-01-10", body.getString("date"));
        assertEquals(1.4, body.getJsonObject("rates").getDouble("USD_CAD"));
        assertEquals(0.71, body.getJsonObject("rates").getDouble("CAD_USD"));
        assertFalse(body.getJsonObject("rates").containsKey("USD_USD"));
    }

    @Test
    void rates_shouldAnswer400ForMalformedOrFutureDate() throws Exception {
        assertEquals(400, await(client.get(port, "localhost", "/api/rates")
                .addQueryParam("date", "10/01/2025").send()).statusCode());
        assertEquals(400, await(client.get(port, "localhost", "/api/rates")
                .addQueryParam("date", "2999-01-01").send()).statusCode());
    }

    @Test
    void unknownEndpoint_shouldAnswer404() throws Exception {
        assertEquals(404, await(client.get(port, "localhost", "/api/unknown").send()).statusCode());
    }

    private void answerRates(HttpServerRequest request) {
        if (rateSourceDown) {
            request.response().setStatusCode(500).end();
            return;
        }
        JsonObject rates = "USD".equals(request.getParam("from"))
                ? new JsonObject().put("CAD", 1.40)
                : new JsonObject().put("USD", 0.71);
        request.response()
                .putHeader("Content-Type", "application/json")
                .end(new JsonObject().put("rates", rates).encode());
    }

    private static JsonObject snapshotRequest() {
        return new JsonObject()
                .put("year", 2025)
                .put("month", 1)
                .put("balances", new JsonArray()
                        .add(new JsonObject()
                                .put("accountId", "chase-checking")
                                .put("accountName", "Chase Checking")
                                .put("owner", "Alex")
                                .put("accountType", "checking")
                                .put("currency", "USD")
                                .put("amount", 600))
                        .add(new JsonObject()
                                .put("accountId", "td-savings")
                                .put("currency", "CAD")
                                .put("amount", 1000)));
    }

    private static void assertAmount(String expected, Object actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(new BigDecimal(actual.toString())),
                "expected " + expected + " but was " + actual);
    }

    private static int freePort() throws Exception {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }

    private static <T> T await(Future<T> future) throws Exception {
        return future.toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
    }
}

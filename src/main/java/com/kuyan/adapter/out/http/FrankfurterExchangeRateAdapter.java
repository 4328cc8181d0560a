package com.kuyan.adapter.out.http;

import com.kuyan.application.port.out.ExchangeRateProvider;
import com.kuyan.infrastructure.config.RateSourceSettings;
import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * HTTP adapter fetching exchange rates from the Frankfurter API
 * Implements ExchangeRateProvider output port
 * <p>
 * {@code GET /{yyyy-MM-dd|latest}?from=BASE&to=A,B} answers
 * {@code {"base":"USD","date":"2025-01-01","rates":{"CAD":1.35}}}.
 * For a historical date the API returns the rates effective on that day
 * (or the last business day before it).
 */
@Slf4j
public class FrankfurterExchangeRateAdapter implements ExchangeRateProvider {

    private final WebClient webClient;
    private final RateSourceSettings settings;

    public FrankfurterExchangeRateAdapter(WebClient webClient, RateSourceSettings settings) {
        this.webClient = webClient;
        this.settings = settings;
    }

    @Override
    public Future<Map<String, BigDecimal>> fetchRates(String baseCurrency, Set<String> targetCurrencies, LocalDate date) {
        if (targetCurrencies.isEmpty()) {
            return Future.succeededFuture(Map.of());
        }

        String path = "/" + (date != null ? date.format(DateTimeFormatter.ISO_LOCAL_DATE) : "latest");
        String targets = String.join(",", targetCurrencies);
        log.debug("Fetching exchange rates {}?from={}&to={}", path, baseCurrency, targets);

        return webClient.get(settings.getPort(), settings.getHost(), path)
                .ssl(settings.isSsl())
                .timeout(settings.getTimeoutMs())
                .addQueryParam("from", baseCurrency)
                .addQueryParam("to", targets)
                .send()
                .compose(response -> parse(baseCurrency, response))
                .onSuccess(rates -> log.info("Fetched {} exchange rates for base {} as of {}",
                        rates.size(), baseCurrency, date != null ? date : "latest"))
                .onFailure(error -> log.error("Failed to fetch exchange rates for base {}: {}",
                        baseCurrency, error.getMessage()));
    }

    private Future<Map<String, BigDecimal>> parse(String baseCurrency, HttpResponse<Buffer> response) {
        if (response.statusCode() / 100 != 2) {
            return Future.failedFuture("Rate source answered " + response.statusCode()
                    + " for base " + baseCurrency + ": " + response.bodyAsString());
        }

        JsonObject body;
        try {
            body = response.bodyAsJsonObject();
        } catch (Exception e) {
            return Future.failedFuture(new IllegalStateException("Malformed rate response for base " + baseCurrency, e));
        }

        JsonObject rates = body != null ? body.getJsonObject("rates") : null;
        if (rates == null) {
            return Future.failedFuture("Rate response for base " + baseCurrency + " has no rates");
        }

        Map<String, BigDecimal> result = new LinkedHashMap<>();
        for (String currency : rates.fieldNames()) {
            Object value = rates.getValue(currency);
            if (value instanceof Number) {
                result.put(currency, new BigDecimal(value.toString()));
            } else {
                log.warn("Skipping non-numeric rate {}_{}: {}", baseCurrency, currency, value);
            }
        }
        return Future.succeededFuture(result);
    }
}

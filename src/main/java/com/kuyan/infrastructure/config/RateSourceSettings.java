package com.kuyan.infrastructure.config;

import io.vertx.core.json.JsonObject;
import lombok.Builder;
import lombok.Value;

/**
 * Connection settings for the external exchange rate API
 */
@Value
@Builder
public class RateSourceSettings {

    private static final String DEFAULT_HOST = "api.frankfurter.app";
    private static final long DEFAULT_TIMEOUT_MS = 10_000;

    String host;
    int port;
    boolean ssl;
    long timeoutMs;

    public static RateSourceSettings fromConfig(JsonObject config) {
        JsonObject rates = config.getJsonObject("rates", new JsonObject());
        boolean ssl = rates.getBoolean("ssl", true);
        return RateSourceSettings.builder()
                .host(rates.getString("host", DEFAULT_HOST))
                .port(rates.getInteger("port", ssl ? 443 : 80))
                .ssl(ssl)
                .timeoutMs(rates.getLong("timeout-ms", DEFAULT_TIMEOUT_MS))
                .build();
    }
}

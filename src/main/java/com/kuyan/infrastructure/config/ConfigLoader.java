package com.kuyan.infrastructure.config;

import io.vertx.config.ConfigRetriever;
import io.vertx.config.ConfigRetrieverOptions;
import io.vertx.config.ConfigStoreOptions;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads application.yml from the classpath; system properties override file values
 */
@Slf4j
public final class ConfigLoader {

    private static final String CONFIG_FILE = "application.yml";

    private ConfigLoader() {
    }

    public static Future<JsonObject> load(Vertx vertx) {
        return load(vertx, CONFIG_FILE);
    }

    public static Future<JsonObject> load(Vertx vertx, String path) {
        ConfigStoreOptions yamlStore = new ConfigStoreOptions()
                .setType("file")
                .setFormat("yaml")
                .setConfig(new JsonObject().put("path", path));

        ConfigStoreOptions sysPropsStore = new ConfigStoreOptions()
                .setType("sys")
                .setConfig(new JsonObject().put("hierarchical", true));

        ConfigRetriever retriever = ConfigRetriever.create(vertx, new ConfigRetrieverOptions()
                .setScanPeriod(0)
                .addStore(yamlStore)
                .addStore(sysPropsStore));

        return retriever.getConfig()
                .onSuccess(config -> log.info("Loaded configuration from {}", path))
                .onFailure(error -> log.error("Failed to load {}: {}", path, error.getMessage()))
                .onComplete(ar -> retriever.close());
    }
}

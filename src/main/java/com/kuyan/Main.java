package com.kuyan;

import com.kuyan.adapter.in.web.HttpServerVerticle;
import com.kuyan.infrastructure.config.ConfigLoader;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main application entry point
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        log.info("Starting Net Worth Tracker...");

        Vertx vertx = Vertx.vertx();

        ConfigLoader.load(vertx)
                .compose(config -> vertx.deployVerticle(new HttpServerVerticle(),
                        new DeploymentOptions().setConfig(config)))
                .onSuccess(deploymentId -> {
                    log.info("HTTP Server Verticle deployed successfully: {}", deploymentId);

                    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                        log.info("Shutting down Net Worth Tracker...");
                        vertx.close();
                    }));

                    log.info("Net Worth Tracker is ready!");
                })
                .onFailure(error -> {
                    log.error("Failed to start Net Worth Tracker", error);
                    vertx.close();
                });
    }
}

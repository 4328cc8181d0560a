package com.kuyan.adapter.in.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.kuyan.domain.exception.RateSourceUnavailableException;
import com.kuyan.domain.exception.SnapshotNotFoundException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;

import java.time.format.DateTimeParseException;

/**
 * Envelope for error and acknowledgement responses
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse(
        String status,
        String message,
        Boolean retryable
) {
    public static ApiResponse success(String message) {
        return new ApiResponse("success", message, null);
    }

    public static ApiResponse error(String message) {
        return new ApiResponse("error", message, null);
    }

    public static ApiResponse retryableError(String message) {
        return new ApiResponse("error", message, true);
    }

    /**
     * Map a failure to its HTTP status: bad input 400, unknown month 404, rate source down 503, anything else 500
     */
    public static void sendFailure(RoutingContext context, Throwable error) {
        if (error instanceof IllegalArgumentException || error instanceof DateTimeParseException) {
            send(context, 400, error(error.getMessage()));
        } else if (error instanceof SnapshotNotFoundException) {
            send(context, 404, error(error.getMessage()));
        } else if (error instanceof RateSourceUnavailableException) {
            send(context, 503, retryableError("Unable to fetch exchange rates, please try again later"));
        } else {
            send(context, 500, error("Internal error: " + error.getMessage()));
        }
    }

    public static void send(RoutingContext context, int statusCode, ApiResponse response) {
        context.response()
                .setStatusCode(statusCode)
                .putHeader("Content-Type", "application/json")
                .end(JsonObject.mapFrom(response).encode());
    }
}

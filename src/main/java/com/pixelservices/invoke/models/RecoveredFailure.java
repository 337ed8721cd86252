package com.pixelservices.invoke.models;

import com.pixelservices.invoke.components.http.HttpMethod;

import java.time.Instant;

/**
 * An unexpected failure caught by the router while dispatching one request.
 *
 * @param cause      what was thrown
 * @param method     the request method
 * @param path       the request path as received
 * @param occurredAt when it was caught
 */
public record RecoveredFailure(Throwable cause, HttpMethod method, String path, Instant occurredAt) {

    public String message() {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
    }
}

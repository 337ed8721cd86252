package com.pixelservices.invoke.exceptions;

/**
 * Thrown when a route cannot be registered. This is a startup configuration error and is not
 * meant to be caught and retried.
 */
public class RouteRegistrationException extends RuntimeException {
    public RouteRegistrationException(String message) {
        super(message);
    }

    public RouteRegistrationException(String message, Throwable cause) {
        super(message, cause);
    }
}

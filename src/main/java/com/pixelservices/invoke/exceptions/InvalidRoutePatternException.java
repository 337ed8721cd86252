package com.pixelservices.invoke.exceptions;

public class InvalidRoutePatternException extends RouteRegistrationException {
    public InvalidRoutePatternException(String message) {
        super(message);
    }

    public InvalidRoutePatternException(String message, Throwable cause) {
        super(message, cause);
    }
}

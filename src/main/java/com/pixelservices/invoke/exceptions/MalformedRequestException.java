package com.pixelservices.invoke.exceptions;

/**
 * Thrown by the transport when the bytes received do not form an HTTP request.
 */
public class MalformedRequestException extends RuntimeException {
    public MalformedRequestException(String message) {
        super(message);
    }
}

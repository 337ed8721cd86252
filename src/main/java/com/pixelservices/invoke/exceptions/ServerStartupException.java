package com.pixelservices.invoke.exceptions;

public class ServerStartupException extends RuntimeException {
    public ServerStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}

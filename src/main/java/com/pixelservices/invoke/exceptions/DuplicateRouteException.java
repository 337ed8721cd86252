package com.pixelservices.invoke.exceptions;

import com.pixelservices.invoke.components.http.HttpMethod;

public class DuplicateRouteException extends RouteRegistrationException {
    private final HttpMethod method;
    private final String path;

    public DuplicateRouteException(HttpMethod method, String path) {
        super("Route '" + path + "' with method '" + method + "' is already registered");
        this.method = method;
        this.path = path;
    }

    public HttpMethod getMethod() {
        return method;
    }

    public String getPath() {
        return path;
    }
}

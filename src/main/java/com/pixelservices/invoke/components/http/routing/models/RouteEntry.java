package com.pixelservices.invoke.components.http.routing.models;

import com.pixelservices.invoke.components.http.HttpMethod;
import com.pixelservices.invoke.components.http.routing.RouteGroup;
import com.pixelservices.invoke.models.RouteHandler;

/**
 * A registered route: the method and full path it was registered under, its handler, and the
 * group it was registered through ({@code null} for routes registered on the router itself).
 */
public class RouteEntry {
    private final HttpMethod method;
    private final String path;
    private final RouteHandler handler;
    private final RouteGroup group;

    public RouteEntry(HttpMethod method, String path, RouteHandler handler, RouteGroup group) {
        this.method = method;
        this.path = path;
        this.handler = handler;
        this.group = group;
    }

    public HttpMethod getMethod() {
        return method;
    }

    public String getPath() {
        return path;
    }

    public RouteHandler getHandler() {
        return handler;
    }

    public RouteGroup getGroup() {
        return group;
    }

    @Override
    public String toString() {
        return "[" + method + "] " + path;
    }
}

package com.pixelservices.invoke.models;

import com.pixelservices.invoke.components.http.HttpContext;

/**
 * Leaf handler bound to a route.
 */
@FunctionalInterface
public interface RouteHandler {
    void handle(HttpContext ctx);
}

package com.pixelservices.invoke.models;

import com.pixelservices.invoke.components.http.HttpContext;

/**
 * Consulted when no route matches the request path.
 */
@FunctionalInterface
public interface AssetHandler {
    /**
     * @return true if routing should continue to the not-found handler, false if the request was served.
     */
    boolean serve(HttpContext ctx);
}

package com.pixelservices.invoke.models;

import com.pixelservices.invoke.components.http.HttpContext;

@FunctionalInterface
public interface BeforeHook {
    /**
     * Runs before the matched handler.
     * @return true to continue to the next hook/handler, false to stop processing the request.
     */
    boolean process(HttpContext ctx);
}

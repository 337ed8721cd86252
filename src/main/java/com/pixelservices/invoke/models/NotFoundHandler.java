package com.pixelservices.invoke.models;

import com.pixelservices.invoke.components.http.HttpContext;

@FunctionalInterface
public interface NotFoundHandler {
    void handle(HttpContext ctx);
}

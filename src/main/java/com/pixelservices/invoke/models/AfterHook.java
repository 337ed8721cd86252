package com.pixelservices.invoke.models;

import com.pixelservices.invoke.components.http.HttpContext;

@FunctionalInterface
public interface AfterHook {
    void process(HttpContext ctx);
}

package com.pixelservices.invoke.models;

import com.pixelservices.invoke.components.http.HttpContext;

/**
 * Produces the response for a request whose hooks or handler threw.
 */
@FunctionalInterface
public interface RecoveryHandler {
    void recover(HttpContext ctx, RecoveredFailure failure);
}

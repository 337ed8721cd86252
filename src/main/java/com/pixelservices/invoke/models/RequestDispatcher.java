package com.pixelservices.invoke.models;

import com.pixelservices.invoke.components.http.lifecycle.Request;
import com.pixelservices.invoke.components.http.lifecycle.Response;

/**
 * Produces the response for one request. The router is the innermost dispatcher; middleware wraps it.
 */
@FunctionalInterface
public interface RequestDispatcher {
    void dispatch(Request request, Response response);
}

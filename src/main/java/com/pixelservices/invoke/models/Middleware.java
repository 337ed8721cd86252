package com.pixelservices.invoke.models;

/**
 * Wraps a dispatcher with behaviour that runs around every request of a server, routed or not.
 */
@FunctionalInterface
public interface Middleware {
    /**
     * @param next the dispatcher to delegate to; not calling it short-circuits the request
     * @return the wrapping dispatcher
     */
    RequestDispatcher wrap(RequestDispatcher next);
}

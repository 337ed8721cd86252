package com.pixelservices.invoke.components.http.routing.models;

import java.util.Collections;
import java.util.Map;

/**
 * Result of walking the route trie for one request.
 *
 * @param outcome how far the walk got
 * @param entry   the matched route, present only for {@link Outcome#MATCHED}
 * @param params  the bound path parameters, empty unless matched
 */
public record RouteMatch(Outcome outcome, RouteEntry entry, Map<String, String> params) {

    public enum Outcome {
        /** The full path was consumed and the final node carries a handler. */
        MATCHED,
        /** The full path was consumed but no node on the way carries a handler for the method. */
        NO_HANDLER,
        /** Some segment had no compatible child. */
        NOT_FOUND
    }

    public static RouteMatch matched(RouteEntry entry, Map<String, String> params) {
        return new RouteMatch(Outcome.MATCHED, entry, Collections.unmodifiableMap(params));
    }

    public static RouteMatch noHandler() {
        return new RouteMatch(Outcome.NO_HANDLER, null, Collections.emptyMap());
    }

    public static RouteMatch notFound() {
        return new RouteMatch(Outcome.NOT_FOUND, null, Collections.emptyMap());
    }

    public boolean isMatched() {
        return outcome == Outcome.MATCHED;
    }
}

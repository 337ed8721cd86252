package com.pixelservices.invoke.components.http.routing;

/**
 * Decides which sibling wins when more than one trie child can consume a request segment.
 */
public enum RoutePrecedence {
    /**
     * Static literals first, then regex segments, then named parameters; registration order
     * within a kind. A branch that dead-ends is abandoned and the next candidate is tried.
     */
    SPECIFICITY,
    /**
     * The first compatible child in registration order wins and the walk never backtracks, so a
     * parameter registered before a literal shadows it.
     */
    REGISTRATION_ORDER
}

package com.pixelservices.invoke.components.http.routing.trie;

/**
 * Match kind of a trie node. The declaration order is the precedence used by
 * {@link com.pixelservices.invoke.components.http.routing.RoutePrecedence#SPECIFICITY}.
 */
public enum NodeType {
    /** Literal segment, e.g. {@code /users}. */
    STATIC,
    /** Regex-constrained segment, e.g. {@code /{id:[0-9]+}}. */
    REGEX,
    /** Named parameter, e.g. {@code /:name}. */
    PARAM
}

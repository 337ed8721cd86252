package com.pixelservices.invoke.components.http.routing.trie;

import com.pixelservices.invoke.components.http.HttpMethod;
import com.pixelservices.invoke.components.http.routing.RoutePrecedence;
import com.pixelservices.invoke.components.http.routing.models.RouteEntry;
import com.pixelservices.invoke.components.http.routing.models.RouteMatch;
import com.pixelservices.invoke.exceptions.DuplicateRouteException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Segment trie holding every registered route. Branching by HTTP method happens at every depth:
 * two routes sharing a prefix under different methods live in different subtrees.
 * <p>
 * Not synchronized. All routes must be inserted before the trie is searched concurrently.
 */
public class RouteTrie {
    private final TrieNode root = TrieNode.root();
    private final boolean caseSensitive;
    private final RoutePrecedence precedence;
    private int routeCount;

    public RouteTrie(boolean caseSensitive, RoutePrecedence precedence) {
        this.caseSensitive = caseSensitive;
        this.precedence = precedence;
    }

    /**
     * Inserts a route, reusing existing nodes for segments already present.
     *
     * @param entry the route to insert; its path is split into segments
     * @return the terminal node now carrying the entry
     * @throws DuplicateRouteException if the method and path are already registered
     */
    public TrieNode insert(RouteEntry entry) {
        TrieNode current = root;
        for (String segment : SegmentPattern.split(entry.getPath())) {
            current = current.childFor(SegmentPattern.parse(segment, caseSensitive), entry.getMethod());
        }
        if (current.isTerminal()) {
            throw new DuplicateRouteException(entry.getMethod(), entry.getPath());
        }
        current.attach(entry);
        routeCount++;
        return current;
    }

    /**
     * Walks the trie for the given request.
     *
     * @param method the request method
     * @param path   the request path, without query string
     * @return the walk result; parameters are only bound on a full match
     */
    public RouteMatch search(HttpMethod method, String path) {
        String[] raw = SegmentPattern.split(path);
        String[] normalized = SegmentPattern.normalizedSegments(path, caseSensitive);
        Map<String, String> params = new HashMap<>();
        if (precedence == RoutePrecedence.REGISTRATION_ORDER) {
            return walkInOrder(method, raw, normalized, params);
        }
        Walk walk = new Walk(method, raw, normalized);
        TrieNode found = walk.descend(root, 0, params);
        if (found != null) {
            return RouteMatch.matched(found.getEntry(), params);
        }
        return walk.consumedAll ? RouteMatch.noHandler() : RouteMatch.notFound();
    }

    private RouteMatch walkInOrder(HttpMethod method, String[] raw, String[] normalized, Map<String, String> params) {
        TrieNode current = root;
        for (int i = 0; i < raw.length; i++) {
            TrieNode next = null;
            for (TrieNode child : current.getChildren()) {
                if (child.accepts(method, raw[i], normalized[i])) {
                    next = child;
                    break;
                }
            }
            if (next == null) {
                return RouteMatch.notFound();
            }
            bind(next, raw[i], params);
            current = next;
        }
        return current.isTerminal() ? RouteMatch.matched(current.getEntry(), params) : RouteMatch.noHandler();
    }

    private static void bind(TrieNode node, String value, Map<String, String> params) {
        if (node.getSegment().getType() != NodeType.STATIC) {
            params.put(node.getSegment().getParamName(), value);
        }
    }

    public TrieNode getRoot() {
        return root;
    }

    public int size() {
        return routeCount;
    }

    /**
     * Collects every route entry in depth-first, registration order.
     */
    public List<RouteEntry> entries() {
        List<RouteEntry> entries = new ArrayList<>();
        collect(root, entries);
        return entries;
    }

    private void collect(TrieNode node, List<RouteEntry> entries) {
        if (node.isTerminal()) {
            entries.add(node.getEntry());
        }
        for (TrieNode child : node.getChildren()) {
            collect(child, entries);
        }
    }

    /**
     * Depth-first, specificity-ordered descent with backtracking.
     */
    private static final class Walk {
        private final HttpMethod method;
        private final String[] raw;
        private final String[] normalized;
        private boolean consumedAll;

        Walk(HttpMethod method, String[] raw, String[] normalized) {
            this.method = method;
            this.raw = raw;
            this.normalized = normalized;
        }

        TrieNode descend(TrieNode node, int depth, Map<String, String> params) {
            if (depth == raw.length) {
                consumedAll = true;
                return node.isTerminal() ? node : null;
            }
            for (NodeType type : NodeType.values()) {
                for (TrieNode child : node.getChildren(type)) {
                    if (!child.accepts(method, raw[depth], normalized[depth])) {
                        continue;
                    }
                    String name = child.getSegment().getParamName();
                    String previous = type == NodeType.STATIC ? null : params.put(name, raw[depth]);
                    TrieNode found = descend(child, depth + 1, params);
                    if (found != null) {
                        return found;
                    }
                    if (type != NodeType.STATIC) {
                        if (previous == null) {
                            params.remove(name);
                        } else {
                            params.put(name, previous);
                        }
                    }
                }
            }
            return null;
        }
    }
}

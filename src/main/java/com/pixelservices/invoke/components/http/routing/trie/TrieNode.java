package com.pixelservices.invoke.components.http.routing.trie;

import com.pixelservices.invoke.components.http.HttpMethod;
import com.pixelservices.invoke.components.http.routing.models.RouteEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * One path segment at one depth of the route trie. Children are kept in registration order,
 * and additionally bucketed by {@link NodeType} so specificity-ordered lookup needs no sorting.
 */
public final class TrieNode {
    private final SegmentPattern segment;
    private final HttpMethod method;
    private final int level;
    private final String fullPath;
    private final List<TrieNode> children = new ArrayList<>();
    private final Map<NodeType, List<TrieNode>> childrenByType = new EnumMap<>(NodeType.class);
    private RouteEntry entry;

    private TrieNode(SegmentPattern segment, HttpMethod method, int level, String fullPath) {
        this.segment = segment;
        this.method = method;
        this.level = level;
        this.fullPath = fullPath;
        for (NodeType type : NodeType.values()) {
            childrenByType.put(type, new ArrayList<>());
        }
    }

    static TrieNode root() {
        return new TrieNode(null, null, 0, "");
    }

    /**
     * Returns the child with the same kind, pattern text and method, creating and appending
     * one if none exists yet.
     */
    TrieNode childFor(SegmentPattern pattern, HttpMethod method) {
        for (TrieNode child : children) {
            if (child.method == method && child.segment.equals(pattern)) {
                return child;
            }
        }
        TrieNode created = new TrieNode(pattern, method, level + 1, fullPath + "/" + pattern);
        children.add(created);
        childrenByType.get(pattern.getType()).add(created);
        return created;
    }

    /**
     * Checks whether this node can consume the given request segment.
     *
     * @param requestMethod     the request method
     * @param rawSegment        the segment as it appeared on the wire
     * @param normalizedSegment the segment after case normalization
     */
    boolean accepts(HttpMethod requestMethod, String rawSegment, String normalizedSegment) {
        if (method != requestMethod) {
            return false;
        }
        switch (segment.getType()) {
            case STATIC:
                return segment.getText().equals(normalizedSegment);
            case PARAM:
                return !rawSegment.isEmpty();
            case REGEX:
                return segment.getCompiled().matcher(rawSegment).matches();
            default:
                return false;
        }
    }

    void attach(RouteEntry routeEntry) {
        this.entry = routeEntry;
    }

    public SegmentPattern getSegment() {
        return segment;
    }

    public HttpMethod getMethod() {
        return method;
    }

    public int getLevel() {
        return level;
    }

    public String getFullPath() {
        return fullPath;
    }

    public List<TrieNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    List<TrieNode> getChildren(NodeType type) {
        return childrenByType.get(type);
    }

    public RouteEntry getEntry() {
        return entry;
    }

    public boolean isTerminal() {
        return entry != null;
    }

    @Override
    public String toString() {
        return "TrieNode{" +
                "level=" + level +
                ", method=" + method +
                ", fullPath='" + fullPath + '\'' +
                ", children=" + children.size() +
                ", terminal=" + isTerminal() +
                '}';
    }
}

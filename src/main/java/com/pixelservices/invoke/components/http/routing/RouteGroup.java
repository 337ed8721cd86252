package com.pixelservices.invoke.components.http.routing;

import com.pixelservices.invoke.components.http.HttpMethod;
import com.pixelservices.invoke.models.AfterHook;
import com.pixelservices.invoke.models.BeforeHook;
import com.pixelservices.invoke.models.RouteHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A view of a {@link Router} with a path prefix and its own before/after hooks. All groups of one
 * router register into the same trie.
 * <p>
 * A group inherits the hooks its parent group had <em>when the group was created</em>; hooks added
 * to the parent later are not seen by this group, and hooks added here are never seen by the parent
 * or by sibling groups. Routes keep a reference to the group they were registered through, and the
 * group's hook chain is resolved when the route is dispatched.
 */
public class RouteGroup extends Routable {
    private static final Logger logger = LoggerFactory.getLogger(RouteGroup.class);

    private final Router router;
    private final RouteGroup parent;
    private final String prefix;
    private final int inheritedBeforeCount;
    private final int inheritedAfterCount;
    private final List<BeforeHook> beforeHooks = new CopyOnWriteArrayList<>();
    private final List<AfterHook> afterHooks = new CopyOnWriteArrayList<>();

    RouteGroup(Router router, RouteGroup parent, String prefix) {
        this.router = router;
        this.parent = parent;
        this.prefix = joinPaths(parent == null ? "" : parent.prefix, prefix);
        this.inheritedBeforeCount = parent == null ? 0 : parent.resolveBeforeHooks().size();
        this.inheritedAfterCount = parent == null ? 0 : parent.resolveAfterHooks().size();
        logger.info("Route group created: {}", this.prefix);
    }

    /**
     * Creates a nested group. Its prefix is this group's prefix followed by {@code prefix}.
     */
    public RouteGroup group(String prefix) {
        return new RouteGroup(router, this, prefix);
    }

    @Override
    public void addRoute(HttpMethod method, String path, RouteHandler handler) {
        router.register(method, joinPaths(prefix, path), handler, this);
    }

    /**
     * Registers a hook run before handlers of routes registered through this group (or through
     * groups created from it afterwards).
     */
    public RouteGroup before(BeforeHook hook) {
        beforeHooks.add(Objects.requireNonNull(hook, "hook"));
        return this;
    }

    public RouteGroup after(AfterHook hook) {
        afterHooks.add(Objects.requireNonNull(hook, "hook"));
        return this;
    }

    /**
     * @return the inherited hooks visible to this group followed by its own, in registration order
     */
    public List<BeforeHook> resolveBeforeHooks() {
        List<BeforeHook> hooks = new ArrayList<>();
        if (parent != null) {
            hooks.addAll(parent.resolveBeforeHooks().subList(0, inheritedBeforeCount));
        }
        hooks.addAll(beforeHooks);
        return Collections.unmodifiableList(hooks);
    }

    public List<AfterHook> resolveAfterHooks() {
        List<AfterHook> hooks = new ArrayList<>();
        if (parent != null) {
            hooks.addAll(parent.resolveAfterHooks().subList(0, inheritedAfterCount));
        }
        hooks.addAll(afterHooks);
        return Collections.unmodifiableList(hooks);
    }

    public String getPrefix() {
        return prefix;
    }

    public RouteGroup getParent() {
        return parent;
    }

    public Router getRouter() {
        return router;
    }
}

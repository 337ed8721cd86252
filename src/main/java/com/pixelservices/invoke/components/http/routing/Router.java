package com.pixelservices.invoke.components.http.routing;

import com.pixelservices.invoke.components.ServerConfiguration;
import com.pixelservices.invoke.components.fileserver.StaticAssetHandler;
import com.pixelservices.invoke.components.http.HttpContext;
import com.pixelservices.invoke.components.http.HttpMethod;
import com.pixelservices.invoke.components.http.lifecycle.Request;
import com.pixelservices.invoke.components.http.lifecycle.Response;
import com.pixelservices.invoke.components.http.routing.models.RouteEntry;
import com.pixelservices.invoke.components.http.routing.models.RouteMatch;
import com.pixelservices.invoke.components.http.routing.trie.RouteTrie;
import com.pixelservices.invoke.exceptions.InvalidRoutePatternException;
import com.pixelservices.invoke.models.AfterHook;
import com.pixelservices.invoke.models.AssetHandler;
import com.pixelservices.invoke.models.BeforeHook;
import com.pixelservices.invoke.models.NotFoundHandler;
import com.pixelservices.invoke.models.RecoveredFailure;
import com.pixelservices.invoke.models.RecoveryHandler;
import com.pixelservices.invoke.models.RouteHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Trie-based request router.
 * <p>
 * Per request, {@link #dispatch(Request, Response)} runs:
 * <ol>
 *     <li>global before hooks; the first returning false ends the request</li>
 *     <li>the trie walk</li>
 *     <li>on a match, the owning group's before hooks, the handler and the group's after hooks;
 *     on a failed walk, the asset handler and then, unless it served the request, the not-found handler</li>
 *     <li>global after hooks</li>
 * </ol>
 * Anything thrown along the way is handed to the recovery handler once, and the remaining hooks are skipped.
 * <p>
 * Registration is not synchronized against dispatch. Register every route and hook before serving traffic.
 */
public class Router extends Routable {
    private static final Logger logger = LoggerFactory.getLogger(Router.class);

    static final String NOT_FOUND_BODY = "404 - Not Found";
    static final String INTERNAL_ERROR_BODY = "500 - Internal Server Error";

    private final RouteTrie trie;
    private final List<BeforeHook> beforeHooks = new CopyOnWriteArrayList<>();
    private final List<AfterHook> afterHooks = new CopyOnWriteArrayList<>();
    private volatile NotFoundHandler notFoundHandler = Router::defaultNotFound;
    private volatile RecoveryHandler recoveryHandler;
    private volatile AssetHandler assetHandler;

    public Router() {
        this(new ServerConfiguration());
    }

    public Router(ServerConfiguration config) {
        this.trie = new RouteTrie(config.isCaseSensitive(), config.getRoutePrecedence());
        this.assetHandler = new StaticAssetHandler(config.getStaticDir(), config.getIndexFile());
    }

    // ------------------ Route Registration ------------------ //

    @Override
    public void addRoute(HttpMethod method, String path, RouteHandler handler) {
        register(method, joinPaths("", path), handler, null);
    }

    /**
     * Creates a group whose routes are registered under {@code prefix}.
     */
    public RouteGroup group(String prefix) {
        return new RouteGroup(this, null, prefix);
    }

    synchronized void register(HttpMethod method, String fullPath, RouteHandler handler, RouteGroup group) {
        Objects.requireNonNull(method, "method");
        if (handler == null) {
            throw new InvalidRoutePatternException("No handler given for [" + method + "] " + fullPath);
        }
        if (method == HttpMethod.UNSUPPORTED) {
            throw new InvalidRoutePatternException("Cannot register a route for an unsupported method: " + fullPath);
        }
        trie.insert(new RouteEntry(method, fullPath, handler, group));
        logger.info("Route registered: [{}] {}", method, fullPath);
    }

    // ------------------ Hooks & Fallbacks ------------------ //

    /**
     * Registers a global hook run before every request, matched or not.
     */
    public Router before(BeforeHook hook) {
        beforeHooks.add(Objects.requireNonNull(hook, "hook"));
        return this;
    }

    /**
     * Registers a global hook run after every request that was neither aborted nor failed.
     */
    public Router after(AfterHook hook) {
        afterHooks.add(Objects.requireNonNull(hook, "hook"));
        return this;
    }

    public Router setNotFoundHandler(NotFoundHandler handler) {
        this.notFoundHandler = Objects.requireNonNull(handler, "handler");
        return this;
    }

    /**
     * Sets the handler producing the response after a hook or handler threw.
     * {@code null} restores the default 500 response.
     */
    public Router setRecoveryHandler(RecoveryHandler handler) {
        this.recoveryHandler = handler;
        return this;
    }

    public Router setAssetHandler(AssetHandler handler) {
        this.assetHandler = Objects.requireNonNull(handler, "handler");
        return this;
    }

    // ------------------ Dispatch ------------------ //

    /**
     * Routes one request and writes the outcome into {@code response}.
     */
    public void dispatch(Request request, Response response) {
        HttpContext ctx = new HttpContext(request, response);
        try {
            runChain(ctx);
        } catch (RuntimeException | Error failure) {
            recover(ctx, failure);
        }
    }

    private void runChain(HttpContext ctx) {
        if (!runBeforeHooks(beforeHooks, ctx)) {
            logger.debug("[{}] {} stopped by a global before hook", ctx.method(), ctx.path());
            return;
        }

        RouteMatch match = trie.search(ctx.method(), ctx.path());
        switch (match.outcome()) {
            case MATCHED:
                ctx.bindParams(match.params());
                if (!invokeRoute(match.entry(), ctx)) {
                    logger.debug("[{}] {} stopped by a group before hook", ctx.method(), ctx.path());
                    return;
                }
                logger.debug("[{}] {} matched {}", ctx.method(), ctx.path(), match.entry().getPath());
                break;
            case NO_HANDLER:
                logger.debug("[{}] {} has no handler", ctx.method(), ctx.path());
                notFoundHandler.handle(ctx);
                break;
            default:
                if (assetHandler.serve(ctx)) {
                    logger.debug("[{}] {} not found", ctx.method(), ctx.path());
                    notFoundHandler.handle(ctx);
                } else {
                    logger.debug("[{}] {} served as asset", ctx.method(), ctx.path());
                }
                break;
        }

        for (AfterHook hook : afterHooks) {
            hook.process(ctx);
        }
    }

    /**
     * Runs the route's group hooks around its handler.
     *
     * @return false if a group before hook stopped the request
     */
    private boolean invokeRoute(RouteEntry entry, HttpContext ctx) {
        RouteGroup group = entry.getGroup();
        if (group != null && !runBeforeHooks(group.resolveBeforeHooks(), ctx)) {
            return false;
        }
        entry.getHandler().handle(ctx);
        if (group != null) {
            for (AfterHook hook : group.resolveAfterHooks()) {
                hook.process(ctx);
            }
        }
        return true;
    }

    private static boolean runBeforeHooks(List<BeforeHook> hooks, HttpContext ctx) {
        for (BeforeHook hook : hooks) {
            if (!hook.process(ctx)) {
                return false;
            }
        }
        return true;
    }

    private void recover(HttpContext ctx, Throwable failure) {
        RecoveredFailure recovered = new RecoveredFailure(failure, ctx.method(), ctx.path(), Instant.now());
        logger.error("Recovered from failure while dispatching [{}] {}", ctx.request().rawMethod(), ctx.request().rawPath(), failure);
        RecoveryHandler handler = recoveryHandler;
        if (handler != null) {
            try {
                handler.recover(ctx, recovered);
                return;
            } catch (RuntimeException | Error e) {
                logger.error("Recovery handler failed for [{}] {}", ctx.request().rawMethod(), ctx.path(), e);
            }
        }
        ctx.response().reset()
                .status(500)
                .type("text/plain")
                .body(INTERNAL_ERROR_BODY);
    }

    private static void defaultNotFound(HttpContext ctx) {
        ctx.response().status(404).type("text/plain").body(NOT_FOUND_BODY);
    }

    // ------------------ Introspection ------------------ //

    /**
     * @return every registered route
     */
    public List<RouteEntry> routes() {
        return trie.entries();
    }

    public int routeCount() {
        return trie.size();
    }

    public RouteTrie getTrie() {
        return trie;
    }
}

package com.pixelservices.invoke.components.http.middleware;

import com.pixelservices.invoke.models.Middleware;
import com.pixelservices.invoke.models.RequestDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named middleware a server configuration can refer to in its {@code middleware} list.
 */
public class MiddlewareRegistry {
    private static final Logger logger = LoggerFactory.getLogger(MiddlewareRegistry.class);

    public static final String LOGGING = "logging";

    private final Map<String, Middleware> middlewares = new ConcurrentHashMap<>();

    /**
     * @return a registry holding the built-in {@value #LOGGING} middleware
     */
    public static MiddlewareRegistry withDefaults() {
        return new MiddlewareRegistry().register(LOGGING, new LoggingMiddleware());
    }

    /**
     * Registers {@code middleware} under {@code name}, replacing any earlier registration.
     */
    public MiddlewareRegistry register(String name, Middleware middleware) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(middleware, "middleware");
        if (middlewares.put(name, middleware) != null) {
            logger.info("Middleware replaced: {}", name);
        }
        return this;
    }

    public Middleware get(String name) {
        return middlewares.get(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(middlewares.keySet());
    }

    /**
     * Wraps {@code dispatcher} with the named middleware. The first name ends up outermost and
     * sees the request first. Names that are not registered are skipped.
     */
    public RequestDispatcher apply(RequestDispatcher dispatcher, List<String> names) {
        RequestDispatcher wrapped = dispatcher;
        for (int i = names.size() - 1; i >= 0; i--) {
            Middleware middleware = middlewares.get(names.get(i));
            if (middleware == null) {
                logger.warn("Unknown middleware '{}' skipped", names.get(i));
                continue;
            }
            wrapped = middleware.wrap(wrapped);
        }
        return wrapped;
    }
}

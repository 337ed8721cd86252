package com.pixelservices.invoke.components.http.routing;

import com.pixelservices.invoke.components.http.HttpMethod;
import com.pixelservices.invoke.models.RouteHandler;

/**
 * Routable abstract class. Lets extending classes inherit the verb shortcuts.
 */
public abstract class Routable {

    /**
     * Adds a route.
     *
     * @param method  the HTTP method
     * @param path    the path pattern, relative to this routable's prefix
     * @param handler the handler
     * @throws com.pixelservices.invoke.exceptions.RouteRegistrationException if the route is a duplicate or malformed
     */
    public abstract void addRoute(HttpMethod method, String path, RouteHandler handler);

    /**
     * Map the route for HTTP GET requests
     *
     * @param path    the path
     * @param handler the handler
     */
    public void get(String path, RouteHandler handler) {
        addRoute(HttpMethod.GET, path, handler);
    }

    /**
     * Map the route for HTTP POST requests
     *
     * @param path    the path
     * @param handler the handler
     */
    public void post(String path, RouteHandler handler) {
        addRoute(HttpMethod.POST, path, handler);
    }

    /**
     * Map the route for HTTP PUT requests
     *
     * @param path    the path
     * @param handler the handler
     */
    public void put(String path, RouteHandler handler) {
        addRoute(HttpMethod.PUT, path, handler);
    }

    /**
     * Map the route for HTTP PATCH requests
     *
     * @param path    the path
     * @param handler the handler
     */
    public void patch(String path, RouteHandler handler) {
        addRoute(HttpMethod.PATCH, path, handler);
    }

    /**
     * Map the route for HTTP DELETE requests
     *
     * @param path    the path
     * @param handler the handler
     */
    public void delete(String path, RouteHandler handler) {
        addRoute(HttpMethod.DELETE, path, handler);
    }

    public void head(String path, RouteHandler handler) {
        addRoute(HttpMethod.HEAD, path, handler);
    }

    public void options(String path, RouteHandler handler) {
        addRoute(HttpMethod.OPTIONS, path, handler);
    }

    public void trace(String path, RouteHandler handler) {
        addRoute(HttpMethod.TRACE, path, handler);
    }

    public void connect(String path, RouteHandler handler) {
        addRoute(HttpMethod.CONNECT, path, handler);
    }

    /**
     * Joins a prefix and a path with exactly one slash between them.
     */
    static String joinPaths(String prefix, String path) {
        String head = prefix == null ? "" : prefix;
        String tail = path == null ? "" : path;
        if (head.isEmpty()) {
            return tail.startsWith("/") ? tail : "/" + tail;
        }
        if (head.endsWith("/")) {
            head = head.substring(0, head.length() - 1);
        }
        if (!head.startsWith("/")) {
            head = "/" + head;
        }
        if (tail.isEmpty()) {
            return head;
        }
        return tail.startsWith("/") ? head + tail : head + "/" + tail;
    }
}

package com.pixelservices.invoke.components.http;

import java.util.HashMap;
import java.util.Locale;

/**
 * Enum for HTTP methods
 */
public enum HttpMethod {
    GET, POST, PUT, PATCH, DELETE, HEAD, TRACE, CONNECT, OPTIONS, UNSUPPORTED;

    private static final HashMap<String, HttpMethod> methods = new HashMap<>();

    static {
        for (HttpMethod method : values()) {
            methods.put(method.toString(), method);
        }
    }

    /**
     * Gets the HttpMethod corresponding to the provided string. If no corresponding method can be found
     * {@link HttpMethod#UNSUPPORTED} will be returned.
     *
     * @param methodStr The string containing HTTP method name
     * @return          The HttpMethod corresponding to the provided string
     */
    public static HttpMethod get(String methodStr) {
        if (methodStr == null) {
            return UNSUPPORTED;
        }
        HttpMethod method = methods.get(methodStr.toUpperCase(Locale.ROOT));
        return method != null ? method : UNSUPPORTED;
    }
}

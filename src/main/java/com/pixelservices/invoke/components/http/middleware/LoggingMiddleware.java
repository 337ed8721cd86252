package com.pixelservices.invoke.components.http.middleware;

import com.pixelservices.invoke.models.Middleware;
import com.pixelservices.invoke.models.RequestDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Access log: one line per request with method, path, status and elapsed time.
 */
public class LoggingMiddleware implements Middleware {
    private static final Logger logger = LoggerFactory.getLogger(LoggingMiddleware.class);

    @Override
    public RequestDispatcher wrap(RequestDispatcher next) {
        return (request, response) -> {
            long start = System.nanoTime();
            next.dispatch(request, response);
            logger.info("Request: {} {} -> {} ({} ms)", request.rawMethod(), request.rawPath(),
                    response.getStatus(), (System.nanoTime() - start) / 1_000_000);
        };
    }
}

package com.pixelservices.invoke.components.http;

import com.pixelservices.invoke.components.http.lifecycle.Response;
import com.pixelservices.invoke.components.http.middleware.MiddlewareRegistry;
import com.pixelservices.invoke.components.http.routing.Router;
import org.junit.Test;

import java.time.Duration;
import java.util.List;

import static com.pixelservices.invoke.utils.RequestPerformer.isolatedRouter;
import static com.pixelservices.invoke.utils.RequestPerformer.request;
import static org.junit.Assert.*;

public class HttpRequestHandlerTest {

    @Test
    public void testProcessFinalizesResponse() {
        Router router = isolatedRouter();
        router.get("/ping", ctx -> ctx.writeString("pong"));
        HttpRequestHandler handler = new HttpRequestHandler(router::dispatch, Duration.ofSeconds(1));

        Response response = handler.process(request("GET", "/ping"));

        assertTrue(response.isFinalized());
        assertEquals("4", response.getHeader("Content-Length"));
        assertEquals("pong", response.getBodyAsString());
    }

    @Test
    public void testProcessRunsMiddlewareAroundRouter() {
        Router router = isolatedRouter();
        router.get("/ping", ctx -> ctx.writeString("pong"));
        MiddlewareRegistry registry = MiddlewareRegistry.withDefaults()
                .register("stamp", next -> (req, res) -> {
                    next.dispatch(req, res);
                    res.header("X-Stamp", "yes");
                });
        HttpRequestHandler handler = new HttpRequestHandler(
                registry.apply(router::dispatch, List.of("logging", "stamp")), Duration.ofSeconds(1));

        Response response = handler.process(request("GET", "/ping"));

        assertEquals("yes", response.getHeader("X-Stamp"));
        assertEquals("pong", response.getBodyAsString());
    }
}

package com.pixelservices.invoke.components;

import com.pixelservices.invoke.components.http.routing.Router;
import com.pixelservices.invoke.exceptions.ServerStartupException;
import com.pixelservices.invoke.utils.RequestPerformer;
import okhttp3.Response;
import org.json.JSONObject;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.Assert.*;

public class InvokeServerTest {
    private InvokeServer server;
    private String baseUrl;

    @Before
    public void setUp() {
        ServerConfiguration config = RequestPerformer.isolatedConfiguration().setPort(0).setMaxHeaderBytes(2048);
        server = new InvokeServer(config, new Router(config));
        server.getRouter().get("/user/:name", ctx -> ctx.writeString("Hello, " + ctx.param("name")));
        server.group("/api").post("/echo", ctx -> ctx.writeSuccessJson(new JSONObject(ctx.request().body())));
        server.getRouter().get("/boom", ctx -> {
            throw new IllegalStateException("boom");
        });
        server.start();
        baseUrl = "http://localhost:" + server.getPort();
    }

    @After
    public void tearDown() {
        server.stop();
    }

    @Test
    public void testServesMatchedRoute() throws IOException {
        try (Response response = RequestPerformer.get(baseUrl + "/user/alice")) {
            assertEquals(200, response.code());
            assertEquals("Hello, alice", response.body().string());
            assertEquals("close", response.header("Connection"));
        }
    }

    @Test
    public void testReadsRequestBody() throws IOException {
        try (Response response = RequestPerformer.post(baseUrl + "/api/echo", "{\"qty\":3}")) {
            JSONObject json = new JSONObject(response.body().string());
            assertEquals(200, json.getInt("code"));
            assertEquals("/api/echo", json.getString("url"));
            assertEquals(3, json.getJSONObject("data").getInt("qty"));
        }
    }

    @Test
    public void testUnmatchedPathIs404() throws IOException {
        try (Response response = RequestPerformer.get(baseUrl + "/nowhere")) {
            assertEquals(404, response.code());
            assertEquals("404 - Not Found", response.body().string());
        }
    }

    @Test
    public void testServerSurvivesHandlerFailure() throws IOException {
        try (Response response = RequestPerformer.get(baseUrl + "/boom")) {
            assertEquals(500, response.code());
        }
        try (Response response = RequestPerformer.get(baseUrl + "/user/bob")) {
            assertEquals("Hello, bob", response.body().string());
        }
    }

    @Test
    public void testOversizedHeadersAreRejected() throws IOException {
        StringBuilder raw = new StringBuilder("GET /user/alice HTTP/1.1\r\nHost: localhost\r\n");
        for (int i = 0; i < 50; i++) {
            raw.append("X-Filler-").append(i).append(": ").append("x".repeat(40)).append("\r\n");
        }
        raw.append("\r\n");

        assertTrue(sendRaw(raw.toString()).startsWith("HTTP/1.1 400"));
    }

    @Test
    public void testHeadOmitsBody() throws IOException {
        server.getRouter().head("/ping", ctx -> ctx.writeString("pong"));

        String reply = sendRaw("HEAD /ping HTTP/1.1\r\nHost: localhost\r\n\r\n");

        assertTrue(reply.startsWith("HTTP/1.1 200"));
        assertTrue(reply.contains("Content-Length: 4"));
        assertTrue(reply.endsWith("\r\n\r\n"));
    }

    @Test
    public void testStopEndsServer() {
        assertTrue(server.isRunning());

        server.stop();

        assertFalse(server.isRunning());
    }

    @Test
    public void testRestartAfterStop() throws IOException {
        server.stop();

        server.start();
        String restartedUrl = "http://localhost:" + server.getPort();

        assertTrue(server.isRunning());
        try (Response response = RequestPerformer.get(restartedUrl + "/user/carol")) {
            assertEquals(200, response.code());
            assertEquals("Hello, carol", response.body().string());
        }
    }

    @Test
    public void testConfiguredMiddlewareWrapsRouter() throws IOException {
        ServerConfiguration config = RequestPerformer.isolatedConfiguration()
                .setPort(0)
                .setMiddleware(List.of("logging", "poweredBy"));
        InvokeServer wrapped = new InvokeServer(config, new Router(config))
                .registerMiddleware("poweredBy", next -> (req, res) -> {
                    next.dispatch(req, res);
                    res.header("X-Powered-By", "invoke");
                });
        wrapped.getRouter().get("/ping", ctx -> ctx.writeString("pong"));
        wrapped.start();
        try (Response response = RequestPerformer.get("http://localhost:" + wrapped.getPort() + "/ping")) {
            assertEquals("invoke", response.header("X-Powered-By"));
            assertEquals("pong", response.body().string());
        } finally {
            wrapped.stop();
        }
    }

    @Test(expected = ServerStartupException.class)
    public void testBindingUsedPortFails() {
        ServerConfiguration config = RequestPerformer.isolatedConfiguration().setPort(server.getPort());
        new InvokeServer(config, new Router(config)).start();
    }

    private String sendRaw(String request) throws IOException {
        try (Socket socket = new Socket("localhost", server.getPort())) {
            socket.setSoTimeout(5000);
            OutputStream out = socket.getOutputStream();
            out.write(request.getBytes(StandardCharsets.UTF_8));
            out.flush();
            InputStream in = socket.getInputStream();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}

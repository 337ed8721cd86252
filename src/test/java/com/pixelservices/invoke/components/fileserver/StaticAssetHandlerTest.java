package com.pixelservices.invoke.components.fileserver;

import com.pixelservices.invoke.components.http.HttpContext;
import com.pixelservices.invoke.components.http.lifecycle.Response;
import com.pixelservices.invoke.components.http.routing.Router;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.pixelservices.invoke.utils.RequestPerformer.dispatch;
import static com.pixelservices.invoke.utils.RequestPerformer.isolatedConfiguration;
import static com.pixelservices.invoke.utils.RequestPerformer.request;
import static org.junit.Assert.*;

public class StaticAssetHandlerTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Path root;
    private StaticAssetHandler handler;

    @Before
    public void setUp() throws IOException {
        root = folder.newFolder("public").toPath();
        Files.writeString(root.resolve("index.html"), "<h1>home</h1>", StandardCharsets.UTF_8);
        Files.createDirectories(root.resolve("css"));
        Files.writeString(root.resolve("css").resolve("site.css"), "body{}", StandardCharsets.UTF_8);
        Files.writeString(folder.getRoot().toPath().resolve("secret.txt"), "secret", StandardCharsets.UTF_8);
        handler = new StaticAssetHandler(root, "index.html");
    }

    private HttpContext context(String target) {
        return new HttpContext(request("GET", target), new Response());
    }

    @Test
    public void testServesFile() {
        HttpContext ctx = context("/css/site.css");

        assertFalse(handler.serve(ctx));
        assertEquals("text/css", ctx.response().getContentType());
        assertEquals("body{}", ctx.response().getBodyAsString());
    }

    @Test
    public void testDirectoryServesIndexFile() {
        HttpContext ctx = context("/");

        assertFalse(handler.serve(ctx));
        assertEquals("text/html", ctx.response().getContentType());
        assertEquals("<h1>home</h1>", ctx.response().getBodyAsString());
    }

    @Test
    public void testDirectoryWithoutIndexFallsThrough() {
        assertTrue(handler.serve(context("/css")));
    }

    @Test
    public void testMissingFileFallsThrough() {
        HttpContext ctx = context("/missing.js");

        assertTrue(handler.serve(ctx));
        assertNull(ctx.response().getBody());
    }

    @Test
    public void testTraversalIsRefused() {
        assertTrue(handler.serve(context("/../secret.txt")));
        assertNull(FileServerUtility.resolveUnderRoot(root, "/../secret.txt"));
    }

    @Test
    public void testRouterFallsBackToAssets() {
        Router router = new Router(isolatedConfiguration().setStaticDir(root));
        router.get("/api/ping", ctx -> ctx.writeString("pong"));

        assertEquals("pong", dispatch(router, "GET", "/api/ping").getBodyAsString());
        assertEquals("body{}", dispatch(router, "GET", "/css/site.css").getBodyAsString());
        assertEquals(404, dispatch(router, "GET", "/css/other.css").getStatus());
    }

    @Test
    public void testContentTypes() {
        assertEquals("application/javascript", FileServerUtility.getContentType("app.JS"));
        assertEquals("image/png", FileServerUtility.getContentType("logo.png"));
        assertEquals("application/octet-stream", FileServerUtility.getContentType("blob.bin"));
    }
}

package com.pixelservices.invoke.components.http;

import com.pixelservices.invoke.components.http.lifecycle.Request;
import com.pixelservices.invoke.components.http.lifecycle.Response;
import com.pixelservices.invoke.models.ErrorCode;
import org.json.JSONException;
import org.json.JSONObject;
import org.junit.Test;

import java.net.InetSocketAddress;
import java.util.Map;

import static com.pixelservices.invoke.utils.RequestPerformer.request;
import static org.junit.Assert.*;

public class HttpContextTest {

    private static HttpContext context(String target) {
        return new HttpContext(request("GET", target), new Response());
    }

    @Test
    public void testSuccessEnvelope() {
        HttpContext ctx = context("/orders?page=1");

        ctx.writeSuccessJson(Map.of("id", 7));

        JSONObject json = (JSONObject) ctx.response().getBody();
        assertEquals("application/json", ctx.response().getContentType());
        assertEquals(200, json.getInt("code"));
        assertEquals("/orders", json.getString("url"));
        assertEquals(7, json.getJSONObject("data").getInt("id"));
        assertTrue(json.getString("desc").startsWith("HttpContextTest.java:"));
    }

    @Test
    public void testErrorEnvelopeWithCode() {
        HttpContext ctx = context("/orders");

        ctx.writeErrorJson(ErrorCode.PARAM_ERROR, "id is required");

        JSONObject json = (JSONObject) ctx.response().getBody();
        assertEquals(200, ctx.response().getStatus());
        assertEquals(2000, json.getInt("code"));
        assertEquals("ParamError: id is required", json.getString("data"));
    }

    @Test
    public void testErrorEnvelopeWithNullData() {
        HttpContext ctx = context("/orders");

        ctx.writeErrorJson(4001, null);

        JSONObject json = (JSONObject) ctx.response().getBody();
        assertEquals(4001, json.getInt("code"));
        assertTrue(json.isNull("data"));
    }

    @Test
    public void testParamsAreReadOnly() {
        HttpContext ctx = context("/user/alice");
        ctx.bindParams(Map.of("name", "alice"));

        assertEquals("alice", ctx.param("name"));
        try {
            ctx.params().put("name", "mallory");
            fail("Expected UnsupportedOperationException");
        } catch (UnsupportedOperationException expected) {
            assertEquals("alice", ctx.param("name"));
        }
    }

    @Test
    public void testRequestShortcuts() {
        HttpContext ctx = context("/find?q=x");

        assertEquals(HttpMethod.GET, ctx.method());
        assertEquals("/find", ctx.path());
        assertEquals("x", ctx.query("q"));
        assertEquals("localhost", ctx.header("host"));
    }

    private static HttpContext context(String head, String body, InetSocketAddress remote) {
        return new HttpContext(new Request(head + "\r\n" + body, remote), new Response());
    }

    @Test
    public void testRealIpPrefersXRealIp() {
        HttpContext ctx = context("GET / HTTP/1.1\r\nX-Real-IP: 10.0.0.7\r\nX-Forwarded-For: 1.1.1.1, 2.2.2.2\r\n", "",
                new InetSocketAddress("127.0.0.1", 4000));

        assertEquals("10.0.0.7", ctx.realIp());
    }

    @Test
    public void testRealIpUsesLastForwardedHop() {
        HttpContext ctx = context("GET / HTTP/1.1\r\nX-Forwarded-For: 1.1.1.1, 2.2.2.2\r\n", "",
                new InetSocketAddress("127.0.0.1", 4000));

        assertEquals("2.2.2.2", ctx.realIp());
    }

    @Test
    public void testRealIpFallsBackToPeer() {
        assertEquals("127.0.0.1", context("GET / HTTP/1.1\r\n", "", new InetSocketAddress("127.0.0.1", 4000)).realIp());
        assertEquals("", context("GET / HTTP/1.1\r\n", "", null).realIp());
    }

    @Test
    public void testHeaderShortcuts() {
        HttpContext ctx = context("POST /x HTTP/1.1\r\nHost: example.org\r\nUser-Agent: curl/8.0\r\nContent-Length: 2\r\n", "{}", null);

        assertEquals("example.org", ctx.host());
        assertEquals("curl/8.0", ctx.userAgent());
        assertEquals(2L, ctx.contentLength());
        assertEquals(-1L, context("GET / HTTP/1.1\r\n", "", null).contentLength());
    }

    @Test
    public void testFormValues() {
        HttpContext ctx = context("POST /form?user=fromQuery&page=2 HTTP/1.1\r\n"
                + "Content-Type: application/x-www-form-urlencoded\r\n", "user=fromBody", null);

        assertEquals("fromBody", ctx.formValue("user"));
        assertEquals("2", ctx.formValue("page"));
        assertEquals("fromBody", ctx.postFormValue("user"));
        assertNull(ctx.postFormValue("page"));
    }

    @Test
    public void testParseJsonBody() {
        HttpContext ctx = context("POST /orders HTTP/1.1\r\nContent-Type: application/json\r\n", "{\"qty\":3}", null);

        assertEquals(3, ctx.parseJsonBody().getInt("qty"));
        assertTrue(context("POST /orders HTTP/1.1\r\n", "", null).parseJsonBody().isEmpty());
    }

    @Test(expected = JSONException.class)
    public void testParseJsonBodyRejectsNonJson() {
        context("POST /orders HTTP/1.1\r\n", "qty=3", null).parseJsonBody();
    }
}

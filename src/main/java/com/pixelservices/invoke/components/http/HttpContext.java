package com.pixelservices.invoke.components.http;

import com.pixelservices.invoke.components.http.lifecycle.Request;
import com.pixelservices.invoke.components.http.lifecycle.Response;
import com.pixelservices.invoke.models.ErrorCode;
import com.pixelservices.invoke.models.ResponseResult;
import org.json.JSONException;
import org.json.JSONObject;

import java.net.InetSocketAddress;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Per-request state handed to hooks and handlers. Path parameters bound by the route matcher
 * live here and nowhere else.
 */
public class HttpContext {
    private static final StackWalker STACK_WALKER = StackWalker.getInstance();

    private final Request request;
    private final Response response;
    private final Map<String, String> params = new HashMap<>();
    private final Map<String, Object> attributes = new HashMap<>();

    public HttpContext(Request request, Response response) {
        this.request = request;
        this.response = response;
    }

    public Request request() {
        return request;
    }

    public Response response() {
        return response;
    }

    /**
     * @return the path parameters bound for this request, read-only
     */
    public Map<String, String> params() {
        return Collections.unmodifiableMap(params);
    }

    /**
     * @param name the parameter name as declared in the route, e.g. {@code name} for {@code :name}
     * @return the bound value, or null
     */
    public String param(String name) {
        return params.get(name);
    }

    /**
     * Copies the parameters bound by the route matcher into this context.
     */
    public void bindParams(Map<String, String> bound) {
        params.putAll(bound);
    }

    @SuppressWarnings("unchecked")
    public <T> T attribute(String key) {
        return (T) attributes.get(key);
    }

    public HttpContext attribute(String key, Object value) {
        attributes.put(key, value);
        return this;
    }

    // ------------------ Request shortcuts ------------------ //

    public HttpMethod method() {
        return request.method();
    }

    public String path() {
        return request.path();
    }

    public String header(String name) {
        return request.header(name);
    }

    public String query(String name) {
        return request.queryParam(name);
    }

    public InetSocketAddress remoteAddress() {
        return request.clientAddress();
    }

    /**
     * Client address as seen through proxies: {@code X-Real-IP}, else the last
     * {@code X-Forwarded-For} hop, else the socket peer.
     *
     * @return the address, or an empty string if none is known
     */
    public String realIp() {
        String realIp = request.header("X-Real-IP");
        if (realIp != null && !realIp.isEmpty()) {
            return realIp;
        }
        String forwardedFor = request.header("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isEmpty()) {
            String[] hops = forwardedFor.split(",");
            return hops[hops.length - 1].trim();
        }
        InetSocketAddress remote = request.clientAddress();
        if (remote == null) {
            return "";
        }
        return remote.getAddress() != null ? remote.getAddress().getHostAddress() : remote.getHostString();
    }

    public String userAgent() {
        return request.header("User-Agent");
    }

    public String host() {
        return request.header("Host");
    }

    /**
     * @return the declared {@code Content-Length}, or -1 if absent or unparseable
     */
    public long contentLength() {
        String value = request.header("Content-Length");
        if (value == null) {
            return -1;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    /**
     * First value of a form field, looking at url-encoded body fields before the query string.
     */
    public String formValue(String name) {
        String value = request.formParam(name);
        return value != null ? value : request.queryParam(name);
    }

    /**
     * First value of a url-encoded body field. The query string is ignored.
     */
    public String postFormValue(String name) {
        return request.formParam(name);
    }

    /**
     * Parses the request body as a JSON object. An empty body yields an empty object.
     *
     * @throws JSONException if the body is not a JSON object
     */
    public JSONObject parseJsonBody() {
        String rawBody = request.body();
        if (rawBody == null || rawBody.isEmpty()) {
            return new JSONObject();
        }
        return new JSONObject(rawBody);
    }

    // ------------------ Response shortcuts ------------------ //

    public HttpContext status(int code) {
        response.status(code);
        return this;
    }

    public HttpContext header(String key, String value) {
        response.header(key, value);
        return this;
    }

    public void writeString(String s) {
        response.body(s);
    }

    public void writeBytes(byte[] data) {
        response.type("application/octet-stream").body(data);
    }

    /**
     * Writes {@code data} wrapped in a {@link ResponseResult} with code 200.
     */
    public void writeSuccessJson(Object data) {
        writeJson(new ResponseResult(200, path(), callerInfo(), data));
    }

    /**
     * Writes an error envelope. The HTTP status stays 200; the error travels in the {@code code} field.
     */
    public void writeErrorJson(int code, Object message) {
        writeJson(new ResponseResult(code, path(), callerInfo(), message));
    }

    /**
     * Writes an error envelope whose message is prefixed with the error code label,
     * e.g. {@code "ParamError: id is required"}.
     */
    public void writeErrorJson(ErrorCode code, String message) {
        writeJson(new ResponseResult(code.getCode(), path(), callerInfo(), code.getLabel() + ": " + message));
    }

    private void writeJson(ResponseResult result) {
        response.type("application/json").body(result.toJson());
    }

    private static String callerInfo() {
        return STACK_WALKER.walk(frames -> frames
                .filter(frame -> !frame.getClassName().equals(HttpContext.class.getName()))
                .findFirst()
                .map(frame -> frame.getFileName() + ":" + frame.getLineNumber())
                .orElse("unknown"));
    }
}

package com.pixelservices.invoke.components.http.lifecycle;

import org.json.JSONArray;
import org.json.JSONObject;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Represents an HTTP response, buffered until the transport serializes it.
 */
public class Response {
    private final Map<String, String> headers;
    private int statusCode;
    private String contentType;
    private Object body;
    private boolean finalized;

    /**
     * Constructs a new Response object with default status and a default content type of "text/plain".
     */
    public Response() {
        this.headers = Collections.synchronizedMap(new LinkedHashMap<>());
        this.statusCode = 200;
        this.contentType = "text/plain";
        this.finalized = false;
    }

    /**
     * Sets the HTTP status code of the response.
     *
     * @param code the status code to set
     * @return the updated Response object
     * @throws IllegalStateException if the response is already finalized
     */
    public Response status(int code) {
        ensureNotFinalized();
        this.statusCode = code;
        return this;
    }

    /**
     * Sets the content type of the response.
     *
     * @param contentType the content type to set
     * @return the updated Response object
     * @throws IllegalStateException if the response is already finalized
     */
    public Response type(String contentType) {
        ensureNotFinalized();
        this.contentType = contentType;
        return this;
    }

    /**
     * Adds a header to the response.
     *
     * @param key   the header name
     * @param value the header value
     * @return the updated Response object
     * @throws IllegalStateException if the response is already finalized
     */
    public Response header(String key, String value) {
        ensureNotFinalized();
        headers.put(key, value);
        return this;
    }

    /**
     * Sets the body of the response.
     * Warning: Overrides existing body content.
     *
     * @param body the body content
     * @return the updated Response object
     * @throws IllegalStateException if the response is already finalized
     */
    public Response body(Object body) {
        ensureNotFinalized();
        this.body = body;
        return this;
    }

    /**
     * Discards status, headers and body so a fresh response can be written.
     * Also lifts finalization.
     */
    public Response reset() {
        headers.clear();
        statusCode = 200;
        contentType = "text/plain";
        body = null;
        finalized = false;
        return this;
    }

    /**
     * Marks the response as finalized, preventing further modifications.
     */
    public void finalizeResponse() {
        if (!this.finalized) {
            this.finalized = true;
            headers.put("Content-Length", String.valueOf(getSerializedBody().length));
        }
    }

    public boolean isFinalized() {
        return finalized;
    }

    /**
     * Serializes the response into a ByteBuffer. The connection is always closed after one exchange.
     *
     * @return the serialized response as a ByteBuffer
     */
    public ByteBuffer getSerialized() {
        byte[] bodyBytes = getSerializedBody();
        headers.put("Content-Length", String.valueOf(bodyBytes.length));
        headers.putIfAbsent("Connection", "close");
        byte[] headerBytes = getHeaderBytes();

        ByteBuffer buffer = ByteBuffer.allocate(headerBytes.length + bodyBytes.length);
        buffer.put(headerBytes);
        buffer.put(bodyBytes);
        buffer.flip();
        return buffer;
    }

    /**
     * Serializes the response body based on its type.
     *
     * @return the serialized body as a byte array
     * @throws UnsupportedOperationException if the body type is not supported
     */
    public byte[] getSerializedBody() {
        if (body == null) {
            return new byte[0];
        }
        if (body instanceof byte[]) {
            return (byte[]) body;
        }
        if (body instanceof String || body instanceof JSONObject || body instanceof JSONArray) {
            return body.toString().getBytes(StandardCharsets.UTF_8);
        }
        throw new UnsupportedOperationException("Unsupported body type for content type: " + contentType
                + ", received " + body.getClass().getSimpleName() + " instead");
    }

    /**
     * Gets just the header portion of the response as a byte array.
     *
     * @return the status line and headers
     */
    public byte[] getHeaderBytes() {
        StringBuilder headerBuilder = new StringBuilder();
        headerBuilder.append("HTTP/1.1 ")
                .append(statusCode)
                .append(" ")
                .append(getStatusMessage(statusCode))
                .append("\r\n");

        if (contentType != null) {
            headers.putIfAbsent("Content-Type", contentType);
        }

        synchronized (headers) {
            headers.entrySet().stream()
                    .filter(entry -> entry.getValue() != null)
                    .forEach(entry -> headerBuilder.append(entry.getKey())
                            .append(": ")
                            .append(entry.getValue())
                            .append("\r\n"));
        }

        headerBuilder.append("\r\n");
        return headerBuilder.toString().getBytes(StandardCharsets.UTF_8);
    }

    static String getStatusMessage(int statusCode) {
        switch (statusCode) {
            case 200: return "OK";
            case 201: return "Created";
            case 204: return "No Content";
            case 206: return "Partial Content";
            case 301: return "Moved Permanently";
            case 302: return "Found";
            case 304: return "Not Modified";
            case 400: return "Bad Request";
            case 401: return "Unauthorized";
            case 403: return "Forbidden";
            case 404: return "Not Found";
            case 405: return "Method Not Allowed";
            case 500: return "Internal Server Error";
            case 503: return "Service Unavailable";
            default: return "Unknown Status";
        }
    }

    private void ensureNotFinalized() {
        if (finalized) {
            throw new IllegalStateException("Response is already finalized");
        }
    }

    public int getStatus() {
        return statusCode;
    }

    public String getContentType() {
        return contentType;
    }

    public String getHeader(String name) {
        return headers.get(name);
    }

    public Object getBody() {
        return body;
    }

    /**
     * @return the body decoded as UTF-8, empty if none was set
     */
    public String getBodyAsString() {
        return new String(getSerializedBody(), StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "Response{" +
                "headers=" + headers +
                ", statusCode=" + statusCode +
                ", contentType='" + contentType + '\'' +
                ", body=" + body +
                ", finalized=" + finalized +
                '}';
    }
}

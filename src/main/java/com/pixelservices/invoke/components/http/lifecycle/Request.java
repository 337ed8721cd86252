package com.pixelservices.invoke.components.http.lifecycle;

import com.pixelservices.invoke.components.http.HttpMethod;
import com.pixelservices.invoke.exceptions.MalformedRequestException;

import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Represents an HTTP request, parsed from a raw buffer.
 */
public class Request {
    private HttpMethod method;
    private String rawMethod;
    private String path;
    private String rawPath;
    private String queryString;
    private final Map<String, String> headers;
    private final Map<String, List<String>> queryParams;
    private final Map<String, List<String>> formParams;
    private String body;
    private final InetSocketAddress clientAddress;

    public Request(String rawRequest, InetSocketAddress clientAddress) {
        this.headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        this.queryParams = new LinkedHashMap<>();
        this.formParams = new LinkedHashMap<>();
        this.clientAddress = clientAddress;

        if (rawRequest == null || rawRequest.isEmpty()) {
            throw new MalformedRequestException("Invalid or empty request line");
        }
        String[] requestLines = rawRequest.split("\r\n", -1);
        if (requestLines[0].isEmpty()) {
            throw new MalformedRequestException("Invalid or empty request line");
        }

        parseRequestLine(requestLines[0]);
        parseHeaders(requestLines);
        parseUrlEncoded(queryString, queryParams);
        parseBody(rawRequest);
        parseFormParams();
    }

    /**
     * Parses a request without a known client address, e.g. one built in memory.
     */
    public Request(String rawRequest) {
        this(rawRequest, null);
    }

    /**
     * Parses the request line (method, target, and version).
     *
     * @param requestLine the first line of the HTTP request
     * @throws MalformedRequestException if the request line format is invalid
     */
    private void parseRequestLine(String requestLine) {
        String[] parts = requestLine.split(" ");
        if (parts.length < 3 || parts[1].isEmpty()) {
            throw new MalformedRequestException("Invalid request line format: " + requestLine);
        }
        this.rawMethod = parts[0];
        this.method = HttpMethod.get(parts[0]);
        String target = parts[1];
        int qIndex = target.indexOf('?');
        this.rawPath = qIndex != -1 ? target.substring(0, qIndex) : target;
        this.path = decodePath(rawPath);
        this.queryString = qIndex != -1 ? target.substring(qIndex + 1) : null;
    }

    /**
     * Percent-decodes a path as UTF-8. A literal '+' stays a '+'.
     *
     * @throws MalformedRequestException if an escape sequence is invalid
     */
    static String decodePath(String rawPath) {
        if (rawPath.indexOf('%') == -1) {
            return rawPath;
        }
        try {
            return URLDecoder.decode(rawPath.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new MalformedRequestException("Invalid escape in request path: " + rawPath);
        }
    }

    /**
     * Parses HTTP headers from the raw request lines.
     *
     * @param requestLines the lines of the HTTP request
     */
    private void parseHeaders(String[] requestLines) {
        int index = 1;
        while (index < requestLines.length && !requestLines[index].isEmpty()) {
            String line = requestLines[index];
            int colon = line.indexOf(':');
            if (colon > 0) {
                headers.put(line.substring(0, colon).trim(), line.substring(colon + 1).trim());
            }
            index++;
        }
    }

    /**
     * Parses {@code application/x-www-form-urlencoded} text, such as a query string, into {@code target}.
     */
    private static void parseUrlEncoded(String encoded, Map<String, List<String>> target) {
        if (encoded == null || encoded.isEmpty()) {
            return;
        }
        for (String param : encoded.split("&")) {
            if (param.isEmpty()) {
                continue;
            }
            String[] keyValue = param.split("=", 2);
            String key = decode(keyValue[0]);
            String value = keyValue.length == 2 ? decode(keyValue[1]) : "";
            target.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
        }
    }

    private static String decode(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return value;
        }
    }

    /**
     * Reads url-encoded form fields from the body of POST, PUT and PATCH requests.
     */
    private void parseFormParams() {
        if (method != HttpMethod.POST && method != HttpMethod.PUT && method != HttpMethod.PATCH) {
            return;
        }
        String contentType = headers.get("Content-Type");
        if (contentType != null && contentType.toLowerCase(Locale.ROOT).startsWith("application/x-www-form-urlencoded")) {
            parseUrlEncoded(body, formParams);
        }
    }

    /**
     * Everything after the blank line terminating the headers.
     */
    private void parseBody(String rawRequest) {
        int headersEnd = rawRequest.indexOf("\r\n\r\n");
        this.body = headersEnd != -1 ? rawRequest.substring(headersEnd + 4) : "";
    }

    /**
     * Retrieves the HTTP method of the request.
     *
     * @return the HttpMethod, {@link HttpMethod#UNSUPPORTED} for unknown verbs
     */
    public HttpMethod method() {
        return method;
    }

    /**
     * @return the method token exactly as received
     */
    public String rawMethod() {
        return rawMethod;
    }

    /**
     * Retrieves the request path, percent-decoded and without the query string.
     *
     * @return the path as a string
     */
    public String path() {
        return path;
    }

    /**
     * @return the path exactly as it appeared in the request target
     */
    public String rawPath() {
        return rawPath;
    }

    /**
     * @return the raw query string, or null if the target had none
     */
    public String queryString() {
        return queryString;
    }

    /**
     * Retrieves the value of a specific header. Header names are case-insensitive.
     *
     * @param name the header name
     * @return the header value, or null if not present
     */
    public String header(String name) {
        return headers.get(name);
    }

    public Map<String, String> headers() {
        return Collections.unmodifiableMap(headers);
    }

    /**
     * Retrieves the query parameters of the request.
     *
     * @return a map of query parameters
     */
    public Map<String, List<String>> queryParams() {
        return queryParams;
    }

    /**
     * @return the first value of the query parameter, or null
     */
    public String queryParam(String name) {
        List<String> values = queryParams.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    /**
     * @return the url-encoded form fields sent in the body, empty for other bodies and methods
     */
    public Map<String, List<String>> formParams() {
        return formParams;
    }

    /**
     * @return the first value of the body form field, or null
     */
    public String formParam(String name) {
        List<String> values = formParams.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    /**
     * Retrieves the request body.
     *
     * @return the body as a string, empty if none was sent
     */
    public String body() {
        return body;
    }

    /**
     * Retrieves the client's remote address.
     *
     * @return the remote address as an InetSocketAddress
     */
    public InetSocketAddress clientAddress() {
        return clientAddress;
    }

    @Override
    public String toString() {
        return "Request{" +
                "method=" + rawMethod +
                ", path='" + rawPath + '\'' +
                ", headers=" + headers +
                ", queryParams=" + queryParams +
                ", clientAddress=" + clientAddress +
                '}';
    }
}

package com.pixelservices.invoke.components.http;

import com.pixelservices.invoke.components.InvokeServer;
import com.pixelservices.invoke.components.http.lifecycle.Request;
import com.pixelservices.invoke.components.http.lifecycle.Response;
import com.pixelservices.invoke.models.RequestDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.AsynchronousSocketChannel;
import java.nio.channels.CompletionHandler;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Turns raw request text into a {@link Request}, runs it through the dispatcher (the router,
 * wrapped in the configured middleware) and writes the buffered {@link Response} back to the client.
 */
public class HttpRequestHandler {
    private static final Logger logger = LoggerFactory.getLogger(HttpRequestHandler.class);

    private final RequestDispatcher dispatcher;
    private final Duration writeTimeout;

    public HttpRequestHandler(RequestDispatcher dispatcher, Duration writeTimeout) {
        this.dispatcher = dispatcher;
        this.writeTimeout = writeTimeout;
    }

    /**
     * @throws com.pixelservices.invoke.exceptions.MalformedRequestException if the request line cannot be parsed
     */
    public void handle(AsynchronousSocketChannel clientChannel, String rawRequest, InetSocketAddress remoteAddress) {
        final Request request = new Request(rawRequest, remoteAddress);
        sendResponse(process(request), request.method() == HttpMethod.HEAD, clientChannel);
    }

    /**
     * Dispatches {@code request} and finalizes the response, so nothing can change it while it is written.
     */
    public Response process(Request request) {
        final Response response = new Response();
        dispatcher.dispatch(request, response);
        response.finalizeResponse();
        return response;
    }

    /**
     * Serializes the whole response up front, then writes it and closes the connection.
     */
    private void sendResponse(Response response, boolean headersOnly, AsynchronousSocketChannel clientChannel) {
        final ByteBuffer serialized = response.getSerialized();
        final ByteBuffer responseBuffer = headersOnly ? ByteBuffer.wrap(response.getHeaderBytes()) : serialized;
        final long timeoutMillis = writeTimeout.toMillis();
        clientChannel.write(responseBuffer, timeoutMillis, TimeUnit.MILLISECONDS, responseBuffer, new CompletionHandler<Integer, ByteBuffer>() {
            @Override
            public void completed(Integer bytesWritten, ByteBuffer buf) {
                if (buf.hasRemaining()) {
                    clientChannel.write(buf, timeoutMillis, TimeUnit.MILLISECONDS, buf, this);
                } else {
                    InvokeServer.closeSocket(clientChannel);
                }
            }

            @Override
            public void failed(Throwable exc, ByteBuffer buf) {
                logger.error("Error sending response: {}", exc.getMessage());
                InvokeServer.closeSocket(clientChannel);
            }
        });
    }
}

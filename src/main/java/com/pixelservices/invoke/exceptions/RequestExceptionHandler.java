package com.pixelservices.invoke.exceptions;

import com.pixelservices.invoke.components.InvokeServer;
import com.pixelservices.invoke.components.http.lifecycle.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.channels.AsynchronousSocketChannel;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Answers requests that failed before or outside routing, e.g. unparseable request lines.
 * Failures inside hooks and handlers never get here; the router recovers those itself.
 */
public class RequestExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(RequestExceptionHandler.class);
    private static final long WRITE_TIMEOUT_SECONDS = 5;

    private final AsynchronousSocketChannel clientChannel;
    private final Exception exception;

    public RequestExceptionHandler(AsynchronousSocketChannel clientChannel, Exception exception) {
        this.clientChannel = clientChannel;
        this.exception = exception;
    }

    /**
     * Handles the exception by sending an appropriate error response to the client.
     */
    public void handle() {
        if (exception instanceof MalformedRequestException) {
            sendErrorResponse(400, "Bad request: " + exception.getMessage());
        } else {
            logger.error("Unhandled error while serving request", exception);
            sendErrorResponse(500, "500 - Internal Server Error");
        }
    }

    /**
     * Sends an error response with the given status code and message to the client.
     *
     * @param statusCode the HTTP status code of the error response
     * @param message    the error message to include in the response
     */
    private void sendErrorResponse(int statusCode, String message) {
        Response errorResponse = new Response();
        errorResponse.status(statusCode).body(message).type("text/plain");
        try {
            ByteBuffer responseBuffer = errorResponse.getSerialized();
            while (responseBuffer.hasRemaining()) {
                clientChannel.write(responseBuffer).get(WRITE_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            }
        } catch (ExecutionException | TimeoutException e) {
            logger.warn("Error sending error response: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            InvokeServer.closeSocket(clientChannel);
        }
    }
}

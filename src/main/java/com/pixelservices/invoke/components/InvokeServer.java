package com.pixelservices.invoke.components;

import com.pixelservices.invoke.components.http.HttpRequestHandler;
import com.pixelservices.invoke.components.http.middleware.MiddlewareRegistry;
import com.pixelservices.invoke.components.http.routing.RouteGroup;
import com.pixelservices.invoke.components.http.routing.Router;
import com.pixelservices.invoke.exceptions.MalformedRequestException;
import com.pixelservices.invoke.exceptions.RequestExceptionHandler;
import com.pixelservices.invoke.exceptions.ServerStartupException;
import com.pixelservices.invoke.models.Middleware;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.AsynchronousServerSocketChannel;
import java.nio.channels.AsynchronousSocketChannel;
import java.nio.channels.CompletionHandler;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Asynchronous HTTP/1.1 host for a {@link Router}. Every connection carries exactly one request:
 * it is read, dispatched on a worker thread, answered and closed.
 */
public class InvokeServer {
    private static final Logger logger = LoggerFactory.getLogger(InvokeServer.class);

    public static final int BUFFER_POOL_SIZE = 64;
    public static final int BUFFER_SIZE = 16384;

    private final ServerConfiguration config;
    private final Router router;
    private final OffHeapBufferPool bufferPool = new OffHeapBufferPool(BUFFER_POOL_SIZE, BUFFER_POOL_SIZE * 4, BUFFER_SIZE);
    private final MiddlewareRegistry middlewareRegistry;
    private volatile HttpRequestHandler httpRequestHandler;
    private volatile ExecutorService workers;

    private AsynchronousServerSocketChannel serverSocketChannel;
    private volatile boolean isRunning = false;
    private Thread serverThread;
    private CountDownLatch stopLatch;
    private final Object serverLock = new Object();

    // ------------------ Constructors ------------------ //

    public InvokeServer(ServerConfiguration config, Router router, MiddlewareRegistry middlewareRegistry) {
        this.config = config;
        this.router = router;
        this.middlewareRegistry = middlewareRegistry;
    }

    public InvokeServer(ServerConfiguration config, Router router) {
        this(config, router, MiddlewareRegistry.withDefaults());
    }

    public InvokeServer(ServerConfiguration config) {
        this(config, new Router(config));
    }

    public InvokeServer(int port) {
        this(new ServerConfiguration().setPort(port));
    }

    /**
     * Starts one server per configuration, all sharing {@code router}.
     */
    public static List<InvokeServer> serveAll(List<ServerConfiguration> configurations, Router router) {
        List<InvokeServer> servers = new ArrayList<>();
        for (ServerConfiguration configuration : configurations) {
            InvokeServer server = new InvokeServer(configuration, router);
            server.start();
            servers.add(server);
        }
        return servers;
    }

    // ------------------ Server Startup ------------------ //

    /**
     * Binds the configured address and starts accepting connections.
     * This method is non-blocking and returns a thread that can be used to wait for the server to stop.
     *
     * @return The thread running the server
     * @throws ServerStartupException if the address cannot be bound
     */
    public Thread start() {
        synchronized (serverLock) {
            if (isRunning) {
                throw new IllegalStateException("Server is already running");
            }
            final long startTime = System.currentTimeMillis();
            try {
                serverSocketChannel = AsynchronousServerSocketChannel.open()
                        .bind(new InetSocketAddress(config.getDomain(), config.getPort()));
            } catch (IOException e) {
                logger.error("Error starting server on {}:{}", config.getDomain(), config.getPort(), e);
                throw new ServerStartupException("Error starting server on " + config.getDomain() + ":" + config.getPort(), e);
            }
            workers = newWorkerPool();
            httpRequestHandler = new HttpRequestHandler(
                    middlewareRegistry.apply(router::dispatch, config.getMiddleware()), config.getWriteTimeout());
            isRunning = true;
            stopLatch = new CountDownLatch(1);
            acceptNextConnection();

            final CountDownLatch latch = stopLatch;
            serverThread = new Thread(() -> {
                try {
                    latch.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "InvokeServer-" + getPort());
            serverThread.setDaemon(false);
            serverThread.start();

            logger.info("Server listening on {}:{} in {} ms, serving {} routes",
                    config.getDomain(), getPort(), System.currentTimeMillis() - startTime, router.routeCount());
            return serverThread;
        }
    }

    private ExecutorService newWorkerPool() {
        AtomicInteger workerIds = new AtomicInteger();
        return Executors.newCachedThreadPool(task -> {
            Thread thread = new Thread(task, "InvokeWorker-" + config.getPort() + "-" + workerIds.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Stops the server safely.
     * This method blocks until in-flight requests finish or the shutdown grace period elapses.
     */
    public void stop() {
        synchronized (serverLock) {
            if (!isRunning) {
                return;
            }
            isRunning = false;
            try {
                if (serverSocketChannel != null && serverSocketChannel.isOpen()) {
                    serverSocketChannel.close();
                }
                workers.shutdown();
                long graceMillis = config.getShutdownGracePeriod().toMillis();
                if (!workers.awaitTermination(graceMillis, TimeUnit.MILLISECONDS)) {
                    logger.warn("Workers did not finish within {} ms, forcing shutdown", graceMillis);
                    workers.shutdownNow();
                }
                logger.info("Server stopped on port {}", config.getPort());
            } catch (IOException e) {
                logger.error("Error closing server channel", e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workers.shutdownNow();
            } finally {
                stopLatch.countDown();
                serverThread = null;
            }
        }
    }

    /**
     * Installs a JVM shutdown hook that stops this server, then blocks until it has stopped.
     */
    public void awaitShutdown() throws InterruptedException {
        Thread thread;
        synchronized (serverLock) {
            thread = serverThread;
        }
        if (thread == null) {
            return;
        }
        Runtime.getRuntime().addShutdownHook(new Thread(this::stop, "InvokeServer-shutdown-" + config.getPort()));
        thread.join();
    }

    /**
     * Checks if the server is currently running.
     *
     * @return true if the server is running, false otherwise
     */
    public boolean isRunning() {
        synchronized (serverLock) {
            return isRunning && serverThread != null && serverThread.isAlive();
        }
    }

    /**
     * @return the bound port, which differs from the configured one when port 0 was requested
     */
    public int getPort() {
        try {
            if (serverSocketChannel != null && serverSocketChannel.isOpen()) {
                return ((InetSocketAddress) serverSocketChannel.getLocalAddress()).getPort();
            }
        } catch (IOException e) {
            logger.warn("Could not read bound address", e);
        }
        return config.getPort();
    }

    private void acceptNextConnection() {
        serverSocketChannel.accept(null, new CompletionHandler<AsynchronousSocketChannel, Object>() {
            @Override
            public void completed(AsynchronousSocketChannel clientChannel, Object attachment) {
                if (isRunning) {
                    acceptNextConnection();
                }
                handleClient(clientChannel);
            }

            @Override
            public void failed(Throwable exc, Object attachment) {
                if (isRunning) {
                    logger.warn("Failed to accept connection: {}", exc.getMessage());
                    acceptNextConnection();
                }
            }
        });
    }

    // ------------------ Route Registration ------------------ //

    public Router getRouter() {
        return router;
    }

    public RouteGroup group(String prefix) {
        return router.group(prefix);
    }

    public ServerConfiguration getConfig() {
        return config;
    }

    /**
     * Registers a middleware that the configuration's {@code middleware} list can name.
     * Takes effect on the next {@link #start()}.
     */
    public InvokeServer registerMiddleware(String name, Middleware middleware) {
        middlewareRegistry.register(name, middleware);
        return this;
    }

    public MiddlewareRegistry getMiddlewareRegistry() {
        return middlewareRegistry;
    }

    // ------------------ Request Handling ------------------ //

    private void handleClient(AsynchronousSocketChannel clientChannel) {
        final ClientAttachment attachment = new ClientAttachment(bufferPool.acquire(), clientChannel);
        startRead(attachment);
    }

    private void startRead(ClientAttachment attachment) {
        attachment.buffer.clear();
        attachment.channel.read(attachment.buffer, config.getReadTimeout().toMillis(), TimeUnit.MILLISECONDS, attachment,
                new CompletionHandler<Integer, ClientAttachment>() {
                    @Override
                    public void completed(Integer bytesRead, ClientAttachment att) {
                        if (bytesRead == -1) {
                            cleanupResources(att);
                        } else {
                            processReadData(att);
                        }
                    }

                    @Override
                    public void failed(Throwable exc, ClientAttachment att) {
                        logger.debug("Read failed: {}", exc.toString());
                        cleanupResources(att);
                    }
                });
    }

    private void processReadData(ClientAttachment att) {
        ByteBuffer buf = att.buffer;
        buf.flip();
        byte[] chunk = new byte[buf.remaining()];
        buf.get(chunk);
        att.requestData.write(chunk, 0, chunk.length);

        final int status = completionStatus(att.requestData.toByteArray());
        if (status == INCOMPLETE) {
            startRead(att);
            return;
        }
        bufferPool.release(att.buffer);
        if (status == HEADERS_TOO_LARGE) {
            submit(att, () -> new RequestExceptionHandler(att.channel,
                    new MalformedRequestException("Request headers exceed " + config.getMaxHeaderBytes() + " bytes")).handle());
            return;
        }
        submit(att, () -> handleRequest(att));
    }

    private void submit(ClientAttachment att, Runnable task) {
        try {
            workers.execute(task);
        } catch (RejectedExecutionException e) {
            logger.debug("Server shutting down, dropping connection");
            closeSocket(att.channel);
        }
    }

    private void handleRequest(ClientAttachment att) {
        String rawRequest = new String(att.requestData.toByteArray(), StandardCharsets.UTF_8);
        try {
            InetSocketAddress remoteAddress = (InetSocketAddress) att.channel.getRemoteAddress();
            httpRequestHandler.handle(att.channel, rawRequest, remoteAddress);
        } catch (IOException | RuntimeException e) {
            new RequestExceptionHandler(att.channel, e).handle();
        }
    }

    private static final int INCOMPLETE = 0;
    private static final int COMPLETE = 1;
    private static final int HEADERS_TOO_LARGE = 2;

    /**
     * Decides whether the bytes read so far hold a whole request: the header block and, when a
     * Content-Length is given, that many body bytes.
     */
    private int completionStatus(byte[] data) {
        int headersEnd = indexOfHeadersEnd(data);
        if (headersEnd == -1) {
            return data.length > config.getMaxHeaderBytes() ? HEADERS_TOO_LARGE : INCOMPLETE;
        }
        if (headersEnd > config.getMaxHeaderBytes()) {
            return HEADERS_TOO_LARGE;
        }
        String headerBlock = new String(data, 0, headersEnd, StandardCharsets.ISO_8859_1);
        for (String line : headerBlock.split("\r\n")) {
            int colon = line.indexOf(':');
            if (colon > 0 && line.substring(0, colon).trim().toLowerCase(Locale.ROOT).equals("content-length")) {
                try {
                    int contentLength = Integer.parseInt(line.substring(colon + 1).trim());
                    return data.length - (headersEnd + 4) >= contentLength ? COMPLETE : INCOMPLETE;
                } catch (NumberFormatException e) {
                    return COMPLETE;
                }
            }
        }
        return COMPLETE;
    }

    private static int indexOfHeadersEnd(byte[] data) {
        for (int i = 0; i + 3 < data.length; i++) {
            if (data[i] == '\r' && data[i + 1] == '\n' && data[i + 2] == '\r' && data[i + 3] == '\n') {
                return i;
            }
        }
        return -1;
    }

    private void cleanupResources(ClientAttachment att) {
        bufferPool.release(att.buffer);
        closeSocket(att.channel);
    }

    public static void closeSocket(AsynchronousSocketChannel clientChannel) {
        try {
            clientChannel.close();
        } catch (IOException e) {
            logger.warn("Error closing socket: {}", e.getMessage());
        }
    }
}

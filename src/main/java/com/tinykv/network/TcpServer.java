package com.tinykv.network;

import com.tinykv.command.CommandInterpreter;
import com.tinykv.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.channels.*;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * NIO-based TCP server for TinyKV.
 * Uses a single-threaded selector event loop for accepting connections and I/O,
 * with a worker pool for command execution.
 */
public class TcpServer {

    private static final Logger logger = LoggerFactory.getLogger(TcpServer.class);
    private static final long SELECT_TIMEOUT_MS = 1000;

    private final String host;
    private final int requestedPort;
    private final CommandInterpreter interpreter;
    private final MetricsCollector metrics;
    private final int maxConnections;
    private final AtomicBoolean running;
    private final Map<SocketChannel, ConnectionSession> connections;
    private final ExecutorService workerPool;

    private Selector selector;
    private ServerSocketChannel serverChannel;
    private Thread serverThread;
    private volatile int boundPort;

    /**
     * Create a new TCP server.
     *
     * @param host           the address to bind, or null/empty for all interfaces
     * @param port           the port to listen on, 0 for an ephemeral port
     * @param interpreter    executes decoded commands
     * @param metrics        the metrics collector
     * @param workerThreads  size of the command worker pool
     * @param maxConnections maximum concurrent connections, 0 for no limit
     */
    public TcpServer(String host, int port, CommandInterpreter interpreter, MetricsCollector metrics,
            int workerThreads, int maxConnections) {
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("workerThreads must be positive");
        }
        if (maxConnections < 0) {
            throw new IllegalArgumentException("maxConnections must be non-negative");
        }
        this.host = host;
        this.requestedPort = port;
        this.interpreter = interpreter;
        this.metrics = metrics;
        this.maxConnections = maxConnections;
        this.running = new AtomicBoolean(false);
        this.connections = new ConcurrentHashMap<>();
        AtomicInteger threadIndex = new AtomicInteger();
        this.workerPool = new ThreadPoolExecutor(
                workerThreads,
                workerThreads,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(workerThreads * 1000),
                r -> {
                    Thread t = new Thread(r, "tinykv-worker-" + threadIndex.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.CallerRunsPolicy());
        logger.info("Initialized worker pool with {} threads", workerThreads);
    }

    /**
     * Bind the listening socket and start the selector thread.
     *
     * @throws IOException if the server cannot be started
     */
    public void start() throws IOException {
        if (running.getAndSet(true)) {
            throw new IllegalStateException("Server already running");
        }

        try {
            selector = Selector.open();
            serverChannel = ServerSocketChannel.open();
            serverChannel.configureBlocking(false);
            serverChannel.socket().setReuseAddress(true);
            InetSocketAddress address = host == null || host.isEmpty()
                    ? new InetSocketAddress(requestedPort)
                    : new InetSocketAddress(host, requestedPort);
            serverChannel.bind(address);
            serverChannel.register(selector, SelectionKey.OP_ACCEPT);
            boundPort = ((InetSocketAddress) serverChannel.getLocalAddress()).getPort();
        } catch (IOException e) {
            running.set(false);
            cleanup();
            throw e;
        }

        serverThread = new Thread(this::eventLoop, "tinykv-server-" + boundPort);
        serverThread.start();

        logger.info("TinyKV server listening on {}:{}", host == null || host.isEmpty() ? "*" : host, boundPort);
    }

    private void eventLoop() {
        while (running.get()) {
            try {
                int ready = selector.select(SELECT_TIMEOUT_MS);

                if (ready > 0) {
                    Iterator<SelectionKey> keys = selector.selectedKeys().iterator();
                    while (keys.hasNext()) {
                        SelectionKey key = keys.next();
                        keys.remove();

                        if (!key.isValid()) {
                            continue;
                        }

                        try {
                            if (key.isAcceptable()) {
                                accept();
                            }
                            if (key.isValid() && key.isReadable()) {
                                read(key);
                            }
                            if (key.isValid() && key.isWritable()) {
                                write(key);
                            }
                        } catch (CancelledKeyException e) {
                            // Key was cancelled, ignore
                        } catch (IOException | RuntimeException e) {
                            logger.error("Error handling connection {}: {}", key.channel(), e.getMessage(), e);
                            ConnectionSession session = (ConnectionSession) key.attachment();
                            if (session != null) {
                                closeConnection(key, session);
                            } else if (key.channel() != serverChannel) {
                                key.cancel();
                            }
                        }
                    }
                }

                resumePausedConnections();
                closeStalledConnections();
            } catch (IOException e) {
                if (running.get()) {
                    logger.error("Selector error: {}", e.getMessage());
                }
            }
        }

        cleanup();
    }

    private void accept() throws IOException {
        SocketChannel clientChannel = serverChannel.accept();
        if (clientChannel == null) {
            return;
        }

        if (maxConnections > 0 && connections.size() >= maxConnections) {
            logger.warn("Connection limit {} reached, rejecting {}", maxConnections,
                    clientChannel.getRemoteAddress());
            clientChannel.close();
            return;
        }

        clientChannel.configureBlocking(false);
        clientChannel.socket().setTcpNoDelay(true);
        clientChannel.socket().setKeepAlive(true);

        ConnectionSession session = new ConnectionSession(clientChannel, interpreter, metrics,
                this, workerPool, selector);
        connections.put(clientChannel, session);

        clientChannel.register(selector, SelectionKey.OP_READ, session);

        logger.debug("Accepted connection from {}", session.getRemoteAddress());
    }

    private void read(SelectionKey key) {
        ConnectionSession session = (ConnectionSession) key.attachment();
        if (session == null) {
            key.cancel();
            return;
        }

        if (!session.handleRead(key)) {
            closeConnection(key, session);
        }
    }

    private void write(SelectionKey key) {
        ConnectionSession session = (ConnectionSession) key.attachment();
        if (session == null) {
            key.cancel();
            return;
        }

        if (!session.handleWrite(key)) {
            closeConnection(key, session);
        }
    }

    /**
     * Give paused sessions a chance to decode their buffered requests once
     * their queues have drained.
     */
    private void resumePausedConnections() {
        for (Map.Entry<SocketChannel, ConnectionSession> e : connections.entrySet()) {
            ConnectionSession session = e.getValue();
            boolean keep;
            try {
                keep = !session.isReadPaused() || session.resumeReadingIfDrained();
            } catch (CancelledKeyException ex) {
                keep = false;
            }
            if (!keep) {
                SelectionKey key = e.getKey().keyFor(selector);
                if (key != null) {
                    closeConnection(key, session);
                } else {
                    connections.remove(e.getKey());
                    session.close();
                }
            }
        }
    }

    /**
     * Close sessions whose partial frame has been pending past the timeout,
     * including clients that stopped sending altogether.
     */
    private void closeStalledConnections() {
        long now = System.currentTimeMillis();
        for (Map.Entry<SocketChannel, ConnectionSession> e : connections.entrySet()) {
            ConnectionSession session = e.getValue();
            if (session.isFrameTimedOut(now)) {
                logger.warn("Connection from {} exceeded incomplete frame timeout, closing",
                        session.getRemoteAddress());
                SelectionKey key = e.getKey().keyFor(selector);
                if (key != null) {
                    key.cancel();
                }
                connections.remove(e.getKey());
                session.close();
            }
        }
    }

    private void closeConnection(SelectionKey key, ConnectionSession session) {
        key.cancel();
        SocketChannel channel = (SocketChannel) key.channel();
        connections.remove(channel);
        session.close();
    }

    /**
     * Stop the server. Open connections are closed; commands already running
     * on a worker are allowed to finish.
     */
    public void stop() {
        if (!running.getAndSet(false)) {
            return;
        }

        logger.info("Stopping TinyKV server on port {}", boundPort);

        if (selector != null) {
            selector.wakeup();
        }

        if (serverThread != null && serverThread != Thread.currentThread()) {
            try {
                serverThread.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void cleanup() {
        // Stop accepting before draining the workers
        if (serverChannel != null) {
            try {
                serverChannel.close();
            } catch (IOException e) {
                logger.debug("Error closing server channel: {}", e.getMessage());
            }
        }

        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(5, TimeUnit.SECONDS)) {
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }

        for (ConnectionSession session : connections.values()) {
            session.close();
        }
        connections.clear();

        if (selector != null) {
            try {
                selector.close();
            } catch (IOException e) {
                logger.debug("Error closing selector: {}", e.getMessage());
            }
        }

        logger.info("TinyKV server stopped on port {}", boundPort);
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Get the number of active connections.
     */
    public int getConnectionCount() {
        return connections.size();
    }

    /**
     * Get the port this server is listening on.
     * After {@link #start()} this is the bound port, which differs from the
     * requested one when port 0 was given.
     */
    public int getPort() {
        return boundPort != 0 ? boundPort : requestedPort;
    }

    /**
     * Remove a connection from tracking.
     * Package-private, called by ConnectionSession when the connection is closed.
     */
    void removeConnection(SocketChannel channel) {
        connections.remove(channel);
    }
}

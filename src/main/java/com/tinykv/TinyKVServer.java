package com.tinykv;

import com.tinykv.command.CommandInterpreter;
import com.tinykv.config.ServerConfig;
import com.tinykv.core.InMemoryStore;
import com.tinykv.network.TcpServer;
import com.tinykv.snapshot.SnapshotException;
import com.tinykv.snapshot.SnapshotManager;
import com.tinykv.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * TinyKV Server entry point.
 * Wires the store, snapshot manager and TCP server together and runs them.
 */
public class TinyKVServer {

    private static final Logger logger = LoggerFactory.getLogger(TinyKVServer.class);

    static final String VERSION = "1.0.0";

    private final ServerConfig config;
    private final InMemoryStore store;
    private final MetricsCollector metrics;
    private final SnapshotManager snapshotManager;
    private final TcpServer tcpServer;
    private final CountDownLatch shutdownLatch;
    private final AtomicBoolean started;
    private final AtomicBoolean stopped;

    /**
     * Create a new TinyKV server.
     *
     * @param config the server configuration
     */
    public TinyKVServer(ServerConfig config) {
        this(config, new MetricsCollector());
    }

    /**
     * Create a server with a custom metrics collector.
     *
     * @param config  the server configuration
     * @param metrics the metrics collector to use
     */
    public TinyKVServer(ServerConfig config, MetricsCollector metrics) {
        this.config = config;
        this.metrics = metrics;
        this.store = new InMemoryStore(config.getCleanupIntervalMs());
        this.snapshotManager = new SnapshotManager(store, config.getSnapshotPath(),
                config.getSnapshotIntervalSeconds(), config.isRestoreFallbackEmpty(), metrics);
        CommandInterpreter interpreter = new CommandInterpreter(store, metrics);
        this.tcpServer = new TcpServer(config.getHost(), config.getPort(), interpreter, metrics,
                config.getWorkerThreads(), config.getMaxConnections());
        this.shutdownLatch = new CountDownLatch(1);
        this.started = new AtomicBoolean(false);
        this.stopped = new AtomicBoolean(false);
        metrics.bindStore(store);
    }

    /**
     * Start the server: restore the snapshot, start the snapshot timer, then
     * open the listening socket. No command is served before restore finishes.
     *
     * @throws SnapshotException if the snapshot cannot be restored
     * @throws IOException       if the listening socket cannot be opened
     */
    public void start() throws IOException {
        if (started.getAndSet(true)) {
            throw new IllegalStateException("Server already started");
        }
        logger.info("Starting TinyKV Server v{}", VERSION);
        logger.info("Configuration: {}", config);

        snapshotManager.restore();
        snapshotManager.start();
        tcpServer.start();

        logger.info("TinyKV Server started successfully on port {}", tcpServer.getPort());
    }

    /**
     * Start the server and block until stopped.
     */
    public void startAndBlock() throws IOException, InterruptedException {
        start();
        shutdownLatch.await();
    }

    /**
     * Stop the server. Stops accepting clients first, then writes the final
     * snapshot. Safe to call more than once.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        logger.info("Stopping TinyKV Server");

        tcpServer.stop();
        snapshotManager.shutdown();
        store.shutdown();

        logger.info("{}", metrics.summary());
        shutdownLatch.countDown();
        logger.info("TinyKV Server stopped");
    }

    public boolean isRunning() {
        return tcpServer.isRunning();
    }

    /**
     * Get the port the server listens on (the bound port once started).
     */
    public int getPort() {
        return tcpServer.getPort();
    }

    public InMemoryStore getStore() {
        return store;
    }

    public MetricsCollector getMetrics() {
        return metrics;
    }

    public SnapshotManager getSnapshotManager() {
        return snapshotManager;
    }

    /**
     * Get the number of active connections.
     */
    public int getConnectionCount() {
        return tcpServer.getConnectionCount();
    }

    /**
     * Main entry point.
     */
    public static void main(String[] args) {
        ServerConfig.Builder builder = ServerConfig.builder();

        try {
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--host":
                    case "-H":
                        builder.host(requireValue(args, ++i, "--host"));
                        break;
                    case "--port":
                    case "-p":
                        builder.port(parseInt(requireValue(args, ++i, "--port"), "port"));
                        break;
                    case "--snapshot-path":
                        builder.snapshotPath(Path.of(requireValue(args, ++i, "--snapshot-path")));
                        break;
                    case "--snapshot-interval":
                        builder.snapshotIntervalSeconds(
                                parseInt(requireValue(args, ++i, "--snapshot-interval"), "snapshot interval"));
                        break;
                    case "--restore-fallback-empty":
                        builder.restoreFallbackEmpty(true);
                        break;
                    case "--help":
                    case "-h":
                        printHelp();
                        return;
                    case "--version":
                    case "-v":
                        System.out.println("TinyKV Server v" + VERSION);
                        return;
                    default:
                        exitWithError("Unknown option: " + args[i]);
                }
            }
        } catch (IllegalArgumentException e) {
            exitWithError(e.getMessage());
        }

        printBanner();

        TinyKVServer server = new TinyKVServer(builder.build());
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received");
            server.stop();
        }, "tinykv-shutdown"));

        try {
            server.startAndBlock();
        } catch (SnapshotException e) {
            logger.error("Failed to restore snapshot, refusing to start: {}", e.getMessage());
            System.err.println("Error: " + e.getMessage());
            System.err.println("Use --restore-fallback-empty to start with an empty keyspace");
            System.exit(1);
        } catch (IOException e) {
            logger.error("Failed to start server: {}", e.getMessage());
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String requireValue(String[] args, int index, String flag) {
        if (index >= args.length) {
            throw new IllegalArgumentException(flag + " requires a value");
        }
        return args[index];
    }

    private static int parseInt(String value, String name) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + value);
        }
    }

    private static void printBanner() {
        System.out.println();
        System.out.println("  _____ _            _  ____     __");
        System.out.println(" |_   _(_)_ __  _   _| |/ /\\ \\   / /");
        System.out.println("   | | | | '_ \\| | | | ' /  \\ \\ / / ");
        System.out.println("   | | | | | | | |_| | . \\   \\ V /  ");
        System.out.println("   |_| |_|_| |_|\\__, |_|\\_\\   \\_/   ");
        System.out.println("                |___/               ");
        System.out.println();
        System.out.println("  In-Memory Key-Value Store v" + VERSION);
        System.out.println();
    }

    private static void exitWithError(String message) {
        System.err.println("Error: " + message);
        System.err.println("Use --help for usage information");
        System.exit(1);
    }

    private static void printHelp() {
        System.out.println("TinyKV Server - In-Memory Key-Value Store");
        System.out.println();
        System.out.println("Usage: tinykv [options]");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  -H, --host <address>           Address to bind (default: " + ServerConfig.DEFAULT_HOST + ")");
        System.out.println("  -p, --port <port>              Port to listen on (default: " + ServerConfig.DEFAULT_PORT + ")");
        System.out.println("      --snapshot-path <file>     Snapshot file (default: " + ServerConfig.DEFAULT_SNAPSHOT_PATH + ")");
        System.out.println("      --snapshot-interval <sec>  Seconds between snapshots, 0 to disable (default: "
                + ServerConfig.DEFAULT_SNAPSHOT_INTERVAL_SECONDS + ")");
        System.out.println("      --restore-fallback-empty   Start empty if the snapshot cannot be read");
        System.out.println("  -h, --help                     Show this help message");
        System.out.println("  -v, --version                  Show version");
        System.out.println();
        System.out.println("Environment:");
        System.out.println("  TINYKV_HOST, TINYKV_PORT, TINYKV_SNAPSHOT_PATH, TINYKV_SNAPSHOT_INTERVAL_SECONDS,");
        System.out.println("  TINYKV_SNAPSHOT_FALLBACK_EMPTY, TINYKV_CLEANUP_INTERVAL_MS, TINYKV_WORKER_THREADS,");
        System.out.println("  TINYKV_MAX_CONNECTIONS");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  tinykv --port 31337 --snapshot-path /var/lib/tinykv/dump.tkvs");
        System.out.println("  tinykv --snapshot-interval 0");
        System.out.println();
    }
}

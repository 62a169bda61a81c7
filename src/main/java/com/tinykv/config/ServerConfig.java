package com.tinykv.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Configuration for the TinyKV server.
 *
 * Defaults can be overridden by environment variables or system properties,
 * the environment variable taking precedence:
 * <pre>
 *   TINYKV_HOST                       tinykv.host
 *   TINYKV_PORT                       tinykv.port
 *   TINYKV_SNAPSHOT_PATH              tinykv.snapshot.path
 *   TINYKV_SNAPSHOT_INTERVAL_SECONDS  tinykv.snapshot.interval.seconds
 *   TINYKV_SNAPSHOT_FALLBACK_EMPTY    tinykv.snapshot.fallback.empty
 *   TINYKV_CLEANUP_INTERVAL_MS        tinykv.cleanup.interval.ms
 *   TINYKV_WORKER_THREADS             tinykv.worker.threads
 *   TINYKV_MAX_CONNECTIONS            tinykv.max.connections
 * </pre>
 * Command line flags are applied on top through the builder.
 */
public class ServerConfig {

    private static final Logger logger = LoggerFactory.getLogger(ServerConfig.class);

    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 31337;
    public static final String DEFAULT_SNAPSHOT_PATH = "data/tinykv.snapshot";
    public static final long DEFAULT_SNAPSHOT_INTERVAL_SECONDS = 60;
    public static final long DEFAULT_CLEANUP_INTERVAL_MS = 60_000;
    public static final int DEFAULT_MAX_CONNECTIONS = 1024;

    private String host = DEFAULT_HOST;
    private int port = DEFAULT_PORT;
    private Path snapshotPath = Path.of(DEFAULT_SNAPSHOT_PATH);
    private long snapshotIntervalSeconds = DEFAULT_SNAPSHOT_INTERVAL_SECONDS;
    private boolean restoreFallbackEmpty = false;
    private long cleanupIntervalMs = DEFAULT_CLEANUP_INTERVAL_MS;
    private int workerThreads = Math.max(4, Runtime.getRuntime().availableProcessors());
    private int maxConnections = DEFAULT_MAX_CONNECTIONS;

    /**
     * Create a config from the defaults plus any environment or system
     * property overrides.
     */
    public ServerConfig() {
        String value = read("TINYKV_HOST", "tinykv.host");
        if (value != null) {
            setHost(value);
        }
        Long number = readNumber("TINYKV_PORT", "tinykv.port");
        if (number != null) {
            apply("port", () -> setPort(number.intValue()));
        }
        value = read("TINYKV_SNAPSHOT_PATH", "tinykv.snapshot.path");
        if (value != null) {
            setSnapshotPath(Path.of(value));
        }
        Long interval = readNumber("TINYKV_SNAPSHOT_INTERVAL_SECONDS", "tinykv.snapshot.interval.seconds");
        if (interval != null) {
            apply("snapshot interval", () -> setSnapshotIntervalSeconds(interval));
        }
        value = read("TINYKV_SNAPSHOT_FALLBACK_EMPTY", "tinykv.snapshot.fallback.empty");
        if (value != null) {
            setRestoreFallbackEmpty(Boolean.parseBoolean(value));
        }
        Long cleanup = readNumber("TINYKV_CLEANUP_INTERVAL_MS", "tinykv.cleanup.interval.ms");
        if (cleanup != null) {
            apply("cleanup interval", () -> setCleanupIntervalMs(cleanup));
        }
        Long threads = readNumber("TINYKV_WORKER_THREADS", "tinykv.worker.threads");
        if (threads != null) {
            apply("worker threads", () -> setWorkerThreads(threads.intValue()));
        }
        Long connections = readNumber("TINYKV_MAX_CONNECTIONS", "tinykv.max.connections");
        if (connections != null) {
            apply("max connections", () -> setMaxConnections(connections.intValue()));
        }
    }

    /**
     * Create a config builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    private static String read(String envKey, String propKey) {
        String value = System.getenv(envKey);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(propKey);
        }
        return value != null && !value.trim().isEmpty() ? value.trim() : null;
    }

    private static Long readNumber(String envKey, String propKey) {
        String value = read(envKey, propKey);
        if (value == null) {
            return null;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value: {}, using default", envKey, value);
            return null;
        }
    }

    private static void apply(String name, Runnable setter) {
        try {
            setter.run();
        } catch (IllegalArgumentException e) {
            logger.warn("Ignoring {} override: {}", name, e.getMessage());
        }
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        if (host == null || host.isEmpty()) {
            throw new IllegalArgumentException("host cannot be null or empty");
        }
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    /**
     * @param port the port to listen on, 0 for an ephemeral port
     */
    public void setPort(int port) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be between 0 and 65535, got: " + port);
        }
        this.port = port;
    }

    public Path getSnapshotPath() {
        return snapshotPath;
    }

    public void setSnapshotPath(Path snapshotPath) {
        if (snapshotPath == null) {
            throw new IllegalArgumentException("snapshotPath cannot be null");
        }
        this.snapshotPath = snapshotPath;
    }

    public long getSnapshotIntervalSeconds() {
        return snapshotIntervalSeconds;
    }

    /**
     * @param snapshotIntervalSeconds seconds between periodic snapshots, 0 to disable them
     */
    public void setSnapshotIntervalSeconds(long snapshotIntervalSeconds) {
        if (snapshotIntervalSeconds < 0) {
            throw new IllegalArgumentException(
                    "snapshotIntervalSeconds must be non-negative, got: " + snapshotIntervalSeconds);
        }
        this.snapshotIntervalSeconds = snapshotIntervalSeconds;
    }

    public boolean isRestoreFallbackEmpty() {
        return restoreFallbackEmpty;
    }

    public void setRestoreFallbackEmpty(boolean restoreFallbackEmpty) {
        this.restoreFallbackEmpty = restoreFallbackEmpty;
    }

    public long getCleanupIntervalMs() {
        return cleanupIntervalMs;
    }

    /**
     * @param cleanupIntervalMs milliseconds between expiration sweeps, 0 to disable them
     */
    public void setCleanupIntervalMs(long cleanupIntervalMs) {
        if (cleanupIntervalMs < 0) {
            throw new IllegalArgumentException("cleanupIntervalMs must be non-negative, got: " + cleanupIntervalMs);
        }
        this.cleanupIntervalMs = cleanupIntervalMs;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("workerThreads must be positive, got: " + workerThreads);
        }
        this.workerThreads = workerThreads;
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    /**
     * @param maxConnections maximum concurrent client connections, 0 for no limit
     */
    public void setMaxConnections(int maxConnections) {
        if (maxConnections < 0) {
            throw new IllegalArgumentException("maxConnections must be non-negative, got: " + maxConnections);
        }
        this.maxConnections = maxConnections;
    }

    @Override
    public String toString() {
        return "ServerConfig{" +
               "host=" + host +
               ", port=" + port +
               ", snapshotPath=" + snapshotPath +
               ", snapshotIntervalSeconds=" + snapshotIntervalSeconds +
               ", restoreFallbackEmpty=" + restoreFallbackEmpty +
               ", cleanupIntervalMs=" + cleanupIntervalMs +
               ", workerThreads=" + workerThreads +
               ", maxConnections=" + maxConnections +
               '}';
    }

    /**
     * Builder for ServerConfig.
     */
    public static class Builder {
        private final ServerConfig config = new ServerConfig();

        public Builder host(String host) {
            config.setHost(host);
            return this;
        }

        public Builder port(int port) {
            config.setPort(port);
            return this;
        }

        public Builder snapshotPath(Path path) {
            config.setSnapshotPath(path);
            return this;
        }

        public Builder snapshotIntervalSeconds(long seconds) {
            config.setSnapshotIntervalSeconds(seconds);
            return this;
        }

        public Builder restoreFallbackEmpty(boolean fallback) {
            config.setRestoreFallbackEmpty(fallback);
            return this;
        }

        public Builder cleanupIntervalMs(long interval) {
            config.setCleanupIntervalMs(interval);
            return this;
        }

        public Builder workerThreads(int threads) {
            config.setWorkerThreads(threads);
            return this;
        }

        public Builder maxConnections(int max) {
            config.setMaxConnections(max);
            return this;
        }

        public ServerConfig build() {
            return config;
        }
    }
}

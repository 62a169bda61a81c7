package com.tinykv.snapshot;

import com.tinykv.core.KVStore;
import com.tinykv.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Persists the keyspace to a single snapshot file and restores it at startup.
 *
 * A capture copies the live keyspace through {@link KVStore#snapshotView()},
 * writes it to {@code <path>.tmp}, syncs it and atomically renames it over the
 * previous file, so a reader only ever sees a complete snapshot. Captures run
 * on a timer, on request, and once more on shutdown. Concurrent requests share
 * the capture already in progress.
 */
public class SnapshotManager {

    private static final Logger logger = LoggerFactory.getLogger(SnapshotManager.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    public enum State {
        IDLE,
        RESTORING,
        READY,
        CAPTURING
    }

    private final KVStore store;
    private final Path path;
    private final Path tempPath;
    private final long intervalSeconds;
    private final boolean restoreFallbackEmpty;
    private final MetricsCollector metrics;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final AtomicReference<State> state;
    private final AtomicBoolean shuttingDown;

    private final Object captureLock = new Object();
    private CompletableFuture<Boolean> inFlight;   // guarded by captureLock
    // Requested capture whose task has not started yet, guarded by captureLock
    private CompletableFuture<Boolean> queuedRequest;
    private volatile long lastPersistedSequence = -1;

    /**
     * Create a snapshot manager.
     *
     * @param store                the store to capture and restore
     * @param path                 snapshot file location
     * @param intervalSeconds      seconds between periodic captures, 0 to disable the timer
     * @param restoreFallbackEmpty start with an empty keyspace when the snapshot cannot be read
     * @param metrics              the metrics collector
     */
    public SnapshotManager(KVStore store, Path path, long intervalSeconds, boolean restoreFallbackEmpty,
            MetricsCollector metrics) {
        this(store, path, intervalSeconds, restoreFallbackEmpty, metrics, Clock.systemUTC());
    }

    public SnapshotManager(KVStore store, Path path, long intervalSeconds, boolean restoreFallbackEmpty,
            MetricsCollector metrics, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("Store cannot be null");
        }
        if (path == null) {
            throw new IllegalArgumentException("Snapshot path cannot be null");
        }
        if (intervalSeconds < 0) {
            throw new IllegalArgumentException("intervalSeconds must be non-negative");
        }
        this.store = store;
        this.path = path;
        this.tempPath = path.resolveSibling(path.getFileName() + ".tmp");
        this.intervalSeconds = intervalSeconds;
        this.restoreFallbackEmpty = restoreFallbackEmpty;
        this.metrics = metrics != null ? metrics : new MetricsCollector();
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "tinykv-snapshot");
            t.setDaemon(true);
            return t;
        });
        this.state = new AtomicReference<>(State.IDLE);
        this.shuttingDown = new AtomicBoolean(false);
    }

    // ==================== Restore ====================

    /**
     * Load the snapshot file into the store. Must run once, before the server
     * accepts connections, against an empty store. A missing file is an empty
     * keyspace.
     *
     * @return the number of entries restored
     * @throws SnapshotException if the file cannot be read and the empty
     *                           fallback is not enabled
     */
    public int restore() {
        if (!state.compareAndSet(State.IDLE, State.RESTORING)) {
            throw new IllegalStateException("Restore already performed (state " + state.get() + ")");
        }
        if (store.size() > 0) {
            state.set(State.IDLE);
            throw new IllegalStateException("Restore requires an empty store");
        }

        if (!Files.exists(path)) {
            logger.info("No snapshot at {}, starting with an empty keyspace", path.toAbsolutePath());
            markRestored(store.sequence());
            return 0;
        }

        Snapshot snapshot;
        try {
            snapshot = SnapshotCodec.read(path);
        } catch (IOException | SnapshotException e) {
            if (!restoreFallbackEmpty) {
                logger.error("Failed to restore snapshot from {}: {}", path.toAbsolutePath(), e.getMessage());
                throw e instanceof SnapshotException
                        ? (SnapshotException) e
                        : new SnapshotException("Failed to read snapshot " + path, e);
            }
            logger.warn("Failed to restore snapshot from {} ({}), starting with an empty keyspace",
                    path.toAbsolutePath(), e.getMessage());
            store.clear();
            // Nothing persisted is trusted; the next capture replaces the unreadable file
            markRestored(-1);
            return 0;
        }

        long now = clock.millis();
        int restored = 0;
        int skipped = 0;
        for (Snapshot.Record record : snapshot.getRecords()) {
            if (record.isExpiredAt(now)) {
                skipped++;
                continue;
            }
            store.setExpiringAt(record.getKey(), record.getValueUnsafe(), record.getExpiresAt());
            restored++;
        }
        // An unchanged keyspace after restore doesn't need to be written back
        markRestored(store.sequence());
        logger.info("Restored {} entries from {} (sequence {}, {} expired entries skipped)",
                restored, path.toAbsolutePath(), snapshot.getSequence(), skipped);
        return restored;
    }

    private void markRestored(long persistedSequence) {
        lastPersistedSequence = persistedSequence;
        state.set(State.READY);
    }

    // ==================== Capture ====================

    /**
     * Start the periodic capture timer. Does nothing when the interval is 0.
     */
    public void start() {
        requireRestored();
        if (intervalSeconds == 0) {
            logger.info("Periodic snapshots disabled");
            return;
        }
        scheduler.scheduleWithFixedDelay(this::periodicCapture, intervalSeconds, intervalSeconds,
                TimeUnit.SECONDS);
        logger.info("Periodic snapshots every {}s to {}", intervalSeconds, path.toAbsolutePath());
    }

    /**
     * Timer tick on the snapshot thread. A requested capture queued on this
     * same thread must never be waited for here, so a tick that finds one in
     * flight leaves the work to it.
     */
    private void periodicCapture() {
        CompletableFuture<Boolean> mine;
        synchronized (captureLock) {
            if (inFlight != null) {
                logger.debug("Snapshot already in flight, skipping periodic tick");
                return;
            }
            mine = new CompletableFuture<>();
            inFlight = mine;
        }
        try {
            runCapture(mine, false);
            await(mine);
        } catch (SnapshotException e) {
            // Already logged and counted by the capture itself
            logger.debug("Periodic snapshot failed: {}", e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Unexpected error in periodic snapshot: {}", e.getMessage(), e);
        }
    }

    /**
     * Request a capture in the background.
     * Joins the capture already in progress if there is one.
     *
     * @return future completing with true if a snapshot was written, false if
     *         it was skipped, or exceptionally with a {@link SnapshotException}
     */
    public CompletableFuture<Boolean> requestCapture() {
        synchronized (captureLock) {
            if (inFlight != null) {
                return inFlight;
            }
            State current = state.get();
            if (current != State.READY) {
                return CompletableFuture.failedFuture(
                        new IllegalStateException("Snapshot manager not ready (state " + current + ")"));
            }
            CompletableFuture<Boolean> future = new CompletableFuture<>();
            inFlight = future;
            queuedRequest = future;
            try {
                scheduler.execute(() -> {
                    synchronized (captureLock) {
                        if (queuedRequest == future) {
                            queuedRequest = null;
                        }
                    }
                    runCapture(future, false);
                });
            } catch (RejectedExecutionException e) {
                inFlight = null;
                queuedRequest = null;
                future.completeExceptionally(new IllegalStateException("Snapshot manager is shut down", e));
            }
            return future;
        }
    }

    /**
     * Capture synchronously on the calling thread.
     * An unforced capture joins the one already in progress and is skipped when
     * nothing changed since the last written snapshot. A forced capture always
     * writes, after waiting for any capture in progress.
     *
     * @param force write even if the keyspace is unchanged
     * @return true if a snapshot was written
     * @throws SnapshotException if writing failed; the previous file is left intact
     */
    public boolean capture(boolean force) {
        requireRestored();
        while (true) {
            CompletableFuture<Boolean> existing;
            CompletableFuture<Boolean> mine = null;
            synchronized (captureLock) {
                existing = inFlight;
                if (existing == null) {
                    mine = new CompletableFuture<>();
                    inFlight = mine;
                }
            }
            if (mine != null) {
                runCapture(mine, force);
                return await(mine);
            }
            if (!force) {
                return await(existing);
            }
            existing.handle((written, error) -> null).join();
        }
    }

    private void runCapture(CompletableFuture<Boolean> future, boolean force) {
        boolean written = false;
        RuntimeException failure = null;
        if (!state.compareAndSet(State.READY, State.CAPTURING)) {
            failure = new IllegalStateException("Snapshot manager not ready (state " + state.get() + ")");
        } else {
            try {
                written = doCapture(force);
            } catch (IOException e) {
                metrics.recordSnapshotFailure();
                logger.warn("Snapshot to {} failed, keeping previous snapshot: {}",
                        path.toAbsolutePath(), e.getMessage());
                failure = new SnapshotException("Failed to write snapshot " + path, e);
            } catch (RuntimeException e) {
                metrics.recordSnapshotFailure();
                logger.error("Snapshot to {} failed: {}", path.toAbsolutePath(), e.getMessage(), e);
                failure = e;
            } finally {
                state.set(State.READY);
            }
        }

        synchronized (captureLock) {
            if (inFlight == future) {
                inFlight = null;
            }
        }
        if (failure != null) {
            future.completeExceptionally(failure);
        } else {
            future.complete(written);
        }
    }

    private boolean doCapture(boolean force) throws IOException {
        if (!force && shuttingDown.get()) {
            logger.debug("Shutting down, abandoning snapshot");
            return false;
        }
        if (!force && store.sequence() == lastPersistedSequence) {
            metrics.recordSnapshotSkipped();
            logger.debug("Keyspace unchanged since sequence {}, skipping snapshot", lastPersistedSequence);
            return false;
        }

        long startTime = System.nanoTime();
        Snapshot snapshot = Snapshot.fromView(store.snapshotView());
        writeAtomically(snapshot);
        lastPersistedSequence = snapshot.getSequence();

        long duration = System.nanoTime() - startTime;
        metrics.recordSnapshotWritten(duration);
        logger.info("Snapshot written to {} ({} entries, sequence {}, {}ms)", path.toAbsolutePath(),
                snapshot.size(), snapshot.getSequence(), TimeUnit.NANOSECONDS.toMillis(duration));
        return true;
    }

    private void writeAtomically(Snapshot snapshot) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try {
            try (FileChannel channel = FileChannel.open(tempPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE)) {
                SnapshotCodec.write(snapshot, channel);
                channel.force(true);
            }
            try {
                Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                logger.warn("Atomic move not supported for {}, falling back to replace", path);
                Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException | RuntimeException e) {
            try {
                Files.deleteIfExists(tempPath);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    private static boolean await(CompletableFuture<Boolean> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new SnapshotException("Snapshot failed", cause);
        }
    }

    private void requireRestored() {
        State current = state.get();
        if (current != State.READY && current != State.CAPTURING) {
            throw new IllegalStateException("Snapshot manager not ready (state " + current + ")");
        }
    }

    // ==================== Shutdown ====================

    /**
     * Stop the timer and write a final snapshot. Does not write anything if
     * restore never completed, so an unreadable file is never overwritten.
     */
    public void shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Snapshot executor did not stop within {}s", SHUTDOWN_TIMEOUT_SECONDS);
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        failOrphanedRequest();

        State current = state.get();
        if (current != State.READY && current != State.CAPTURING) {
            logger.info("Snapshot manager stopped before restore completed, skipping final snapshot");
            return;
        }
        try {
            capture(true);
        } catch (SnapshotException e) {
            logger.error("Final snapshot failed: {}", e.getMessage());
        }
    }

    /**
     * Fail a requested capture whose task was dropped by a forced executor
     * shutdown, so nothing waits on it forever.
     */
    private void failOrphanedRequest() {
        CompletableFuture<Boolean> orphan;
        synchronized (captureLock) {
            orphan = queuedRequest;
            if (orphan == null) {
                return;
            }
            queuedRequest = null;
            if (inFlight == orphan) {
                inFlight = null;
            }
        }
        orphan.completeExceptionally(new IllegalStateException("Snapshot manager is shut down"));
    }

    public State getState() {
        return state.get();
    }

    public Path getPath() {
        return path;
    }

    /**
     * Store sequence covered by the last snapshot written or restored, -1 if none.
     */
    public long getLastPersistedSequence() {
        return lastPersistedSequence;
    }
}

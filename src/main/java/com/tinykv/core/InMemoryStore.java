package com.tinykv.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Thread-safe in-memory keyspace backed by a ConcurrentHashMap.
 *
 * <p>Point operations (set, get, delete, exists) are made atomic per key by the
 * map's own bin locking and run under the shared side of a read-write lock.
 * Whole-keyspace operations ({@link #snapshotView()} and {@link #clear()}) take
 * the exclusive side, so they never observe a half-applied point operation.
 * The exclusive section only copies references; it never performs I/O.
 *
 * <p>Expiration is lazy: an expired entry reads as absent and is removed by
 * whichever operation observes it. An optional periodic sweep removes expired
 * entries nobody reads.
 */
public class InMemoryStore implements KVStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryStore.class);
    private static final long DEFAULT_CLEANUP_INTERVAL_MS = 60_000;

    private final ConcurrentHashMap<String, Entry> store;
    private final AtomicLong sequence;
    private final ReadWriteLock keyspaceLock;
    private final Clock clock;
    private final ScheduledExecutorService cleanupExecutor;
    private final long cleanupIntervalMs;

    /**
     * Create a new in-memory store with the default sweep interval (1 minute).
     */
    public InMemoryStore() {
        this(DEFAULT_CLEANUP_INTERVAL_MS);
    }

    /**
     * Create a new in-memory store with a custom sweep interval.
     *
     * @param cleanupIntervalMs interval between sweeps in milliseconds, 0 to disable
     */
    public InMemoryStore(long cleanupIntervalMs) {
        this(cleanupIntervalMs, Clock.systemUTC());
    }

    /**
     * Create a new in-memory store with a custom sweep interval and clock.
     *
     * @param cleanupIntervalMs interval between sweeps in milliseconds, 0 to disable
     * @param clock             source of the current time for TTL handling
     */
    public InMemoryStore(long cleanupIntervalMs, Clock clock) {
        if (cleanupIntervalMs < 0) {
            throw new IllegalArgumentException("cleanupIntervalMs must be non-negative");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.store = new ConcurrentHashMap<>();
        this.sequence = new AtomicLong(0);
        this.keyspaceLock = new ReentrantReadWriteLock();
        this.clock = clock;
        this.cleanupIntervalMs = cleanupIntervalMs;
        if (cleanupIntervalMs > 0) {
            this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "tinykv-cleanup");
                t.setDaemon(true);
                return t;
            });
            startCleanupTask();
        } else {
            this.cleanupExecutor = null;
        }
    }

    private void startCleanupTask() {
        cleanupExecutor.scheduleWithFixedDelay(this::runCleanup,
                cleanupIntervalMs, cleanupIntervalMs, TimeUnit.MILLISECONDS);
        logger.debug("Started TTL cleanup task with interval {}ms", cleanupIntervalMs);
    }

    private void runCleanup() {
        try {
            cleanupExpired();
        } catch (RuntimeException e) {
            logger.warn("Expiration sweep failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Remove all expired entries.
     * Uses conditional remove so an entry replaced after the check survives.
     *
     * @return the number of entries removed
     */
    public int cleanupExpired() {
        long now = clock.millis();
        int removed = 0;
        Lock shared = keyspaceLock.readLock();
        shared.lock();
        try {
            for (Map.Entry<String, Entry> e : store.entrySet()) {
                Entry entry = e.getValue();
                if (entry.isExpiredAt(now) && store.remove(e.getKey(), entry)) {
                    removed++;
                }
            }
        } finally {
            shared.unlock();
        }
        if (removed > 0) {
            logger.debug("Cleaned up {} expired entries", removed);
        }
        return removed;
    }

    @Override
    public boolean set(String key, byte[] value) {
        return set(key, value, 0);
    }

    @Override
    public boolean set(String key, byte[] value, long ttlMillis) {
        validateKey(key);
        if (ttlMillis < 0) {
            throw new IllegalArgumentException("ttlMillis must be non-negative, got: " + ttlMillis);
        }
        long now = clock.millis();
        long expiresAt = 0;
        if (ttlMillis > 0) {
            expiresAt = ttlMillis > Long.MAX_VALUE - now ? Long.MAX_VALUE : now + ttlMillis;
        }
        boolean replaced = write(key, new Entry(value, now, expiresAt), now);
        logger.trace("SET key={}, valueSize={}, ttl={}", key, value.length, ttlMillis);
        return replaced;
    }

    @Override
    public boolean setExpiringAt(String key, byte[] value, long expiresAt) {
        validateKey(key);
        long now = clock.millis();
        boolean replaced = write(key, new Entry(value, now, expiresAt), now);
        logger.trace("SET key={}, valueSize={}, expiresAt={}", key, value.length, expiresAt);
        return replaced;
    }

    private boolean write(String key, Entry entry, long now) {
        final boolean[] replaced = {false};
        Lock shared = keyspaceLock.readLock();
        shared.lock();
        try {
            store.compute(key, (k, old) -> {
                replaced[0] = old != null && !old.isExpiredAt(now);
                sequence.incrementAndGet();
                return entry;
            });
        } finally {
            shared.unlock();
        }
        return replaced[0];
    }

    @Override
    public Optional<Entry> get(String key) {
        validateKey(key);
        Lock shared = keyspaceLock.readLock();
        shared.lock();
        try {
            Entry entry = store.get(key);
            if (entry == null) {
                logger.trace("GET key={} -> NOT_FOUND", key);
                return Optional.empty();
            }
            if (entry.isExpiredAt(clock.millis())) {
                // Lazy deletion of expired entry
                store.remove(key, entry);
                logger.trace("GET key={} -> EXPIRED", key);
                return Optional.empty();
            }
            logger.trace("GET key={} -> FOUND", key);
            return Optional.of(entry);
        } finally {
            shared.unlock();
        }
    }

    @Override
    public boolean delete(String key) {
        validateKey(key);
        long now = clock.millis();
        final boolean[] removed = {false};
        Lock shared = keyspaceLock.readLock();
        shared.lock();
        try {
            store.computeIfPresent(key, (k, old) -> {
                if (!old.isExpiredAt(now)) {
                    removed[0] = true;
                    sequence.incrementAndGet();
                }
                return null;
            });
        } finally {
            shared.unlock();
        }
        logger.trace("DELETE key={} -> {}", key, removed[0] ? "DELETED" : "NOT_FOUND");
        return removed[0];
    }

    @Override
    public boolean exists(String key) {
        return get(key).isPresent();
    }

    @Override
    public int clear() {
        long now = clock.millis();
        int removed = 0;
        Lock exclusive = keyspaceLock.writeLock();
        exclusive.lock();
        try {
            for (Entry entry : store.values()) {
                if (!entry.isExpiredAt(now)) {
                    removed++;
                }
            }
            store.clear();
            if (removed > 0) {
                sequence.incrementAndGet();
            }
        } finally {
            exclusive.unlock();
        }
        logger.debug("Store cleared, removed {} entries", removed);
        return removed;
    }

    @Override
    public int size() {
        long now = clock.millis();
        int live = 0;
        for (Entry entry : store.values()) {
            if (!entry.isExpiredAt(now)) {
                live++;
            }
        }
        return live;
    }

    @Override
    public long sequence() {
        return sequence.get();
    }

    @Override
    public KeyspaceView snapshotView() {
        List<Map.Entry<String, Entry>> live = new ArrayList<>(store.size());
        long seq;
        long now;
        Lock exclusive = keyspaceLock.writeLock();
        exclusive.lock();
        try {
            now = clock.millis();
            for (Map.Entry<String, Entry> e : store.entrySet()) {
                if (!e.getValue().isExpiredAt(now)) {
                    live.add(new AbstractMap.SimpleImmutableEntry<>(e.getKey(), e.getValue()));
                }
            }
            seq = sequence.get();
        } finally {
            exclusive.unlock();
        }
        logger.trace("Snapshot view taken: entries={}, sequence={}", live.size(), seq);
        return new KeyspaceView(live, seq, now);
    }

    /**
     * Get raw entry count including expired ones not yet removed.
     */
    public int rawSize() {
        return store.size();
    }

    /**
     * Shutdown the cleanup executor.
     */
    public void shutdown() {
        if (cleanupExecutor == null) {
            return;
        }
        cleanupExecutor.shutdown();
        try {
            if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                cleanupExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cleanupExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.debug("InMemoryStore shutdown complete");
    }

    private void validateKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Key cannot be null or empty");
        }
    }
}

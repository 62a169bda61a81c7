package com.tinykv.util;

import com.tinykv.core.KVStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * Metrics collector for TinyKV.
 * Tracks command throughput and latency, GET hit rate, connections and
 * snapshot activity.
 */
public class MetricsCollector {

    private final MeterRegistry registry;

    // Counters
    private final Counter getHits;
    private final Counter getMisses;
    private final Counter errors;
    private final Counter snapshotsWritten;
    private final Counter snapshotsSkipped;
    private final Counter snapshotFailures;

    // Timers
    private final Timer snapshotLatency;

    // Gauges
    private final LongAdder activeConnections;

    /**
     * Create a metrics collector with a simple registry.
     */
    public MetricsCollector() {
        this(new SimpleMeterRegistry());
    }

    /**
     * Create a metrics collector with a custom registry.
     *
     * @param registry the Micrometer registry to use
     */
    public MetricsCollector(MeterRegistry registry) {
        this.registry = registry;

        this.getHits = Counter.builder("tinykv.get")
            .tag("result", "hit")
            .description("GET lookups that found a live key")
            .register(registry);

        this.getMisses = Counter.builder("tinykv.get")
            .tag("result", "miss")
            .description("GET lookups that found nothing")
            .register(registry);

        this.errors = Counter.builder("tinykv.errors")
            .description("Error replies sent to clients")
            .register(registry);

        this.snapshotsWritten = Counter.builder("tinykv.snapshots")
            .tag("result", "written")
            .description("Snapshots persisted to disk")
            .register(registry);

        this.snapshotsSkipped = Counter.builder("tinykv.snapshots")
            .tag("result", "skipped")
            .description("Captures skipped because the keyspace was unchanged")
            .register(registry);

        this.snapshotFailures = Counter.builder("tinykv.snapshots")
            .tag("result", "failed")
            .description("Captures that failed to persist")
            .register(registry);

        this.snapshotLatency = Timer.builder("tinykv.snapshot.latency")
            .description("Time to serialize and persist a snapshot")
            .register(registry);

        this.activeConnections = new LongAdder();
        Gauge.builder("tinykv.connections", activeConnections, LongAdder::sum)
            .description("Active connections")
            .register(registry);
    }

    /**
     * Expose the live keyspace size as a gauge.
     *
     * @param store the store to observe
     */
    public void bindStore(KVStore store) {
        Gauge.builder("tinykv.store.size", store, KVStore::size)
            .description("Number of live entries in the keyspace")
            .register(registry);
    }

    // Command recording

    public void recordCommand(String command, long durationNanos) {
        String name = command.toLowerCase(Locale.ROOT);
        commandCounter(name).increment();
        Timer.builder("tinykv.latency")
            .tag("command", name)
            .description("Command latency")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry)
            .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordGetResult(boolean hit) {
        if (hit) {
            getHits.increment();
        } else {
            getMisses.increment();
        }
    }

    public void recordError() {
        errors.increment();
    }

    // Connection tracking

    public void connectionOpened() {
        activeConnections.increment();
    }

    public void connectionClosed() {
        activeConnections.decrement();
    }

    // Snapshot tracking

    public void recordSnapshotWritten(long durationNanos) {
        snapshotsWritten.increment();
        snapshotLatency.record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordSnapshotSkipped() {
        snapshotsSkipped.increment();
    }

    public void recordSnapshotFailure() {
        snapshotFailures.increment();
    }

    // Getters for metrics values

    public long getCommandCount(String command) {
        return (long) commandCounter(command.toLowerCase(Locale.ROOT)).count();
    }

    public long getTotalErrors() {
        return (long) errors.count();
    }

    public long getActiveConnections() {
        return activeConnections.sum();
    }

    public double getHitRate() {
        double hits = getHits.count();
        double misses = getMisses.count();
        double total = hits + misses;
        return total > 0 ? hits / total : 0.0;
    }

    public long getSnapshotsWritten() {
        return (long) snapshotsWritten.count();
    }

    public long getSnapshotsSkipped() {
        return (long) snapshotsSkipped.count();
    }

    public long getSnapshotFailures() {
        return (long) snapshotFailures.count();
    }

    private Counter commandCounter(String name) {
        return Counter.builder("tinykv.commands")
            .tag("command", name)
            .description("Commands executed")
            .register(registry);
    }

    /**
     * Get the underlying registry.
     *
     * @return the MeterRegistry
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * Print a summary of current metrics.
     *
     * @return formatted metrics string
     */
    public String summary() {
        return String.format(
            "TinyKV Metrics Summary%n" +
            "======================%n" +
            "Commands: GET=%d, SET=%d, DEL=%d, EXISTS=%d%n" +
            "GET: hits=%d, misses=%d, hitRate=%.2f%%%n" +
            "Errors: %d%n" +
            "Connections: %d active%n" +
            "Snapshots: written=%d, skipped=%d, failed=%d",
            getCommandCount("get"), getCommandCount("set"), getCommandCount("del"), getCommandCount("exists"),
            (long) getHits.count(), (long) getMisses.count(), getHitRate() * 100,
            getTotalErrors(),
            getActiveConnections(),
            getSnapshotsWritten(), getSnapshotsSkipped(), getSnapshotFailures()
        );
    }
}

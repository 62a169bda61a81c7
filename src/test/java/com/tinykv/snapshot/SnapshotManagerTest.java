package com.tinykv.snapshot;

import com.tinykv.core.InMemoryStore;
import com.tinykv.core.KeyspaceView;
import com.tinykv.core.MutableClock;
import com.tinykv.util.MetricsCollector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.*;

class SnapshotManagerTest {

    private static final long START = 1_700_000_000_000L;

    @TempDir
    Path tempDir;

    private Path file;
    private MutableClock clock;
    private MetricsCollector metrics;
    private final List<InMemoryStore> stores = new ArrayList<>();
    private final List<SnapshotManager> managers = new ArrayList<>();

    @BeforeEach
    void setUp() {
        file = tempDir.resolve("tinykv.snapshot");
        clock = new MutableClock(START);
        metrics = new MetricsCollector();
    }

    @AfterEach
    void tearDown() {
        for (SnapshotManager manager : managers) {
            manager.shutdown();
        }
        for (InMemoryStore store : stores) {
            store.shutdown();
        }
    }

    private InMemoryStore newStore() {
        InMemoryStore store = new InMemoryStore(0, clock);
        stores.add(store);
        return store;
    }

    private SnapshotManager newManager(InMemoryStore store, long intervalSeconds, boolean fallback) {
        SnapshotManager manager = new SnapshotManager(store, file, intervalSeconds, fallback, metrics, clock);
        managers.add(manager);
        return manager;
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static String value(InMemoryStore store, String key) {
        return store.get(key).map(e -> new String(e.getValue(), StandardCharsets.UTF_8)).orElse(null);
    }

    @Test
    void restore_missingFile_startsEmpty() {
        InMemoryStore store = newStore();
        SnapshotManager manager = newManager(store, 0, false);

        assertThat(manager.restore()).isZero();
        assertThat(manager.getState()).isEqualTo(SnapshotManager.State.READY);
        assertThat(manager.getLastPersistedSequence()).isZero();
        assertThat(store.size()).isZero();
    }

    @Test
    void capture_thenRestore_reproducesKeyspace() {
        InMemoryStore store = newStore();
        SnapshotManager manager = newManager(store, 0, false);
        manager.restore();
        store.set("plain", bytes("v1"));
        store.set("expiring", bytes("v2"), 60_000);
        store.set("gone", bytes("v3"));
        store.delete("gone");

        assertThat(manager.capture(false)).isTrue();
        assertThat(Files.exists(file)).isTrue();
        assertThat(Files.exists(tempDir.resolve("tinykv.snapshot.tmp"))).isFalse();
        assertThat(manager.getLastPersistedSequence()).isEqualTo(store.sequence());

        InMemoryStore restoredStore = newStore();
        SnapshotManager restoredManager = newManager(restoredStore, 0, false);

        assertThat(restoredManager.restore()).isEqualTo(2);
        assertThat(value(restoredStore, "plain")).isEqualTo("v1");
        assertThat(value(restoredStore, "expiring")).isEqualTo("v2");
        assertThat(restoredStore.get("expiring").get().getExpiresAt()).isEqualTo(START + 60_000);
        assertThat(restoredStore.exists("gone")).isFalse();
    }

    @Test
    void capture_unchangedKeyspace_isSkipped() {
        InMemoryStore store = newStore();
        SnapshotManager manager = newManager(store, 0, false);
        manager.restore();

        assertThat(manager.capture(false)).isFalse();
        assertThat(Files.exists(file)).isFalse();

        store.set("k", bytes("v"));
        assertThat(manager.capture(false)).isTrue();
        assertThat(manager.capture(false)).isFalse();

        assertThat(metrics.getSnapshotsWritten()).isEqualTo(1);
        assertThat(metrics.getSnapshotsSkipped()).isEqualTo(2);
    }

    @Test
    void capture_forced_writesUnchangedKeyspace() {
        InMemoryStore store = newStore();
        SnapshotManager manager = newManager(store, 0, false);
        manager.restore();

        assertThat(manager.capture(true)).isTrue();
        assertThat(manager.capture(true)).isTrue();
        assertThat(Files.exists(file)).isTrue();
        assertThat(metrics.getSnapshotsWritten()).isEqualTo(2);
    }

    @Test
    void restore_skipsRecordsExpiredWhileDown() {
        InMemoryStore store = newStore();
        SnapshotManager manager = newManager(store, 0, false);
        manager.restore();
        store.set("short", bytes("v"), 100);
        store.set("long", bytes("v"), 10_000);
        manager.capture(false);

        clock.advance(100);
        InMemoryStore restoredStore = newStore();

        assertThat(newManager(restoredStore, 0, false).restore()).isEqualTo(1);
        assertThat(restoredStore.exists("short")).isFalse();
        assertThat(restoredStore.exists("long")).isTrue();
    }

    @Test
    void capture_failure_keepsPreviousSnapshot() throws IOException {
        InMemoryStore store = newStore();
        SnapshotManager manager = newManager(store, 0, false);
        manager.restore();
        store.set("k", bytes("first"));
        manager.capture(false);
        byte[] before = Files.readAllBytes(file);

        // A non-empty directory at the temp path makes the write fail
        Path blocker = tempDir.resolve("tinykv.snapshot.tmp");
        Files.createDirectory(blocker);
        Files.write(blocker.resolve("occupied"), bytes("x"));
        store.set("k", bytes("second"));

        assertThatThrownBy(() -> manager.capture(false))
                .isInstanceOf(SnapshotException.class)
                .hasCauseInstanceOf(IOException.class);
        assertThat(Files.readAllBytes(file)).isEqualTo(before);
        assertThat(manager.getState()).isEqualTo(SnapshotManager.State.READY);
        assertThat(metrics.getSnapshotFailures()).isEqualTo(1);

        Files.delete(blocker.resolve("occupied"));
        Files.delete(blocker);
        assertThat(manager.capture(false)).isTrue();

        InMemoryStore restoredStore = newStore();
        newManager(restoredStore, 0, false).restore();
        assertThat(value(restoredStore, "k")).isEqualTo("second");
    }

    @Test
    void restore_corruptFile_isFatalByDefault() throws IOException {
        Files.write(file, bytes("definitely not a snapshot"));
        InMemoryStore store = newStore();
        SnapshotManager manager = newManager(store, 0, false);

        assertThatThrownBy(manager::restore).isInstanceOf(SnapshotException.class);
        assertThat(manager.getState()).isEqualTo(SnapshotManager.State.RESTORING);

        manager.shutdown();
        assertThat(Files.readAllBytes(file)).isEqualTo(bytes("definitely not a snapshot"));
    }

    @Test
    void restore_corruptFile_withFallback_startsEmptyAndReplacesFile() throws IOException {
        Files.write(file, bytes("definitely not a snapshot"));
        InMemoryStore store = newStore();
        SnapshotManager manager = newManager(store, 0, true);

        assertThat(manager.restore()).isZero();
        assertThat(manager.getState()).isEqualTo(SnapshotManager.State.READY);
        assertThat(manager.getLastPersistedSequence()).isEqualTo(-1);

        assertThat(manager.capture(false)).isTrue();
        assertThat(SnapshotCodec.read(file).size()).isZero();
    }

    @Test
    void restore_truncatedFile_isRejected() throws IOException {
        InMemoryStore store = newStore();
        SnapshotManager manager = newManager(store, 0, false);
        manager.restore();
        store.set("k", bytes("v"));
        manager.capture(false);
        byte[] full = Files.readAllBytes(file);
        Files.write(file, Arrays.copyOf(full, full.length - 3));

        assertThatThrownBy(() -> newManager(newStore(), 0, false).restore())
                .isInstanceOf(SnapshotException.class)
                .hasMessageContaining("Truncated");
    }

    @Test
    void capture_beforeRestore_isRejected() {
        SnapshotManager manager = newManager(newStore(), 0, false);

        assertThatThrownBy(() -> manager.capture(false)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(manager::start).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> manager.requestCapture().get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void restore_calledTwice_isRejected() {
        SnapshotManager manager = newManager(newStore(), 0, false);
        manager.restore();

        assertThatThrownBy(manager::restore).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void restore_intoNonEmptyStore_isRejected() {
        InMemoryStore store = newStore();
        store.set("k", bytes("v"));
        SnapshotManager manager = newManager(store, 0, false);

        assertThatThrownBy(manager::restore).isInstanceOf(IllegalStateException.class);
        assertThat(manager.getState()).isEqualTo(SnapshotManager.State.IDLE);
    }

    @Test
    void requestCapture_concurrentRequests_shareOneCapture() throws Exception {
        GatedStore store = new GatedStore(clock);
        stores.add(store);
        SnapshotManager manager = newManager(store, 0, false);
        manager.restore();
        store.set("k", bytes("v"));
        store.arm();

        CompletableFuture<Boolean> first = manager.requestCapture();
        assertThat(store.entered.await(5, TimeUnit.SECONDS)).isTrue();
        CompletableFuture<Boolean> second = manager.requestCapture();

        assertThat(second).isSameAs(first);
        assertThat(manager.getState()).isEqualTo(SnapshotManager.State.CAPTURING);

        store.gate.countDown();
        assertThat(first.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(metrics.getSnapshotsWritten()).isEqualTo(1);
        assertThat(manager.getState()).isEqualTo(SnapshotManager.State.READY);
    }

    @Test
    void requestCapture_queuedBehindOverdueTimerTick_completes() throws Exception {
        GatedStore store = new GatedStore(clock);
        stores.add(store);
        SnapshotManager manager = newManager(store, 1, false);
        manager.restore();
        manager.start();
        store.set("k", bytes("v"));
        store.arm();

        CompletableFuture<Boolean> first = manager.requestCapture();
        assertThat(store.entered.await(5, TimeUnit.SECONDS)).isTrue();
        // Issued on the snapshot thread as the first capture finishes, so it queues behind the tick
        CompletableFuture<CompletableFuture<Boolean>> second = new CompletableFuture<>();
        first.whenComplete((written, error) -> second.complete(manager.requestCapture()));

        // Hold the first capture past the timer's due time
        Thread.sleep(1500);
        store.gate.countDown();

        assertThat(first.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(second.get(5, TimeUnit.SECONDS).get(5, TimeUnit.SECONDS)).isFalse();
        assertThat(manager.getState()).isEqualTo(SnapshotManager.State.READY);

        store.set("k2", bytes("v2"));
        // The timer may get there first; either way the request must complete
        manager.requestCapture().get(5, TimeUnit.SECONDS);
        CompletableFuture.runAsync(manager::shutdown).get(10, TimeUnit.SECONDS);
        assertThat(SnapshotCodec.read(file).getRecords())
                .extracting(Snapshot.Record::getKey)
                .containsExactlyInAnyOrder("k", "k2");
    }

    @Test
    void capture_duringConcurrentWrites_isNeverTorn() throws Exception {
        // Writers bump per-key counters, so a consistent snapshot sums to its sequence
        InMemoryStore store = newStore();
        SnapshotManager manager = newManager(store, 0, false);
        manager.restore();

        int writers = 4;
        AtomicBoolean running = new AtomicBoolean(true);
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        List<Future<?>> futures = new ArrayList<>();
        for (int w = 0; w < writers; w++) {
            final String key = "counter-" + w;
            futures.add(executor.submit(() -> {
                long n = 0;
                while (running.get()) {
                    n++;
                    store.set(key, bytes(Long.toString(n)));
                }
                return null;
            }));
        }

        try {
            for (int i = 0; i < 20; i++) {
                manager.capture(true);
                Snapshot snapshot = SnapshotCodec.read(file);
                long total = 0;
                for (Snapshot.Record record : snapshot.getRecords()) {
                    total += Long.parseLong(new String(record.getValueUnsafe(), StandardCharsets.UTF_8));
                }
                assertThat(total).isEqualTo(snapshot.getSequence());
            }
        } finally {
            running.set(false);
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
            executor.shutdown();
        }
    }

    @Test
    void shutdown_writesFinalSnapshot() throws IOException {
        InMemoryStore store = newStore();
        SnapshotManager manager = newManager(store, 0, false);
        manager.restore();
        manager.start();
        store.set("k", bytes("v"));

        manager.shutdown();
        manager.shutdown();

        assertThat(SnapshotCodec.read(file).getRecords())
                .extracting(Snapshot.Record::getKey)
                .containsExactly("k");
        assertThat(metrics.getSnapshotsWritten()).isEqualTo(1);
    }

    @Test
    void shutdown_beforeRestore_writesNothing() {
        SnapshotManager manager = newManager(newStore(), 0, false);

        manager.shutdown();

        assertThat(Files.exists(file)).isFalse();
    }

    @Test
    void start_periodicTimer_writesSnapshot() throws Exception {
        InMemoryStore store = newStore();
        SnapshotManager manager = newManager(store, 1, false);
        manager.restore();
        store.set("k", bytes("v"));

        manager.start();

        long deadline = System.currentTimeMillis() + 10_000;
        while (metrics.getSnapshotsWritten() == 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
        }
        assertThat(metrics.getSnapshotsWritten()).isEqualTo(1);
        assertThat(Files.exists(file)).isTrue();
    }

    @Test
    void constructor_rejectsInvalidArguments() {
        InMemoryStore store = newStore();

        assertThatThrownBy(() -> new SnapshotManager(null, file, 0, false, metrics))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SnapshotManager(store, null, 0, false, metrics))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SnapshotManager(store, file, -1, false, metrics))
                .isInstanceOf(IllegalArgumentException.class);
    }

    /**
     * Store whose next snapshot view blocks until the test opens the gate.
     */
    private static class GatedStore extends InMemoryStore {
        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch gate = new CountDownLatch(1);
        private volatile boolean armed;

        GatedStore(MutableClock clock) {
            super(0, clock);
        }

        void arm() {
            armed = true;
        }

        @Override
        public KeyspaceView snapshotView() {
            if (armed) {
                armed = false;
                entered.countDown();
                try {
                    gate.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return super.snapshotView();
        }
    }
}

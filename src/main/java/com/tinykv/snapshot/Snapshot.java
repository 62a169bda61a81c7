package com.tinykv.snapshot;

import com.tinykv.core.Entry;
import com.tinykv.core.KeyspaceView;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable point-in-time copy of the keyspace as it is written to disk.
 */
public final class Snapshot {

    private final long sequence;
    private final long capturedAt;
    private final List<Record> records;

    public Snapshot(long sequence, long capturedAt, List<Record> records) {
        this.sequence = sequence;
        this.capturedAt = capturedAt;
        this.records = List.copyOf(records);
    }

    /**
     * Build a snapshot from a store view. Only live entries are in a view, so
     * nothing is filtered here.
     */
    public static Snapshot fromView(KeyspaceView view) {
        List<Record> records = new ArrayList<>(view.size());
        for (Map.Entry<String, Entry> e : view.getEntries()) {
            Entry entry = e.getValue();
            records.add(new Record(e.getKey(), entry.getValueUnsafe(), entry.getExpiresAt()));
        }
        return new Snapshot(view.getSequence(), view.getTakenAt(), records);
    }

    /**
     * Mutation sequence of the store when the view was taken.
     */
    public long getSequence() {
        return sequence;
    }

    public long getCapturedAt() {
        return capturedAt;
    }

    public List<Record> getRecords() {
        return records;
    }

    public int size() {
        return records.size();
    }

    @Override
    public String toString() {
        return "Snapshot{sequence=" + sequence +
               ", capturedAt=" + capturedAt +
               ", records=" + records.size() +
               '}';
    }

    /**
     * One persisted key.
     */
    public static final class Record {

        private final String key;
        private final byte[] value;
        private final long expiresAt;

        public Record(String key, byte[] value, long expiresAt) {
            this.key = Objects.requireNonNull(key, "key");
            this.value = Objects.requireNonNull(value, "value");
            this.expiresAt = expiresAt;
        }

        public String getKey() {
            return key;
        }

        /**
         * UTF-8 form of the key. A key that cannot be encoded exactly, such as
         * one holding an unpaired surrogate, fails instead of being altered.
         */
        byte[] getKeyBytes() {
            try {
                ByteBuffer encoded = StandardCharsets.UTF_8.newEncoder()
                        .onMalformedInput(CodingErrorAction.REPORT)
                        .onUnmappableCharacter(CodingErrorAction.REPORT)
                        .encode(CharBuffer.wrap(key));
                byte[] bytes = new byte[encoded.remaining()];
                encoded.get(bytes);
                return bytes;
            } catch (CharacterCodingException e) {
                throw new SnapshotException("Key cannot be encoded as UTF-8", e);
            }
        }

        /**
         * Get the value bytes without copying.
         * Use with caution - do not modify the returned array.
         */
        public byte[] getValueUnsafe() {
            return value;
        }

        public byte[] getValue() {
            return Arrays.copyOf(value, value.length);
        }

        public long getExpiresAt() {
            return expiresAt;
        }

        public boolean isExpiredAt(long now) {
            return expiresAt > 0 && now >= expiresAt;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Record record = (Record) o;
            return expiresAt == record.expiresAt &&
                   key.equals(record.key) &&
                   Arrays.equals(value, record.value);
        }

        @Override
        public int hashCode() {
            int result = Objects.hash(key, expiresAt);
            result = 31 * result + Arrays.hashCode(value);
            return result;
        }

        @Override
        public String toString() {
            return "Record{key='" + key + "', valueLength=" + value.length + ", expiresAt=" + expiresAt + '}';
        }
    }
}

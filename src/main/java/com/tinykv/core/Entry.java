package com.tinykv.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable keyspace record.
 * Holds the value bytes along with the write time and optional expiration.
 */
public final class Entry {

    private final byte[] value;
    private final long timestamp;
    private final long expiresAt; // 0 means no expiration

    /**
     * Create a new entry with no expiration.
     *
     * @param value the value bytes
     */
    public Entry(byte[] value) {
        this(value, System.currentTimeMillis(), 0);
    }

    /**
     * Create an entry with explicit timestamp and expiration.
     *
     * @param value     the value bytes
     * @param timestamp the write timestamp
     * @param expiresAt the absolute expiration timestamp (0 for no expiration)
     */
    public Entry(byte[] value, long timestamp, long expiresAt) {
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null");
        }
        if (expiresAt < 0) {
            throw new IllegalArgumentException("expiresAt must be non-negative, got: " + expiresAt);
        }
        this.value = Arrays.copyOf(value, value.length);
        this.timestamp = timestamp;
        this.expiresAt = expiresAt;
    }

    /**
     * Get a copy of the value bytes.
     *
     * @return copy of the value
     */
    public byte[] getValue() {
        return Arrays.copyOf(value, value.length);
    }

    /**
     * Get the raw value bytes without copying.
     * Use with caution - do not modify the returned array.
     *
     * @return the internal value array
     */
    public byte[] getValueUnsafe() {
        return value;
    }

    /**
     * Get the write timestamp.
     *
     * @return timestamp in milliseconds since epoch
     */
    public long getTimestamp() {
        return timestamp;
    }

    /**
     * Get the expiration timestamp.
     *
     * @return expiration timestamp, or 0 if no expiration
     */
    public long getExpiresAt() {
        return expiresAt;
    }

    /**
     * Check if this entry has expired at the given instant.
     *
     * @param nowMillis the current time in milliseconds since epoch
     * @return true if expired
     */
    public boolean isExpiredAt(long nowMillis) {
        return expiresAt > 0 && nowMillis >= expiresAt;
    }

    /**
     * Check if this entry has expired against the system clock.
     *
     * @return true if expired
     */
    public boolean isExpired() {
        return isExpiredAt(System.currentTimeMillis());
    }

    public boolean hasTtl() {
        return expiresAt > 0;
    }

    /**
     * Get remaining TTL in milliseconds.
     *
     * @param nowMillis the current time in milliseconds since epoch
     * @return remaining TTL, or -1 if no TTL, or 0 if expired
     */
    public long getRemainingTtl(long nowMillis) {
        if (expiresAt == 0) {
            return -1;
        }
        return Math.max(0, expiresAt - nowMillis);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entry that = (Entry) o;
        return timestamp == that.timestamp &&
               expiresAt == that.expiresAt &&
               Arrays.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(timestamp, expiresAt);
        result = 31 * result + Arrays.hashCode(value);
        return result;
    }

    @Override
    public String toString() {
        return "Entry{" +
               "valueLength=" + value.length +
               ", timestamp=" + timestamp +
               ", expiresAt=" + expiresAt +
               '}';
    }
}

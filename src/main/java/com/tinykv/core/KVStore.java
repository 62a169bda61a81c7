package com.tinykv.core;

import java.util.Optional;

/**
 * Keyspace contract shared by every component that touches stored data.
 * All implementations must be thread-safe, and every operation must be atomic
 * with respect to every other one.
 */
public interface KVStore {

    /**
     * Store a value with no expiration.
     *
     * @param key   the key to store
     * @param value the value to store
     * @return true if a live entry was replaced
     */
    boolean set(String key, byte[] value);

    /**
     * Store a value with a TTL.
     *
     * @param key       the key to store
     * @param value     the value to store
     * @param ttlMillis time-to-live in milliseconds (0 for no expiration)
     * @return true if a live entry was replaced
     */
    boolean set(String key, byte[] value, long ttlMillis);

    /**
     * Store a value with an absolute expiration time.
     * Used when repopulating the keyspace from a snapshot.
     *
     * @param key       the key to store
     * @param value     the value to store
     * @param expiresAt expiration timestamp in milliseconds since epoch (0 for none)
     * @return true if a live entry was replaced
     */
    boolean setExpiringAt(String key, byte[] value, long expiresAt);

    /**
     * Retrieve the entry for a key.
     * Expired entries observed here are removed.
     *
     * @param key the key to look up
     * @return the entry if found and not expired, empty otherwise
     */
    Optional<Entry> get(String key);

    /**
     * Delete a key.
     *
     * @param key the key to delete
     * @return true if a live entry was removed
     */
    boolean delete(String key);

    /**
     * Check if a key exists and is not expired.
     *
     * @param key the key to check
     * @return true if the key exists and is not expired
     */
    boolean exists(String key);

    /**
     * Remove every entry.
     *
     * @return the number of live entries removed
     */
    int clear();

    /**
     * Get the number of live entries.
     *
     * @return the number of non-expired entries
     */
    int size();

    /**
     * Get the mutation sequence counter.
     * Incremented on every write that changed the keyspace.
     *
     * @return the current sequence value
     */
    long sequence();

    /**
     * Take a point-in-time copy of all live entries together with the sequence
     * value they correspond to.
     *
     * @return an immutable view of the keyspace
     */
    KeyspaceView snapshotView();
}

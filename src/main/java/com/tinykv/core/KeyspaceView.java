package com.tinykv.core;

import java.util.List;
import java.util.Map;

/**
 * Point-in-time copy of the live keyspace, tagged with the mutation sequence
 * value at which it was taken. Never changes after construction.
 */
public final class KeyspaceView {

    private final List<Map.Entry<String, Entry>> entries;
    private final long sequence;
    private final long takenAt;

    public KeyspaceView(List<Map.Entry<String, Entry>> entries, long sequence, long takenAt) {
        this.entries = List.copyOf(entries);
        this.sequence = sequence;
        this.takenAt = takenAt;
    }

    /**
     * Live entries at the time the view was taken, in no particular order.
     */
    public List<Map.Entry<String, Entry>> getEntries() {
        return entries;
    }

    public long getSequence() {
        return sequence;
    }

    /**
     * Wall clock time used for the expiration check while the view was taken.
     */
    public long getTakenAt() {
        return takenAt;
    }

    public int size() {
        return entries.size();
    }

    @Override
    public String toString() {
        return "KeyspaceView{entries=" + entries.size() + ", sequence=" + sequence + '}';
    }
}

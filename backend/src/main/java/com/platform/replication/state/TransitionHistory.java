package com.platform.replication.state;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-capacity ring buffer of transition records. The oldest record is overwritten once full.
 * Safe for concurrent writers.
 */
public class TransitionHistory {

    private final TransitionRecord[] buffer;
    private int next;
    private int size;

    public TransitionHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("History capacity must be positive: " + capacity);
        }
        this.buffer = new TransitionRecord[capacity];
    }

    public synchronized void append(TransitionRecord record) {
        buffer[next] = record;
        next = (next + 1) % buffer.length;
        if (size < buffer.length) {
            size++;
        }
    }

    /**
     * Records oldest first.
     */
    public synchronized List<TransitionRecord> snapshot() {
        List<TransitionRecord> records = new ArrayList<>(size);
        int start = (next - size + buffer.length) % buffer.length;
        for (int i = 0; i < size; i++) {
            records.add(buffer[(start + i) % buffer.length]);
        }
        return records;
    }

    public synchronized int size() {
        return size;
    }

    public int capacity() {
        return buffer.length;
    }
}

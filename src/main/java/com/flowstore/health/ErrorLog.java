package com.flowstore.health;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Bounded log of recent errors. When full, the oldest half is dropped.
 */
public class ErrorLog {

    private final int capacity;
    private final Clock clock;
    private final Deque<ErrorRecord> records = new ArrayDeque<>();
    private long totalRecorded;

    public ErrorLog(int capacity, Clock clock) {
        if (capacity < 2) {
            throw new IllegalArgumentException("capacity must be at least 2, got: " + capacity);
        }
        this.capacity = capacity;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public synchronized void record(String operation, String key, Throwable error) {
        if (records.size() >= capacity) {
            int drop = capacity / 2;
            for (int i = 0; i < drop; i++) {
                records.removeFirst();
            }
        }
        records.addLast(new ErrorRecord(operation, key, error.getClass().getSimpleName(),
            error.getMessage(), clock.millis()));
        totalRecorded++;
    }

    /**
     * Retained records, oldest first.
     */
    public synchronized List<ErrorRecord> snapshot() {
        return List.copyOf(records);
    }

    /**
     * The most recent {@code n} records, oldest first.
     */
    public synchronized List<ErrorRecord> recent(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must be non-negative, got: " + n);
        }
        List<ErrorRecord> all = List.copyOf(records);
        return all.subList(Math.max(0, all.size() - n), all.size());
    }

    public synchronized int size() {
        return records.size();
    }

    /**
     * Errors recorded since creation, including dropped ones.
     */
    public synchronized long getTotalRecorded() {
        return totalRecorded;
    }
}

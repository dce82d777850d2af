package com.weblens.credits.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Bounded, newest-first window over a wallet's transactions.
 *
 * Older entries are evicted once the capacity is reached; this is a recent-activity
 * view, not an audit trail. Instances are immutable.
 */
public final class TransactionLog {

    public static final int DEFAULT_CAPACITY = 50;

    private final int capacity;
    private final List<CreditTransaction> entries;

    private TransactionLog(int capacity, List<CreditTransaction> entries) {
        this.capacity = capacity;
        this.entries = Collections.unmodifiableList(entries);
    }

    public static TransactionLog empty(int capacity) {
        return of(List.of(), capacity);
    }

    /**
     * Wraps entries that are already newest-first, dropping anything beyond capacity.
     */
    public static TransactionLog of(List<CreditTransaction> newestFirst, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        int size = Math.min(newestFirst.size(), capacity);
        return new TransactionLog(capacity, new ArrayList<>(newestFirst.subList(0, size)));
    }

    /** Prepend, then truncate to capacity. */
    public TransactionLog prepend(CreditTransaction tx) {
        List<CreditTransaction> next = new ArrayList<>(Math.min(entries.size() + 1, capacity));
        next.add(tx);
        next.addAll(entries.subList(0, Math.min(entries.size(), capacity - 1)));
        return new TransactionLog(capacity, next);
    }

    public List<CreditTransaction> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }
}

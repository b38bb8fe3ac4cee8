package com.olend.oracle;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded, append-only price history for a single asset. When full, the oldest point is evicted.
 *
 * <p>Timestamps are non-decreasing: {@link #append(PricePoint)} refuses a point older than the newest one.
 *
 * <p><b>Not thread-safe.</b> Callers hold the per-asset lock (the history instance itself).
 */
public class PriceHistory {

    private final int capacity;
    private final Deque<PricePoint> points;

    public PriceHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.points = new ArrayDeque<>(capacity);
    }

    /**
     * Appends a point, evicting the oldest if at capacity.
     *
     * @throws IllegalStateException if the point is older than the newest stored point
     */
    public void append(PricePoint point) {
        PricePoint last = points.peekLast();
        if (last != null && point.getTimestamp() < last.getTimestamp()) {
            throw new IllegalStateException(
                    "Timestamp regression: " + point.getTimestamp() + " < " + last.getTimestamp());
        }
        if (points.size() == capacity) {
            points.pollFirst();
        }
        points.addLast(point);
    }

    /** Newest point, or null when empty. */
    public PricePoint last() {
        return points.peekLast();
    }

    /** Oldest-first copy of the stored points. */
    public List<PricePoint> snapshot() {
        return new ArrayList<>(points);
    }

    public int size() {
        return points.size();
    }

    public int capacity() {
        return capacity;
    }
}

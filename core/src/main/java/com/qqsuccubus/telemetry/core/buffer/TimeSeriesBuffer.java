package com.qqsuccubus.telemetry.core.buffer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Bounded, ring-buffered time axis plus one value column per metric.
 * <p>
 * All columns share one write cursor, so the time buffer and every value buffer always have the
 * same length. When the capacity is reached the oldest row is overwritten. Values are nullable:
 * {@code null} marks a sample where the metric had no value.
 * </p>
 * <p>
 * Not thread-safe; callers guard it with the state store lock.
 * </p>
 */
public class TimeSeriesBuffer {

    private final int capacity;
    private final double[] times;
    private final Map<String, Double[]> columns = new LinkedHashMap<>();

    // Index of the oldest row and number of rows held
    private int head;
    private int size;

    public TimeSeriesBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.times = new double[capacity];
    }

    /**
     * Capacity for a window of {@code windowSeconds} sampled at {@code sampleHz}, plus a margin.
     */
    public static int capacityFor(double windowSeconds, double sampleHz, int margin) {
        return (int) Math.ceil(windowSeconds * sampleHz) + margin;
    }

    /**
     * Appends one row. Columns missing from {@code row} receive {@code null}.
     *
     * @param time Time of the row in seconds
     * @param row  Values keyed by column; keys without a column are ignored
     */
    public void append(double time, Map<String, Double> row) {
        int slot = (head + size) % capacity;
        times[slot] = time;
        for (Map.Entry<String, Double[]> column : columns.entrySet()) {
            column.getValue()[slot] = row.get(column.getKey());
        }
        if (size == capacity) {
            head = (head + 1) % capacity;
        } else {
            size++;
        }
    }

    /**
     * Makes the column set equal to {@code keys}, in that order.
     * <p>
     * Existing columns keep their data. New columns are filled with {@code null} for every row
     * already held, so the equal-length invariant is preserved mid-recording.
     * </p>
     */
    public void reconcileColumns(Collection<String> keys) {
        Map<String, Double[]> previous = new LinkedHashMap<>(columns);
        columns.clear();
        for (String key : keys) {
            Double[] column = previous.get(key);
            columns.put(key, column != null ? column : new Double[capacity]);
        }
    }

    /**
     * Drops every row; columns are kept.
     */
    public void clear() {
        head = 0;
        size = 0;
        for (Double[] column : columns.values()) {
            Arrays.fill(column, null);
        }
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return capacity;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public Set<String> columns() {
        return Collections.unmodifiableSet(columns.keySet());
    }

    /**
     * @return Copy of the time axis, oldest first
     */
    public List<Double> times() {
        List<Double> copy = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            copy.add(times[(head + i) % capacity]);
        }
        return copy;
    }

    /**
     * @return Copy of one column, oldest first, or an empty list for an unknown column
     */
    public List<Double> values(String key) {
        Double[] column = columns.get(key);
        if (column == null) {
            return new ArrayList<>();
        }
        List<Double> copy = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            copy.add(column[(head + i) % capacity]);
        }
        return copy;
    }

    /**
     * @return Copy of every column, in column order
     */
    public Map<String, List<Double>> valuesByColumn() {
        Map<String, List<Double>> copy = new LinkedHashMap<>();
        for (String key : columns.keySet()) {
            copy.put(key, values(key));
        }
        return copy;
    }

    /**
     * @return Time of the newest row, or {@code null} when empty
     */
    public Double lastTime() {
        return size == 0 ? null : times[(head + size - 1) % capacity];
    }
}

package io.dense63.kernel;

import java.util.Arrays;

/**
 * Append-only growable array of packed intervals used while building a set.
 */
final class CellBuffer {
    private static final int DEFAULT_CAPACITY = 16;

    private long[] cells;
    private int size;

    CellBuffer(int initialCapacity) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("initialCapacity must be non-negative");
        }
        this.cells = new long[Math.max(DEFAULT_CAPACITY, initialCapacity)];
    }

    int size() {
        return size;
    }

    long last() {
        return cells[size - 1];
    }

    long removeLast() {
        return cells[--size];
    }

    void add(long cell) {
        ensureCapacity(size + 1);
        cells[size++] = cell;
    }

    void addAll(long[] source, int from, int to) {
        var count = to - from;
        if (count <= 0) {
            return;
        }
        ensureCapacity(size + count);
        System.arraycopy(source, from, cells, size, count);
        size += count;
    }

    /**
     * Appends the canonical decomposition of the half-open range {@code [min, max)}.
     * Bounds are unsigned, so {@code max} may be {@code 2^63}.
     */
    void addRange(long min, long max) {
        while (Long.compareUnsigned(min, max) < 0) {
            var cell = DyadicInterval.singletonOf(min);
            while (cell != DyadicInterval.UNIVERSE) {
                var parent = DyadicInterval.parent(cell);
                if (DyadicInterval.begin(parent) != min
                        || Long.compareUnsigned(DyadicInterval.end(parent), max) > 0) {
                    break;
                }
                cell = parent;
            }
            add(cell);
            min = DyadicInterval.end(cell);
        }
    }

    long[] toArray() {
        return Arrays.copyOf(cells, size);
    }

    private void ensureCapacity(int desired) {
        if (desired <= cells.length) {
            return;
        }
        cells = Arrays.copyOf(cells, Math.max(cells.length * 2, desired));
    }
}

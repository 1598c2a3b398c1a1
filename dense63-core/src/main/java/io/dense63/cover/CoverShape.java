package io.dense63.cover;

import io.dense63.kernel.DyadicInterval;

import java.util.Arrays;

/**
 * Arena of decomposition-tree nodes for one cover computation.
 * <p>
 * Nodes are addressed by index and appended children first, so the root is the last node.
 * A node is a leaf while it has no children. Collapsing a node turns it into a leaf and
 * marks its whole former subtree dead; dead nodes stay in the arena but are never read
 * again except through {@link #isLive(int)}.
 * <p>
 * Weights, wastes and gains are unsigned: a full universe node weighs {@code 2^63}.
 */
final class CoverShape {
    private static final int NONE = -1;

    private DyadicInterval[] cells;
    private long[] weights;
    private long[] gains;
    private int[] lefts;
    private int[] rights;
    private int[] parents;
    private boolean[] dead;
    private int size;

    CoverShape(int initialCapacity) {
        var capacity = Math.max(4, initialCapacity);
        cells = new DyadicInterval[capacity];
        weights = new long[capacity];
        gains = new long[capacity];
        lefts = new int[capacity];
        rights = new int[capacity];
        parents = new int[capacity];
        dead = new boolean[capacity];
    }

    int size() {
        return size;
    }

    int root() {
        return size - 1;
    }

    int addLeaf(DyadicInterval cell, long weight) {
        return append(cell, weight, NONE, NONE);
    }

    /**
     * Appends a node over two existing subtree roots and records the waste-gain of
     * collapsing it: its own waste minus the wastes of the two roots.
     */
    int addInternal(DyadicInterval cell, long weight, int left, int right) {
        var index = append(cell, weight, left, right);
        parents[left] = index;
        parents[right] = index;
        gains[index] = waste(index) - waste(left) - waste(right);
        return index;
    }

    DyadicInterval cell(int index) {
        return cells[index];
    }

    /** Elements the node's interval covers beyond its weight. */
    long waste(int index) {
        return cells[index].size() - weights[index];
    }

    /** Waste-gain of collapsing the node's parent, or zero for the root. */
    long parentGain(int index) {
        var parent = parents[index];
        return parent == NONE ? 0L : gains[parent];
    }

    int parent(int index) {
        return parents[index];
    }

    int sibling(int index) {
        var parent = parents[index];
        if (parent == NONE) {
            return NONE;
        }
        return lefts[parent] == index ? rights[parent] : lefts[parent];
    }

    boolean isLeaf(int index) {
        return lefts[index] == NONE;
    }

    boolean isLive(int index) {
        return !dead[index];
    }

    /**
     * Turns the node into a leaf covering its whole subtree.
     *
     * @return number of live leaves removed from the former subtree
     */
    int collapse(int index) {
        if (isLeaf(index)) {
            return 0;
        }
        var removed = kill(lefts[index]) + kill(rights[index]);
        lefts[index] = NONE;
        rights[index] = NONE;
        return removed;
    }

    /** Live leaves in subtree order, left to right. */
    long[] collectLeaves(int liveLeaves) {
        var out = new long[liveLeaves];
        var n = collect(root(), out, 0);
        return n == out.length ? out : Arrays.copyOf(out, n);
    }

    private int collect(int index, long[] out, int n) {
        if (isLeaf(index)) {
            if (n == out.length) {
                throw new IllegalStateException("more live leaves than counted: " + (n + 1));
            }
            out[n] = cells[index].packed();
            return n + 1;
        }
        n = collect(lefts[index], out, n);
        return collect(rights[index], out, n);
    }

    private int kill(int index) {
        dead[index] = true;
        if (isLeaf(index)) {
            return 1;
        }
        return kill(lefts[index]) + kill(rights[index]);
    }

    private int append(DyadicInterval cell, long weight, int left, int right) {
        ensureCapacity(size + 1);
        cells[size] = cell;
        weights[size] = weight;
        lefts[size] = left;
        rights[size] = right;
        parents[size] = NONE;
        return size++;
    }

    private void ensureCapacity(int desired) {
        if (desired <= cells.length) {
            return;
        }
        var capacity = Math.max(cells.length * 2, desired);
        cells = Arrays.copyOf(cells, capacity);
        weights = Arrays.copyOf(weights, capacity);
        gains = Arrays.copyOf(gains, capacity);
        lefts = Arrays.copyOf(lefts, capacity);
        rights = Arrays.copyOf(rights, capacity);
        parents = Arrays.copyOf(parents, capacity);
        dead = Arrays.copyOf(dead, capacity);
    }
}

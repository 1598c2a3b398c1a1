package io.dense63.kernel;

import io.dense63.core.CoverConfiguration;
import io.dense63.core.NegativeElementException;
import io.dense63.cover.CoverPlanner;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.LongPredicate;

/**
 * Immutable set of integers in {@code [0, 2^63)} stored as dyadic intervals.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>Intervals are strictly increasing, pairwise disjoint, none nested in another,
 *       and no two neighbours are siblings (those are folded into their parent).</li>
 *   <li>That normal form is unique, so two sets are equal iff their intervals are.</li>
 *   <li>Every operation returns a new set; no instance is ever mutated.</li>
 *   <li>Storage and most operations scale with {@link #size()}, the number of intervals,
 *       not with {@link #count()}. Runs of neighbouring elements are cheap; isolated
 *       elements cost one interval each.</li>
 *   <li>Inserting or removing a single element means a union with a singleton, or an
 *       intersection with a singleton's complement.</li>
 * </ul>
 */
public final class CanonicalSet {
    static final CanonicalSet EMPTY = new CanonicalSet(new long[0]);
    static final CanonicalSet UNIVERSE = new CanonicalSet(new long[] {DyadicInterval.UNIVERSE});
    private static final int MAX_ARRAY_LENGTH = Integer.MAX_VALUE - 8;

    private final long[] cells;

    private CanonicalSet(long[] cells) {
        this.cells = cells;
    }

    static CanonicalSet wrap(long[] cells) {
        return cells.length == 0 ? EMPTY : new CanonicalSet(cells);
    }

    /**
     * Set of the given elements, in any order, duplicates allowed.
     *
     * @throws NegativeElementException if any element is negative
     */
    public static CanonicalSet of(long... elements) {
        if (elements == null || elements.length == 0) {
            return EMPTY;
        }
        var sorted = elements.clone();
        Arrays.sort(sorted);
        if (sorted[0] < 0) {
            throw new NegativeElementException(sorted[0]);
        }
        var out = new CellBuffer(sorted.length);
        for (var element : sorted) {
            var cell = DyadicInterval.singletonOf(element);
            if (out.size() > 0 && DyadicInterval.contains(out.last(), cell)) {
                continue;
            }
            // Fold upward while the tail is nested in the new cell or is its sibling.
            while (out.size() > 0) {
                var last = out.last();
                if (DyadicInterval.contains(cell, last)) {
                    out.removeLast();
                } else if (cell != DyadicInterval.UNIVERSE && last == DyadicInterval.sibling(cell)) {
                    out.removeLast();
                    cell = DyadicInterval.parent(cell);
                } else {
                    break;
                }
            }
            out.add(cell);
        }
        return wrap(out.toArray());
    }

    /**
     * The closed range {@code [min, max]}; empty when {@code min > max}.
     *
     * @throws NegativeElementException if {@code min} is negative
     */
    public static CanonicalSet interval(long min, long max) {
        if (min < 0) {
            throw new NegativeElementException(min);
        }
        if (min > max) {
            return EMPTY;
        }
        var out = new CellBuffer(64);
        out.addRange(min, max + 1);
        return wrap(out.toArray());
    }

    /**
     * Rebuilds a set from packed intervals as returned by {@link #toPackedArray()}.
     *
     * @throws IllegalArgumentException if the intervals are not in canonical form
     */
    public static CanonicalSet ofPacked(long... packed) {
        if (packed == null || packed.length == 0) {
            return EMPTY;
        }
        var copy = packed.clone();
        for (var cell : copy) {
            if (cell == 0L) {
                throw new IllegalArgumentException("packed interval must be non-zero");
            }
        }
        var anomalies = anomalies(copy);
        if (!anomalies.isEmpty()) {
            throw new IllegalArgumentException("not canonical, offending intervals: " + anomalies);
        }
        return wrap(copy);
    }

    public CanonicalSet union(CanonicalSet other) {
        requireSet(other);
        return wrapResult(SetAlgebra.union(cells, other.cells), other);
    }

    public CanonicalSet intersection(CanonicalSet other) {
        requireSet(other);
        return wrapResult(SetAlgebra.intersection(cells, other.cells), other);
    }

    /** Everything in {@code [0, 2^63)} not in this set. */
    public CanonicalSet complement() {
        if (cells.length == 0) {
            return UNIVERSE;
        }
        return wrap(SetAlgebra.complement(cells));
    }

    /** True iff the two sets share at least one element. */
    public boolean intersects(CanonicalSet other) {
        requireSet(other);
        return SetAlgebra.intersects(cells, other.cells);
    }

    /** Membership; negative values are never members. */
    public boolean contains(long element) {
        if (element < 0) {
            return false;
        }
        var i = DyadicInterval.lowerBound(cells, 0, cells.length, DyadicInterval.singletonOf(element));
        if (i > 0 && Long.compareUnsigned(element, DyadicInterval.end(cells[i - 1])) < 0) {
            return true;
        }
        return i < cells.length && DyadicInterval.begin(cells[i]) <= element;
    }

    /**
     * Number of elements, as an unsigned 64-bit value: the universe counts {@code 2^63},
     * which reads as {@link Long#MIN_VALUE}.
     */
    public long count() {
        return DyadicInterval.totalSize(cells, 0, cells.length);
    }

    /** Smallest and largest element, or {@link Span#EMPTY}. */
    public Span span() {
        if (cells.length == 0) {
            return Span.EMPTY;
        }
        return new Span(DyadicInterval.begin(cells[0]), DyadicInterval.end(cells[cells.length - 1]) - 1);
    }

    public boolean isEmpty() {
        return cells.length == 0;
    }

    /** Number of dyadic intervals in the representation. */
    public int size() {
        return cells.length;
    }

    public DyadicInterval interval(int index) {
        return DyadicInterval.fromPacked(cells[index]);
    }

    public List<DyadicInterval> intervals() {
        var list = new ArrayList<DyadicInterval>(cells.length);
        for (var cell : cells) {
            list.add(DyadicInterval.fromPacked(cell));
        }
        return Collections.unmodifiableList(list);
    }

    /** Snapshot copy of the packed intervals. */
    public long[] toPackedArray() {
        return cells.clone();
    }

    /**
     * Visits elements in increasing order.
     *
     * @param visitor returns false to stop
     */
    public void forEach(LongPredicate visitor) {
        for (var cell : cells) {
            var end = DyadicInterval.end(cell);
            for (var e = DyadicInterval.begin(cell); Long.compareUnsigned(e, end) < 0; e++) {
                if (!visitor.test(e)) {
                    return;
                }
            }
        }
    }

    /**
     * Visits the maximal closed runs {@code [first, last]} in increasing order.
     * Neighbouring intervals are reported as one run.
     */
    public void forEachInterval(IntervalVisitor visitor) {
        var runs = new RunCursor(cells);
        while (runs.present()) {
            if (!visitor.visit(runs.begin(), runs.end() - 1)) {
                return;
            }
            runs.advance();
        }
    }

    public List<Span> runs() {
        var list = new ArrayList<Span>();
        forEachInterval((first, last) -> list.add(new Span(first, last)));
        return Collections.unmodifiableList(list);
    }

    /**
     * Lazy enumerator over the elements in increasing order. Each call starts over.
     */
    public LongEnumerator enumerator() {
        var snapshot = cells;
        return new LongEnumerator() {
            private int index;
            private long next = snapshot.length == 0 ? 0L : DyadicInterval.begin(snapshot[0]);

            @Override
            public boolean hasNext() {
                return index < snapshot.length;
            }

            @Override
            public long nextLong() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                var value = next++;
                if (next == DyadicInterval.end(snapshot[index])) {
                    index++;
                    if (index < snapshot.length) {
                        next = DyadicInterval.begin(snapshot[index]);
                    }
                }
                return value;
            }
        };
    }

    /**
     * Snapshot array of all elements in increasing order.
     *
     * @throws IllegalStateException if there are too many elements for a Java array
     */
    public long[] toLongArray() {
        var n = count();
        if (n < 0 || n > MAX_ARRAY_LENGTH) {
            throw new IllegalStateException("set of " + Long.toUnsignedString(n) + " elements does not fit an array");
        }
        var result = new long[(int) n];
        var e = enumerator();
        for (var i = 0; i < result.length; i++) {
            result[i] = e.nextLong();
        }
        return result;
    }

    /**
     * Superset of this set with at most {@code maxSize} intervals (when positive), none
     * smaller than {@code minGrain}, chosen greedily to keep the extra elements low.
     */
    public CanonicalSet cover(int maxSize, long minGrain) {
        return cover(CoverConfiguration.builder().maxSize(maxSize).minGrain(minGrain).build());
    }

    public CanonicalSet cover(CoverConfiguration configuration) {
        return new CoverPlanner(configuration).cover(this);
    }

    /**
     * Intervals that break the canonical form: out of order or equal to, nested with,
     * or an exact sibling of their predecessor. Empty for every set this class builds.
     */
    public List<DyadicInterval> findAnomalies() {
        return anomalies(cells);
    }

    private static List<DyadicInterval> anomalies(long[] cells) {
        var result = new ArrayList<DyadicInterval>();
        for (var i = 1; i < cells.length; i++) {
            var prev = cells[i - 1];
            var cell = cells[i];
            if (Long.compareUnsigned(prev, cell) >= 0
                    || DyadicInterval.contains(cell, prev)
                    || DyadicInterval.contains(prev, cell)
                    || (cell != DyadicInterval.UNIVERSE && DyadicInterval.sibling(cell) == prev)) {
                result.add(DyadicInterval.fromPacked(cell));
            }
        }
        return result;
    }

    private CanonicalSet wrapResult(long[] result, CanonicalSet other) {
        if (result == cells) {
            return this;
        }
        if (result == other.cells) {
            return other;
        }
        return wrap(result);
    }

    private static void requireSet(CanonicalSet other) {
        if (other == null) {
            throw new IllegalArgumentException("other set required");
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        CanonicalSet that = (CanonicalSet) obj;
        return Arrays.equals(cells, that.cells);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(cells);
    }

    /** {@code ∅}, or the maximal runs as closed intervals joined by {@code ∪}. */
    @Override
    public String toString() {
        if (cells.length == 0) {
            return "∅";
        }
        var sb = new StringBuilder();
        forEachInterval((first, last) -> {
            if (sb.length() > 0) {
                sb.append(" ∪ ");
            }
            sb.append('[').append(first).append(", ").append(last).append(']');
            return true;
        });
        return sb.toString();
    }
}

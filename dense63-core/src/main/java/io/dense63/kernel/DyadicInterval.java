package io.dense63.kernel;

/**
 * Size-aligned half-open interval {@code [begin, begin + 2^level)} packed into one 64-bit word.
 * <p>
 * Layout: the least significant set bit marks the level, every bit above it is the begin
 * shifted left by one. A singleton {@code e} is packed as {@code (e << 1) | 1}; the universe
 * {@code [0, 2^63)} is packed as {@code 1L << 63}.
 * <p>
 * The packed value is read as unsigned. Ordering by packed value equals ordering by begin
 * for disjoint intervals, which is what {@link CanonicalSet} relies on for its binary searches.
 * <p>
 * Sizes and {@link #end()} are unsigned too: the universe has size and end {@code 2^63},
 * which reads as {@link Long#MIN_VALUE}.
 */
public final class DyadicInterval implements Comparable<DyadicInterval> {
    static final long UNIVERSE = Long.MIN_VALUE;
    static final int MAX_LEVEL = 63;

    private static final DyadicInterval UNIVERSE_INTERVAL = new DyadicInterval(UNIVERSE);

    private final long packed;

    private DyadicInterval(long packed) {
        this.packed = packed;
    }

    /**
     * Interval holding the single element {@code e}.
     * <p>
     * {@code e} must be non-negative; sets check this before packing.
     */
    public static DyadicInterval singleton(long e) {
        return new DyadicInterval(singletonOf(e));
    }

    public static DyadicInterval universe() {
        return UNIVERSE_INTERVAL;
    }

    /**
     * Aligned interval of size {@code 2^level} starting at {@code begin}.
     *
     * @throws IllegalArgumentException if the level is outside [0, 63], begin is negative,
     *                                  or begin is not a multiple of the size
     */
    public static DyadicInterval of(long begin, int level) {
        if (level < 0 || level > MAX_LEVEL) {
            throw new IllegalArgumentException("level out of range: " + level);
        }
        if (begin < 0) {
            throw new IllegalArgumentException("begin must be non-negative: " + begin);
        }
        var size = 1L << level;
        if (level == MAX_LEVEL) {
            if (begin != 0) {
                throw new IllegalArgumentException("level 63 interval must begin at 0: " + begin);
            }
            return UNIVERSE_INTERVAL;
        }
        if ((begin & (size - 1)) != 0) {
            throw new IllegalArgumentException("begin " + begin + " not aligned to size " + size);
        }
        return new DyadicInterval((begin << 1) | size);
    }

    /**
     * Wraps a packed value previously obtained from {@link #packed()}.
     *
     * @throws IllegalArgumentException for zero, which packs no interval
     */
    public static DyadicInterval fromPacked(long packed) {
        if (packed == 0L) {
            throw new IllegalArgumentException("packed interval must be non-zero");
        }
        return packed == UNIVERSE ? UNIVERSE_INTERVAL : new DyadicInterval(packed);
    }

    public long packed() {
        return packed;
    }

    public int level() {
        return level(packed);
    }

    /** Number of elements, unsigned. */
    public long size() {
        return lsb(packed);
    }

    public long begin() {
        return begin(packed);
    }

    /** One past the last element, unsigned. */
    public long end() {
        return end(packed);
    }

    /** Last element, inclusive. Always fits a signed long. */
    public long last() {
        return end(packed) - 1;
    }

    public boolean isUniverse() {
        return packed == UNIVERSE;
    }

    /** Aligned interval of twice the size containing this one. The universe is its own parent. */
    public DyadicInterval parent() {
        return isUniverse() ? this : new DyadicInterval(parent(packed));
    }

    /** Lower half. A singleton is its own half. */
    public DyadicInterval left() {
        return fromPacked(left(packed));
    }

    /** Upper half. A singleton is its own half. */
    public DyadicInterval right() {
        return fromPacked(right(packed));
    }

    public DyadicInterval[] children() {
        return new DyadicInterval[] {left(), right()};
    }

    /** Other half of {@link #parent()}. The universe is its own sibling. */
    public DyadicInterval sibling() {
        return isUniverse() ? this : new DyadicInterval(sibling(packed));
    }

    /** True iff {@code other} is nested in this interval, including equality. Ancestors are never nested. */
    public boolean contains(DyadicInterval other) {
        return contains(packed, other.packed);
    }

    @Override
    public int compareTo(DyadicInterval other) {
        return Long.compareUnsigned(packed, other.packed);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        DyadicInterval interval = (DyadicInterval) obj;
        return packed == interval.packed;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(packed);
    }

    @Override
    public String toString() {
        return "[" + begin() + ", " + Long.toUnsignedString(end()) + ")";
    }

    /**
     * Index of the first packed interval in {@code packed[from, to)} not less than {@code cell}
     * in unsigned order, or {@code to}. The range must be sorted the way canonical sets store it.
     */
    public static int lowerBound(long[] packed, int from, int to, long cell) {
        var lo = from;
        var hi = to;
        while (lo < hi) {
            var mid = (lo + hi) >>> 1;
            if (Long.compareUnsigned(packed[mid], cell) < 0) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    /** Summed sizes of {@code packed[from, to)}, unsigned. */
    public static long totalSize(long[] packed, int from, int to) {
        var n = 0L;
        for (var i = from; i < to; i++) {
            n += lsb(packed[i]);
        }
        return n;
    }

    // Packed-word primitives shared by the set algorithms, which keep intervals unboxed.

    static long singletonOf(long e) {
        return (e << 1) | 1L;
    }

    static long lsb(long cell) {
        return cell & -cell;
    }

    static int level(long cell) {
        return Long.numberOfTrailingZeros(cell);
    }

    static long begin(long cell) {
        return (cell - lsb(cell)) >>> 1;
    }

    static long end(long cell) {
        return begin(cell) + lsb(cell);
    }

    static long parent(long cell) {
        var p = lsb(cell);
        return (cell ^ p) | (p << 1);
    }

    static long left(long cell) {
        var half = lsb(cell) >>> 1;
        return (cell | half) & ~(half << 1);
    }

    static long right(long cell) {
        var half = lsb(cell) >>> 1;
        return cell | half | (half << 1);
    }

    static long sibling(long cell) {
        return cell ^ (lsb(cell) << 1);
    }

    static boolean contains(long outer, long inner) {
        // outer - lsb(outer) shares the high bits but packs a strict ancestor
        return Long.compareUnsigned(lsb(inner), lsb(outer)) <= 0
                && ((outer ^ inner) & ~((lsb(outer) << 1) - 1)) == 0;
    }
}

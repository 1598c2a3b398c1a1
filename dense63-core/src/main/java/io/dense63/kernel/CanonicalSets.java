package io.dense63.kernel;

import io.dense63.core.NegativeElementException;

public final class CanonicalSets {
    private CanonicalSets() {
    }

    public static CanonicalSet empty() {
        return CanonicalSet.EMPTY;
    }

    /** The whole domain {@code [0, 2^63)}. */
    public static CanonicalSet universe() {
        return CanonicalSet.UNIVERSE;
    }

    public static CanonicalSet singleton(long element) {
        if (element < 0) {
            throw new NegativeElementException(element);
        }
        return CanonicalSet.wrap(new long[] {DyadicInterval.singletonOf(element)});
    }

    /** Set of the positions of the one bits of {@code mask}, a subset of {@code [0, 64)}. */
    public static CanonicalSet fromMask(long mask) {
        var elements = new long[Long.bitCount(mask)];
        var n = 0;
        for (var rest = mask; rest != 0; rest &= rest - 1) {
            elements[n++] = Long.numberOfTrailingZeros(rest);
        }
        return CanonicalSet.of(elements);
    }
}

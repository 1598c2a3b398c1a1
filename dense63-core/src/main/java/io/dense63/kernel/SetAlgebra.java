package io.dense63.kernel;

/**
 * Merge walks over canonical cell arrays.
 * <p>
 * Union and intersection pull maximal runs from both operands with {@link RunCursor}
 * and resolve each step into one of six orderings of the two current runs. Runs from
 * different operands that end up in the output are always separated by a gap, so copying
 * verbatim runs and re-decomposing modified ones yields canonical output without a
 * normalization pass.
 * <p>
 * All begin/end comparisons are unsigned: the universe ends at {@code 2^63}.
 */
final class SetAlgebra {
    private SetAlgebra() {
    }

    static long[] union(long[] s, long[] t) {
        if (t.length == 0) {
            return s;
        }
        if (s.length == 0) {
            return t;
        }
        var out = new CellBuffer(s.length + t.length);
        var a = new RunCursor(s);
        var b = new RunCursor(t);

        while (a.present() && b.present()) {
            // a inside b
            if (le(b.begin(), a.begin()) && le(a.end(), b.end())) {
                a.advance();
                continue;
            }
            // b inside a
            if (le(a.begin(), b.begin()) && le(b.end(), a.end())) {
                b.advance();
                continue;
            }
            // a before b, not touching
            if (lt(a.end(), b.begin())) {
                a.emitTo(out);
                a.advance();
                continue;
            }
            // b before a, not touching
            if (lt(b.end(), a.begin())) {
                b.emitTo(out);
                b.advance();
                continue;
            }
            // [a.begin .. [b.begin .. a.end) .. b.end): b may still reach into the next run of a
            if (le(a.begin(), b.begin()) && le(a.end(), b.end())) {
                b.restart(a.begin());
                a.advance();
                continue;
            }
            // [b.begin .. [a.begin .. b.end) .. a.end)
            if (le(b.begin(), a.begin()) && le(b.end(), a.end())) {
                a.restart(b.begin());
                b.advance();
                continue;
            }
            throw new IllegalStateException("impossible run order: [" + a.begin() + ", "
                    + Long.toUnsignedString(a.end()) + ") vs [" + b.begin() + ", "
                    + Long.toUnsignedString(b.end()) + ")");
        }

        if (a.present()) {
            a.emitTo(out);
            a.emitRemainderTo(out);
        }
        if (b.present()) {
            b.emitTo(out);
            b.emitRemainderTo(out);
        }
        return out.toArray();
    }

    static long[] intersection(long[] s, long[] t) {
        if (t.length == 0) {
            return t;
        }
        if (s.length == 0) {
            return s;
        }
        var out = new CellBuffer(Math.min(s.length, t.length));
        var a = new RunCursor(s);
        var b = new RunCursor(t);

        while (a.present() && b.present()) {
            if (le(b.begin(), a.begin()) && le(a.end(), b.end())) {
                a.emitTo(out);
                a.advance();
                continue;
            }
            if (le(a.begin(), b.begin()) && le(b.end(), a.end())) {
                b.emitTo(out);
                b.advance();
                continue;
            }
            // disjoint, touching counts as disjoint here
            if (le(a.end(), b.begin())) {
                a.advance();
                continue;
            }
            if (le(b.end(), a.begin())) {
                b.advance();
                continue;
            }
            // [a.begin .. [b.begin .. a.end) .. b.end): keep [a.end, b.end) of b for later runs of a
            if (le(a.begin(), b.begin()) && le(a.end(), b.end())) {
                out.addRange(b.begin(), a.end());
                b.restart(a.end());
                a.advance();
                continue;
            }
            // [b.begin .. [a.begin .. b.end) .. a.end)
            if (le(b.begin(), a.begin()) && le(b.end(), a.end())) {
                out.addRange(a.begin(), b.end());
                a.restart(b.end());
                b.advance();
                continue;
            }
            throw new IllegalStateException("impossible run order: [" + a.begin() + ", "
                    + Long.toUnsignedString(a.end()) + ") vs [" + b.begin() + ", "
                    + Long.toUnsignedString(b.end()) + ")");
        }
        return out.toArray();
    }

    /**
     * Probes the first remaining cell of the shorter operand against the longer one,
     * located by binary search, until an overlap turns up or one side runs out.
     */
    static boolean intersects(long[] s, long[] t) {
        var i = 0;
        var j = 0;
        while (i < s.length && j < t.length) {
            if (s.length - i <= t.length - j) {
                var k = DyadicInterval.lowerBound(t, j, t.length, s[i]);
                if (overlapsNear(t, j, k, s[i])) {
                    return true;
                }
                i++;
                j = k;
            } else {
                var k = DyadicInterval.lowerBound(s, i, s.length, t[j]);
                if (overlapsNear(s, i, k, t[j])) {
                    return true;
                }
                j++;
                i = k;
            }
        }
        return false;
    }

    static long[] complement(long[] s) {
        var out = new CellBuffer(s.length + 1);
        var b = 0L;
        var runs = new RunCursor(s);
        while (runs.present()) {
            out.addRange(b, runs.begin());
            b = runs.end();
            runs.advance();
        }
        out.addRange(b, DyadicInterval.UNIVERSE);
        return out.toArray();
    }

    // Only the cells either side of the insertion point can overlap the probe.
    private static boolean overlapsNear(long[] cells, int from, int insertion, long probe) {
        if (insertion > from && overlaps(cells[insertion - 1], probe)) {
            return true;
        }
        return insertion < cells.length && overlaps(cells[insertion], probe);
    }

    private static boolean overlaps(long x, long y) {
        return DyadicInterval.contains(x, y) || DyadicInterval.contains(y, x);
    }

    private static boolean le(long x, long y) {
        return Long.compareUnsigned(x, y) <= 0;
    }

    private static boolean lt(long x, long y) {
        return Long.compareUnsigned(x, y) < 0;
    }
}

package io.dense63.kernel;

/**
 * Walks a canonical cell array one maximal run at a time.
 * <p>
 * A run is a maximal block of cells with no gap between one end and the next begin.
 * The current run is {@code [begin, end)} (unsigned bounds). While {@link #verbatim()} holds,
 * it is exactly the cells {@code [from, to)} of the source array and can be copied as is;
 * once a merge walk moves {@code begin}, the run must be re-decomposed on output.
 */
final class RunCursor {
    private final long[] cells;
    private int next;

    private boolean present;
    private boolean verbatim;
    private long begin;
    private long end;
    private int from;
    private int to;

    RunCursor(long[] cells) {
        this.cells = cells;
        advance();
    }

    boolean present() {
        return present;
    }

    boolean verbatim() {
        return verbatim;
    }

    long begin() {
        return begin;
    }

    long end() {
        return end;
    }

    /** Moves to the next maximal run, or clears {@link #present()} when the array is exhausted. */
    void advance() {
        if (next >= cells.length) {
            present = false;
            verbatim = false;
            return;
        }
        from = next;
        var i = next + 1;
        while (i < cells.length && DyadicInterval.end(cells[i - 1]) == DyadicInterval.begin(cells[i])) {
            i++;
        }
        to = i;
        next = i;
        begin = DyadicInterval.begin(cells[from]);
        end = DyadicInterval.end(cells[to - 1]);
        present = true;
        verbatim = true;
    }

    /** Replaces the current run's begin. The run is no longer backed by source cells. */
    void restart(long newBegin) {
        begin = newBegin;
        verbatim = false;
    }

    /** Appends the current run to {@code out}, copying source cells when still verbatim. */
    void emitTo(CellBuffer out) {
        if (verbatim) {
            out.addAll(cells, from, to);
        } else {
            out.addRange(begin, end);
        }
    }

    /** Appends every cell after the current run unchanged. */
    void emitRemainderTo(CellBuffer out) {
        out.addAll(cells, next, cells.length);
    }
}

package io.dense63.cover;

import io.dense63.core.CoverConfiguration;
import io.dense63.kernel.CanonicalSet;
import io.dense63.kernel.CanonicalSets;
import io.dense63.kernel.DyadicInterval;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Approximates a set by a superset with few, coarse intervals.
 * <p>
 * <b>Contract:</b> for a set {@code S} the cover {@code C}
 * <ul>
 *   <li>is canonical and contains {@code S};</li>
 *   <li>has at most {@code maxSize} intervals when {@code maxSize > 0};</li>
 *   <li>has no interval smaller than {@code minGrain};</li>
 *   <li>keeps {@code count(C) - count(S)} low, greedily rather than optimally.</li>
 * </ul>
 * <p>
 * The planner first decomposes the support of {@code S} top-down into a binary tree whose
 * leaves respect the grain. It then merges sibling leaves into their parent, cheapest
 * waste-gain first: merges that add no waste are always taken, others only while the
 * cover has too many intervals. A leaf whose sibling is still an internal node waits until
 * that sibling has collapsed into a leaf.
 * <p>
 * Planners are stateless between calls and can be shared.
 */
public final class CoverPlanner {
    private static final Logger log = LoggerFactory.getLogger(CoverPlanner.class);

    // From this grain on the cover is the universe.
    private static final long UNIVERSE_GRAIN = 1L << 62;

    private final CoverConfiguration configuration;

    public CoverPlanner() {
        this(CoverConfiguration.defaults());
    }

    public CoverPlanner(CoverConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("configuration required");
        }
        this.configuration = configuration;
    }

    public CoverConfiguration configuration() {
        return configuration;
    }

    public CanonicalSet cover(CanonicalSet set) {
        if (set == null) {
            throw new IllegalArgumentException("set required");
        }
        if (set.isEmpty()) {
            return set;
        }
        var minGrain = Math.max(1L, configuration.minGrain());
        if (minGrain >= UNIVERSE_GRAIN) {
            log.debug("Cover of {} intervals: minGrain={} reaches 2^62, returning the universe", set.size(), minGrain);
            return CanonicalSets.universe();
        }
        var maxSize = configuration.maxSize();
        if (maxSize < 1 || set.size() < maxSize) {
            maxSize = set.size();
        }

        var cells = set.toPackedArray();
        var shape = new CoverShape(2 * cells.length);
        decompose(cells, 0, cells.length, DyadicInterval.universe(), minGrain, shape);

        var liveLeaves = shave(shape, maxSize);
        var result = CanonicalSet.ofPacked(shape.collectLeaves(liveLeaves));

        if (log.isDebugEnabled()) {
            log.debug("Cover of {} intervals (maxSize={}, minGrain={}): {} intervals, waste {}",
                    set.size(), configuration.maxSize(), minGrain, result.size(),
                    Long.toUnsignedString(result.count() - set.count()));
        }
        return result;
    }

    /**
     * Appends the decomposition of {@code cells[from, to)} within {@code node} and returns
     * the covered weight. The last appended node is the root of the produced subtree.
     * Sides without elements produce nothing, so a one-sided split adds no node of its own.
     */
    private static long decompose(long[] cells, int from, int to, DyadicInterval node, long minGrain,
                                  CoverShape shape) {
        if (from == to) {
            return 0L;
        }
        if (Long.compareUnsigned(node.size(), 2 * minGrain) < 0) {
            var weight = DyadicInterval.totalSize(cells, from, to);
            shape.addLeaf(node, weight);
            return weight;
        }
        if (from + 1 == to) {
            var cell = DyadicInterval.fromPacked(cells[from]);
            var weight = cell.size();
            while (Long.compareUnsigned(cell.size(), minGrain) < 0 && !cell.isUniverse()) {
                cell = cell.parent();
            }
            shape.addLeaf(cell, weight);
            return weight;
        }

        var split = DyadicInterval.lowerBound(cells, from, to, node.packed());
        var leftWeight = decompose(cells, from, split, node.left(), minGrain, shape);
        var left = shape.root();
        var rightWeight = decompose(cells, split, to, node.right(), minGrain, shape);
        var right = shape.root();

        if (leftWeight != 0 && rightWeight != 0) {
            shape.addInternal(node, leftWeight + rightWeight, left, right);
        }
        return leftWeight + rightWeight;
    }

    /**
     * Merges sibling leaves cheapest-first and returns the number of live leaves left.
     */
    private int shave(CoverShape shape, int maxSize) {
        var heap = new LeafHeap(shape, configuration.tieBreak());
        var liveLeaves = 0;
        for (var i = 0; i < shape.size(); i++) {
            if (shape.isLeaf(i)) {
                heap.push(i);
                liveLeaves++;
            }
        }

        while (liveLeaves > 1 && !heap.isEmpty()) {
            var leaf = heap.pop();
            if (!shape.isLive(leaf)) {
                continue;
            }
            var parent = shape.parent(leaf);
            if (parent < 0) {
                break;
            }
            var gain = shape.parentGain(leaf);
            if (gain != 0 && liveLeaves <= maxSize) {
                break;
            }
            if (!shape.isLeaf(shape.sibling(leaf))) {
                // picked up again once the sibling collapses and is queued
                continue;
            }
            liveLeaves -= shape.collapse(parent) - 1;
            heap.push(parent);
            if (log.isTraceEnabled()) {
                log.trace("Merged into {} (gain {}), {} leaves left",
                        shape.cell(parent), Long.toUnsignedString(gain), liveLeaves);
            }
        }
        return liveLeaves;
    }
}

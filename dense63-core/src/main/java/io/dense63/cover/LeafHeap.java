package io.dense63.cover;

import io.dense63.core.CoverConfiguration.TieBreak;

import java.util.Arrays;
import java.util.NoSuchElementException;

/**
 * Binary min-heap of node indices keyed by the waste-gain of merging the node into its parent.
 * <p>
 * Keys are read from the shape at comparison time and are stable while a node sits in the heap:
 * a gain only changes for nodes that were collapsed, and those are dead by then.
 * Equal gains fall back to the configured {@link TieBreak}, so the order is total and deterministic.
 */
final class LeafHeap {
    private final CoverShape shape;
    private final TieBreak tieBreak;

    private int[] heap;
    private long[] pushOrder;
    private long pushes;
    private int size;

    LeafHeap(CoverShape shape, TieBreak tieBreak) {
        this.shape = shape;
        this.tieBreak = tieBreak;
        this.heap = new int[Math.max(16, shape.size())];
        this.pushOrder = new long[shape.size()];
    }

    boolean isEmpty() {
        return size == 0;
    }

    void push(int node) {
        if (node >= pushOrder.length) {
            pushOrder = Arrays.copyOf(pushOrder, Math.max(pushOrder.length * 2, node + 1));
        }
        pushOrder[node] = pushes++;
        if (size == heap.length) {
            heap = Arrays.copyOf(heap, heap.length * 2);
        }
        heap[size] = node;
        siftUp(size++);
    }

    int pop() {
        if (size == 0) {
            throw new NoSuchElementException();
        }
        var top = heap[0];
        heap[0] = heap[--size];
        if (size > 0) {
            siftDown(0);
        }
        return top;
    }

    private void siftUp(int pos) {
        var node = heap[pos];
        while (pos > 0) {
            var parentPos = (pos - 1) >>> 1;
            var parent = heap[parentPos];
            if (compare(node, parent) >= 0) {
                break;
            }
            heap[pos] = parent;
            pos = parentPos;
        }
        heap[pos] = node;
    }

    private void siftDown(int pos) {
        var node = heap[pos];
        var half = size >>> 1;
        while (pos < half) {
            var child = 2 * pos + 1;
            var right = child + 1;
            if (right < size && compare(heap[right], heap[child]) < 0) {
                child = right;
            }
            if (compare(node, heap[child]) <= 0) {
                break;
            }
            heap[pos] = heap[child];
            pos = child;
        }
        heap[pos] = node;
    }

    private int compare(int a, int b) {
        var byGain = Long.compareUnsigned(shape.parentGain(a), shape.parentGain(b));
        if (byGain != 0) {
            return byGain;
        }
        if (tieBreak == TieBreak.INSERTION_ORDER) {
            return Long.compare(pushOrder[a], pushOrder[b]);
        }
        var byBegin = Long.compare(shape.cell(a).begin(), shape.cell(b).begin());
        return byBegin != 0 ? byBegin : Long.compare(pushOrder[a], pushOrder[b]);
    }
}

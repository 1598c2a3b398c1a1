package io.dense63.kernel;

/**
 * Closed interval {@code [first, last]} of non-negative longs.
 * <p>
 * {@code first > last} denotes nothing; {@link #EMPTY} is the sentinel returned for empty sets.
 */
public record Span(long first, long last) {
    public static final Span EMPTY = new Span(0L, -1L);

    public boolean isEmpty() {
        return first > last;
    }

    /** Number of elements, unsigned: the whole domain reads as {@link Long#MIN_VALUE}. */
    public long count() {
        return isEmpty() ? 0L : last - first + 1;
    }

    @Override
    public String toString() {
        return isEmpty() ? "∅" : "[" + first + ", " + last + "]";
    }
}

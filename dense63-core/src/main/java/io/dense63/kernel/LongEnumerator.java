package io.dense63.kernel;

/**
 * Primitive forward-only cursor over {@code long} values.
 */
public interface LongEnumerator {
    boolean hasNext();

    /**
     * @throws java.util.NoSuchElementException when exhausted
     */
    long nextLong();
}

package io.dense63.kernel;

/**
 * Callback for {@link CanonicalSet#forEachInterval(IntervalVisitor)}.
 */
@FunctionalInterface
public interface IntervalVisitor {
    /**
     * Visits the closed interval {@code [first, last]}.
     *
     * @return false to stop the traversal
     */
    boolean visit(long first, long last);
}

package io.dense63.core;

/**
 * Raised when a negative integer is offered to a set. The domain is {@code [0, 2^63)}
 * and out-of-domain input is rejected, never clamped or wrapped.
 */
public class NegativeElementException extends IllegalArgumentException {

    private final long element;

    public NegativeElementException(long element) {
        super("sets hold non-negative integers only, got " + element);
        this.element = element;
    }

    public long element() {
        return element;
    }
}

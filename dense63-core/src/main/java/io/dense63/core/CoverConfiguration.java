package io.dense63.core;

/**
 * Immutable limits for building a cover of a set.
 * <p>
 * Use the builder to create custom configurations:
 * <pre>
 * CoverConfiguration config = CoverConfiguration.builder()
 *     .maxSize(16)
 *     .minGrain(1024)
 *     .build();
 * </pre>
 *
 * @see io.dense63.cover.CoverPlanner
 */
public final class CoverConfiguration {
    private static final CoverConfiguration DEFAULTS = builder().build();

    // Output size
    private final int maxSize;

    // Granularity
    private final long minGrain;

    // Merge order among equal waste-gains
    private final TieBreak tieBreak;

    private CoverConfiguration(Builder builder) {
        this.maxSize = builder.maxSize;
        this.minGrain = builder.minGrain;
        this.tieBreak = builder.tieBreak != null ? builder.tieBreak : TieBreak.ASCENDING_BEGIN;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Unbounded size, grain 1: only merges that add no extra elements.
     */
    public static CoverConfiguration defaults() {
        return DEFAULTS;
    }

    /**
     * Maximum number of intervals in a cover. Zero or negative means unbounded.
     *
     * @return max intervals
     */
    public int maxSize() {
        return maxSize;
    }

    /**
     * Minimum interval size in a cover. Values below 1 behave as 1.
     *
     * @return min grain
     */
    public long minGrain() {
        return minGrain;
    }

    public TieBreak tieBreak() {
        return tieBreak;
    }

    @Override
    public String toString() {
        return "CoverConfiguration{maxSize=" + maxSize + ", minGrain=" + minGrain + ", tieBreak=" + tieBreak + "}";
    }

    /**
     * Order in which candidates with equal waste-gain are merged.
     */
    public enum TieBreak {
        /**
         * Leftmost candidate first.
         */
        ASCENDING_BEGIN,

        /**
         * Candidate queued first, first. Leaves are queued left to right, merged parents
         * after them in merge order.
         */
        INSERTION_ORDER
    }

    /**
     * Builder for CoverConfiguration.
     */
    public static class Builder {
        private int maxSize = 0;
        private long minGrain = 1L;
        private TieBreak tieBreak = TieBreak.ASCENDING_BEGIN;

        private Builder() {
        }

        /**
         * Set the maximum number of intervals.
         *
         * @param maxSize the bound, zero or negative for none
         * @return this builder for method chaining
         */
        public Builder maxSize(int maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        /**
         * Set the minimum interval size.
         *
         * @param minGrain the smallest size an output interval may have
         * @return this builder for method chaining
         */
        public Builder minGrain(long minGrain) {
            this.minGrain = minGrain;
            return this;
        }

        public Builder tieBreak(TieBreak tieBreak) {
            this.tieBreak = tieBreak;
            return this;
        }

        public CoverConfiguration build() {
            return new CoverConfiguration(this);
        }
    }
}

// file: core/src/main/java/io/mergekit/core/MergeOptions.java
package io.mergekit.core;

/**
 * Policy knobs for one merge invocation.
 * <p>
 * Built once per call and threaded through the recursion; only {@code depth}
 * changes from level to level (see {@link #nested()}).
 * <p>
 * Fields:
 *  - preserveUnmergeables: keep the destination when source and destination
 *                          cannot be merged (default: the source overwrites).
 *  - knockoutPrefix:       sentinel marking deletion directives in the source,
 *                          e.g. "!merge" and "!merge:value". Null disables knockout.
 *  - horizontalPrecedence: in array-concat mode, concatenate sequences of the same
 *                          precedence tier instead of letting the source replace them.
 *  - sortMergedArrays:     sort every sequence produced by an array merge.
 *  - unpackArrays:         delimiter; sequences are joined with it and re-split
 *                          before merging. Null (or empty) disables unpacking.
 *  - legacyArrayConcat:    false (default): sequences combine as an ordered set union.
 *                          true: precedence decides concatenation vs. replacement.
 *  - maxDepth:             deepest recursion level accepted before failing.
 *  - trace:                diagnostic sink, never affects the result.
 *  - depth:                current recursion level, 0 at the top.
 * <p>
 * Invariant (checked by {@link #validate()} at merge entry, not here):
 *  - knockoutPrefix is never "", and a knockout prefix requires overwriting
 *    unmergeables.
 */
public record MergeOptions(
        boolean preserveUnmergeables,
        String knockoutPrefix,
        boolean horizontalPrecedence,
        boolean sortMergedArrays,
        String unpackArrays,
        boolean legacyArrayConcat,
        int maxDepth,
        MergeTrace trace,
        int depth
) {
    public static final int DEFAULT_MAX_DEPTH = 512;

    public MergeOptions {
        if (maxDepth <= 0) throw new IllegalArgumentException("maxDepth must be > 0");
        if (depth < 0) throw new IllegalArgumentException("depth must be >= 0");
        if (unpackArrays != null && unpackArrays.isEmpty()) unpackArrays = null;
        if (trace == null) trace = MergeTrace.NONE;
    }

    /** Overwrite unmergeables, no knockout, set-union arrays, no sorting or unpacking. */
    public static MergeOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .preserveUnmergeables(preserveUnmergeables)
                .knockoutPrefix(knockoutPrefix)
                .horizontalPrecedence(horizontalPrecedence)
                .sortMergedArrays(sortMergedArrays)
                .unpackArrays(unpackArrays)
                .legacyArrayConcat(legacyArrayConcat)
                .maxDepth(maxDepth)
                .trace(trace);
    }

    public boolean overwriteUnmergeables() { return !preserveUnmergeables; }

    public boolean hasKnockout() { return knockoutPrefix != null; }

    /** Copy for the next recursion level. */
    public MergeOptions nested() {
        return new MergeOptions(
                preserveUnmergeables,
                knockoutPrefix,
                horizontalPrecedence,
                sortMergedArrays,
                unpackArrays,
                legacyArrayConcat,
                maxDepth,
                trace,
                depth + 1
        );
    }

    /**
     * Reject option combinations the engine cannot honour.
     *
     * @throws InvalidConfigurationException if the knockout prefix is empty, or
     *         is combined with preserveUnmergeables
     */
    public void validate() {
        if (knockoutPrefix != null && knockoutPrefix.isEmpty()) {
            throw new InvalidConfigurationException("knockoutPrefix cannot be an empty string");
        }
        if (knockoutPrefix != null && preserveUnmergeables) {
            throw new InvalidConfigurationException(
                    "preserveUnmergeables must be false when knockoutPrefix is set");
        }
    }

    public static final class Builder {
        private boolean preserveUnmergeables;
        private String knockoutPrefix;
        private boolean horizontalPrecedence;
        private boolean sortMergedArrays;
        private String unpackArrays;
        private boolean legacyArrayConcat;
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private MergeTrace trace = MergeTrace.NONE;

        private Builder() {
        }

        public Builder preserveUnmergeables(boolean v) { this.preserveUnmergeables = v; return this; }

        public Builder knockoutPrefix(String v) { this.knockoutPrefix = v; return this; }

        public Builder horizontalPrecedence(boolean v) { this.horizontalPrecedence = v; return this; }

        public Builder sortMergedArrays(boolean v) { this.sortMergedArrays = v; return this; }

        public Builder unpackArrays(String v) { this.unpackArrays = v; return this; }

        public Builder legacyArrayConcat(boolean v) { this.legacyArrayConcat = v; return this; }

        public Builder maxDepth(int v) { this.maxDepth = v; return this; }

        public Builder trace(MergeTrace v) { this.trace = v; return this; }

        public MergeOptions build() {
            return new MergeOptions(
                    preserveUnmergeables,
                    knockoutPrefix,
                    horizontalPrecedence,
                    sortMergedArrays,
                    unpackArrays,
                    legacyArrayConcat,
                    maxDepth,
                    trace,
                    0
            );
        }
    }
}

package io.mergekit.core;

import java.util.function.Supplier;

/**
 * Optional diagnostic side channel for a merge.
 * <p>
 * The engine reports each step it takes together with the recursion depth.
 * Messages are supplied lazily, so a disabled trace costs one call per step.
 * A trace never influences the merge result.
 */
@FunctionalInterface
public interface MergeTrace {

    /** Trace that drops every message. */
    MergeTrace NONE = (depth, message) -> { };

    /**
     * @param depth   recursion level of the step, 0 at the top of the tree
     * @param message lazily built description of the step
     */
    void record(int depth, Supplier<String> message);
}

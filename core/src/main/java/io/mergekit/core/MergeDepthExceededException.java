package io.mergekit.core;

/**
 * The merged trees nest deeper than {@link MergeOptions#maxDepth()}.
 */
public final class MergeDepthExceededException extends MergeException {
    private final int maxDepth;

    public MergeDepthExceededException(int maxDepth) {
        super("merge exceeded max depth " + maxDepth);
        this.maxDepth = maxDepth;
    }

    public int maxDepth() { return maxDepth; }
}

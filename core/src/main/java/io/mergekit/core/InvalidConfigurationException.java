package io.mergekit.core;

/**
 * Rejected {@link MergeOptions}, raised before any traversal starts.
 * <p>
 * Causes:
 *  - the knockout prefix is the empty string, or
 *  - a knockout prefix is combined with preserving unmergeables.
 */
public final class InvalidConfigurationException extends MergeException {
    public InvalidConfigurationException(String message) {
        super(message);
    }
}

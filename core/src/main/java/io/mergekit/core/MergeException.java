package io.mergekit.core;

/**
 * Base type for every failure raised by a merge.
 */
public class MergeException extends RuntimeException {
    public MergeException(String message) {
        super(message);
    }
}

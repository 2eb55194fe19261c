// file: core/src/main/java/io/mergekit/core/DeepMerge.java
package io.mergekit.core;

import java.util.Objects;

/**
 * Entry points over {@link DeepMerger}.
 * <p>
 * The three presets merge an overlay onto a base without touching either input:
 *  - merge:           overwrite unmergeables, no knockout.
 *  - horizontalMerge: as merge, for two layers of the same precedence tier
 *                     (sequences concatenate in array-concat mode).
 *  - roleMerge:       as horizontalMerge, plus the "!merge" knockout prefix used
 *                     by role inheritance chains.
 * <p>
 * The array-concat mode is injected once per instance rather than looked up
 * from process-wide configuration.
 */
public final class DeepMerge {

    /** Knockout prefix used by {@link #roleMerge}. */
    public static final String ROLE_KNOCKOUT_PREFIX = "!merge";

    private final boolean legacyArrayConcat;
    private final MergeTrace trace;

    /** Presets merging arrays as a set union, without tracing. */
    public DeepMerge() {
        this(false, MergeTrace.NONE);
    }

    public DeepMerge(boolean legacyArrayConcat) {
        this(legacyArrayConcat, MergeTrace.NONE);
    }

    public DeepMerge(boolean legacyArrayConcat, MergeTrace trace) {
        this.legacyArrayConcat = legacyArrayConcat;
        this.trace = Objects.requireNonNull(trace, "trace");
    }

    public Value merge(Value overlay, Value base) {
        return deepMerge(overlay, base, presetOptions().build());
    }

    public Value horizontalMerge(Value overlay, Value base) {
        return deepMerge(overlay, base, presetOptions()
                .horizontalPrecedence(true)
                .build());
    }

    public Value roleMerge(Value overlay, Value base) {
        return deepMerge(overlay, base, presetOptions()
                .horizontalPrecedence(true)
                .knockoutPrefix(ROLE_KNOCKOUT_PREFIX)
                .build());
    }

    public boolean legacyArrayConcat() { return legacyArrayConcat; }

    private MergeOptions.Builder presetOptions() {
        return MergeOptions.builder()
                .preserveUnmergeables(false)
                .legacyArrayConcat(legacyArrayConcat)
                .trace(trace);
    }

    /**
     * Non-destructive merge: both inputs are deep-copied before merging.
     *
     * @throws InvalidConfigurationException if the options are rejected
     * @throws MergeDepthExceededException if either tree nests deeper than options.maxDepth()
     */
    public static Value deepMerge(Value source, Value destination, MergeOptions options) {
        return DeepMerger.mergeCopies(source, destination, options);
    }

    /**
     * Destructive merge: destination mappings and sequences are updated in place.
     * Always use the returned value, since a scalar destination cannot be updated.
     *
     * @throws InvalidConfigurationException if the options are rejected
     * @throws MergeDepthExceededException if either tree nests deeper than options.maxDepth()
     */
    public static Value deepMergeInPlace(Value source, Value destination, MergeOptions options) {
        return DeepMerger.mergeInPlace(source, destination, options);
    }
}

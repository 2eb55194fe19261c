// file: core/src/main/java/io/mergekit/core/DeepMerger.java
package io.mergekit.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Recursive deep merge of a source tree into a destination tree.
 * <p>
 * The source wins on conflicts. Dispatch is on the shape of the source:
 *  - Mapping:  keys are merged one by one into a destination mapping.
 *  - Sequence: knockout directives are applied, then the sequences are combined
 *              by set union, concatenation or replacement.
 *  - Scalar:   resolved by the unmergeable-overwrite policy.
 * Whenever the shapes disagree the whole source value goes through the
 * overwrite policy ({@link #overwriteUnmergeable}).
 * <p>
 * This class works in place: destination mappings and sequences are updated
 * and returned, and source nodes may end up shared with the result. Use
 * {@link DeepMerge#deepMerge} for a merge that leaves both inputs untouched.
 * <p>
 * Failures are limited to option validation at entry and the depth guard;
 * every shape combination has a defined result.
 */
public final class DeepMerger {

    private DeepMerger() {
        // utility
    }

    /**
     * Merge {@code source} into {@code destination}.
     *
     * @param source      higher-precedence tree; null or {@link Value.Null} leaves destination as is
     * @param destination tree to merge into, mutated where its containers allow
     * @param options     merge policy, validated before traversal
     * @return the merged tree (the destination container when it could be updated in place)
     * @throws InvalidConfigurationException if the options are rejected
     * @throws MergeDepthExceededException if the trees nest deeper than options.maxDepth()
     */
    public static Value mergeInPlace(Value source, Value destination, MergeOptions options) {
        Objects.requireNonNull(options, "options");
        options.validate();
        checkDepth(source, options.maxDepth());
        checkDepth(destination, options.maxDepth());
        return merge(source, destination, options);
    }

    /**
     * Validate, depth-check and deep-copy both inputs, then merge the copies.
     * The depth check runs before copying, since copying recurses too.
     */
    static Value mergeCopies(Value source, Value destination, MergeOptions options) {
        Objects.requireNonNull(options, "options");
        options.validate();
        checkDepth(source, options.maxDepth());
        checkDepth(destination, options.maxDepth());
        Value src = source == null ? null : source.deepCopy();
        Value dest = destination == null ? null : destination.deepCopy();
        return merge(src, dest, options);
    }

    /**
     * Fail when any node of {@code root} sits below level {@code maxDepth}
     * (the root is level 0). Walks the tree with an explicit stack.
     *
     * @throws MergeDepthExceededException if the tree is too deep
     */
    static void checkDepth(Value root, int maxDepth) {
        if (root == null) return;
        Deque<Value> nodes = new ArrayDeque<>();
        Deque<Integer> levels = new ArrayDeque<>();
        nodes.push(root);
        levels.push(0);
        while (!nodes.isEmpty()) {
            Value node = nodes.pop();
            int level = levels.pop();
            if (level > maxDepth) {
                throw new MergeDepthExceededException(maxDepth);
            }
            Collection<Value> children;
            if (node instanceof Value.Mapping m) {
                children = m.entries().values();
            } else if (node instanceof Value.Sequence seq) {
                children = seq.items();
            } else {
                continue;
            }
            for (Value child : children) {
                nodes.push(child);
                levels.push(level + 1);
            }
        }
    }

    private static Value merge(Value source, Value destination, MergeOptions opts) {
        if (opts.depth() > opts.maxDepth()) {
            throw new MergeDepthExceededException(opts.maxDepth());
        }
        Value dest = destination == null ? Value.Null.INSTANCE : destination;

        // Nothing to merge in.
        if (isAbsent(source)) return dest;

        // Nothing to merge into: adopt the source as is.
        if (isAbsent(dest) && opts.overwriteUnmergeables()) return source;

        MergeTrace trace = opts.trace();
        trace.record(opts.depth(), () -> "source " + kind(source) + " :: dest " + kind(dest));

        Value result;
        if (source instanceof Value.Mapping map) {
            result = mergeMapping(map, dest, opts);
        } else if (source instanceof Value.Sequence seq) {
            result = mergeSequence(seq, dest, opts);
        } else {
            result = overwriteUnmergeable(source, dest, opts);
        }

        trace.record(opts.depth(), () -> "returning " + result);
        return result;
    }

    private static Value mergeMapping(Value.Mapping source, Value dest, MergeOptions opts) {
        if (!(dest instanceof Value.Mapping target)) {
            return overwriteUnmergeable(source, dest, opts);
        }
        MergeTrace trace = opts.trace();
        MergeOptions child = opts.nested();

        // Snapshot the keys: source and destination may be the same container.
        for (String key : List.copyOf(source.keys())) {
            Value srcValue = source.get(key);
            Value existing = target.get(key);

            if (srcValue instanceof Value.Null) {
                trace.record(opts.depth(), () -> " storing null: " + key);
                target.put(key, srcValue);
            } else if (!isAbsent(existing)) {
                trace.record(opts.depth(), () -> " merging: " + key + " => " + srcValue + " :: " + existing);
                target.put(key, merge(srcValue, existing, child));
            } else if (opts.overwriteUnmergeables()) {
                // New key: still merged so that knockout directives inside the branch apply.
                trace.record(opts.depth(), () -> " merging over: " + key + " => " + srcValue);
                target.put(key, merge(srcValue, target.emptyLike(), child));
            } else {
                trace.record(opts.depth(), () -> " adding: " + key + " => " + srcValue);
                target.put(key, srcValue);
            }
        }
        return target;
    }

    private static Value mergeSequence(Value.Sequence source, Value destination, MergeOptions opts) {
        MergeTrace trace = opts.trace();
        List<Value> src = new ArrayList<>(source.items());
        Value dest = destination;

        String delimiter = opts.unpackArrays();
        if (delimiter != null) {
            trace.record(opts.depth(), () -> " split/join on " + source);
            src = unpack(src, delimiter);
            if (dest instanceof Value.Sequence destSeq) {
                destSeq.replaceWith(unpack(destSeq.items(), delimiter));
            }
        }

        // A bare knockout marker truncates the destination.
        if (opts.hasKnockout()) {
            for (String marker : List.of(opts.knockoutPrefix(), opts.knockoutPrefix() + ":")) {
                Value.Text bare = new Value.Text(marker);
                if (src.contains(bare)) {
                    trace.record(opts.depth(), () -> " clearing dest on " + bare);
                    dest = clearOrNull(dest);
                    src.removeIf(bare::equals);
                }
            }
        }

        if (!(dest instanceof Value.Sequence target)) {
            return overwriteUnmergeable(Value.Sequence.ofAll(src), dest, opts);
        }

        if (opts.hasKnockout()) {
            knockOut(src, target, opts);
        }

        trace.record(opts.depth(), () -> " merging arrays: " + target);
        List<Value> combined = combine(target.items(), src, opts);
        if (opts.sortMergedArrays()) {
            combined.sort(ValueOrdering.NATURAL);
        }
        target.replaceWith(combined);
        return target;
    }

    /**
     * Remove "prefix:value" directives from {@code src}, deleting both the value
     * and the literal directive from {@code dest}.
     */
    private static void knockOut(List<Value> src, Value.Sequence dest, MergeOptions opts) {
        String directive = opts.knockoutPrefix() + ":";
        Iterator<Value> it = src.iterator();
        while (it.hasNext()) {
            Value item = it.next();
            if (item instanceof Value.Text t && t.value().startsWith(directive)) {
                var target = new Value.Text(t.value().substring(directive.length()));
                opts.trace().record(opts.depth(), () -> " knocking out: " + target);
                dest.removeAll(target);
                dest.removeAll(t);
                it.remove();
            }
        }
    }

    private static List<Value> combine(List<Value> dest, List<Value> src, MergeOptions opts) {
        if (!opts.legacyArrayConcat()) {
            var union = new LinkedHashSet<Value>(dest);
            union.addAll(src);
            return new ArrayList<>(union);
        }
        if (opts.horizontalPrecedence()) {
            // Same precedence tier: keep both.
            var all = new ArrayList<Value>(dest.size() + src.size());
            all.addAll(dest);
            all.addAll(src);
            return all;
        }
        // Higher tier replaces the lower one.
        return new ArrayList<>(src);
    }

    /**
     * Resolve a source and destination that cannot be merged structurally.
     * <p>
     * Rules:
     *  - preserving unmergeables: keep the destination.
     *  - no knockout prefix:      take the source.
     *  - knockout prefix set:
     *      - text equal to the prefix erases the destination ("").
     *      - "prefix:rest" replaces the destination with "rest".
     *      - a sequence holding any "prefix:*" text erases the destination ("");
     *        a sequence without directives replaces it.
     *      - anything else replaces the destination.
     */
    static Value overwriteUnmergeable(Value source, Value dest, MergeOptions opts) {
        MergeTrace trace = opts.trace();
        if (opts.preserveUnmergeables()) {
            trace.record(opts.depth(), () -> " preserving dest: " + dest);
            return dest;
        }
        if (!opts.hasKnockout()) {
            trace.record(opts.depth(), () -> " " + source + " -over-> " + dest);
            return source;
        }

        String prefix = opts.knockoutPrefix();
        String directive = prefix + ":";
        Value result = source;
        if (source instanceof Value.Text t) {
            if (t.value().equals(prefix)) {
                result = new Value.Text("");
            } else if (t.value().startsWith(directive)) {
                result = new Value.Text(t.value().substring(directive.length()));
            }
        } else if (source instanceof Value.Sequence seq) {
            boolean hasDirective = seq.items().stream().anyMatch(v -> isDirective(v, directive));
            if (hasDirective) {
                result = new Value.Text("");
            }
        }
        Value chosen = result;
        trace.record(opts.depth(), () -> " " + chosen + " -over-> " + dest);
        return chosen;
    }

    private static boolean isDirective(Value v, String directive) {
        return v instanceof Value.Text t && t.value().startsWith(directive);
    }

    private static boolean isAbsent(Value v) {
        return v == null || v instanceof Value.Null;
    }

    /** Empty a container in place; text becomes "", other scalars become Null. */
    private static Value clearOrNull(Value v) {
        if (v instanceof Value.Mapping m) {
            m.clear();
            return m;
        }
        if (v instanceof Value.Sequence s) {
            s.clear();
            return s;
        }
        if (v instanceof Value.Text) {
            return new Value.Text("");
        }
        return Value.Null.INSTANCE;
    }

    /** Join all elements with the delimiter and split the result on it again. */
    static List<Value> unpack(List<Value> items, String delimiter) {
        String joined = items.stream()
                .map(v -> joinText(v, delimiter))
                .collect(Collectors.joining(delimiter));
        var out = new ArrayList<Value>();
        if (joined.isEmpty()) {
            return out;
        }
        // String.split drops trailing empty pieces.
        for (String piece : joined.split(Pattern.quote(delimiter))) {
            out.add(new Value.Text(piece));
        }
        return out;
    }

    private static String joinText(Value v, String delimiter) {
        if (v instanceof Value.Null) return "";
        if (v instanceof Value.Sequence s) {
            return s.items().stream()
                    .map(item -> joinText(item, delimiter))
                    .collect(Collectors.joining(delimiter));
        }
        return v.toString();
    }

    private static String kind(Value v) {
        return v.getClass().getSimpleName();
    }
}

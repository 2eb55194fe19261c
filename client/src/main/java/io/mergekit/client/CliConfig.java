// file: client/src/main/java/io/mergekit/client/CliConfig.java
package io.mergekit.client;

import io.mergekit.core.MergeOptions;
import io.mergekit.core.MergeTrace;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Command line configuration for the merge tool.
 *
 * Supports:
 *  - mode:                 merge | horizontal | role | deep (default: merge)
 *  - knockoutPrefix:       deep mode only
 *  - preserveUnmergeables: deep mode only
 *  - sortMergedArrays:     deep mode only
 *  - unpackArrays:         deep mode only
 *  - arrayConcat:          concatenate or replace arrays by precedence instead of a set union
 *  - trace:                log every merge step to stderr
 *  - compact:              single-line JSON output
 *  - files:                base layer first, then overlays in increasing precedence
 */
public record CliConfig(
        Mode mode,
        String knockoutPrefix,
        boolean preserveUnmergeables,
        boolean sortMergedArrays,
        String unpackArrays,
        boolean arrayConcat,
        boolean trace,
        boolean compact,
        boolean help,
        List<Path> files
) {

    public enum Mode {
        MERGE, HORIZONTAL, ROLE, DEEP;

        static Mode parse(String s) {
            try {
                return Mode.valueOf(s.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new UsageException("unknown mode: " + s);
            }
        }
    }

    public CliConfig {
        files = List.copyOf(files);
    }

    /**
     * Small CLI parser.
     *
     * Supported flags:
     *   --mode, -m <merge|horizontal|role|deep>
     *   --knockout-prefix, -k <prefix>
     *   --preserve-unmergeables
     *   --sort-merged-arrays
     *   --unpack-arrays <delimiter>
     *   --array-concat
     *   --trace
     *   --compact
     *   --help, -h
     * Every other argument is a JSON file.
     *
     * @throws UsageException on unknown flags, missing values or missing files
     */
    public static CliConfig fromArgs(String[] args) {
        Mode mode = Mode.MERGE;
        String knockoutPrefix = null;
        boolean preserve = false;
        boolean sort = false;
        String unpack = null;
        boolean arrayConcat = false;
        boolean trace = false;
        boolean compact = false;
        List<Path> files = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> {
                    return new CliConfig(mode, null, false, false, null, false, false, false, true, List.of());
                }
                case "--mode", "-m" -> mode = Mode.parse(valueAfter(args, i++));
                case "--knockout-prefix", "-k" -> knockoutPrefix = valueAfter(args, i++);
                case "--preserve-unmergeables" -> preserve = true;
                case "--sort-merged-arrays" -> sort = true;
                case "--unpack-arrays" -> unpack = valueAfter(args, i++);
                case "--array-concat" -> arrayConcat = true;
                case "--trace" -> trace = true;
                case "--compact" -> compact = true;
                default -> {
                    if (args[i].startsWith("--")) {
                        throw new UsageException("unknown option: " + args[i]);
                    }
                    files.add(Path.of(args[i]));
                }
            }
        }

        if (files.isEmpty()) {
            throw new UsageException("at least one JSON file is required");
        }
        boolean deepOnly = knockoutPrefix != null || preserve || sort || unpack != null;
        if (deepOnly && mode != Mode.DEEP) {
            throw new UsageException("--knockout-prefix, --preserve-unmergeables, --sort-merged-arrays"
                    + " and --unpack-arrays require --mode deep");
        }
        return new CliConfig(mode, knockoutPrefix, preserve, sort, unpack, arrayConcat, trace, compact, false, files);
    }

    /** Options for deep mode. Validation happens when the merge starts. */
    public MergeOptions mergeOptions(MergeTrace mergeTrace) {
        return MergeOptions.builder()
                .knockoutPrefix(knockoutPrefix)
                .preserveUnmergeables(preserveUnmergeables)
                .sortMergedArrays(sortMergedArrays)
                .unpackArrays(unpackArrays)
                .legacyArrayConcat(arrayConcat)
                .trace(mergeTrace)
                .build();
    }

    static String usage() {
        return """
                Usage: mergekit [options] <base.json> [<overlay.json>...]

                Each file is merged over the result of the files before it.

                Options:
                  --mode, -m               merge | horizontal | role | deep (default: merge)
                  --knockout-prefix, -k    Knockout prefix (deep mode)
                  --preserve-unmergeables  Keep destination values that cannot be merged (deep mode)
                  --sort-merged-arrays     Sort merged arrays (deep mode)
                  --unpack-arrays          Split array strings on this delimiter (deep mode)
                  --array-concat           Concatenate or replace arrays by precedence (default: set union)
                  --trace                  Log merge steps to stderr
                  --compact                Print single-line JSON
                  --help, -h               Show this help message
                """;
    }

    private static String valueAfter(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new UsageException("missing value for option: " + args[i]);
        }
        return args[i + 1];
    }

    /** Bad command line. */
    public static final class UsageException extends RuntimeException {
        UsageException(String msg) {
            super(msg);
        }
    }
}

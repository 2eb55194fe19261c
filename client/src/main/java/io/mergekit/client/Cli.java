// file: client/src/main/java/io/mergekit/client/Cli.java
package io.mergekit.client;

import io.mergekit.codec.ValueCodec;
import io.mergekit.core.DeepMerge;
import io.mergekit.core.LoggingMergeTrace;
import io.mergekit.core.MergeException;
import io.mergekit.core.MergeOptions;
import io.mergekit.core.MergeTrace;
import io.mergekit.core.Value;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Merges layered JSON configuration files and prints the result.
 *
 * Usage:
 *   mergekit [options] <base.json> [<overlay.json>...]
 *
 * Examples:
 *   mergekit defaults.json site.json
 *   mergekit --mode role base-role.json web-role.json
 *   mergekit --mode deep -k '!merge' --sort-merged-arrays base.json override.json
 *
 * Exit codes: 0 on success, 1 on usage or merge errors, 2 on anything unexpected.
 */
public final class Cli {
    private static final Logger log = Logger.getLogger(Cli.class.getName());

    private final CliConfig config;
    private final ValueCodec codec;
    private final MergeTrace trace;
    private final DeepMerge presets;

    Cli(CliConfig config, ValueCodec codec) {
        this.config = config;
        this.codec = codec;
        this.trace = config.trace() ? new LoggingMergeTrace() : MergeTrace.NONE;
        this.presets = new DeepMerge(config.arrayConcat(), trace);
    }

    public static void main(String[] args) {
        try {
            CliConfig cfg = CliConfig.fromArgs(args);
            if (cfg.help()) {
                System.out.println(CliConfig.usage());
                return;
            }
            if (cfg.trace()) {
                enableTraceLogging();
            }
            new Cli(cfg, new ValueCodec()).run(System.out);
        } catch (CliConfig.UsageException e) {
            System.err.println("error: " + e.getMessage());
            System.err.println(CliConfig.usage());
            System.exit(1);
        } catch (MergeException | UncheckedIOException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    /** Merge every configured file and print the JSON result. */
    void run(PrintStream out) {
        out.println(codec.write(mergeLayers(), config.compact()));
    }

    /**
     * Fold the layers left to right: the first file is the base, each next file
     * is merged over the accumulated result.
     */
    Value mergeLayers() {
        if (config.mode() == CliConfig.Mode.DEEP) {
            // fail on bad options even when there is a single layer
            config.mergeOptions(trace).validate();
        }
        List<Value> layers = codec.readAll(config.files());
        Value result = layers.get(0);
        for (int i = 1; i < layers.size(); i++) {
            int index = i;
            log.log(Level.FINE, () -> "applying layer " + config.files().get(index));
            result = apply(layers.get(i), result);
        }
        return result;
    }

    private Value apply(Value overlay, Value base) {
        return switch (config.mode()) {
            case MERGE -> presets.merge(overlay, base);
            case HORIZONTAL -> presets.horizontalMerge(overlay, base);
            case ROLE -> presets.roleMerge(overlay, base);
            case DEEP -> {
                MergeOptions options = config.mergeOptions(trace);
                yield DeepMerge.deepMerge(overlay, base, options);
            }
        };
    }

    private static void enableTraceLogging() {
        Logger root = Logger.getLogger("io.mergekit");
        root.setLevel(Level.FINE);
        var handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        root.addHandler(handler);
    }
}

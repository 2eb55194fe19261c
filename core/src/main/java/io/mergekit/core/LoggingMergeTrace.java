// file: core/src/main/java/io/mergekit/core/LoggingMergeTrace.java
package io.mergekit.core;

import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link MergeTrace} that writes indented merge steps to java.util.logging.
 * <p>
 * Each recursion level indents by two spaces, so nested maps read like the
 * tree being merged. Messages are only built when the logger accepts the level.
 */
public final class LoggingMergeTrace implements MergeTrace {
    private static final Logger log = Logger.getLogger(LoggingMergeTrace.class.getName());

    private final Logger logger;
    private final Level level;

    public LoggingMergeTrace() {
        this(log, Level.FINE);
    }

    public LoggingMergeTrace(Logger logger, Level level) {
        this.logger = Objects.requireNonNull(logger, "logger");
        this.level = Objects.requireNonNull(level, "level");
    }

    @Override
    public void record(int depth, Supplier<String> message) {
        if (!logger.isLoggable(level)) {
            return;
        }
        logger.log(level, "  ".repeat(Math.max(0, depth)) + message.get());
    }

    public Logger logger() { return logger; }

    public Level level() { return level; }
}

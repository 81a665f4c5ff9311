package org.ctyped.compiler.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Front-end logger with integer verbosity levels on top of SLF4J.
 * Levels: 0=ERROR, 1=WARN, 2=INFO, 3=DEBUG, 4=TRACE
 */
public final class CompilerLogger {

    /** Log level for errors. */
    public static final int ERROR = 0;
    /** Log level for warnings. */
    public static final int WARN  = 1;
    /** Log level for informational messages. */
    public static final int INFO  = 2;
    /** Log level for debug messages. */
    public static final int DEBUG = 3;
    /** Log level for trace messages. */
    public static final int TRACE = 4;
    private static volatile int level = INFO;

    private static final Logger logger = LoggerFactory.getLogger(CompilerLogger.class);

    private CompilerLogger() {}

    /**
     * Sets the logging verbosity level. Values outside 0..4 are clamped.
     * @param newLevel The new level to set.
     */
    public static void setLevel(int newLevel) { level = Math.max(ERROR, Math.min(TRACE, newLevel)); }

    /**
     * @return The current verbosity level.
     */
    public static int getLevel() { return level; }

    public static void error(String msg) {
        if (level >= ERROR) logger.error(msg);
    }

    public static void warn(String msg) {
        if (level >= WARN) logger.warn(msg);
    }

    public static void info(String msg) {
        if (level >= INFO) logger.info(msg);
    }

    public static void debug(String msg) {
        if (level >= DEBUG) logger.debug(msg);
    }

    /**
     * Logs a trace message. Trace output is produced per grammar rule, so keep it cheap.
     * @param msg The message to log.
     */
    public static void trace(String msg) {
        if (level >= TRACE) logger.trace(msg);
    }

    /**
     * @return {@code true} if trace messages would be written.
     */
    public static boolean isTraceEnabled() { return level >= TRACE && logger.isTraceEnabled(); }
}

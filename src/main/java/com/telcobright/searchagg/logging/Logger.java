package com.telcobright.searchagg.logging;

import java.util.Map;

/**
 * Sink for the controller's diagnostics. Every message names the query it belongs to
 * ({@code qid=...}); remote merges are also reported as structured events.
 *
 * Segment workers and remote handlers log concurrently, so implementations must be thread-safe.
 */
public interface Logger {

    enum Level {
        TRACE,
        DEBUG,
        INFO,
        WARN,
        ERROR
    }

    /**
     * Lets callers skip building per-segment messages that would be dropped.
     */
    boolean isLevelEnabled(Level level);

    void log(Level level, String message);

    void log(Level level, String message, Throwable throwable);

    /**
     * @param eventType short tag such as {@code REMOTE_MERGE}
     * @param context   key/value pairs appended to the message in insertion order
     */
    void logEvent(Level level, String eventType, String message, Map<String, Object> context);

    default void trace(String message) {
        log(Level.TRACE, message);
    }

    default void debug(String message) {
        log(Level.DEBUG, message);
    }

    default void info(String message) {
        log(Level.INFO, message);
    }

    default void warn(String message) {
        log(Level.WARN, message);
    }

    default void error(String message, Throwable throwable) {
        log(Level.ERROR, message, throwable);
    }
}

package com.telcobright.searchagg.logging;

import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * {@link Logger} backed by an SLF4J logger.
 */
public class Slf4jLogger implements Logger {

    private final org.slf4j.Logger delegate;

    public Slf4jLogger(String name) {
        this(LoggerFactory.getLogger(name));
    }

    public Slf4jLogger(Class<?> type) {
        this(LoggerFactory.getLogger(type));
    }

    public Slf4jLogger(org.slf4j.Logger delegate) {
        this.delegate = delegate;
    }

    @Override
    public boolean isLevelEnabled(Level level) {
        switch (level) {
            case TRACE:
                return delegate.isTraceEnabled();
            case DEBUG:
                return delegate.isDebugEnabled();
            case INFO:
                return delegate.isInfoEnabled();
            case WARN:
                return delegate.isWarnEnabled();
            case ERROR:
                return delegate.isErrorEnabled();
            default:
                return false;
        }
    }

    @Override
    public void log(Level level, String message) {
        switch (level) {
            case TRACE:
                delegate.trace(message);
                break;
            case DEBUG:
                delegate.debug(message);
                break;
            case INFO:
                delegate.info(message);
                break;
            case WARN:
                delegate.warn(message);
                break;
            case ERROR:
                delegate.error(message);
                break;
        }
    }

    @Override
    public void log(Level level, String message, Throwable throwable) {
        switch (level) {
            case TRACE:
                delegate.trace(message, throwable);
                break;
            case DEBUG:
                delegate.debug(message, throwable);
                break;
            case INFO:
                delegate.info(message, throwable);
                break;
            case WARN:
                delegate.warn(message, throwable);
                break;
            case ERROR:
                delegate.error(message, throwable);
                break;
        }
    }

    @Override
    public void logEvent(Level level, String eventType, String message, Map<String, Object> context) {
        if (!isLevelEnabled(level)) {
            return;
        }

        StringBuilder sb = new StringBuilder();
        sb.append(message);
        sb.append(" [event=").append(eventType);

        if (context != null && !context.isEmpty()) {
            context.forEach((key, value) ->
                sb.append(", ").append(key).append("=").append(value));
        }
        sb.append("]");

        log(level, sb.toString());
    }
}

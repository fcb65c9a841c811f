package org.celconform.junit.extensions.logging;

import ch.qos.logback.classic.Level;

import java.util.regex.Pattern;

/**
 * A log event seen while a test ran.
 */
record CapturedEvent(String loggerName, Level level, String message) {

    CapturedEvent {
        message = message != null ? message : "";
    }

    boolean matches(LogLevel minLevel, String loggerPattern, String messagePattern) {
        return level.isGreaterOrEqual(toLogback(minLevel))
                && Pattern.matches(loggerPattern, loggerName)
                && Pattern.matches(messagePattern, message);
    }

    static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    @Override
    public String toString() {
        return String.format("[%s] %s - %s", level, loggerName, message);
    }
}

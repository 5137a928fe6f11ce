package work.lcod.pro2cmake.api;

import java.util.Locale;

/**
 * Diagnostic thresholds understood by the converter and its CLI.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    FATAL;

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return WARN;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }

    public boolean includes(LogLevel level) {
        return level.ordinal() >= ordinal();
    }
}

package work.lcod.pro2cmake.shared;

import java.io.OutputStream;
import java.io.PrintStream;
import java.util.Locale;
import java.util.Objects;
import work.lcod.pro2cmake.api.LogLevel;

/**
 * Threshold-gated message sink. Conversion warnings (missing includes, unknown
 * sources, unsupported templates) are routed through here instead of being
 * printed ad hoc.
 */
public final class Diagnostics {
    private final PrintStream err;
    private final LogLevel threshold;

    public Diagnostics(PrintStream err, LogLevel threshold) {
        this.err = Objects.requireNonNull(err, "err");
        this.threshold = Objects.requireNonNull(threshold, "threshold");
    }

    public static Diagnostics silent() {
        return new Diagnostics(new PrintStream(OutputStream.nullOutputStream()), LogLevel.FATAL);
    }

    public boolean enabled(LogLevel level) {
        return threshold.includes(level);
    }

    public void log(LogLevel level, String format, Object... args) {
        if (!enabled(level)) {
            return;
        }
        String message = args.length == 0 ? format : String.format(Locale.ROOT, format, args);
        err.println("[" + level.name().toLowerCase(Locale.ROOT) + "] " + message);
    }

    public void debug(String format, Object... args) {
        log(LogLevel.DEBUG, format, args);
    }

    public void info(String format, Object... args) {
        log(LogLevel.INFO, format, args);
    }

    public void warn(String format, Object... args) {
        log(LogLevel.WARN, format, args);
    }

    public void error(String format, Object... args) {
        log(LogLevel.ERROR, format, args);
    }
}

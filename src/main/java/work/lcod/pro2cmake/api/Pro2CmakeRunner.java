package work.lcod.pro2cmake.api;

import java.io.PrintStream;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Objects;
import work.lcod.pro2cmake.parser.QmakeParseException;
import work.lcod.pro2cmake.runtime.ProjectConverter;
import work.lcod.pro2cmake.shared.Diagnostics;

/**
 * Public entry point for embedding the converter.
 */
public final class Pro2CmakeRunner {
    private final PrintStream out;
    private final PrintStream err;

    public Pro2CmakeRunner() {
        this(System.out, System.err);
    }

    /**
     * @param out receives the debug dumps
     * @param err receives diagnostics at or above the configured log level
     */
    public Pro2CmakeRunner(PrintStream out, PrintStream err) {
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
    }

    public ConversionResult run(ConversionConfiguration configuration) {
        var started = Instant.now();
        var diagnostics = new Diagnostics(err, configuration.debugParser() ? LogLevel.DEBUG : configuration.logLevel());
        try {
            var converter = new ProjectConverter(configuration, out, diagnostics);
            var output = converter.convert();

            var metadata = new LinkedHashMap<String, Object>();
            metadata.put("project", configuration.projectFile().toString());
            metadata.put("output", output.toString());
            metadata.put("written", converter.writtenFiles().stream().map(Object::toString).toList());
            metadata.put("scopes", converter.scopeCount());
            metadata.put("logLevel", configuration.logLevel().name());
            return ConversionResult.success(metadata, started);
        } catch (Exception ex) {
            var errorMeta = new LinkedHashMap<String, Object>();
            errorMeta.put("project", configuration.projectFile().toString());
            if (ex.getMessage() != null && !ex.getMessage().isBlank()) {
                errorMeta.put("error", ex.getMessage());
            }
            var report = configuration.projectFile() + ": " + errorMeta.getOrDefault("error", ex.getClass().getSimpleName());
            if (ex instanceof QmakeParseException parseError) {
                errorMeta.put("location", parseError.getOrigin() + ":" + parseError.getLine() + ":" + parseError.getColumn());
                errorMeta.put("excerpt", parseError.excerpt());
                report += System.lineSeparator() + parseError.excerpt();
            }
            diagnostics.error("%s", report);
            if (Boolean.getBoolean("pro2cmake.debug")) {
                ex.printStackTrace(err);
            }
            return ConversionResult.failure(ex.getMessage(), errorMeta, started);
        }
    }
}

package work.lcod.pro2cmake.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import work.lcod.pro2cmake.api.LogLevel;

class DiagnosticsTest {
    @Test
    void filtersBelowThreshold() {
        var buffer = new ByteArrayOutputStream();
        var diagnostics = new Diagnostics(new PrintStream(buffer, true, StandardCharsets.UTF_8), LogLevel.WARN);

        diagnostics.debug("hidden %s", "debug");
        diagnostics.info("hidden info");
        diagnostics.warn("Include file %s not found", "a.pri");
        diagnostics.error("broken");

        assertEquals(
            "[warn] Include file a.pri not found" + System.lineSeparator() + "[error] broken" + System.lineSeparator(),
            buffer.toString(StandardCharsets.UTF_8)
        );
    }

    @Test
    void logLevelDefaultsToWarn() {
        assertEquals(LogLevel.WARN, LogLevel.from(null));
        assertEquals(LogLevel.DEBUG, LogLevel.from(" debug "));
    }
}

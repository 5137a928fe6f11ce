package work.lcod.pro2cmake.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import work.lcod.pro2cmake.support.ConverterTestSupport;

class Pro2CmakeCommandTest {
    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private final StringWriter picocliErr = new StringWriter();
    private final StringWriter picocliOut = new StringWriter();

    private int execute(String... args) {
        var command = new Pro2CmakeCommand(
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8)
        );
        return new CommandLine(command)
            .setExecutionExceptionHandler(new ShortErrorHandler())
            .setErr(new PrintWriter(picocliErr, true))
            .setOut(new PrintWriter(picocliOut, true))
            .execute(args);
    }

    private Path project(String name, String content) throws Exception {
        return ConverterTestSupport.write(tempDir, name, content);
    }

    @Test
    void convertsEveryFile() throws Exception {
        var first = project("a/a.pro", "TEMPLATE = aux\n");
        var second = project("b/b.pro", "TEMPLATE = aux\n");

        assertEquals(0, execute(first.toString(), second.toString()));
        assertTrue(Files.exists(tempDir.resolve("a/CMakeLists.txt")));
        assertTrue(Files.exists(tempDir.resolve("b/CMakeLists.txt")));
    }

    @Test
    void stopsAtFirstFailure() throws Exception {
        var broken = project("a/a.pro", "A = 1\n}\n");
        var fine = project("b/b.pro", "TEMPLATE = aux\n");

        assertEquals(1, execute(broken.toString(), fine.toString()));
        assertTrue(Files.notExists(tempDir.resolve("b/CMakeLists.txt")));
        var errors = err.toString(StandardCharsets.UTF_8);
        assertTrue(errors.contains(broken.toString() + ": "), errors);
    }

    @Test
    void printsJsonSummary() throws Exception {
        var file = project("proj.pro", "TEMPLATE = aux\n");

        assertEquals(0, execute("--json", file.toString()));
        var printed = out.toString(StandardCharsets.UTF_8);
        assertTrue(printed.contains("\"status\" : \"success\""), printed);
        assertTrue(printed.contains("\"project\""), printed);
    }

    @Test
    void requiresAtLeastOneFile() {
        assertEquals(2, execute());
    }

    @Test
    void rejectsUnknownLogLevel() throws Exception {
        var file = project("proj.pro", "TEMPLATE = aux\n");

        assertEquals(1, execute("--log-level", "bogus", file.toString()));
        assertTrue(picocliErr.toString().contains("Unsupported log level: bogus"), picocliErr.toString());
    }

    @Test
    void rejectsMissingMappingsFile() throws Exception {
        var file = project("proj.pro", "TEMPLATE = aux\n");

        assertEquals(2, execute("--mappings", tempDir.resolve("none.toml").toString(), file.toString()));
        assertTrue(picocliErr.toString().contains("Mappings file not found"), picocliErr.toString());
    }

    @Test
    void printsVersion() {
        assertEquals(0, execute("--version"));
        assertTrue(picocliOut.toString().startsWith("pro2cmake (java) "), picocliOut.toString());
    }
}

package work.lcod.pro2cmake.cli;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.pro2cmake.api.ConversionConfiguration;
import work.lcod.pro2cmake.api.ConversionResult;
import work.lcod.pro2cmake.api.LogLevel;
import work.lcod.pro2cmake.api.Pro2CmakeRunner;

@CommandLine.Command(
    name = "pro2cmake",
    description = "Generate CMakeLists.txt files from qmake .pro/.pri files.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class Pro2CmakeCommand implements Callable<Integer> {
    private final PrintStream out;
    private final PrintStream err;

    @CommandLine.Parameters(
        paramLabel = "<.pro/.pri file>",
        arity = "1..*",
        description = "The .pro/.pri file(s) to process."
    )
    private List<Path> files = new ArrayList<>();

    @CommandLine.Option(names = "--debug", description = "Dump all debug output.")
    private boolean debug;

    @CommandLine.Option(names = "--debug-parser", description = "Trace the qmake parser.")
    private boolean debugParser;

    @CommandLine.Option(names = "--debug-parse-result", description = "Dump the qmake parser result.")
    private boolean debugParseResult;

    @CommandLine.Option(names = "--debug-parse-dictionary", description = "Dump the qmake parser result as JSON.")
    private boolean debugParseDictionary;

    @CommandLine.Option(names = "--debug-pro-structure", description = "Dump the structure of the project file.")
    private boolean debugProStructure;

    @CommandLine.Option(
        names = "--debug-full-pro-structure",
        description = "Dump the full structure of the project file, includes resolved."
    )
    private boolean debugFullProStructure;

    @CommandLine.Option(names = "--recursive", description = "Also convert the projects of SUBDIRS directories.")
    private boolean recursive;

    @CommandLine.Option(
        names = "--mappings",
        paramLabel = "TOML",
        description = "TOML file overriding the platform and library mappings.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path mappings;

    @CommandLine.Option(
        names = "--log-level",
        description = "Diagnostics threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(names = "--json", description = "Print a JSON summary for every converted file.")
    private boolean json;

    Pro2CmakeCommand() {
        this(System.out, System.err);
    }

    Pro2CmakeCommand(PrintStream out, PrintStream err) {
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
    }

    @Override
    public Integer call() {
        if (mappings != null && !Files.isRegularFile(mappings)) {
            throw new CommandLine.ParameterException(new CommandLine(this), "Mappings file not found: " + mappings);
        }
        LogLevel logLevel = LogLevel.from(logLevelRaw);
        Pro2CmakeRunner runner = new Pro2CmakeRunner(out, err);

        for (Path file : files) {
            ConversionConfiguration configuration = ConversionConfiguration.builder()
                .projectFile(file)
                .debugParser(debugParser)
                .debugParseResult(debugParseResult)
                .debugParseDictionary(debugParseDictionary)
                .debugProStructure(debugProStructure)
                .debugFullProStructure(debugFullProStructure)
                .debug(debug)
                .recursive(recursive)
                .mappingsFile(Optional.ofNullable(mappings))
                .logLevel(logLevel)
                .build();

            ConversionResult result = runner.run(configuration);
            if (json) {
                out.println(result.toPrettyJson());
            }
            if (result.status() != ConversionResult.Status.SUCCESS) {
                return result.status().exitCode();
            }
        }
        return 0;
    }
}

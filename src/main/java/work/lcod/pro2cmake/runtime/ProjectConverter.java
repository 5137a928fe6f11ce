package work.lcod.pro2cmake.runtime;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import work.lcod.pro2cmake.api.ConversionConfiguration;
import work.lcod.pro2cmake.condition.ConditionMapper;
import work.lcod.pro2cmake.condition.ConditionPropagator;
import work.lcod.pro2cmake.condition.ConditionSimplifier;
import work.lcod.pro2cmake.emit.CMakeListsWriter;
import work.lcod.pro2cmake.emit.SourceLocator;
import work.lcod.pro2cmake.emit.SubprojectHandler;
import work.lcod.pro2cmake.mapping.NameMappings;
import work.lcod.pro2cmake.parser.ParserOptions;
import work.lcod.pro2cmake.parser.QmakeParser;
import work.lcod.pro2cmake.parser.Statement;
import work.lcod.pro2cmake.scope.IncludeProcessor;
import work.lcod.pro2cmake.scope.Scope;
import work.lcod.pro2cmake.scope.ScopeBuilder;
import work.lcod.pro2cmake.scope.ScopeDumper;
import work.lcod.pro2cmake.scope.ScopeMerger;
import work.lcod.pro2cmake.shared.Diagnostics;

/**
 * Converts project files into CMakeLists.txt files next to them: parse, build
 * the scope tree, resolve includes, render and write.
 */
public final class ProjectConverter implements SubprojectHandler {
    private final ConversionConfiguration configuration;
    private final PrintStream out;
    private final Diagnostics diagnostics;
    private final QmakeParser parser;
    private final ScopeBuilder builder;
    private final IncludeProcessor includes;
    private final CMakeListsWriter writer;
    private final List<Path> writtenFiles = new ArrayList<>();
    private int scopeCount;

    public ProjectConverter(ConversionConfiguration configuration, PrintStream out, Diagnostics diagnostics) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.out = Objects.requireNonNull(out, "out");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        NameMappings mappings = configuration.mappingsFile()
            .map(NameMappings::load)
            .orElseGet(NameMappings::defaults);
        this.parser = new QmakeParser(new ParserOptions(configuration.debugParser()), diagnostics);
        this.builder = new ScopeBuilder(new ConditionMapper(mappings));
        this.includes = new IncludeProcessor(parser, builder, diagnostics);
        this.writer = new CMakeListsWriter(
            mappings,
            new ConditionPropagator(new ConditionSimplifier()),
            new SourceLocator(diagnostics),
            this,
            diagnostics
        );
    }

    public Path convert() {
        return convert(configuration.projectFile());
    }

    /** Converts {@code projectFile} and returns the path of the generated CMakeLists.txt. */
    public Path convert(Path projectFile) {
        List<Statement> statements = parser.parseFile(projectFile);
        if (configuration.debugParseResult()) {
            dump("Parser result", ScopeDumper.statementsToText(statements));
        }
        if (configuration.debugParseDictionary()) {
            dump("Parser result dictionary", ScopeDumper.statementsToJson(statements));
        }

        Scope scope = builder.build(projectFile.toString(), statements);
        if (configuration.debugProStructure()) {
            dump(".pro/.pri file structure", ScopeDumper.scopeToJson(scope));
        }
        includes.process(scope);
        if (configuration.debugFullProStructure()) {
            dump("Full .pro/.pri file structure", ScopeDumper.scopeToJson(scope));
        }
        scopeCount += ScopeMerger.flatten(scope).size();

        String text = writer.write(scope);
        Path output = Path.of(scope.cmakeListsFile());
        try {
            Files.writeString(output, text, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to write " + output, ex);
        }
        diagnostics.info("Wrote %s", output);
        writtenFiles.add(output);
        return output;
    }

    @Override
    public Scope loadProject(String file, String baseDir) {
        Scope scope = builder.build(null, file, parser.parseFile(Path.of(file)), "", baseDir);
        includes.process(scope);
        return scope;
    }

    @Override
    public void subdirectory(String directory) {
        if (!configuration.recursive()) {
            return;
        }
        Path dir = Path.of(directory);
        Path project = dir.resolve(dir.getFileName() + ".pro");
        if (!Files.isRegularFile(project)) {
            diagnostics.warn("No project file %s in subdirectory %s", project.getFileName(), directory);
            return;
        }
        convert(project);
    }

    public List<Path> writtenFiles() {
        return Collections.unmodifiableList(writtenFiles);
    }

    public int scopeCount() {
        return scopeCount;
    }

    private void dump(String title, String content) {
        out.println();
        out.println("#### " + title + ":");
        out.println(content);
        out.println("#### End of " + title + ".");
        out.println();
    }
}

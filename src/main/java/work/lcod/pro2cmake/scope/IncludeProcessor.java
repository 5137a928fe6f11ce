package work.lcod.pro2cmake.scope;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.lcod.pro2cmake.parser.QmakeParser;
import work.lcod.pro2cmake.parser.Statement;
import work.lcod.pro2cmake.shared.Diagnostics;
import work.lcod.pro2cmake.shared.PosixPaths;

/**
 * Replaces every {@code include(...)} recorded in a scope tree by the contents
 * of the included file, merged into the including scope.
 */
public final class IncludeProcessor {
    private final QmakeParser parser;
    private final ScopeBuilder builder;
    private final Diagnostics diagnostics;

    public IncludeProcessor(QmakeParser parser, ScopeBuilder builder, Diagnostics diagnostics) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.builder = Objects.requireNonNull(builder, "builder");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public void process(Scope scope) {
        for (Scope child : List.copyOf(scope.children())) {
            process(child);
        }
        for (String include : scope.included()) {
            Optional<String> resolved = resolve(include, scope);
            if (resolved.isEmpty()) {
                diagnostics.warn("Include file %s not found (included from %s)", include, scope.file());
                continue;
            }
            String file = resolved.get();
            diagnostics.info("Including %s into %s", file, scope);
            List<Statement> statements = parser.parseFile(Path.of(file));
            Scope included = builder.build(null, file, statements, "", scope.baseDir());
            process(included);
            scope.merge(included);
        }
    }

    static Optional<String> resolve(String include, Scope scope) {
        if (PosixPaths.isAbsolute(include)) {
            return Files.isRegularFile(Path.of(include)) ? Optional.of(include) : Optional.empty();
        }
        for (String dir : List.of(scope.baseDir(), scope.currentDir())) {
            String candidate = PosixPaths.join(dir, include);
            if (Files.isRegularFile(Path.of(candidate))) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}

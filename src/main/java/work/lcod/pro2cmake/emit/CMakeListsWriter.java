package work.lcod.pro2cmake.emit;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import work.lcod.pro2cmake.condition.ConditionPropagator;
import work.lcod.pro2cmake.mapping.NameMappings;
import work.lcod.pro2cmake.scope.PathMapper;
import work.lcod.pro2cmake.scope.Scope;
import work.lcod.pro2cmake.scope.ScopeBuilder;
import work.lcod.pro2cmake.scope.ScopeMerger;
import work.lcod.pro2cmake.shared.Diagnostics;
import work.lcod.pro2cmake.shared.PosixPaths;

/**
 * Renders a fully included scope tree as the text of a CMakeLists.txt.
 *
 * <p>{@code subdirs} projects become {@code add_subdirectory} calls; {@code app}
 * and {@code lib} projects become one {@code add_qt_*} call for the
 * unconditional part plus one {@code extend_target} call per distinct total
 * condition.
 */
public final class CMakeListsWriter {
    private static final String RULE = "#".repeat(69);
    private static final String PWD_DEFINE = "=\\\\\\\"$$PWD/\\\\\\\"";
    private static final String SOURCE_DIR_DEFINE = "=\"${CMAKE_CURRENT_SOURCE_DIR}/\"";
    private static final Set<String> REPORTED_KEYS = Set.of(ScopeBuilder.INCLUDED, "TARGET", "QMAKE_DOCS");
    private static final Set<String> CORE = Set.of("Qt::Core");
    private static final Set<String> CORE_AND_TEST = Set.of("Qt::Core", "Qt::Test");

    private final NameMappings mappings;
    private final ConditionPropagator propagator;
    private final SourceLocator locator;
    private final SubprojectHandler subprojects;
    private final Diagnostics diagnostics;

    public CMakeListsWriter(
        NameMappings mappings,
        ConditionPropagator propagator,
        SourceLocator locator,
        SubprojectHandler subprojects,
        Diagnostics diagnostics
    ) {
        this.mappings = Objects.requireNonNull(mappings, "mappings");
        this.propagator = Objects.requireNonNull(propagator, "propagator");
        this.locator = Objects.requireNonNull(locator, "locator");
        this.subprojects = Objects.requireNonNull(subprojects, "subprojects");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public String write(Scope scope) {
        if (scope.file().isEmpty()) {
            throw new IllegalStateException("Cannot generate CMakeLists.txt for a scope without a file");
        }
        StringBuilder out = new StringBuilder();
        out.append("# Generated from ").append(PosixPaths.basename(scope.file())).append(".\n\n");
        cmakeify(scope, out, 0);
        return out.toString();
    }

    private void cmakeify(Scope scope, StringBuilder out, int indent) {
        String template = scope.template();
        switch (template) {
            case "subdirs" -> writeSubdirs(scope, out, indent);
            case "app", "lib" -> writeAppOrLib(scope, out, indent);
            default -> diagnostics.warn("%s: template type %s not yet supported", scope.file(), template);
        }
    }

    private void writeSubdirs(Scope scope, StringBuilder out, int indent) {
        String ind = spaces(indent);
        for (String subdir : scope.get("SUBDIRS")) {
            String path = PosixPaths.join(scope.baseDir(), subdir);
            if (Files.isDirectory(Path.of(path))) {
                out.append(ind).append("add_subdirectory(").append(subdir).append(")\n");
                subprojects.subdirectory(path);
            } else if (Files.isRegularFile(Path.of(path))) {
                cmakeify(subprojects.loadProject(path, scope.baseDir()), out, indent + 1);
            } else if (subdir.startsWith("-")) {
                out.append(ind).append("### remove_subdirectory(\"").append(subdir.substring(1)).append("\")\n");
            } else {
                diagnostics.warn("SUBDIR %s in %s: not found", subdir, scope);
            }
        }

        List<Scope> children = scope.children();
        for (int i = 0; i < children.size(); i++) {
            Scope child = children.get(i);
            String condition = child.condition();
            if (child.isElse()) {
                out.append(ind).append("else()\n");
            } else if (!condition.isEmpty()) {
                out.append('\n').append(ind).append("if(").append(condition).append(")\n");
            }
            writeSubdirs(child, out, indent + 1);
            boolean elseFollows = i + 1 < children.size() && children.get(i + 1).isElse();
            if (!condition.isEmpty() && !elseFollows) {
                out.append(ind).append("endif()\n");
            }
        }
    }

    private void writeAppOrLib(Scope scope, StringBuilder out, int indent) {
        List<String> loaded = scope.get(ScopeBuilder.LOADED);
        List<String> config = scope.get("CONFIG");
        String target = scope.target();

        if ("lib".equals(scope.template()) || loaded.contains("qt_module")) {
            writeModule(scope, target, config, out, indent);
        } else if (loaded.contains("qt_plugin")) {
            writeMainPart(out, target, "Plugin", "add_qt_plugin", scope, List.of(), CORE, indent);
        } else if (loaded.contains("qt_tool")) {
            writeMainPart(out, target, "Tool", "add_qt_tool", scope, List.of(), CORE, indent);
        } else if (config.contains("testcase") || config.contains("testlib")) {
            writeMainPart(out, target, "Test", "add_qt_test", scope, List.of(), CORE_AND_TEST, indent);
        } else {
            List<String> extra = config.contains("console") ? List.of() : List.of("GUI");
            writeMainPart(out, target, "Binary", "add_qt_executable", scope, extra, CORE, indent);
        }

        String docs = scope.getString("QMAKE_DOCS");
        if (!docs.isEmpty()) {
            out.append('\n').append(spaces(indent)).append("add_qt_docs(")
                .append(mapToFile(docs, scope)).append(")\n");
        }
    }

    private void writeModule(Scope scope, String target, List<String> config, StringBuilder out, int indent) {
        String name = target.startsWith("Qt") ? target.substring(2) : target;
        List<String> extra = new ArrayList<>();
        if (config.contains("static")) {
            extra.add("STATIC");
        }
        if (config.contains("no_module_headers")) {
            extra.add("NO_MODULE_HEADERS");
        }
        writeMainPart(out, name, "Module", "add_qt_module", scope, extra, CORE, indent);

        if (scope.get("CONFIG").contains("qt_tracepoints")) {
            String provider = mapToFile(scope.getString("TRACEPOINT_PROVIDER"), scope);
            out.append("\n\n").append(spaces(indent)).append("qt_create_tracepoints(")
                .append(name).append(' ').append(provider).append(")\n");
        }
    }

    private void writeMainPart(
        StringBuilder out,
        String name,
        String typeName,
        String cmakeFunction,
        Scope scope,
        List<String> extraLines,
        Set<String> knownLibraries,
        int indent
    ) {
        propagator.propagate(scope);
        List<Scope> all = ScopeMerger.flatten(scope);
        List<Scope> scopes = ScopeMerger.merge(all);
        diagnostics.info("%s: %d scopes, %d after merging", name, all.size(), scopes.size());
        if (scopes.isEmpty() || !ScopeMerger.ALWAYS.equals(scopes.get(0).totalCondition().orElse(""))) {
            throw new IllegalStateException("The main scope of " + scope.file() + " is not unconditional");
        }

        String ind = spaces(indent);
        out.append(ind).append(RULE).append('\n');
        out.append(ind).append("## ").append(name).append(' ').append(typeName).append(":\n");
        out.append(ind).append(RULE).append("\n\n");

        out.append(ind).append(cmakeFunction).append('(').append(name).append('\n');
        for (String extra : extraLines) {
            out.append(ind).append("    ").append(extra).append('\n');
        }
        Scope main = scopes.get(0);
        StringBuilder sources = new StringBuilder();
        Set<String> ignored = writeSourcesSection(sources, main, knownLibraries, indent);
        out.append(sources);
        out.append(ignoredKeysReport(main, ignored, spaces(indent + 1)));
        out.append(ind).append(")\n");

        if (scopes.size() == 1) {
            return;
        }
        out.append('\n').append(ind).append("## Scopes:\n");
        out.append(ind).append(RULE).append('\n');
        for (Scope extension : scopes.subList(1, scopes.size())) {
            out.append(extendTarget(name, extension, knownLibraries, indent));
        }
    }

    private String extendTarget(String target, Scope scope, Set<String> knownLibraries, int indent) {
        String ind = spaces(indent);
        StringBuilder sources = new StringBuilder();
        Set<String> ignored = writeSourcesSection(sources, scope, knownLibraries, indent);
        String report = ignoredKeysReport(scope, ignored, spaces(indent + 1));
        if (sources.length() > 0 && !report.isEmpty()) {
            report = "\n" + report;
        }
        String block = "\n" + ind + "extend_target(" + target + " CONDITION " + scope.totalCondition().orElse("")
            + "\n" + sources + report + ind + ")\n";
        if (sources.length() > 0) {
            return block;
        }
        if (report.isEmpty()) {
            return "";
        }
        // Only diagnostics: keep the block for reference but commented out.
        StringBuilder commented = new StringBuilder();
        for (String line : block.split("(?<=\n)")) {
            commented.append('#').append(line);
        }
        return commented.toString();
    }

    /** Writes TYPE, SOURCES, DEFINES, INCLUDE_DIRECTORIES and LIBRARIES; returns the keys left unread. */
    Set<String> writeSourcesSection(StringBuilder out, Scope scope, Set<String> knownLibraries, int indent) {
        String ind = spaces(indent);
        scope.resetVisitedKeys();

        List<String> pluginType = scope.get("PLUGIN_TYPE");
        if (!pluginType.isEmpty()) {
            out.append(ind).append("    TYPE ").append(pluginType.get(0)).append('\n');
        }

        List<String> sources = new ArrayList<>();
        for (String key : List.of("SOURCES", "HEADERS", "OBJECTIVE_SOURCES", "NO_PCH_SOURCES", "FORMS")) {
            sources.addAll(scope.get(key));
        }
        List<String> resources = scope.get("RESOURCES");
        if (!resources.isEmpty()) {
            if (resources.stream().allMatch(resource -> resource.endsWith(".qrc"))) {
                sources.addAll(resources);
            } else {
                diagnostics.warn("%s: ignoring non-QRC file resources", scope);
            }
        }
        List<String> vpath = scope.get("VPATH");
        List<String> located = new ArrayList<>(sources.size());
        for (String source : sources) {
            located.add(locator.locate(source, scope.baseDir(), vpath));
        }
        List<String> sourceLines = SourceSorter.sort(located);
        if (!sourceLines.isEmpty()) {
            out.append(ind).append("    SOURCES\n");
            for (String line : sourceLines) {
                out.append(ind).append("        ").append(line).append('\n');
            }
        }

        List<String> defines = scope.get("DEFINES");
        if (!defines.isEmpty()) {
            out.append(ind).append("    DEFINES\n");
            for (String define : defines) {
                out.append(ind).append("        ").append(define.replace(PWD_DEFINE, SOURCE_DIR_DEFINE)).append('\n');
            }
        }

        List<String> includes = scope.get("INCLUDEPATH");
        if (!includes.isEmpty()) {
            out.append(ind).append("    INCLUDE_DIRECTORIES\n");
            for (String include : includes) {
                out.append(ind).append("        ").append(stripTrailingSlashes(include)).append('\n');
            }
        }

        List<String> dependencies = new ArrayList<>();
        for (String key : List.of("QT", "QT_FOR_PRIVATE")) {
            for (String module : scope.get(key)) {
                String library = mappings.qtLibrary(module);
                if (!knownLibraries.contains(library)) {
                    dependencies.add(library);
                }
            }
        }
        for (String key : List.of("QMAKE_USE_PRIVATE", "LIBS_PRIVATE", "LIBS")) {
            dependencies.addAll(scope.get(key));
        }
        if (!dependencies.isEmpty()) {
            out.append(ind).append("    LIBRARIES\n");
            for (String line : libraryLines(dependencies)) {
                out.append(ind).append("        ").append(line).append('\n');
            }
        }
        return scope.unvisitedKeys();
    }

    List<String> libraryLines(List<String> dependencies) {
        List<String> lines = new ArrayList<>();
        boolean framework = false;
        for (String dependency : dependencies) {
            if ("-framework".equals(dependency)) {
                framework = true;
                continue;
            }
            String line = framework ? "${FW" + dependency + "}" : dependency;
            if (line.startsWith("-l")) {
                line = line.substring(2);
            }
            if (line.startsWith("-")) {
                line = "# Remove: " + line.substring(1);
            } else {
                line = mappings.library(line);
            }
            lines.add(line);
            framework = false;
        }
        return lines;
    }

    private static String ignoredKeysReport(Scope scope, Set<String> ignoredKeys, String indent) {
        StringBuilder report = new StringBuilder();
        for (String key : new TreeSet<>(ignoredKeys)) {
            if (REPORTED_KEYS.contains(key)) {
                continue;
            }
            List<String> values = scope.get(key);
            String rendered = values.isEmpty() ? "<EMPTY>" : "\"" + String.join("\" \"", values) + "\"";
            report.append(indent).append("# ").append(key).append(" = ").append(rendered).append('\n');
        }
        return report.toString();
    }

    private static String mapToFile(String value, Scope scope) {
        return PathMapper.mapToFile(value, scope.baseDir(), scope.currentDir()).orElse("");
    }

    private static String stripTrailingSlashes(String path) {
        int end = path.length();
        while (end > 0 && path.charAt(end - 1) == '/') {
            end--;
        }
        return end == 0 ? "/" : path.substring(0, end);
    }

    private static String spaces(int indent) {
        return "    ".repeat(indent);
    }
}

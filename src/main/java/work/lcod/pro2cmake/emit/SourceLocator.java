package work.lcod.pro2cmake.emit;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import work.lcod.pro2cmake.scope.PathMapper;
import work.lcod.pro2cmake.shared.Diagnostics;
import work.lcod.pro2cmake.shared.PosixPaths;

/**
 * Maps a source entry to the form it takes in CMakeLists.txt, checking that it
 * exists on disk relative to the base directory or one of the VPATH entries.
 */
public final class SourceLocator {
    static final String NOT_FOUND_SUFFIX = "-NOTFOUND";

    private final Diagnostics diagnostics;

    public SourceLocator(Diagnostics diagnostics) {
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    /** Returns an empty string for entries that produce no source. */
    public String locate(String source, String baseDir, List<String> vpath) {
        if (source == null || source.isEmpty() || PathMapper.NO_PCH_SOURCES.equals(source)) {
            return "";
        }
        if (source.startsWith("$$PWD/")) {
            return source.substring("$$PWD/".length());
        }
        if (".".equals(source)) {
            return "${CMAKE_CURRENT_SOURCE_DIR}";
        }
        if (source.startsWith("$$QT_SOURCE_TREE/")) {
            return "${PROJECT_SOURCE_DIR}/" + source.substring("$$QT_SOURCE_TREE/".length());
        }
        if (source.startsWith("${")) {
            return source;
        }
        if (exists(PosixPaths.join(baseDir, source))) {
            return source;
        }
        for (String dir : vpath) {
            String candidate = PosixPaths.join(dir, source);
            if (exists(candidate)) {
                return PosixPaths.relativize(candidate, baseDir);
            }
        }
        diagnostics.warn("Source %s: not found", source);
        return source + NOT_FOUND_SUFFIX;
    }

    private static boolean exists(String path) {
        return Files.exists(Path.of(path));
    }
}

package work.lcod.pro2cmake.scope;

import java.util.Optional;
import work.lcod.pro2cmake.shared.PosixPaths;

/**
 * Rewrites qmake path spellings into paths relative to a scope's base
 * directory or into CMake variable references.
 */
public final class PathMapper {
    public static final String NO_PCH_SOURCES = "$$NO_PCH_SOURCES";
    private static final String PWD = "$$PWD";
    private static final String OUT_PWD = "$$OUT_PWD/";
    private static final String SOURCE_TREE = "$$QT_SOURCE_TREE";

    private PathMapper() {}

    /**
     * Maps one path value. Returns empty for values that must be dropped.
     */
    public static Optional<String> mapToFile(String value, String baseDir, String currentDir) {
        if (NO_PCH_SOURCES.equals(value)) {
            return Optional.empty();
        }
        if (value.equals(PWD)) {
            return Optional.of(relativeDir(currentDir, baseDir));
        }
        if (value.startsWith(PWD + "/")) {
            return Optional.of(underCurrentDir(value.substring(PWD.length() + 1), baseDir, currentDir));
        }
        if (value.startsWith(OUT_PWD)) {
            return Optional.of("${CMAKE_CURRENT_BUILD_DIR}/" + value.substring(OUT_PWD.length()));
        }
        if (value.startsWith(SOURCE_TREE)) {
            String rest = value.substring(SOURCE_TREE.length());
            return Optional.of("${PROJECT_SOURCE_DIR}/" + (rest.startsWith("/") ? rest.substring(1) : rest));
        }
        if (value.startsWith("./")) {
            return Optional.of(underCurrentDir(value.substring(2), baseDir, currentDir));
        }
        return Optional.of(value);
    }

    private static String underCurrentDir(String rest, String baseDir, String currentDir) {
        String dir = relativeDir(currentDir, baseDir);
        if (rest.isEmpty()) {
            return dir;
        }
        return ".".equals(dir) ? rest : PosixPaths.join(dir, rest);
    }

    private static String relativeDir(String currentDir, String baseDir) {
        if (currentDir.equals(baseDir)) {
            return ".";
        }
        return PosixPaths.relativize(currentDir, baseDir);
    }

    public static boolean isPathKey(String key) {
        return switch (key) {
            case "HEADERS", "SOURCES", "INCLUDEPATH", "RESOURCES" -> true;
            default -> key.endsWith("_HEADERS") || key.endsWith("_SOURCES");
        };
    }
}

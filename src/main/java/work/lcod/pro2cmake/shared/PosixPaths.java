package work.lcod.pro2cmake.shared;

import java.nio.file.Path;

/**
 * String based path helpers. Project files describe paths with forward slashes
 * and CMake variable prefixes, so these stay strings instead of {@link Path}s.
 */
public final class PosixPaths {
    private PosixPaths() {}

    public static String join(String first, String... more) {
        StringBuilder result = new StringBuilder(first == null ? "" : first);
        for (String part : more) {
            if (part == null) {
                continue;
            }
            if (part.startsWith("/")) {
                result.setLength(0);
                result.append(part);
            } else if (result.length() == 0 || result.charAt(result.length() - 1) == '/') {
                result.append(part);
            } else {
                result.append('/').append(part);
            }
        }
        return result.toString();
    }

    public static String dirname(String path) {
        if (path == null) {
            return "";
        }
        int slash = path.lastIndexOf('/');
        if (slash < 0) {
            return "";
        }
        if (slash == 0) {
            return "/";
        }
        return path.substring(0, slash);
    }

    public static String basename(String path) {
        if (path == null) {
            return "";
        }
        return path.substring(path.lastIndexOf('/') + 1);
    }

    /** Base name without its last extension; dot files keep their name. */
    public static String stem(String path) {
        String base = basename(path);
        int dot = base.lastIndexOf('.');
        if (dot <= 0) {
            return base;
        }
        return base.substring(0, dot);
    }

    /** {@code path} relative to {@code start}; {@code "."} when both are the same directory. */
    public static String relativize(String path, String start) {
        Path from = Path.of(start.isEmpty() ? "." : start).toAbsolutePath().normalize();
        Path to = Path.of(path.isEmpty() ? "." : path).toAbsolutePath().normalize();
        String relative = from.relativize(to).toString().replace('\\', '/');
        return relative.isEmpty() ? "." : relative;
    }

    public static boolean isAbsolute(String path) {
        return path.startsWith("/");
    }
}

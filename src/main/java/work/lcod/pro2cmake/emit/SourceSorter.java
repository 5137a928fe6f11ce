package work.lcod.pro2cmake.emit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import work.lcod.pro2cmake.shared.PosixPaths;

/**
 * Orders source lists for output: files sharing a directory and base name (a
 * trailing {@code _p} ignored) are written together on one line.
 */
public final class SourceSorter {
    private SourceSorter() {}

    public static List<String> sort(List<String> sources) {
        Map<String, List<String>> groups = new TreeMap<>();
        for (String source : sources) {
            if (source == null || source.isEmpty()) {
                continue;
            }
            groups.computeIfAbsent(sortKey(source), ignored -> new ArrayList<>()).add(source);
        }
        List<String> lines = new ArrayList<>(groups.size());
        for (List<String> group : groups.values()) {
            Collections.sort(group);
            lines.add(String.join(" ", group));
        }
        return lines;
    }

    static String sortKey(String source) {
        String base = PosixPaths.basename(source);
        int dot = base.lastIndexOf('.');
        if (dot > 0) {
            base = base.substring(0, dot);
        }
        if (base.endsWith("_p")) {
            base = base.substring(0, base.length() - 2);
        }
        String dir = PosixPaths.dirname(source);
        return dir.isEmpty() ? base : PosixPaths.join(dir, base);
    }
}

package work.lcod.pro2cmake.condition;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import work.lcod.pro2cmake.mapping.NameMappings;

/**
 * Rewrites qmake condition syntax into the CMake vocabulary understood by
 * {@link ConditionSimplifier}: {@code NOT}, {@code AND}, {@code OR}, {@code ON},
 * {@code OFF}, feature variables and {@code TARGET} checks.
 */
public final class ConditionMapper {
    private static final Pattern FEATURE = Pattern.compile("(qtConfig|qtHaveModule)\\(([a-zA-Z0-9_-]+)\\)");
    private static final String SYSTEM_PREFIX = "system_";

    private final NameMappings mappings;

    public ConditionMapper(NameMappings mappings) {
        this.mappings = Objects.requireNonNull(mappings, "mappings");
    }

    public String canonicalize(String condition) {
        if (condition == null || condition.isBlank()) {
            return "";
        }
        String rewritten = condition
            .replace("*", "_x_")
            .replace(".$$", "__ss_")
            .replace("$$", "_ss_")
            .replace("!", "NOT ")
            .replace("&&", " AND ")
            .replace("|", " OR ");

        List<String> parts = new ArrayList<>();
        for (String part : rewritten.trim().split("\\s+")) {
            parts.add(mapToken(part));
        }
        return String.join(" ", parts);
    }

    private String mapToken(String part) {
        Matcher matcher = FEATURE.matcher(part);
        if (matcher.matches()) {
            String name = matcher.group(2);
            if ("qtHaveModule".equals(matcher.group(1))) {
                return "TARGET " + mappings.qtBaseLibrary(name);
            }
            String feature = NameMappings.featureName(name);
            if (feature.startsWith(SYSTEM_PREFIX)) {
                String library = feature.substring(SYSTEM_PREFIX.length());
                if (!mappings.library(library).equals(library)) {
                    // system libraries are always used when the library is known
                    return "ON";
                }
            }
            return "QT_FEATURE_" + feature;
        }
        return switch (part) {
            case "true" -> "ON";
            case "false" -> "OFF";
            default -> mappings.platform(part);
        };
    }
}

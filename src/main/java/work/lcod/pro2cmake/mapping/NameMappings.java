package work.lcod.pro2cmake.mapping;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Lookup tables translating qmake platform, module and library names into
 * their CMake spelling. Defaults ship as the {@code mappings.toml} resource and
 * can be overlaid by a user supplied TOML file with the same tables.
 */
public final class NameMappings {
    private static final String DEFAULT_RESOURCE = "/mappings.toml";
    private static final String PRIVATE_SUFFIX = "-private";

    private final Map<String, String> platforms;
    private final Map<String, String> qtLibraries;
    private final Map<String, String> libraries;

    public NameMappings(Map<String, String> platforms, Map<String, String> qtLibraries, Map<String, String> libraries) {
        this.platforms = Collections.unmodifiableMap(new LinkedHashMap<>(platforms));
        this.qtLibraries = Collections.unmodifiableMap(new LinkedHashMap<>(qtLibraries));
        this.libraries = Collections.unmodifiableMap(new LinkedHashMap<>(libraries));
    }

    public static NameMappings defaults() {
        try (InputStream in = NameMappings.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + DEFAULT_RESOURCE);
            }
            return fromToml(parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), DEFAULT_RESOURCE));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read " + DEFAULT_RESOURCE, ex);
        }
    }

    /** Defaults overlaid with the entries of {@code overrides}. */
    public static NameMappings load(Path overrides) {
        String source;
        try {
            source = Files.readString(overrides);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read mappings: " + overrides, ex);
        }
        return defaults().overlay(fromToml(parse(source, overrides.toString())));
    }

    public static NameMappings fromToml(TomlParseResult result) {
        return new NameMappings(
            readTable(result.getTable("platforms")),
            readTable(result.getTable("qt_libraries")),
            readTable(result.getTable("libraries"))
        );
    }

    private static TomlParseResult parse(String source, String origin) {
        TomlParseResult result = Toml.parse(source);
        if (result.hasErrors()) {
            String errors = result.errors().stream()
                .map(Object::toString)
                .collect(Collectors.joining("; "));
            throw new IllegalStateException("Invalid mappings in " + origin + ": " + errors);
        }
        return result;
    }

    private static Map<String, String> readTable(TomlTable table) {
        Map<String, String> values = new LinkedHashMap<>();
        if (table == null || table.isEmpty()) {
            return values;
        }
        for (String key : table.keySet()) {
            Object value = table.get(Collections.singletonList(key));
            if (value instanceof String str) {
                values.put(key, str);
            }
        }
        return values;
    }

    public NameMappings overlay(NameMappings other) {
        return new NameMappings(
            merged(platforms, other.platforms),
            merged(qtLibraries, other.qtLibraries),
            merged(libraries, other.libraries)
        );
    }

    private static Map<String, String> merged(Map<String, String> base, Map<String, String> extra) {
        Map<String, String> result = new LinkedHashMap<>(base);
        result.putAll(extra);
        return result;
    }

    public String platform(String token) {
        return platforms.getOrDefault(token, token);
    }

    public String qtBaseLibrary(String name) {
        String mapped = qtLibraries.get(name);
        if (mapped != null) {
            return mapped;
        }
        if (name.startsWith("Qt::")) {
            return name;
        }
        return "Qt::" + name;
    }

    /** Like {@link #qtBaseLibrary} but maps {@code foo-private} to the private target. */
    public String qtLibrary(String name) {
        if (name.endsWith(PRIVATE_SUFFIX)) {
            return qtBaseLibrary(name.substring(0, name.length() - PRIVATE_SUFFIX.length())) + "Private";
        }
        return qtBaseLibrary(name);
    }

    public String library(String name) {
        return libraries.getOrDefault(name, name);
    }

    public static String featureName(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}

package work.lcod.pro2cmake.scope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import work.lcod.pro2cmake.shared.PosixPaths;

/**
 * A conditional region of a project file with its own per-key operation lists.
 *
 * <p>Children are owned; the parent link is only used for navigation. Keys are
 * resolved against this scope's operations alone, never against ancestors.
 */
public final class Scope {
    public static final String ELSE = "else";

    private Scope parent;
    private final List<Scope> children = new ArrayList<>();
    private final Map<String, List<Operation>> operations = new LinkedHashMap<>();
    private final Set<String> visitedKeys = new LinkedHashSet<>();
    private final String file;
    private final String baseDir;
    private final String currentDir;
    private final String rawCondition;
    private final String condition;
    private String totalCondition;

    /**
     * @param parent       owning scope, or {@code null} for a file root
     * @param file         originating file; empty for synthetic scopes
     * @param rawCondition condition text as written, {@code "else"} for else branches
     * @param condition    canonical form of {@code rawCondition}
     * @param baseDir      directory the generated CMakeLists.txt lives in; defaults to the file's directory
     */
    public Scope(Scope parent, String file, String rawCondition, String condition, String baseDir) {
        this.file = file == null ? "" : file;
        String dir = PosixPaths.dirname(this.file);
        this.currentDir = dir.isEmpty() ? "." : dir;
        this.baseDir = baseDir == null || baseDir.isEmpty() ? currentDir : baseDir;
        this.rawCondition = rawCondition == null ? "" : rawCondition;
        this.condition = condition == null ? "" : condition;
        if (parent != null) {
            parent.addChild(this);
        }
    }

    public static Scope root(String file) {
        return new Scope(null, file, "", "", "");
    }

    public Optional<Scope> parent() {
        return Optional.ofNullable(parent);
    }

    public List<Scope> children() {
        return Collections.unmodifiableList(children);
    }

    public String file() {
        return file;
    }

    public String baseDir() {
        return baseDir;
    }

    public String currentDir() {
        return currentDir;
    }

    public String rawCondition() {
        return rawCondition;
    }

    public String condition() {
        return condition;
    }

    public boolean isElse() {
        return ELSE.equals(condition);
    }

    public Optional<String> totalCondition() {
        return Optional.ofNullable(totalCondition);
    }

    public void setTotalCondition(String totalCondition) {
        this.totalCondition = totalCondition;
    }

    public String cmakeListsFile() {
        return PosixPaths.join(baseDir, "CMakeLists.txt");
    }

    public void appendOperation(String key, Operation operation) {
        operations.computeIfAbsent(key, ignored -> new ArrayList<>()).add(operation);
    }

    public List<Operation> operations(String key) {
        return Collections.unmodifiableList(operations.getOrDefault(key, List.of()));
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(operations.keySet());
    }

    /** Resolves {@code key} from this scope's operations and marks it visited. */
    public List<String> get(String key) {
        visitedKeys.add(key);
        List<String> result = new ArrayList<>();
        for (Operation operation : operations.getOrDefault(key, List.of())) {
            result = operation.apply(result);
        }
        return result;
    }

    public String getString(String key, String defaultValue) {
        List<String> values = get(key);
        if (values.isEmpty()) {
            return defaultValue;
        }
        if (values.size() > 1) {
            throw new IllegalStateException(
                "Expected a single value for " + key + " in " + this + " but got " + values
            );
        }
        return values.get(0);
    }

    public String getString(String key) {
        return getString(key, "");
    }

    public Set<String> visitedKeys() {
        return Collections.unmodifiableSet(visitedKeys);
    }

    public void resetVisitedKeys() {
        visitedKeys.clear();
    }

    /** Keys that carry operations but were never resolved since the last reset. */
    public Set<String> unvisitedKeys() {
        Set<String> result = new LinkedHashSet<>(operations.keySet());
        result.removeAll(visitedKeys);
        return result;
    }

    public String template() {
        return getString("TEMPLATE", "app");
    }

    public String target() {
        String target = getString("TARGET");
        return target.isEmpty() ? PosixPaths.stem(file) : target;
    }

    public List<String> included() {
        return get("_INCLUDED");
    }

    /**
     * Absorbs {@code other}: its children are re-parented here and its operation
     * lists are appended key by key.
     */
    public void merge(Scope other) {
        for (Scope child : List.copyOf(other.children)) {
            addChild(child);
        }
        other.operations.forEach((key, list) ->
            operations.computeIfAbsent(key, ignored -> new ArrayList<>()).addAll(list)
        );
    }

    void addChild(Scope child) {
        if (child.parent != null && child.parent != this) {
            child.parent.children.remove(child);
        }
        child.parent = this;
        if (!children.contains(child)) {
            children.add(child);
        }
    }

    @Override
    public String toString() {
        return baseDir + ":" + file + ":" + (condition.isEmpty() ? "<NONE>" : condition);
    }
}

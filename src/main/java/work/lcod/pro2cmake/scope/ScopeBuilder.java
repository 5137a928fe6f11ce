package work.lcod.pro2cmake.scope;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import work.lcod.pro2cmake.condition.ConditionMapper;
import work.lcod.pro2cmake.parser.Statement;

/**
 * Turns a parsed statement sequence into a {@link Scope} tree: one child scope
 * per conditional branch, one operation per assignment.
 */
public final class ScopeBuilder {
    public static final String LOADED = "_LOADED";
    public static final String OPTION = "_OPTION";
    public static final String INCLUDED = "_INCLUDED";

    private final ConditionMapper conditionMapper;

    public ScopeBuilder(ConditionMapper conditionMapper) {
        this.conditionMapper = Objects.requireNonNull(conditionMapper, "conditionMapper");
    }

    public Scope build(String file, List<Statement> statements) {
        return build(null, file, statements, "", "");
    }

    public Scope build(Scope parent, String file, List<Statement> statements, String rawCondition, String baseDir) {
        String condition = Scope.ELSE.equals(rawCondition) ? Scope.ELSE : conditionMapper.canonicalize(rawCondition);
        Scope scope = new Scope(parent, file, rawCondition, condition, baseDir);
        for (Statement statement : statements) {
            if (statement instanceof Statement.Assignment assignment) {
                List<String> values = assignment.values();
                if (PathMapper.isPathKey(assignment.key())) {
                    values = mapPaths(values, scope);
                }
                scope.appendOperation(assignment.key(), new Operation(assignment.operator(), values));
            } else if (statement instanceof Statement.Conditional conditional) {
                build(scope, file, conditional.thenStatements(), conditional.condition(), scope.baseDir());
                if (conditional.hasElse()) {
                    build(scope, file, conditional.elseStatements(), Scope.ELSE, scope.baseDir());
                }
            } else if (statement instanceof Statement.Load load) {
                scope.appendOperation(LOADED, Operation.uniqueAdd(List.of(load.name())));
            } else if (statement instanceof Statement.Option option) {
                scope.appendOperation(OPTION, Operation.uniqueAdd(List.of(option.name())));
            } else if (statement instanceof Statement.Include include) {
                List<String> mapped = PathMapper.mapToFile(include.path(), scope.baseDir(), scope.currentDir())
                    .map(List::of)
                    .orElse(List.of());
                scope.appendOperation(INCLUDED, Operation.uniqueAdd(mapped));
            }
        }
        return scope;
    }

    private static List<String> mapPaths(List<String> values, Scope scope) {
        List<String> mapped = new ArrayList<>(values.size());
        for (String value : values) {
            PathMapper.mapToFile(value, scope.baseDir(), scope.currentDir()).ifPresent(mapped::add);
        }
        return mapped;
    }
}

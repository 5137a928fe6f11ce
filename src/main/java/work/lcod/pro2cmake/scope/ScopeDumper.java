package work.lcod.pro2cmake.scope;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import work.lcod.pro2cmake.parser.Statement;

/**
 * Debug renderings of parse results and scope trees.
 */
public final class ScopeDumper {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    private ScopeDumper() {}

    /** One statement per line, nested branches indented. */
    public static String statementsToText(List<Statement> statements) {
        StringBuilder out = new StringBuilder();
        appendStatements(out, statements, 0);
        return out.toString();
    }

    public static String statementsToJson(List<Statement> statements) {
        return toJson(statements.stream().map(ScopeDumper::toSerializableMap).collect(Collectors.toList()));
    }

    public static String scopeToJson(Scope scope) {
        return toJson(toSerializableMap(scope));
    }

    static Map<String, Object> toSerializableMap(Statement statement) {
        Map<String, Object> map = new LinkedHashMap<>();
        if (statement instanceof Statement.Assignment assignment) {
            map.put("type", "assignment");
            map.put("key", assignment.key());
            map.put("operation", assignment.operator().symbol());
            map.put("value", assignment.values());
        } else if (statement instanceof Statement.Conditional conditional) {
            map.put("type", "condition");
            map.put("condition", conditional.condition());
            map.put("statements", conditional.thenStatements().stream()
                .map(ScopeDumper::toSerializableMap).collect(Collectors.toList()));
            if (conditional.hasElse()) {
                map.put("else_statements", conditional.elseStatements().stream()
                    .map(ScopeDumper::toSerializableMap).collect(Collectors.toList()));
            }
        } else if (statement instanceof Statement.Include include) {
            map.put("type", "include");
            map.put("included", include.path());
        } else if (statement instanceof Statement.Load load) {
            map.put("type", "load");
            map.put("loaded", load.name());
        } else if (statement instanceof Statement.Option option) {
            map.put("type", "option");
            map.put("option", option.name());
        } else if (statement instanceof Statement.Opaque opaque) {
            map.put("type", opaque.kind());
            map.put("text", opaque.text());
        }
        return map;
    }

    static Map<String, Object> toSerializableMap(Scope scope) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("file", scope.file());
        map.put("baseDir", scope.baseDir());
        map.put("condition", scope.condition());
        scope.totalCondition().ifPresent(total -> map.put("totalCondition", total));
        Map<String, Object> operations = new LinkedHashMap<>();
        for (String key : scope.keys()) {
            operations.put(key, scope.operations(key).stream().map(Operation::toString).collect(Collectors.toList()));
        }
        map.put("operations", operations);
        List<Object> children = new ArrayList<>();
        for (Scope child : scope.children()) {
            children.add(toSerializableMap(child));
        }
        map.put("children", children);
        return map;
    }

    private static void appendStatements(StringBuilder out, List<Statement> statements, int depth) {
        String indent = "  ".repeat(depth);
        for (Statement statement : statements) {
            if (statement instanceof Statement.Conditional conditional) {
                out.append(indent).append("if ").append(conditional.condition()).append('\n');
                appendStatements(out, conditional.thenStatements(), depth + 1);
                if (conditional.hasElse()) {
                    out.append(indent).append("else\n");
                    appendStatements(out, conditional.elseStatements(), depth + 1);
                }
            } else if (statement instanceof Statement.Assignment assignment) {
                out.append(indent).append(assignment.key()).append(' ').append(assignment.operator().symbol())
                    .append(' ').append(assignment.values()).append('\n');
            } else {
                out.append(indent).append(statement).append('\n');
            }
        }
    }

    private static String toJson(Object value) {
        try {
            return WRITER.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize debug dump", ex);
        }
    }
}

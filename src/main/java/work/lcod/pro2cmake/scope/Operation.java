package work.lcod.pro2cmake.scope;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import work.lcod.pro2cmake.parser.AssignmentOperator;

/**
 * A single update recorded against a key. Resolving a key folds its operations,
 * in order, over an empty list.
 */
public record Operation(AssignmentOperator kind, List<String> values) {
    public Operation {
        Objects.requireNonNull(kind, "kind");
        values = List.copyOf(values);
    }

    public static Operation set(List<String> values) {
        return new Operation(AssignmentOperator.SET, values);
    }

    public static Operation add(List<String> values) {
        return new Operation(AssignmentOperator.ADD, values);
    }

    public static Operation uniqueAdd(List<String> values) {
        return new Operation(AssignmentOperator.UNIQUE_ADD, values);
    }

    public static Operation remove(List<String> values) {
        return new Operation(AssignmentOperator.REMOVE, values);
    }

    public List<String> apply(List<String> input) {
        return switch (kind) {
            case SET -> new ArrayList<>(values);
            case ADD -> {
                List<String> result = new ArrayList<>(input);
                result.addAll(values);
                yield result;
            }
            case UNIQUE_ADD -> {
                List<String> result = new ArrayList<>(input);
                for (String value : values) {
                    if (!result.contains(value)) {
                        result.add(value);
                    }
                }
                yield result;
            }
            case REMOVE -> {
                // Values that are not present are kept as "-value" markers.
                Set<String> present = new LinkedHashSet<>(input);
                Set<String> removed = new LinkedHashSet<>(values);
                List<String> result = new ArrayList<>();
                for (String value : input) {
                    if (!removed.contains(value)) {
                        result.add(value);
                    }
                }
                for (String value : values) {
                    if (!present.contains(value)) {
                        result.add("-" + value);
                    }
                }
                yield result;
            }
        };
    }

    @Override
    public String toString() {
        String prefix = switch (kind) {
            case SET -> "=";
            case ADD -> "+";
            case UNIQUE_ADD -> "*";
            case REMOVE -> "-";
        };
        if (values.isEmpty()) {
            return prefix + "(<NOTHING>)";
        }
        return prefix + values.stream()
            .map(value -> value.isEmpty() ? "<NONE>" : value)
            .collect(Collectors.joining("\", \"", "(\"", "\")"));
    }
}

package work.lcod.pro2cmake.parser;

import java.util.List;
import java.util.Objects;

/**
 * One parsed qmake statement. Consumers dispatch on the concrete record type.
 */
public interface Statement {

    /** {@code key op values}. */
    record Assignment(String key, AssignmentOperator operator, List<String> values) implements Statement {
        public Assignment {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(operator, "operator");
            values = List.copyOf(values);
        }
    }

    /**
     * {@code condition: ...} or {@code condition { ... } else { ... }}. The else
     * list is empty when no else branch was written.
     */
    record Conditional(String condition, List<Statement> thenStatements, List<Statement> elseStatements)
        implements Statement {
        public Conditional {
            Objects.requireNonNull(condition, "condition");
            thenStatements = List.copyOf(thenStatements);
            elseStatements = List.copyOf(elseStatements);
        }

        public boolean hasElse() {
            return !elseStatements.isEmpty();
        }
    }

    record Include(String path) implements Statement {
        public Include {
            Objects.requireNonNull(path, "path");
        }
    }

    record Load(String name) implements Statement {
        public Load {
            Objects.requireNonNull(name, "name");
        }
    }

    record Option(String name) implements Statement {
        public Option {
            Objects.requireNonNull(name, "name");
        }
    }

    /**
     * Function calls, {@code for} loops and test/replace function definitions.
     * Only the source text is kept, for debug dumps.
     */
    record Opaque(String kind, String text) implements Statement {
        public Opaque {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(text, "text");
        }
    }
}

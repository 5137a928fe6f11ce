package work.lcod.pro2cmake.condition;

import java.util.Objects;
import work.lcod.pro2cmake.scope.Scope;

/**
 * Computes the total condition of every scope in a tree: the simplified
 * conjunction of the scope's own condition with those of all its ancestors.
 */
public final class ConditionPropagator {
    private static final String NOT_PREFIX = "NOT ";

    private final ConditionSimplifier simplifier;

    public ConditionPropagator(ConditionSimplifier simplifier) {
        this.simplifier = Objects.requireNonNull(simplifier, "simplifier");
    }

    public void propagate(Scope root) {
        propagate(root, "", "");
    }

    /** Returns the effective condition of {@code scope}, used by a following {@code else} sibling. */
    private String propagate(Scope scope, String parentCombined, String previous) {
        String effective = scope.condition();
        if (scope.isElse()) {
            if (previous.isEmpty()) {
                throw new IllegalStateException("else branch without a preceding condition in " + scope);
            }
            effective = negate(previous);
        }

        String combined = effective;
        if (!parentCombined.isEmpty()) {
            combined = effective.isEmpty() ? parentCombined : wrap(parentCombined) + " AND " + wrap(effective);
        }
        scope.setTotalCondition(simplifier.simplify(combined));

        String previousSibling = "";
        for (Scope child : scope.children()) {
            previousSibling = propagate(child, combined, previousSibling);
        }
        return effective;
    }

    static boolean isSimple(String condition) {
        return !condition.contains(" ")
            || (condition.startsWith(NOT_PREFIX) && !condition.substring(NOT_PREFIX.length()).contains(" "));
    }

    static String negate(String condition) {
        if (condition.startsWith(NOT_PREFIX) && isSimple(condition)) {
            return condition.substring(NOT_PREFIX.length());
        }
        return isSimple(condition) ? NOT_PREFIX + condition : NOT_PREFIX + "(" + condition + ")";
    }

    private static String wrap(String condition) {
        return isSimple(condition) ? condition : "(" + condition + ")";
    }
}

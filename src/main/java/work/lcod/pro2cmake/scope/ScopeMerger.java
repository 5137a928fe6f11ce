package work.lcod.pro2cmake.scope;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses a propagated scope tree into one scope per distinct total condition.
 */
public final class ScopeMerger {
    public static final String ALWAYS = "ON";
    public static final String NEVER = "OFF";

    private ScopeMerger() {}

    /** Pre-order listing of {@code root} and all its descendants. */
    public static List<Scope> flatten(Scope root) {
        List<Scope> result = new ArrayList<>();
        collect(root, result);
        return result;
    }

    private static void collect(Scope scope, List<Scope> result) {
        result.add(scope);
        for (Scope child : scope.children()) {
            collect(child, result);
        }
    }

    /**
     * Drops scopes that can never apply and folds scopes sharing a total
     * condition into the first one encountered. Scopes must have been propagated.
     */
    public static List<Scope> merge(List<Scope> scopes) {
        Map<String, Scope> byCondition = new LinkedHashMap<>();
        for (Scope scope : scopes) {
            String total = scope.totalCondition()
                .orElseThrow(() -> new IllegalStateException("Scope " + scope + " has no total condition"));
            if (NEVER.equals(total)) {
                continue;
            }
            Scope first = byCondition.putIfAbsent(total, scope);
            if (first != null) {
                first.merge(scope);
            }
        }
        return new ArrayList<>(byCondition.values());
    }
}

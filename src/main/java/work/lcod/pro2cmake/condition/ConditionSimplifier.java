package work.lcod.pro2cmake.condition;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Simplifies canonical conditions so that equivalent scopes end up with the
 * same text and can be merged.
 *
 * <p>Generic laws (negation normal form, flattening, constant folding,
 * idempotence, complement, absorption) and the {@link PlatformHierarchy} rules
 * are applied alternately until the expression stops changing. Text that is not
 * a Boolean expression is returned unchanged.
 */
public final class ConditionSimplifier {
    private static final Comparator<BoolExpr> OPERAND_ORDER =
        Comparator.comparing((BoolExpr expr) -> expr.isCompound() ? 1 : 0).thenComparing(BoolExpr::sortKey);

    public String simplify(String condition) {
        String input = condition == null ? "" : condition.trim();
        String result;
        try {
            result = simplify(ExpressionParser.parse(input)).render();
        } catch (ConditionSyntaxException ex) {
            result = input;
        }
        return result.isEmpty() ? "ON" : result;
    }

    public BoolExpr simplify(BoolExpr expr) {
        BoolExpr current = normalize(expr);
        while (true) {
            BoolExpr next = normalize(PlatformHierarchy.apply(current));
            if (next.equals(current)) {
                return current;
            }
            current = next;
        }
    }

    static BoolExpr normalize(BoolExpr expr) {
        if (expr instanceof BoolExpr.Not not) {
            return negate(normalize(not.operand()));
        }
        if (expr instanceof BoolExpr.And and) {
            return normalizeAnd(and.operands());
        }
        if (expr instanceof BoolExpr.Or or) {
            return normalizeOr(or.operands());
        }
        return expr;
    }

    /** Negation of an already normalized expression, pushed down to the literals. */
    private static BoolExpr negate(BoolExpr expr) {
        if (expr instanceof BoolExpr.Const constant) {
            return constant.value() ? BoolExpr.OFF : BoolExpr.ON;
        }
        if (expr instanceof BoolExpr.Not not) {
            return not.operand();
        }
        if (expr instanceof BoolExpr.And and) {
            return normalizeOr(and.operands().stream().map(ConditionSimplifier::negate).toList());
        }
        if (expr instanceof BoolExpr.Or or) {
            return normalizeAnd(or.operands().stream().map(ConditionSimplifier::negate).toList());
        }
        return new BoolExpr.Not(expr);
    }

    private static BoolExpr normalizeAnd(List<BoolExpr> operands) {
        Set<BoolExpr> terms = new LinkedHashSet<>();
        for (BoolExpr operand : operands) {
            BoolExpr normalized = normalize(operand);
            if (normalized instanceof BoolExpr.And nested) {
                terms.addAll(nested.operands());
            } else if (normalized.equals(BoolExpr.OFF)) {
                return BoolExpr.OFF;
            } else if (!normalized.equals(BoolExpr.ON)) {
                terms.add(normalized);
            }
        }
        for (BoolExpr term : terms) {
            if (terms.contains(negate(term))) {
                return BoolExpr.OFF;
            }
        }

        boolean changed = false;
        List<BoolExpr> reduced = new ArrayList<>();
        for (BoolExpr term : terms) {
            if (term instanceof BoolExpr.Or or) {
                // a AND (NOT a OR b) -> a AND b
                List<BoolExpr> kept = or.operands().stream().filter(d -> !terms.contains(negate(d))).toList();
                if (kept.isEmpty()) {
                    return BoolExpr.OFF;
                }
                if (kept.size() != or.operands().size()) {
                    changed = true;
                    term = kept.size() == 1 ? kept.get(0) : new BoolExpr.Or(kept);
                }
            }
            reduced.add(term);
        }
        // a AND (a OR b) -> a
        List<BoolExpr> absorbed = new ArrayList<>();
        for (BoolExpr term : reduced) {
            if (!isAbsorbed(term, reduced, true)) {
                absorbed.add(term);
            } else {
                changed = true;
            }
        }
        if (changed) {
            return normalizeAnd(absorbed);
        }
        return build(absorbed, true);
    }

    private static BoolExpr normalizeOr(List<BoolExpr> operands) {
        Set<BoolExpr> terms = new LinkedHashSet<>();
        for (BoolExpr operand : operands) {
            BoolExpr normalized = normalize(operand);
            if (normalized instanceof BoolExpr.Or nested) {
                terms.addAll(nested.operands());
            } else if (normalized.equals(BoolExpr.ON)) {
                return BoolExpr.ON;
            } else if (!normalized.equals(BoolExpr.OFF)) {
                terms.add(normalized);
            }
        }
        for (BoolExpr term : terms) {
            if (terms.contains(negate(term))) {
                return BoolExpr.ON;
            }
        }

        boolean changed = false;
        List<BoolExpr> reduced = new ArrayList<>();
        for (BoolExpr term : terms) {
            if (term instanceof BoolExpr.And and) {
                // a OR (NOT a AND b) -> a OR b
                List<BoolExpr> kept = and.operands().stream().filter(c -> !terms.contains(negate(c))).toList();
                if (kept.isEmpty()) {
                    return BoolExpr.ON;
                }
                if (kept.size() != and.operands().size()) {
                    changed = true;
                    term = kept.size() == 1 ? kept.get(0) : new BoolExpr.And(kept);
                }
            }
            reduced.add(term);
        }
        // a OR (a AND b) -> a
        List<BoolExpr> absorbed = new ArrayList<>();
        for (BoolExpr term : reduced) {
            if (!isAbsorbed(term, reduced, false)) {
                absorbed.add(term);
            } else {
                changed = true;
            }
        }
        if (changed) {
            return normalizeOr(absorbed);
        }
        return build(absorbed, false);
    }

    /**
     * Inside an AND, {@code term} is redundant when another operand's disjuncts
     * are a subset of its own; inside an OR the same holds for conjuncts.
     */
    private static boolean isAbsorbed(BoolExpr term, List<BoolExpr> siblings, boolean insideAnd) {
        Set<BoolExpr> own = parts(term, insideAnd);
        if (own.size() < 2) {
            return false;
        }
        for (BoolExpr other : siblings) {
            if (other != term && !other.equals(term) && own.containsAll(parts(other, insideAnd))) {
                return true;
            }
        }
        return false;
    }

    private static Set<BoolExpr> parts(BoolExpr expr, boolean insideAnd) {
        if (insideAnd && expr instanceof BoolExpr.Or or) {
            return new LinkedHashSet<>(or.operands());
        }
        if (!insideAnd && expr instanceof BoolExpr.And and) {
            return new LinkedHashSet<>(and.operands());
        }
        return Set.of(expr);
    }

    private static BoolExpr build(List<BoolExpr> operands, boolean conjunction) {
        if (operands.isEmpty()) {
            return conjunction ? BoolExpr.ON : BoolExpr.OFF;
        }
        if (operands.size() == 1) {
            return operands.get(0);
        }
        List<BoolExpr> sorted = new ArrayList<>(operands);
        sorted.sort(OPERAND_ORDER);
        return conjunction ? new BoolExpr.And(sorted) : new BoolExpr.Or(sorted);
    }
}

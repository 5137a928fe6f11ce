package work.lcod.pro2cmake.condition;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Rewrite rules derived from which platform variables imply which others:
 * WIN32 and UNIX are complementary, every flavor implies its root.
 */
final class PlatformHierarchy {
    static final BoolExpr UNIX = new BoolExpr.Var("UNIX");
    static final BoolExpr WIN32 = new BoolExpr.Var("WIN32");

    static final List<String> APPLE_FLAVORS = List.of(
        "APPLE_OSX", "APPLE_UIKIT", "APPLE_IOS", "APPLE_TVOS", "APPLE_WATCHOS"
    );
    static final List<String> BSD_FLAVORS = List.of("APPLE", "FREEBSD", "OPENBSD", "NETBSD");
    static final List<String> UNIX_FLAVORS = unixFlavors();

    /** Applied in order: WIN32, APPLE, BSD, UNIX. */
    static final List<Family> FAMILIES = List.of(
        new Family("WIN32", List.of("WINRT")),
        new Family("APPLE", APPLE_FLAVORS),
        new Family("BSD", BSD_FLAVORS),
        new Family("UNIX", UNIX_FLAVORS)
    );

    record Family(String root, List<String> flavors) {
        BoolExpr rootExpr() {
            return new BoolExpr.Var(root);
        }
    }

    private PlatformHierarchy() {}

    private static List<String> unixFlavors() {
        List<String> flavors = new ArrayList<>();
        flavors.add("APPLE");
        flavors.addAll(APPLE_FLAVORS);
        flavors.add("BSD");
        flavors.addAll(BSD_FLAVORS);
        flavors.addAll(List.of("LINUX", "ANDROID", "ANDROID_EMBEDDED", "INTEGRITY", "VXWORKS", "QNX", "WASM"));
        return List.copyOf(new LinkedHashSet<>(flavors));
    }

    /** One bottom-up pass of the platform rules. The result may need normalizing. */
    static BoolExpr apply(BoolExpr expr) {
        if (expr instanceof BoolExpr.Not not) {
            BoolExpr operand = apply(not.operand());
            if (operand.equals(UNIX)) {
                return WIN32;
            }
            if (operand.equals(WIN32)) {
                return UNIX;
            }
            return new BoolExpr.Not(operand);
        }
        if (expr instanceof BoolExpr.And and) {
            return applyToAnd(applyAll(and.operands()));
        }
        if (expr instanceof BoolExpr.Or or) {
            return applyToOr(applyAll(or.operands()));
        }
        return expr;
    }

    private static BoolExpr applyToAnd(Set<BoolExpr> operands) {
        if (operands.contains(UNIX) && operands.contains(WIN32)) {
            return BoolExpr.OFF;
        }
        if (operands.contains(WIN32)) {
            for (String flavor : UNIX_FLAVORS) {
                if (operands.contains(new BoolExpr.Var(flavor))) {
                    return BoolExpr.OFF;
                }
            }
        }
        for (Family family : FAMILIES) {
            BoolExpr root = family.rootExpr();
            BoolExpr notRoot = new BoolExpr.Not(root);
            for (String name : family.flavors()) {
                BoolExpr flavor = new BoolExpr.Var(name);
                if (!operands.contains(flavor)) {
                    continue;
                }
                if (operands.contains(notRoot)) {
                    return BoolExpr.OFF;
                }
                operands.remove(root);
            }
        }
        return new BoolExpr.And(new ArrayList<>(operands));
    }

    private static BoolExpr applyToOr(Set<BoolExpr> operands) {
        if (operands.contains(UNIX) && operands.contains(WIN32)) {
            return BoolExpr.ON;
        }
        for (Family family : FAMILIES) {
            BoolExpr root = family.rootExpr();
            if (!operands.contains(root)) {
                continue;
            }
            for (String name : family.flavors()) {
                operands.remove(new BoolExpr.Var(name));
            }
        }
        return new BoolExpr.Or(new ArrayList<>(operands));
    }

    private static Set<BoolExpr> applyAll(List<BoolExpr> operands) {
        Set<BoolExpr> result = new LinkedHashSet<>();
        for (BoolExpr operand : operands) {
            result.add(apply(operand));
        }
        return result;
    }
}

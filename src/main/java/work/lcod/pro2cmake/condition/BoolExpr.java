package work.lcod.pro2cmake.condition;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Boolean expression over the canonical condition vocabulary.
 */
public interface BoolExpr {
    BoolExpr ON = new Const(true);
    BoolExpr OFF = new Const(false);

    /** CMake condition text; compound operands are parenthesized. */
    String render();

    default boolean isCompound() {
        return false;
    }

    /** Sort key used to order the operands of AND / OR deterministically. */
    default String sortKey() {
        return render();
    }

    record Const(boolean value) implements BoolExpr {
        @Override
        public String render() {
            return value ? "ON" : "OFF";
        }
    }

    record Var(String name) implements BoolExpr {
        public Var {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String render() {
            return name;
        }
    }

    record Not(BoolExpr operand) implements BoolExpr {
        public Not {
            Objects.requireNonNull(operand, "operand");
        }

        @Override
        public String render() {
            return "NOT " + wrap(operand);
        }

        @Override
        public String sortKey() {
            return operand.isCompound() ? render() : operand.sortKey() + " ";
        }
    }

    record And(List<BoolExpr> operands) implements BoolExpr {
        public And {
            operands = List.copyOf(operands);
        }

        @Override
        public String render() {
            return join(operands, " AND ");
        }

        @Override
        public boolean isCompound() {
            return true;
        }
    }

    record Or(List<BoolExpr> operands) implements BoolExpr {
        public Or {
            operands = List.copyOf(operands);
        }

        @Override
        public String render() {
            return join(operands, " OR ");
        }

        @Override
        public boolean isCompound() {
            return true;
        }
    }

    private static String wrap(BoolExpr expr) {
        return expr.isCompound() ? "(" + expr.render() + ")" : expr.render();
    }

    private static String join(List<BoolExpr> operands, String separator) {
        return operands.stream().map(BoolExpr::wrap).collect(Collectors.joining(separator));
    }
}

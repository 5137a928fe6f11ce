package work.lcod.pro2cmake.condition;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads canonical condition text into a {@link BoolExpr} tree.
 *
 * <p>Precedence: NOT &gt; AND &gt; OR, parentheses override. {@code TARGET x}
 * is a single atom. Any other token is a variable.
 */
final class ExpressionParser {
    private static final String TARGET = "TARGET";

    private final List<String> tokens;
    private int position;

    private ExpressionParser(List<String> tokens) {
        this.tokens = tokens;
    }

    static BoolExpr parse(String condition) {
        List<String> tokens = tokenize(condition);
        if (tokens.isEmpty()) {
            throw new ConditionSyntaxException("Empty condition");
        }
        ExpressionParser parser = new ExpressionParser(tokens);
        BoolExpr expr = parser.parseOr();
        if (parser.position < tokens.size()) {
            throw new ConditionSyntaxException(
                "Unexpected '" + tokens.get(parser.position) + "' in condition: " + condition
            );
        }
        return expr;
    }

    private static List<String> tokenize(String condition) {
        String padded = condition.replace("(", " ( ").replace(")", " ) ").trim();
        List<String> tokens = new ArrayList<>();
        if (padded.isEmpty()) {
            return tokens;
        }
        for (String token : padded.split("\\s+")) {
            tokens.add(token);
        }
        return tokens;
    }

    private BoolExpr parseOr() {
        List<BoolExpr> operands = new ArrayList<>();
        operands.add(parseAnd());
        while (match("OR")) {
            operands.add(parseAnd());
        }
        return operands.size() == 1 ? operands.get(0) : new BoolExpr.Or(operands);
    }

    private BoolExpr parseAnd() {
        List<BoolExpr> operands = new ArrayList<>();
        operands.add(parseNot());
        while (match("AND")) {
            operands.add(parseNot());
        }
        return operands.size() == 1 ? operands.get(0) : new BoolExpr.And(operands);
    }

    private BoolExpr parseNot() {
        if (match("NOT")) {
            return new BoolExpr.Not(parseNot());
        }
        return parsePrimary();
    }

    private BoolExpr parsePrimary() {
        String token = next();
        switch (token) {
            case "(" -> {
                BoolExpr inner = parseOr();
                if (!match(")")) {
                    throw new ConditionSyntaxException("Missing ')'");
                }
                return inner;
            }
            case "ON" -> {
                return BoolExpr.ON;
            }
            case "OFF" -> {
                return BoolExpr.OFF;
            }
            case ")", "AND", "OR", "NOT" -> throw new ConditionSyntaxException("Unexpected '" + token + "'");
            case TARGET -> {
                String name = next();
                if (isReserved(name)) {
                    throw new ConditionSyntaxException("TARGET without a name");
                }
                return new BoolExpr.Var(TARGET + " " + name);
            }
            default -> {
                return new BoolExpr.Var(token);
            }
        }
    }

    private static boolean isReserved(String token) {
        return switch (token) {
            case "(", ")", "AND", "OR", "NOT", "ON", "OFF", TARGET -> true;
            default -> false;
        };
    }

    private boolean match(String expected) {
        if (position < tokens.size() && tokens.get(position).equals(expected)) {
            position++;
            return true;
        }
        return false;
    }

    private String next() {
        if (position >= tokens.size()) {
            throw new ConditionSyntaxException("Unexpected end of condition");
        }
        return tokens.get(position++);
    }
}

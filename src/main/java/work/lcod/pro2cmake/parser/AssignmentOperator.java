package work.lcod.pro2cmake.parser;

/**
 * The four qmake assignment operators.
 */
public enum AssignmentOperator {
    SET("="),
    ADD("+="),
    UNIQUE_ADD("*="),
    REMOVE("-=");

    private final String symbol;

    AssignmentOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}

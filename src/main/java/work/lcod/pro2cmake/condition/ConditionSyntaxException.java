package work.lcod.pro2cmake.condition;

/**
 * Raised when a canonical condition cannot be read as a Boolean expression,
 * e.g. because it still contains unmapped qmake test functions.
 */
public final class ConditionSyntaxException extends RuntimeException {
    public ConditionSyntaxException(String message) {
        super(message);
    }
}

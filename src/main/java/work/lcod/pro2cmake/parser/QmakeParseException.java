package work.lcod.pro2cmake.parser;

/**
 * Raised when a project file does not match the qmake grammar. Carries the
 * 1-based location of the furthest point the parser could reach.
 */
public class QmakeParseException extends RuntimeException {
    private final String origin;
    private final int line;
    private final int column;
    private final String sourceLine;
    private final String reason;

    public QmakeParseException(String origin, int line, int column, String sourceLine, String reason) {
        super(origin + ":" + line + ":" + column + ": " + reason);
        this.origin = origin;
        this.line = line;
        this.column = column;
        this.sourceLine = sourceLine;
        this.reason = reason;
    }

    public String getOrigin() {
        return origin;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getSourceLine() {
        return sourceLine;
    }

    public String getReason() {
        return reason;
    }

    /** The offending line with a caret under the failing column. */
    public String excerpt() {
        return sourceLine + System.lineSeparator() + " ".repeat(Math.max(0, column - 1)) + "^";
    }
}

package work.lcod.pro2cmake.parser;

/**
 * Construction-time switches for {@link QmakeParser}.
 *
 * @param debug trace every grammar rule attempt at DEBUG level
 */
public record ParserOptions(boolean debug) {
    public static ParserOptions defaults() {
        return new ParserOptions(false);
    }
}

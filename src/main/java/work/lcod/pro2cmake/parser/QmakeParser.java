package work.lcod.pro2cmake.parser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import work.lcod.pro2cmake.shared.Diagnostics;

/**
 * Recursive descent parser for qmake project files.
 *
 * <p>The grammar is parsed directly on characters with backtracking: a line is
 * first tried as a plain statement and, failing that, as a conditional scope.
 * Errors are reported at the furthest offset any alternative reached, together
 * with what was expected there.
 *
 * <pre>
 * file        := (eol | statement eol | scope)*
 * statement   := load | include | option | define | for | call | assignment
 * scope       := condition (':' (scope | block | statement eol) | block) else?
 * else        := 'else' (':' (scope | statement eol) | block)
 * block       := '{' eol? (eol | statement eol | scope)* statement? '}' eol?
 * </pre>
 */
public final class QmakeParser {
    private static final String CONDITION_STOP = ":{=}#\\\n";
    private static final String INCLUDE_STOP = ":{=}#)\n";
    private static final String LITERAL_EXCLUDED = "$#{}()";
    private static final String IDENTIFIER_EXTRA = "_-./";

    private final ParserOptions options;
    private final Diagnostics diagnostics;

    public QmakeParser(ParserOptions options, Diagnostics diagnostics) {
        this.options = Objects.requireNonNull(options, "options");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public List<Statement> parseFile(Path file) {
        diagnostics.info("Parsing \"%s\"...", file);
        String source;
        try {
            source = Files.readString(file);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read project file: " + file, ex);
        }
        return parse(source, file.toString());
    }

    public List<Statement> parse(String source, String origin) {
        Objects.requireNonNull(source, "source");
        return new Session(source.replace("\r\n", "\n"), origin == null ? "<input>" : origin).parseAll();
    }

    private final class Session {
        private final String text;
        private final String origin;
        private int pos;
        private int furthest = -1;
        private final Set<String> expectations = new LinkedHashSet<>();

        Session(String text, String origin) {
            this.text = text;
            this.origin = origin;
        }

        List<Statement> parseAll() {
            List<Statement> statements = new ArrayList<>();
            while (true) {
                skipSpace();
                if (atEnd()) {
                    return statements;
                }
                int mark = pos;
                if (lineEnd(false)) {
                    continue;
                }
                Statement statement = statementOrScope();
                if (statement == null) {
                    pos = mark;
                    expect("statement");
                    throw failure();
                }
                statements.add(statement);
            }
        }

        private Statement statementOrScope() {
            int mark = pos;
            Statement statement = statementLine();
            if (statement != null) {
                return statement;
            }
            pos = mark;
            statement = scope();
            if (statement != null) {
                return statement;
            }
            pos = mark;
            return null;
        }

        private Statement statementLine() {
            int mark = pos;
            Statement statement = statement();
            if (statement == null || !lineEnd(true)) {
                pos = mark;
                return null;
            }
            return statement;
        }

        private Statement statement() {
            trace("Statement");
            int mark = pos;
            List<Supplier<Statement>> alternatives = List.of(
                this::load,
                this::include,
                this::option,
                this::functionDefinition,
                this::forLoop,
                this::functionCall,
                this::assignment
            );
            for (Supplier<Statement> alternative : alternatives) {
                pos = mark;
                Statement statement = alternative.get();
                if (statement != null) {
                    return statement;
                }
            }
            pos = mark;
            return null;
        }

        private Statement load() {
            skipSpace();
            if (!keyword("load")) {
                return null;
            }
            String name = parenthesizedIdentifier();
            return name == null ? null : new Statement.Load(name);
        }

        private Statement option() {
            skipSpace();
            if (!keyword("option")) {
                return null;
            }
            String name = parenthesizedIdentifier();
            return name == null ? null : new Statement.Option(name);
        }

        private Statement include() {
            skipSpace();
            if (!keyword("include")) {
                return null;
            }
            skipSpace();
            if (!literal('(')) {
                expect("'('");
                return null;
            }
            skipSpace();
            int start = pos;
            while (!atEnd() && INCLUDE_STOP.indexOf(peek()) < 0) {
                pos++;
            }
            String path = text.substring(start, pos).trim();
            if (path.isEmpty()) {
                expect("include path");
                return null;
            }
            if (!literal(')')) {
                expect("')'");
                return null;
            }
            return new Statement.Include(path);
        }

        private Statement functionDefinition() {
            skipSpace();
            int start = pos;
            String kind;
            if (keyword("defineTest")) {
                kind = "defineTest";
            } else if (keyword("defineReplace")) {
                kind = "defineReplace";
            } else {
                return null;
            }
            if (parenthesizedIdentifier() == null) {
                return null;
            }
            skipSpace();
            if (!nested('{', '}', true)) {
                return null;
            }
            return new Statement.Opaque(kind, text.substring(start, pos));
        }

        private Statement forLoop() {
            skipSpace();
            int start = pos;
            if (!keyword("for")) {
                return null;
            }
            skipSpace();
            if (!nested('(', ')', true)) {
                return null;
            }
            skipSpace();
            if (!nested('{', '}', false)) {
                return null;
            }
            return new Statement.Opaque("for", text.substring(start, pos));
        }

        private Statement functionCall() {
            skipSpace();
            int start = pos;
            if (identifier() == null) {
                return null;
            }
            skipSpace();
            if (!nested('(', ')', true)) {
                return null;
            }
            return new Statement.Opaque("call", text.substring(start, pos));
        }

        private Statement assignment() {
            skipSpace();
            String key = identifier();
            if (key == null) {
                expect("identifier");
                return null;
            }
            skipSpace();
            AssignmentOperator operator = operator();
            if (operator == null) {
                expect("assignment operator");
                return null;
            }
            return new Statement.Assignment(key, operator, values());
        }

        private AssignmentOperator operator() {
            for (AssignmentOperator candidate : List.of(
                AssignmentOperator.ADD,
                AssignmentOperator.REMOVE,
                AssignmentOperator.UNIQUE_ADD,
                AssignmentOperator.SET
            )) {
                if (text.startsWith(candidate.symbol(), pos)) {
                    pos += candidate.symbol().length();
                    return candidate;
                }
            }
            return null;
        }

        private List<String> values() {
            List<String> values = new ArrayList<>();
            while (true) {
                skipSpace();
                int mark = pos;
                String value = quoted();
                if (value == null) {
                    pos = mark;
                    value = substitutionValue();
                }
                if (value == null) {
                    pos = mark;
                    return values;
                }
                values.add(value);
            }
        }

        private String quoted() {
            if (peek() != '"') {
                return null;
            }
            pos++;
            StringBuilder value = new StringBuilder();
            while (!atEnd() && peek() != '\n') {
                char c = text.charAt(pos++);
                if (c == '"') {
                    return value.toString();
                }
                if (c == '\\' && !atEnd() && peek() != '\n') {
                    char escaped = text.charAt(pos++);
                    value.append(switch (escaped) {
                        case 't' -> '\t';
                        case 'n' -> '\n';
                        default -> escaped;
                    });
                } else {
                    value.append(c);
                }
            }
            expect("closing '\"'");
            return null;
        }

        private String substitutionValue() {
            StringBuilder value = new StringBuilder();
            while (!atEnd()) {
                char c = peek();
                if (c == '$') {
                    int mark = pos;
                    String substitution = substitution();
                    if (substitution != null) {
                        value.append(substitution);
                    } else {
                        pos = mark + 1;
                        value.append('$');
                    }
                    continue;
                }
                if (!isLiteralChar(c) || atContinuation()) {
                    break;
                }
                value.append(c);
                pos++;
            }
            return value.length() == 0 ? null : value.toString();
        }

        /** {@code $$NAME[(..)]}, {@code $${NAME[(..)]}}, {@code $$[NAME]}, {@code $(NAME)}, {@code ${NAME}}. */
        private String substitution() {
            int start = pos;
            pos++;
            if (literal('$')) {
                if (literal('{')) {
                    if (!requireIdentifier() || !optionalArguments() || !require('}')) {
                        return null;
                    }
                } else if (literal('[')) {
                    if (!requireIdentifier() || !require(']')) {
                        return null;
                    }
                } else if (!requireIdentifier() || !optionalArguments()) {
                    return null;
                }
            } else if (literal('(')) {
                if (!requireIdentifier() || !require(')')) {
                    return null;
                }
            } else if (literal('{')) {
                if (!requireIdentifier() || !require('}')) {
                    return null;
                }
            } else {
                return null;
            }
            return text.substring(start, pos);
        }

        private boolean optionalArguments() {
            return peek() != '(' || nested('(', ')', true);
        }

        private boolean requireIdentifier() {
            if (identifier() == null) {
                expect("identifier");
                return false;
            }
            return true;
        }

        private boolean require(char c) {
            if (!literal(c)) {
                expect("'" + c + "'");
                return false;
            }
            return true;
        }

        private Statement scope() {
            trace("Scope");
            int mark = pos;
            String condition = condition();
            if (condition == null) {
                pos = mark;
                return null;
            }
            skipSpace();
            List<Statement> thenStatements;
            if (literal(':')) {
                thenStatements = singleLineBody(true);
            } else {
                expect("':'");
                thenStatements = block();
            }
            if (thenStatements == null) {
                pos = mark;
                return null;
            }
            return new Statement.Conditional(condition, thenStatements, elseBranch());
        }

        private List<Statement> singleLineBody(boolean allowBlock) {
            int mark = pos;
            Statement nested = scope();
            if (nested != null) {
                return List.of(nested);
            }
            pos = mark;
            if (allowBlock) {
                List<Statement> block = block();
                if (block != null) {
                    return block;
                }
                pos = mark;
            }
            Statement statement = statementLine();
            if (statement != null) {
                return List.of(statement);
            }
            pos = mark;
            return null;
        }

        private List<Statement> elseBranch() {
            int mark = pos;
            skipSpace();
            if (!keyword("else")) {
                pos = mark;
                return List.of();
            }
            trace("Else");
            skipSpace();
            List<Statement> body = literal(':') ? singleLineBody(false) : block();
            if (body == null) {
                pos = mark;
                return List.of();
            }
            return body;
        }

        private List<Statement> block() {
            trace("Block");
            int mark = pos;
            skipSpace();
            if (!literal('{')) {
                expect("'{'");
                pos = mark;
                return null;
            }
            lineEnd(false);
            List<Statement> statements = new ArrayList<>();
            while (true) {
                skipSpace();
                if (atEnd()) {
                    expect("'}'");
                    pos = mark;
                    return null;
                }
                if (peek() == '}') {
                    break;
                }
                int lineStart = pos;
                if (lineEnd(false)) {
                    continue;
                }
                Statement statement = statementOrScope();
                if (statement != null) {
                    statements.add(statement);
                    continue;
                }
                pos = lineStart;
                statement = statement();
                skipSpace();
                if (statement == null || peek() != '}') {
                    expect("'}'");
                    pos = mark;
                    return null;
                }
                statements.add(statement);
                break;
            }
            pos++;
            lineEnd(false);
            return statements;
        }

        private String condition() {
            skipSpace();
            int start = pos;
            while (!atEnd() && CONDITION_STOP.indexOf(peek()) < 0) {
                pos++;
            }
            String condition = text.substring(start, pos).trim().replaceAll("\\s+", " ");
            if (condition.isEmpty()) {
                expect("condition");
                return null;
            }
            return condition;
        }

        private String parenthesizedIdentifier() {
            skipSpace();
            if (!require('(')) {
                return null;
            }
            skipSpace();
            String name = identifier();
            if (name == null) {
                expect("identifier");
                return null;
            }
            skipSpace();
            return require(')') ? name : null;
        }

        /** Consumes a balanced {@code open ... close} group, optionally skipping quoted strings. */
        private boolean nested(char open, char close, boolean honourQuotes) {
            if (peek() != open) {
                expect("'" + open + "'");
                return false;
            }
            int depth = 0;
            while (!atEnd()) {
                char c = text.charAt(pos);
                if (honourQuotes && c == '"') {
                    int closing = closingQuote(pos + 1);
                    if (closing > 0) {
                        pos = closing + 1;
                        continue;
                    }
                }
                pos++;
                if (c == open) {
                    depth++;
                } else if (c == close) {
                    depth--;
                    if (depth == 0) {
                        return true;
                    }
                }
            }
            expect("'" + close + "'");
            return false;
        }

        private int closingQuote(int from) {
            for (int i = from; i < text.length(); i++) {
                char c = text.charAt(i);
                if (c == '\n') {
                    return -1;
                }
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    return i;
                }
            }
            return -1;
        }

        private String identifier() {
            if (atEnd()) {
                return null;
            }
            char first = peek();
            if (!isAsciiLetter(first) && first != '_') {
                return null;
            }
            int start = pos;
            pos++;
            while (!atEnd() && isIdentifierBody(peek())) {
                pos++;
            }
            return text.substring(start, pos);
        }

        private boolean keyword(String word) {
            if (!text.startsWith(word, pos)) {
                return false;
            }
            int end = pos + word.length();
            if (end < text.length() && isIdentifierBody(text.charAt(end))) {
                return false;
            }
            pos = end;
            return true;
        }

        /** Optional comment followed by a line break or the end of input. */
        private boolean lineEnd(boolean required) {
            int mark = pos;
            skipSpace();
            if (peek() == '#') {
                while (!atEnd() && peek() != '\n') {
                    pos++;
                }
            }
            if (atEnd()) {
                return true;
            }
            if (peek() == '\n') {
                pos++;
                return true;
            }
            if (required) {
                expect("end of line");
            }
            pos = mark;
            return false;
        }

        private void skipSpace() {
            while (!atEnd()) {
                char c = peek();
                if (c == ' ' || c == '\t' || c == '\r') {
                    pos++;
                } else if (atContinuation()) {
                    pos += 2;
                } else {
                    return;
                }
            }
        }

        private boolean atContinuation() {
            return peek() == '\\' && pos + 1 < text.length() && text.charAt(pos + 1) == '\n';
        }

        private boolean literal(char c) {
            if (peek() == c) {
                pos++;
                return true;
            }
            return false;
        }

        private char peek() {
            return atEnd() ? '\0' : text.charAt(pos);
        }

        private boolean atEnd() {
            return pos >= text.length();
        }

        private void expect(String what) {
            if (pos > furthest) {
                furthest = pos;
                expectations.clear();
            }
            if (pos == furthest) {
                expectations.add(what);
            }
        }

        private void trace(String rule) {
            if (options.debug()) {
                diagnostics.debug("Match %s at %s:%d:%d", rule, origin, lineOf(pos), columnOf(pos));
            }
        }

        private QmakeParseException failure() {
            int offset = Math.max(furthest, pos);
            String reason = expectations.isEmpty()
                ? "unexpected input"
                : "expected " + String.join(" or ", expectations);
            return new QmakeParseException(origin, lineOf(offset), columnOf(offset), lineText(offset), reason);
        }

        private int lineOf(int offset) {
            int line = 1;
            for (int i = 0; i < offset && i < text.length(); i++) {
                if (text.charAt(i) == '\n') {
                    line++;
                }
            }
            return line;
        }

        private int columnOf(int offset) {
            return offset - text.lastIndexOf('\n', offset - 1);
        }

        private String lineText(int offset) {
            int start = text.lastIndexOf('\n', offset - 1) + 1;
            int end = text.indexOf('\n', offset);
            return text.substring(start, end < 0 ? text.length() : end);
        }
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isIdentifierBody(char c) {
        return isAsciiLetter(c) || (c >= '0' && c <= '9') || IDENTIFIER_EXTRA.indexOf(c) >= 0;
    }

    private static boolean isLiteralChar(char c) {
        return !Character.isWhitespace(c) && !Character.isISOControl(c) && LITERAL_EXCLUDED.indexOf(c) < 0;
    }
}

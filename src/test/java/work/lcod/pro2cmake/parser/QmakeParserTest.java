package work.lcod.pro2cmake.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.pro2cmake.support.ConverterTestSupport;

class QmakeParserTest {
    @Test
    void parsesAssignmentsWithEveryOperator() {
        var statements = ConverterTestSupport.parse("A = 1\nB += 2 3\nC -= 4\nD *= 5\n");
        assertEquals(List.of(
            new Statement.Assignment("A", AssignmentOperator.SET, List.of("1")),
            new Statement.Assignment("B", AssignmentOperator.ADD, List.of("2", "3")),
            new Statement.Assignment("C", AssignmentOperator.REMOVE, List.of("4")),
            new Statement.Assignment("D", AssignmentOperator.UNIQUE_ADD, List.of("5"))
        ), statements);
    }

    @Test
    void emptyAssignmentHasNoValues() {
        var statements = ConverterTestSupport.parse("QT =\n");
        assertEquals(List.of(new Statement.Assignment("QT", AssignmentOperator.SET, List.of())), statements);
    }

    @Test
    void joinsContinuationLines() {
        var statements = ConverterTestSupport.parse("SOURCES = a.cpp \\\n    b.cpp \\\n    c.cpp\n");
        var assignment = (Statement.Assignment) statements.get(0);
        assertEquals(List.of("a.cpp", "b.cpp", "c.cpp"), assignment.values());
        assertEquals(1, statements.size());
    }

    @Test
    void skipsComments() {
        var statements = ConverterTestSupport.parse("# header\n\nA = 1 # trailing\n   # indented\n");
        assertEquals(List.of(new Statement.Assignment("A", AssignmentOperator.SET, List.of("1"))), statements);
    }

    @Test
    void keepsSubstitutionsInsideValues() {
        var statements = ConverterTestSupport.parse(
            "INCLUDEPATH += $$PWD/include $${QT_DIR}/x $$[QT_INSTALL_HEADERS] $(HOME) ${VAR} $$join(A, B)\n"
        );
        var assignment = (Statement.Assignment) statements.get(0);
        assertEquals(
            List.of("$$PWD/include", "$${QT_DIR}/x", "$$[QT_INSTALL_HEADERS]", "$(HOME)", "${VAR}", "$$join(A, B)"),
            assignment.values()
        );
    }

    @Test
    void unquotesQuotedValues() {
        var statements = ConverterTestSupport.parse("DEFINES += \"FOO=\\\"bar\\\"\" plain\n");
        var assignment = (Statement.Assignment) statements.get(0);
        assertEquals(List.of("FOO=\"bar\"", "plain"), assignment.values());
    }

    @Test
    void parsesLoadIncludeAndOption() {
        var statements = ConverterTestSupport.parse("load(qt_module)\ninclude( ../common.pri )\noption(host_build)\n");
        assertEquals(List.of(
            new Statement.Load("qt_module"),
            new Statement.Include("../common.pri"),
            new Statement.Option("host_build")
        ), statements);
    }

    @Test
    void keepsCallsLoopsAndDefinitionsAsOpaque() {
        var statements = ConverterTestSupport.parse(
            "message(\"hello ) world\")\n"
                + "for(f, FILES) {\n    message($$f)\n}\n"
                + "defineTest(check) {\n    return(true)\n}\n"
                + "defineReplace(names) {\n    return($$1)\n}\n"
        );
        assertEquals(4, statements.size());
        assertEquals(new Statement.Opaque("call", "message(\"hello ) world\")"), statements.get(0));
        assertEquals("for", ((Statement.Opaque) statements.get(1)).kind());
        assertEquals("defineTest", ((Statement.Opaque) statements.get(2)).kind());
        assertEquals("defineReplace", ((Statement.Opaque) statements.get(3)).kind());
    }

    @Test
    void parsesSingleLineScopeWithElse() {
        var statements = ConverterTestSupport.parse("win32: SOURCES += w.cpp\nelse: SOURCES += u.cpp\n");
        assertEquals(1, statements.size());
        var conditional = assertInstanceOf(Statement.Conditional.class, statements.get(0));
        assertEquals("win32", conditional.condition());
        assertEquals(
            List.of(new Statement.Assignment("SOURCES", AssignmentOperator.ADD, List.of("w.cpp"))),
            conditional.thenStatements()
        );
        assertEquals(
            List.of(new Statement.Assignment("SOURCES", AssignmentOperator.ADD, List.of("u.cpp"))),
            conditional.elseStatements()
        );
    }

    @Test
    void parsesBlockScopeWithElseBlock() {
        var statements = ConverterTestSupport.parse(
            "unix {\n    A = 1\n    B = 2\n} else {\n    C = 3\n}\nD = 4\n"
        );
        assertEquals(2, statements.size());
        var conditional = (Statement.Conditional) statements.get(0);
        assertEquals("unix", conditional.condition());
        assertEquals(2, conditional.thenStatements().size());
        assertEquals(1, conditional.elseStatements().size());
        assertEquals(new Statement.Assignment("D", AssignmentOperator.SET, List.of("4")), statements.get(1));
    }

    @Test
    void nestsChainedSingleLineConditions() {
        var statements = ConverterTestSupport.parse("unix:!mac: A = 1\n");
        var outer = (Statement.Conditional) statements.get(0);
        assertEquals("unix", outer.condition());
        var inner = (Statement.Conditional) outer.thenStatements().get(0);
        assertEquals("!mac", inner.condition());
        assertEquals(new Statement.Assignment("A", AssignmentOperator.SET, List.of("1")), inner.thenStatements().get(0));
    }

    @Test
    void treatsFunctionCallFollowedByBlockAsScope() {
        var statements = ConverterTestSupport.parse("CONFIG(debug, debug|release) {\n    A = 1\n}\n");
        var conditional = assertInstanceOf(Statement.Conditional.class, statements.get(0));
        assertEquals("CONFIG(debug, debug|release)", conditional.condition());
    }

    @Test
    void collapsesWhitespaceInConditions() {
        var statements = ConverterTestSupport.parse("contains(A,  b)   :  X = 1\n");
        assertEquals("contains(A, b)", ((Statement.Conditional) statements.get(0)).condition());
    }

    @Test
    void acceptsFinalStatementBeforeClosingBrace() {
        var statements = ConverterTestSupport.parse("win32 { A = 1 }\n");
        var conditional = (Statement.Conditional) statements.get(0);
        assertEquals(List.of(new Statement.Assignment("A", AssignmentOperator.SET, List.of("1"))), conditional.thenStatements());
    }

    @Test
    void reportsLocationOfUnexpectedInput() {
        var ex = assertThrows(QmakeParseException.class, () -> ConverterTestSupport.parse("A = 1\n}\n"));
        assertEquals("test.pro", ex.getOrigin());
        assertEquals(2, ex.getLine());
        assertEquals(1, ex.getColumn());
        assertEquals("}", ex.getSourceLine());
        assertTrue(ex.getMessage().startsWith("test.pro:2:1: expected"), ex.getMessage());
    }

    @Test
    void rejectsUnclosedSubstitution() {
        var ex = assertThrows(QmakeParseException.class, () -> ConverterTestSupport.parse("A = $${FOO\n"));
        assertEquals(1, ex.getLine());
        assertEquals(11, ex.getColumn());
        assertTrue(ex.getReason().contains("'}'"), ex.getReason());
    }

    @Test
    void normalizesWindowsLineEndings() {
        var statements = ConverterTestSupport.parse("A = 1\r\nB = 2\r\n");
        assertEquals(2, statements.size());
    }
}

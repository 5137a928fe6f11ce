package work.lcod.pro2cmake.condition;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

class ConditionSimplifierTest {
    private final ConditionSimplifier simplifier = new ConditionSimplifier();

    @Test
    void complementOfUnixAndWin32() {
        assertEquals("WIN32", simplifier.simplify("NOT UNIX"));
        assertEquals("UNIX", simplifier.simplify("NOT WIN32"));
    }

    @Test
    void reducesFlavorsAgainstTheirRoot() {
        assertEquals("APPLE_IOS", simplifier.simplify("APPLE AND APPLE_IOS"));
        assertEquals("APPLE", simplifier.simplify("APPLE OR APPLE_IOS"));
        assertEquals("OFF", simplifier.simplify("NOT APPLE AND APPLE_IOS"));
        assertEquals("LINUX", simplifier.simplify("UNIX AND LINUX"));
        assertEquals("UNIX", simplifier.simplify("LINUX OR UNIX"));
        assertEquals("WINRT", simplifier.simplify("WIN32 AND WINRT"));
        assertEquals("FREEBSD", simplifier.simplify("BSD AND FREEBSD"));
    }

    @Test
    void contradictoryPlatformsCancelOut() {
        assertEquals("OFF", simplifier.simplify("UNIX AND WIN32"));
        assertEquals("ON", simplifier.simplify("UNIX OR WIN32"));
        assertEquals("OFF", simplifier.simplify("WIN32 AND ANDROID"));
        assertEquals("OFF", simplifier.simplify("WIN32 AND (UNIX OR LINUX)"));
        assertEquals("OFF", simplifier.simplify("NOT UNIX AND LINUX"));
    }

    @Test
    void appliesGenericLaws() {
        assertEquals("OFF", simplifier.simplify("A AND NOT A"));
        assertEquals("ON", simplifier.simplify("A OR NOT A"));
        assertEquals("A", simplifier.simplify("A AND A"));
        assertEquals("A", simplifier.simplify("NOT NOT A"));
        assertEquals("A", simplifier.simplify("A AND (A OR B)"));
        assertEquals("A", simplifier.simplify("A OR (A AND B)"));
        assertEquals("A AND B", simplifier.simplify("A AND (NOT A OR B)"));
        assertEquals("A OR B", simplifier.simplify("A OR (NOT A AND B)"));
        assertEquals("A", simplifier.simplify("ON AND A"));
        assertEquals("OFF", simplifier.simplify("OFF AND A"));
        assertEquals("ON", simplifier.simplify("ON OR A"));
    }

    @Test
    void pushesNegationsToTheLeaves() {
        assertEquals("NOT A OR NOT B", simplifier.simplify("NOT (A AND B)"));
        assertEquals("NOT A AND NOT B", simplifier.simplify("NOT (A OR B)"));
    }

    @Test
    void ordersOperandsDeterministically() {
        assertEquals("A AND B AND C", simplifier.simplify("C AND (B AND A)"));
        assertEquals("A AND NOT B", simplifier.simplify("NOT B AND A"));
        assertEquals("C AND (A OR B)", simplifier.simplify("(B OR A) AND C"));
    }

    @Test
    void targetChecksStayAtomic() {
        assertEquals("TARGET Qt::Gui", simplifier.simplify("TARGET Qt::Gui AND TARGET Qt::Gui"));
        assertEquals("NOT TARGET Qt::Gui", simplifier.simplify("NOT TARGET Qt::Gui"));
    }

    @Test
    void emptyConditionIsAlwaysTrue() {
        assertEquals("ON", simplifier.simplify(""));
        assertEquals("ON", simplifier.simplify("   "));
        assertEquals("ON", simplifier.simplify((String) null));
    }

    @Test
    void fallsBackToInputWhenNotAnExpression() {
        assertEquals("CONFIG(debug, debug OR release)", simplifier.simplify(" CONFIG(debug, debug OR release) "));
        assertEquals("A AND", simplifier.simplify("A AND"));
        assertEquals("(A", simplifier.simplify("(A"));
    }

    @Test
    void isIdempotent() {
        for (String input : List.of(
            "UNIX AND NOT LINUX",
            "(A OR B) AND (C OR NOT A)",
            "NOT (APPLE AND NOT APPLE_OSX) OR QT_FEATURE_x",
            "WIN32 OR (UNIX AND NOT APPLE)",
            "TARGET Qt::Network AND NOT (MSVC OR CLANG)",
            "A AND (B OR (C AND NOT D))"
        )) {
            String once = simplifier.simplify(input);
            assertEquals(once, simplifier.simplify(once), input);
        }
    }
}

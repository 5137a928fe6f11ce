package work.lcod.pro2cmake.condition;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import work.lcod.pro2cmake.scope.Scope;
import work.lcod.pro2cmake.support.ConverterTestSupport;

class ConditionPropagatorTest {
    private final ConditionPropagator propagator = new ConditionPropagator(new ConditionSimplifier());

    @Test
    void rootIsUnconditional() {
        var root = ConverterTestSupport.buildScope("proj.pro", "A = 1\n");
        propagator.propagate(root);
        assertEquals("ON", root.totalCondition().orElseThrow());
    }

    @Test
    void elseNegatesPreviousSibling() {
        var root = ConverterTestSupport.buildScope("proj.pro", "win32: A = 1\nelse: A = 2\n");
        propagator.propagate(root);
        assertEquals("WIN32", root.children().get(0).totalCondition().orElseThrow());
        assertEquals("UNIX", root.children().get(1).totalCondition().orElseThrow());
    }

    @Test
    void combinesWithAncestors() {
        var root = ConverterTestSupport.buildScope(
            "proj.pro",
            "unix {\n    linux: A = 1\n    else: B = 2\n}\n"
        );
        propagator.propagate(root);
        var unix = root.children().get(0);
        assertEquals("UNIX", unix.totalCondition().orElseThrow());
        assertEquals("LINUX", unix.children().get(0).totalCondition().orElseThrow());
        assertEquals("NOT LINUX AND UNIX", unix.children().get(1).totalCondition().orElseThrow());
    }

    @Test
    void elseOfCompoundConditionIsParenthesized() {
        var root = ConverterTestSupport.buildScope("proj.pro", "linux|android: A = 1\nelse: A = 2\n");
        propagator.propagate(root);
        assertEquals("ANDROID OR LINUX", root.children().get(0).totalCondition().orElseThrow());
        assertEquals("NOT ANDROID AND NOT LINUX", root.children().get(1).totalCondition().orElseThrow());
    }

    @Test
    void elseWithoutPredecessorFails() {
        var root = Scope.root("proj.pro");
        new Scope(root, "proj.pro", Scope.ELSE, Scope.ELSE, "");
        assertThrows(IllegalStateException.class, () -> propagator.propagate(root));
    }

    @Test
    void negatesConditionText() {
        assertEquals("NOT A", ConditionPropagator.negate("A"));
        assertEquals("A", ConditionPropagator.negate("NOT A"));
        assertEquals("NOT (A AND B)", ConditionPropagator.negate("A AND B"));
        assertEquals("NOT (NOT A OR B)", ConditionPropagator.negate("NOT A OR B"));
    }
}

package work.lcod.pro2cmake.scope;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.pro2cmake.condition.ConditionPropagator;
import work.lcod.pro2cmake.condition.ConditionSimplifier;
import work.lcod.pro2cmake.support.ConverterTestSupport;

class ScopeMergerTest {
    private final ConditionPropagator propagator = new ConditionPropagator(new ConditionSimplifier());

    @Test
    void flattensInPreOrder() {
        var root = ConverterTestSupport.buildScope("proj.pro", "win32 {\n    A = 1\n    msvc: B = 2\n}\nunix: C = 3\n");
        var flat = ScopeMerger.flatten(root);
        assertEquals(4, flat.size());
        assertEquals(root, flat.get(0));
        assertEquals("WIN32", flat.get(1).condition());
        assertEquals("MSVC", flat.get(2).condition());
        assertEquals("UNIX", flat.get(3).condition());
    }

    @Test
    void mergesScopesWithEquivalentConditions() {
        var root = ConverterTestSupport.buildScope("proj.pro", "win32: A += 1\nunix: B = 2\n!unix: A += 2\n");
        propagator.propagate(root);

        var merged = ScopeMerger.merge(ScopeMerger.flatten(root));

        assertEquals(3, merged.size());
        assertEquals("ON", merged.get(0).totalCondition().orElseThrow());
        assertEquals("WIN32", merged.get(1).totalCondition().orElseThrow());
        assertEquals(List.of("1", "2"), merged.get(1).get("A"));
        assertEquals("UNIX", merged.get(2).totalCondition().orElseThrow());
    }

    @Test
    void dropsScopesThatNeverApply() {
        var root = ConverterTestSupport.buildScope("proj.pro", "win32 {\n    unix: B = 2\n}\n");
        propagator.propagate(root);

        var merged = ScopeMerger.merge(ScopeMerger.flatten(root));

        assertEquals(2, merged.size());
        assertEquals("WIN32", merged.get(1).totalCondition().orElseThrow());
    }

    @Test
    void requiresPropagatedScopes() {
        var root = ConverterTestSupport.buildScope("proj.pro", "A = 1\n");
        assertThrows(IllegalStateException.class, () -> ScopeMerger.merge(List.of(root)));
    }
}

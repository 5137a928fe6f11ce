package work.lcod.pro2cmake.scope;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.lcod.pro2cmake.support.ConverterTestSupport;

class ScopeBuilderTest {
    @Test
    void foldsAssignmentsPerKey() {
        var scope = ConverterTestSupport.buildScope("proj.pro", "SOURCES = a.cpp\nSOURCES += b.cpp\nSOURCES -= a.cpp\n");
        assertEquals(List.of("b.cpp"), scope.get("SOURCES"));
        assertEquals(3, scope.operations("SOURCES").size());
    }

    @Test
    void createsChildScopesForBranches() {
        var scope = ConverterTestSupport.buildScope("proj.pro", "win32: SOURCES += w.cpp\nelse: SOURCES += u.cpp\n");
        assertEquals(2, scope.children().size());

        var then = scope.children().get(0);
        assertEquals("win32", then.rawCondition());
        assertEquals("WIN32", then.condition());
        assertEquals(List.of("w.cpp"), then.get("SOURCES"));
        assertEquals(scope, then.parent().orElseThrow());

        var otherwise = scope.children().get(1);
        assertTrue(otherwise.isElse());
        assertEquals(Scope.ELSE, otherwise.rawCondition());
        assertEquals(List.of("u.cpp"), otherwise.get("SOURCES"));
        assertTrue(scope.get("SOURCES").isEmpty());
    }

    @Test
    void recordsLoadOptionAndInclude() {
        var scope = ConverterTestSupport.buildScope(
            "src/corelib/corelib.pro",
            "load(qt_module)\nload(qt_module)\noption(host_build)\ninclude($$PWD/global/global.pri)\n"
        );
        assertEquals(List.of("qt_module"), scope.get(ScopeBuilder.LOADED));
        assertEquals(List.of("host_build"), scope.get(ScopeBuilder.OPTION));
        assertEquals(List.of("global/global.pri"), scope.included());
    }

    @Test
    void mapsPathValuesOfSourceKeys() {
        var scope = ConverterTestSupport.buildScope(
            "src/corelib/corelib.pro",
            "SOURCES += $$PWD/global/qglobal.cpp $$NO_PCH_SOURCES ./io/qfile.cpp\n"
                + "PRIVATE_HEADERS += $$PWD/qglobal_p.h\n"
                + "INCLUDEPATH += $$QT_SOURCE_TREE/include $$OUT_PWD/gen\n"
                + "DEFINES += $$PWD/untouched\n"
        );
        assertEquals(List.of("global/qglobal.cpp", "io/qfile.cpp"), scope.get("SOURCES"));
        assertEquals(List.of("qglobal_p.h"), scope.get("PRIVATE_HEADERS"));
        assertEquals(List.of("${PROJECT_SOURCE_DIR}/include", "${CMAKE_CURRENT_BUILD_DIR}/gen"), scope.get("INCLUDEPATH"));
        assertEquals(List.of("$$PWD/untouched"), scope.get("DEFINES"));
    }

    @Test
    void ignoresOpaqueStatements() {
        var scope = ConverterTestSupport.buildScope("proj.pro", "message(hi)\nfor(a, B) { C = 1 }\nA = 1\n");
        assertEquals(Set.of("A"), scope.keys());
        assertTrue(scope.children().isEmpty());
    }

    @Test
    void directoriesFollowTheFile() {
        var scope = ConverterTestSupport.buildScope("src/gui/gui.pro", "A = 1\n");
        assertEquals("src/gui", scope.currentDir());
        assertEquals("src/gui", scope.baseDir());
        assertEquals("src/gui/CMakeLists.txt", scope.cmakeListsFile());

        var bare = ConverterTestSupport.buildScope("gui.pro", "A = 1\n");
        assertEquals(".", bare.currentDir());
    }

    @Test
    void tracksVisitedKeys() {
        var scope = ConverterTestSupport.buildScope("proj.pro", "A = 1\nB = 2\n");
        scope.get("A");
        assertEquals(Set.of("B"), scope.unvisitedKeys());
        scope.resetVisitedKeys();
        assertEquals(Set.of("A", "B"), scope.unvisitedKeys());
    }

    @Test
    void singleValueAccessors() {
        var scope = ConverterTestSupport.buildScope("dir/proj.pro", "A = 1 2\nTEMPLATE = lib\n");
        assertEquals("lib", scope.template());
        assertEquals("proj", scope.target());
        assertEquals("fallback", scope.getString("MISSING", "fallback"));
        assertThrows(IllegalStateException.class, () -> scope.getString("A"));
    }

    @Test
    void mergeReparentsChildrenAndConcatenatesOperations() {
        var first = ConverterTestSupport.buildScope("a.pro", "A = 1\nwin32: B = 2\n");
        var second = ConverterTestSupport.buildScope("b.pri", "A += 3\nunix: C = 4\n");
        var moved = second.children().get(0);

        first.merge(second);

        assertEquals(List.of("1", "3"), first.get("A"));
        assertEquals(2, first.children().size());
        assertEquals(first, moved.parent().orElseThrow());
        assertFalse(second.children().contains(moved));
    }
}

package work.lcod.pro2cmake.emit;

import work.lcod.pro2cmake.scope.Scope;

/**
 * Callbacks used by {@link CMakeListsWriter} for {@code SUBDIRS} entries.
 */
public interface SubprojectHandler {

    /** Parses {@code file} into a scope with includes resolved, rooted at {@code baseDir}. */
    Scope loadProject(String file, String baseDir);

    /** Called for every {@code SUBDIRS} entry that names a directory. */
    void subdirectory(String directory);
}

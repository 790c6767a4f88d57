package ai.pydeps.query;

import java.nio.file.Path;
import java.util.List;
import java.util.SortedMap;
import java.util.SortedSet;

import ai.pydeps.model.ImportEdge;

/**
 * Output of one {@link QueryMode}. Collections are sorted wherever the mode
 * defines an order, so rendering needs no further sorting.
 */
public interface QueryResult {

    QueryMode mode();

    /** dep: edges whose target is a known module, in discovery order. */
    record InternalImports(List<ImportEdge> imports) implements QueryResult {
        public InternalImports {
            imports = List.copyOf(imports);
        }

        @Override
        public QueryMode mode() {
            return QueryMode.DEP;
        }
    }

    /** nodeps: modules importing no known module. */
    record Unreferenced(SortedSet<String> modules) implements QueryResult {
        @Override
        public QueryMode mode() {
            return QueryMode.NODEPS;
        }
    }

    /** nodeps_verbose: as nodeps, with each module's imports of unknown modules. */
    record UnreferencedVerbose(List<ModuleExternals> modules) implements QueryResult {
        public UnreferencedVerbose {
            modules = List.copyOf(modules);
        }

        @Override
        public QueryMode mode() {
            return QueryMode.NODEPS_VERBOSE;
        }
    }

    record ModuleExternals(String module, List<String> externalImports) {
        public ModuleExternals {
            externalImports = List.copyOf(externalImports);
        }
    }

    /**
     * pkg_dep: modules importing the package (direct) and modules reaching one
     * of those through imports (indirect), each with the path that reached it.
     * A path starts at a direct dependent and ends at the indirect one.
     */
    record PackageDependents(
            String packageName,
            SortedSet<String> direct,
            SortedMap<String, List<String>> indirect
    ) implements QueryResult {
        @Override
        public QueryMode mode() {
            return QueryMode.PKG_DEP;
        }
    }

    /** not_pkg_dep: modules that are neither direct nor indirect dependents. */
    record NonDependents(String packageName, SortedSet<String> modules) implements QueryResult {
        @Override
        public QueryMode mode() {
            return QueryMode.NOT_PKG_DEP;
        }
    }

    /** outside_local_dir: callers importing modules outside their own directory tree, by caller. */
    record OutsideLocalDirectory(List<OutsideImports> callers) implements QueryResult {
        public OutsideLocalDirectory {
            callers = List.copyOf(callers);
        }

        @Override
        public QueryMode mode() {
            return QueryMode.OUTSIDE_LOCAL_DIR;
        }
    }

    record OutsideImports(String caller, Path callerPath, List<OutsideTarget> targets) {
        public OutsideImports {
            targets = List.copyOf(targets);
        }
    }

    record OutsideTarget(String module, Path path) {
    }

    /** encapsulated_dir: directories whose own modules only import inside the directory tree. */
    record EncapsulatedDirectories(SortedSet<Path> directories) implements QueryResult {
        @Override
        public QueryMode mode() {
            return QueryMode.ENCAPSULATED_DIR;
        }
    }
}

package ai.pydeps.graph;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import ai.pydeps.model.DirectoryModules;
import ai.pydeps.model.ImportEdge;

/**
 * Fully built import graph, read-only.
 * - modules: every module id found under the roots
 * - edges: every (caller, target) pair in discovery order, repeats kept
 * - modulePaths: module id -> absolute file (last root wins on id collisions)
 * - directories: per visited directory, the modules whose file sits directly in it
 */
public record ImportGraph(
        SortedSet<String> modules,
        List<ImportEdge> edges,
        Map<String, Path> modulePaths,
        List<DirectoryModules> directories,
        int parseWarnings
) {

    public ImportGraph {
        modules = Collections.unmodifiableSortedSet(new TreeSet<>(modules));
        edges = List.copyOf(edges);
        modulePaths = Map.copyOf(modulePaths);
        directories = List.copyOf(directories);
    }

    public static ImportGraph of(Set<String> modules, List<ImportEdge> edges, Map<String, Path> modulePaths) {
        return new ImportGraph(new TreeSet<>(modules), edges, modulePaths, List.of(), 0);
    }

    public boolean isModule(String id) {
        return id != null && modules.contains(id);
    }

    public Optional<Path> pathOf(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(modulePaths.get(id));
    }
}

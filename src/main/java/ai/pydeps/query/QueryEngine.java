package ai.pydeps.query;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import ai.pydeps.graph.GraphBuilder;
import ai.pydeps.graph.ImportGraph;
import ai.pydeps.model.DirectoryModules;
import ai.pydeps.model.ImportEdge;
import ai.pydeps.model.ModuleNames;

/**
 * Answers the {@link QueryMode} analyses over one built {@link ImportGraph}.
 * The graph is never modified; the reverse graph is derived once per engine.
 */
public final class QueryEngine {

    private final ImportGraph graph;
    private final Map<String, SortedSet<String>> reverse;
    private final Map<String, List<String>> targetsByCaller;
    private final Map<Path, Path> realPaths = new HashMap<>();

    public QueryEngine(ImportGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.reverse = GraphBuilder.reverseGraph(graph.edges());

        final Map<String, List<String>> byCaller = new LinkedHashMap<>();
        for (ImportEdge edge : graph.edges()) {
            byCaller.computeIfAbsent(edge.caller(), k -> new ArrayList<>()).add(edge.target());
        }
        this.targetsByCaller = byCaller;
    }

    public QueryResult run(QueryRequest request) {
        Objects.requireNonNull(request, "request");
        return switch (request.mode()) {
            case DEP -> new QueryResult.InternalImports(internalImports());
            case NODEPS -> new QueryResult.Unreferenced(unreferencedModules());
            case NODEPS_VERBOSE -> new QueryResult.UnreferencedVerbose(unreferencedWithExternals());
            case PKG_DEP -> packageDependents(request.packageName());
            case NOT_PKG_DEP -> new QueryResult.NonDependents(request.packageName(),
                    nonDependents(request.packageName()));
            case OUTSIDE_LOCAL_DIR -> new QueryResult.OutsideLocalDirectory(outsideLocalDirectory());
            case ENCAPSULATED_DIR -> new QueryResult.EncapsulatedDirectories(encapsulatedDirectories());
        };
    }

    public List<ImportEdge> internalImports() {
        final List<ImportEdge> out = new ArrayList<>();
        for (ImportEdge edge : graph.edges()) {
            if (graph.isModule(edge.target())) {
                out.add(edge);
            }
        }
        return out;
    }

    /**
     * Modules with no edge into the known module set. They may still import
     * modules from outside the roots.
     */
    public SortedSet<String> unreferencedModules() {
        final Set<String> hasDeps = new HashSet<>();
        for (ImportEdge edge : graph.edges()) {
            if (graph.isModule(edge.target())) {
                hasDeps.add(edge.caller());
            }
        }
        final SortedSet<String> out = new TreeSet<>(graph.modules());
        out.removeAll(hasDeps);
        return Collections.unmodifiableSortedSet(out);
    }

    public List<QueryResult.ModuleExternals> unreferencedWithExternals() {
        final List<QueryResult.ModuleExternals> out = new ArrayList<>();
        for (String module : unreferencedModules()) {
            final List<String> externals = new ArrayList<>();
            for (String target : targetsByCaller.getOrDefault(module, List.of())) {
                if (!graph.isModule(target)) {
                    externals.add(target);
                }
            }
            out.add(new QueryResult.ModuleExternals(module, externals));
        }
        return out;
    }

    /**
     * Callers of an edge whose target is {@code packageName} or a dotted descendant of it.
     */
    public SortedSet<String> directDependents(String packageName) {
        requirePackage(packageName);
        final SortedSet<String> out = new TreeSet<>();
        for (ImportEdge edge : graph.edges()) {
            if (ModuleNames.isWithin(edge.target(), packageName)) {
                out.add(edge.caller());
            }
        }
        return Collections.unmodifiableSortedSet(out);
    }

    /**
     * Multi-source breadth-first search over the reverse graph.
     * <p>
     * Every seed starts with path {@code [seed]} and is never reported itself.
     * Each other reachable module is visited once and gets the path of the
     * traversal that reached it first, which is a minimum-hop path. Seeds are
     * enqueued in sorted order and callers expanded in sorted order, so among
     * equally short paths the one from the smallest seed wins.
     */
    public SortedMap<String, List<String>> traceDependencyPaths(Collection<String> seeds) {
        Objects.requireNonNull(seeds, "seeds");
        final SortedMap<String, List<String>> paths = new TreeMap<>();
        final Set<String> visited = new HashSet<>(seeds);
        final Deque<List<String>> queue = new ArrayDeque<>();
        for (String seed : new TreeSet<>(seeds)) {
            queue.add(List.of(seed));
        }

        while (!queue.isEmpty()) {
            final List<String> path = queue.poll();
            final String current = path.get(path.size() - 1);
            for (String dependent : reverse.getOrDefault(current, Collections.emptySortedSet())) {
                if (!visited.add(dependent)) {
                    continue;
                }
                final List<String> next = new ArrayList<>(path.size() + 1);
                next.addAll(path);
                next.add(dependent);
                final List<String> frozen = List.copyOf(next);
                paths.put(dependent, frozen);
                queue.add(frozen);
            }
        }
        return Collections.unmodifiableSortedMap(paths);
    }

    public QueryResult.PackageDependents packageDependents(String packageName) {
        final SortedSet<String> direct = directDependents(packageName);
        return new QueryResult.PackageDependents(packageName, direct, traceDependencyPaths(direct));
    }

    public SortedSet<String> nonDependents(String packageName) {
        final QueryResult.PackageDependents dependents = packageDependents(packageName);
        final SortedSet<String> out = new TreeSet<>(graph.modules());
        out.removeAll(dependents.direct());
        out.removeAll(dependents.indirect().keySet());
        return Collections.unmodifiableSortedSet(out);
    }

    /**
     * Edges between two known modules where the target file is not under the
     * caller file's directory. Targets that are not known modules are skipped.
     */
    public List<QueryResult.OutsideImports> outsideLocalDirectory() {
        final SortedMap<String, List<String>> outside = new TreeMap<>();
        for (ImportEdge edge : graph.edges()) {
            final Path callerPath = graph.modulePaths().get(edge.caller());
            final Path targetPath = graph.modulePaths().get(edge.target());
            if (callerPath == null || targetPath == null) {
                continue;
            }
            final Path localDir = realPath(callerPath.getParent());
            if (!realPath(targetPath).startsWith(localDir)) {
                outside.computeIfAbsent(edge.caller(), k -> new ArrayList<>()).add(edge.target());
            }
        }

        final List<QueryResult.OutsideImports> out = new ArrayList<>(outside.size());
        for (var e : outside.entrySet()) {
            final List<String> targets = new ArrayList<>(e.getValue());
            Collections.sort(targets);
            final List<QueryResult.OutsideTarget> resolved = new ArrayList<>(targets.size());
            for (String target : targets) {
                resolved.add(new QueryResult.OutsideTarget(target, graph.modulePaths().get(target)));
            }
            out.add(new QueryResult.OutsideImports(e.getKey(), graph.modulePaths().get(e.getKey()), resolved));
        }
        return out;
    }

    /**
     * Directories holding at least one module directly, where every import of
     * those modules that names a known module lands inside the directory tree.
     */
    public SortedSet<Path> encapsulatedDirectories() {
        final SortedSet<Path> out = new TreeSet<>();
        for (DirectoryModules dir : graph.directories()) {
            if (dir.modules().isEmpty()) {
                continue;
            }
            final Path dirPath = realPath(dir.dir());
            if (importsStayUnder(dir.modules(), dirPath)) {
                out.add(dirPath);
            }
        }
        return Collections.unmodifiableSortedSet(out);
    }

    private boolean importsStayUnder(List<String> modules, Path dirPath) {
        for (String module : modules) {
            for (String target : targetsByCaller.getOrDefault(module, List.of())) {
                final Path targetPath = graph.modulePaths().get(target);
                if (targetPath != null && !realPath(targetPath).startsWith(dirPath)) {
                    return false;
                }
            }
        }
        return true;
    }

    private static void requirePackage(String packageName) {
        if (packageName == null || packageName.isBlank()) {
            throw new IllegalArgumentException("package name is required");
        }
    }

    private Path realPath(Path path) {
        return realPaths.computeIfAbsent(path, QueryEngine::toRealPath);
    }

    // symlinks resolved where the file exists, plain normalization otherwise
    private static Path toRealPath(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException ex) {
            return path.toAbsolutePath().normalize();
        }
    }
}

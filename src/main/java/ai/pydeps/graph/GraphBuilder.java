package ai.pydeps.graph;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import ai.pydeps.model.DirectoryModules;
import ai.pydeps.model.ImportEdge;
import ai.pydeps.model.SourceRoot;
import ai.pydeps.modules.ModuleResolver;
import ai.pydeps.scan.ImportExtractor;
import ai.pydeps.scan.SourceFinder;

/**
 * Builds the import graph of a list of roots.
 * Pass 1 walks the roots and names every module; pass 2 extracts imports per
 * file, on a worker pool when more than one thread is configured.
 */
public final class GraphBuilder {

    private final ModuleResolver resolver;
    private final ImportExtractor extractor;
    private final int threads;

    public GraphBuilder(ModuleResolver resolver, ImportExtractor extractor, int threads) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1: " + threads);
        }
        this.threads = threads;
    }

    public ImportGraph build(List<SourceRoot> roots) throws IOException, InterruptedException {
        Objects.requireNonNull(roots, "roots");

        final int warningsBefore = extractor.parseWarningCount();

        // Step 1: discover files and name them
        final SourceFinder finder = new SourceFinder();
        final Set<String> modules = new HashSet<>();
        final Map<String, Path> modulePaths = new HashMap<>();
        final List<DirectoryModules> directories = new ArrayList<>();
        final List<SourceFile> files = new ArrayList<>();
        final Set<Path> knownFiles = new HashSet<>();

        for (SourceRoot root : roots) {
            final SourceFinder.SourceTree tree = finder.scan(root);
            for (var dir : tree.directories()) {
                final List<String> local = new ArrayList<>();
                for (Path file : dir.files()) {
                    final Path abs = file.toAbsolutePath().normalize();
                    knownFiles.add(abs);
                    final Optional<String> module = resolver.canonicalize(root, abs);
                    if (module.isEmpty()) {
                        continue;
                    }
                    modules.add(module.get());
                    modulePaths.put(module.get(), abs);
                    local.add(module.get());
                    files.add(new SourceFile(root, abs));
                }
                directories.add(new DirectoryModules(dir.dir().toAbsolutePath().normalize(), local));
            }
        }

        // Step 2: extract imports; results are merged in discovery order
        final List<ImportEdge> edges = new ArrayList<>();
        if (threads == 1 || files.size() < 2) {
            for (SourceFile f : files) {
                edges.addAll(extractor.extract(f.root(), f.file(), knownFiles::contains));
            }
        } else {
            final ExecutorService pool = Executors.newFixedThreadPool(Math.min(threads, files.size()));
            try {
                final List<Future<List<ImportEdge>>> pending = new ArrayList<>(files.size());
                for (SourceFile f : files) {
                    pending.add(pool.submit(() -> extractor.extract(f.root(), f.file(), knownFiles::contains)));
                }
                for (Future<List<ImportEdge>> future : pending) {
                    edges.addAll(future.get());
                }
            } catch (ExecutionException ex) {
                throw new IllegalStateException("import extraction failed", ex.getCause());
            } finally {
                pool.shutdownNow();
            }
        }

        return new ImportGraph(new TreeSet<>(modules), edges, modulePaths, directories,
                extractor.parseWarningCount() - warningsBefore);
    }

    /**
     * target -> callers. A caller importing the same target twice is listed once.
     */
    public static Map<String, SortedSet<String>> reverseGraph(List<ImportEdge> edges) {
        Objects.requireNonNull(edges, "edges");
        final Map<String, SortedSet<String>> reverse = new TreeMap<>();
        for (ImportEdge edge : edges) {
            reverse.computeIfAbsent(edge.target(), k -> new TreeSet<>()).add(edge.caller());
        }
        return reverse;
    }

    private record SourceFile(SourceRoot root, Path file) {
    }
}

package ai.pydeps;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import ai.pydeps.graph.GraphBuilder;
import ai.pydeps.graph.ImportGraph;
import ai.pydeps.model.SourceRoot;
import ai.pydeps.modules.ModuleResolver;
import ai.pydeps.query.QueryEngine;
import ai.pydeps.query.QueryRequest;
import ai.pydeps.query.QueryResult;
import ai.pydeps.scan.ImportExtractor;

/**
 * Wires resolver, extractor, builder and query engine for one run.
 */
public final class Analyzer {

    private final AnalyzerOptions options;

    public Analyzer(AnalyzerOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public ImportGraph buildGraph() throws IOException, InterruptedException {
        final List<SourceRoot> roots = new ArrayList<>(options.roots().size());
        for (Path dir : options.roots()) {
            roots.add(SourceRoot.of(dir));
        }
        final ModuleResolver resolver = new ModuleResolver(options.initPolicy());
        final ImportExtractor extractor = new ImportExtractor(resolver, options.relativePolicy());
        return new GraphBuilder(resolver, extractor, options.threads()).build(roots);
    }

    public QueryResult query(ImportGraph graph) {
        return new QueryEngine(graph).run(new QueryRequest(options.mode(), options.packageName()));
    }
}

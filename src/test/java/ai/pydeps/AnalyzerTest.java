package ai.pydeps;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ai.pydeps.graph.ImportGraph;
import ai.pydeps.io.ReportWriter;
import ai.pydeps.modules.InitModulePolicy;
import ai.pydeps.query.QueryEngine;
import ai.pydeps.query.QueryMode;
import ai.pydeps.query.QueryResult;
import ai.pydeps.scan.RelativeImportPolicy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * End-to-end runs over small trees written to a temporary directory.
 */
class AnalyzerTest {

    // -- nodeps round trip --

    @Test
    void whenRunningNodeps_givenKeepInitPolicy_shouldReportInitModuleAndLeaf(
            @TempDir final Path tmp) throws Exception {
        final Path root = initPackage(tmp);

        final QueryResult result = run(root, QueryMode.NODEPS, null, InitModulePolicy.KEEP,
                RelativeImportPolicy.SINGLE_EDGE);

        assertEquals(new TreeSet<>(Set.of("pkgA.__init__", "pkgA.b")),
                ((QueryResult.Unreferenced) result).modules());
    }

    @Test
    void whenRunningNodeps_givenCollapseInitPolicy_shouldReportPackageAndLeaf(
            @TempDir final Path tmp) throws Exception {
        final Path root = initPackage(tmp);

        final QueryResult result = run(root, QueryMode.NODEPS, null, InitModulePolicy.COLLAPSE,
                RelativeImportPolicy.SINGLE_EDGE);

        assertEquals(new TreeSet<>(Set.of("pkgA", "pkgA.b")), ((QueryResult.Unreferenced) result).modules());
    }

    // -- relative imports and pkg_dep --

    @Test
    void whenRunningPkgDep_givenSingleEdgeRelativeImports_shouldSeeBothAsDirectOfPackage(
            @TempDir final Path tmp) throws Exception {
        final Path root = relativeTree(tmp);

        final QueryResult.PackageDependents result = (QueryResult.PackageDependents) run(root,
                QueryMode.PKG_DEP, "pkgA", InitModulePolicy.KEEP, RelativeImportPolicy.SINGLE_EDGE);

        assertEquals(new TreeSet<>(Set.of("pkgA.a", "pkgA.sub.c")), result.direct());
        assertTrue(result.indirect().isEmpty());
    }

    @Test
    void whenRunningPkgDep_givenRelativeNamesResolvedAsModules_shouldTraceIndirectPath(
            @TempDir final Path tmp) throws Exception {
        final Path root = relativeTree(tmp);

        final QueryResult.PackageDependents onB = (QueryResult.PackageDependents) run(root,
                QueryMode.PKG_DEP, "pkgA.b", InitModulePolicy.KEEP, RelativeImportPolicy.PROBE_NAMES);
        final QueryResult.PackageDependents onA = (QueryResult.PackageDependents) run(root,
                QueryMode.PKG_DEP, "pkgA.a", InitModulePolicy.KEEP, RelativeImportPolicy.PROBE_NAMES);

        assertEquals(Set.of("pkgA.a"), onB.direct());
        assertEquals(List.of("pkgA.a", "pkgA.sub.c"), onB.indirect().get("pkgA.sub.c"));
        assertEquals(Set.of("pkgA.sub.c"), onA.direct());
    }

    @Test
    void whenRunningQueries_givenRelativeImportAboveTopPackage_shouldNeverReportItPositively(
            @TempDir final Path tmp) throws Exception {
        final Path root = tmp.resolve("pkgA");
        write(root, "a.py", "from .... import x\nimport pkgA.b\n");
        write(root, "b.py", "");

        final ImportGraph graph = analyzer(root, QueryMode.DEP, null,
                InitModulePolicy.KEEP, RelativeImportPolicy.SINGLE_EDGE).buildGraph();
        final QueryEngine engine = new QueryEngine(graph);

        assertEquals(1, engine.internalImports().size());
        assertEquals("pkgA.b", engine.internalImports().get(0).target());
        assertTrue(engine.outsideLocalDirectory().isEmpty());
        assertTrue(engine.directDependents("pkgA.x").isEmpty());
    }

    @Test
    void whenBuildingGraph_givenRootThatIsASymlink_shouldNameModulesAfterTheLink(
            @TempDir final Path tmp) throws Exception {
        final Path real = tmp.resolve("real/pkgA");
        write(real, "a.py", "import pkgA.b\n");
        write(real, "b.py", "");
        final Path link = Files.createSymbolicLink(tmp.resolve("pkgA"), real);

        final ImportGraph graph = analyzer(link, QueryMode.DEP, null,
                InitModulePolicy.KEEP, RelativeImportPolicy.SINGLE_EDGE).buildGraph();

        assertEquals(new TreeSet<>(Set.of("pkgA.a", "pkgA.b")), graph.modules());
        assertEquals(1, new QueryEngine(graph).internalImports().size());
    }

    // -- encapsulated_dir / outside_local_dir --

    @Test
    void whenRunningEncapsulated_givenSelfContainedDirectory_shouldReportItUntilAForeignImportAppears(
            @TempDir final Path tmp) throws Exception {
        final Path root = tmp.resolve("proj");
        write(root, "main.py", "import proj.core.x\n");
        write(root, "core/x.py", "import proj.core.y\n");
        write(root, "core/y.py", "import proj.core.x\nimport os\n");
        write(root, "other/z.py", "");

        final QueryResult before = run(root, QueryMode.ENCAPSULATED_DIR, null,
                InitModulePolicy.KEEP, RelativeImportPolicy.SINGLE_EDGE);

        assertEquals(new TreeSet<>(Set.of(
                        root.toRealPath(),
                        root.resolve("core").toRealPath(),
                        root.resolve("other").toRealPath())),
                ((QueryResult.EncapsulatedDirectories) before).directories());

        write(root, "core/w.py", "import proj.other.z\n");

        final QueryResult after = run(root, QueryMode.ENCAPSULATED_DIR, null,
                InitModulePolicy.KEEP, RelativeImportPolicy.SINGLE_EDGE);

        assertEquals(new TreeSet<>(Set.of(root.toRealPath(), root.resolve("other").toRealPath())),
                ((QueryResult.EncapsulatedDirectories) after).directories());
    }

    @Test
    void whenRunningOutsideLocalDir_givenSiblingSubdirAndForeignImports_shouldReportOnlyForeign(
            @TempDir final Path tmp) throws Exception {
        final Path root = tmp.resolve("proj");
        write(root, "main.py", "import proj.core.x\n");
        write(root, "core/x.py", "import proj.core.y\n");
        write(root, "core/y.py", "");
        write(root, "core/w.py", "import proj.other.z\nimport proj.core.x\n");
        write(root, "other/z.py", "");

        final QueryResult.OutsideLocalDirectory result = (QueryResult.OutsideLocalDirectory) run(root,
                QueryMode.OUTSIDE_LOCAL_DIR, null, InitModulePolicy.KEEP, RelativeImportPolicy.SINGLE_EDGE);

        assertEquals(1, result.callers().size());
        assertEquals("proj.core.w", result.callers().get(0).caller());
        assertEquals(List.of("proj.other.z"), result.callers().get(0).targets().stream()
                .map(QueryResult.OutsideTarget::module).toList());
    }

    // -- helpers --

    private static Path initPackage(Path tmp) throws IOException {
        final Path root = tmp.resolve("pkgA");
        write(root, "__init__.py", "");
        write(root, "a.py", "import pkgA.b\n");
        write(root, "b.py", "");
        return root;
    }

    private static Path relativeTree(Path tmp) throws IOException {
        final Path root = tmp.resolve("pkgA");
        write(root, "a.py", "from . import b\n");
        write(root, "b.py", "");
        write(root, "sub/c.py", "from .. import a\n");
        return root;
    }

    private static Analyzer analyzer(Path root, QueryMode mode, String pkg,
                                     InitModulePolicy init, RelativeImportPolicy relative) {
        return new Analyzer(new AnalyzerOptions(List.of(root), mode, pkg,
                ReportWriter.Format.TEXT, init, relative, 2));
    }

    private static QueryResult run(Path root, QueryMode mode, String pkg,
                                   InitModulePolicy init, RelativeImportPolicy relative) throws Exception {
        final Analyzer analyzer = analyzer(root, mode, pkg, init, relative);
        return analyzer.query(analyzer.buildGraph());
    }

    private static void write(Path root, String rel, String content) throws IOException {
        final Path file = root.resolve(rel);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }
}

package ai.pydeps.io;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Test;

import ai.pydeps.model.ImportEdge;
import ai.pydeps.query.QueryResult;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ReportWriter}.
 */
class ReportWriterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ReportWriter text = new ReportWriter(ReportWriter.Format.TEXT);
    private final ReportWriter json = new ReportWriter(ReportWriter.Format.JSON);

    // -- text --

    @Test
    void whenRenderingText_givenInternalImports_shouldPrintArrowLines() throws Exception {
        final String out = text.render(new QueryResult.InternalImports(List.of(new ImportEdge("a.x", "a.y"))));

        assertEquals("\nInternal Imports Found:\na.x imports a.y --> a.y\n", out);
    }

    @Test
    void whenRenderingText_givenUnreferenced_shouldListModulesUnderHeader() throws Exception {
        final String out = text.render(new QueryResult.Unreferenced(new TreeSet<>(Set.of("b", "a"))));

        assertEquals("\nModules with no internal dependencies:\na\nb\n", out);
    }

    @Test
    void whenRenderingText_givenVerboseTable_shouldPadModuleColumn() throws Exception {
        final String out = text.render(new QueryResult.UnreferencedVerbose(List.of(
                new QueryResult.ModuleExternals("a.lonely", List.of()),
                new QueryResult.ModuleExternals("b.user", List.of("os", "json")))));

        final List<String> lines = out.lines().toList();
        assertEquals("MODULE" + " ".repeat(54) + " | EXTERNAL IMPORT", lines.get(2));
        assertEquals("=".repeat(90), lines.get(3));
        assertEquals("a.lonely" + " ".repeat(52) + " | -", lines.get(4));
        assertEquals("b.user" + " ".repeat(54) + " | os", lines.get(5));
        assertEquals(" ".repeat(60) + " | json", lines.get(6));
    }

    @Test
    void whenRenderingText_givenPackageDependents_shouldPrintIndirectPathsThenDirect() throws Exception {
        final TreeMap<String, List<String>> indirect = new TreeMap<>();
        indirect.put("c.top", List.of("b.mid", "c.top"));

        final String out = text.render(new QueryResult.PackageDependents(
                "pkg", new TreeSet<>(Set.of("b.mid", "a.low")), indirect));

        assertEquals("c.top (indirect)\n  path: b.mid -> c.top\na.low (direct)\nb.mid (direct)\n", out);
    }

    @Test
    void whenRenderingText_givenNonDependents_shouldNameThePackage() throws Exception {
        final String out = text.render(new QueryResult.NonDependents("pkg", new TreeSet<>(Set.of("x"))));

        assertEquals("\nModules NOT dependent (even recursively) on package 'pkg':\nx\n", out);
    }

    @Test
    void whenRenderingText_givenOutsideImports_shouldPrintFilePaths() throws Exception {
        final Path caller = Path.of("/p/app/main.py");
        final Path target = Path.of("/p/lib/core.py");

        final String out = text.render(new QueryResult.OutsideLocalDirectory(List.of(
                new QueryResult.OutsideImports("app.main", caller,
                        List.of(new QueryResult.OutsideTarget("lib.core", target))))));

        assertTrue(out.contains(caller + "\n  ↳ " + target + "\n"));
    }

    // -- json --

    @Test
    void whenRenderingJson_givenPackageDependents_shouldWrapResultWithMode() throws Exception {
        final TreeMap<String, List<String>> indirect = new TreeMap<>();
        indirect.put("c.top", List.of("b.mid", "c.top"));

        final JsonNode node = MAPPER.readTree(json.render(new QueryResult.PackageDependents(
                "pkg", new TreeSet<>(Set.of("b.mid")), indirect)));

        assertEquals(ReportWriter.SCHEMA_VERSION, node.get("schema").asText());
        assertEquals("pkg_dep", node.get("mode").asText());
        assertEquals("b.mid", node.get("result").get("direct").get(0).asText());
        assertEquals("c.top", node.get("result").get("indirect").get("c.top").get(1).asText());
    }

    @Test
    void whenRenderingJson_givenDirectories_shouldWritePathsAsStrings() throws Exception {
        final Path dir = Path.of("/p/lib");

        final JsonNode node = MAPPER.readTree(json.render(
                new QueryResult.EncapsulatedDirectories(new TreeSet<>(Set.of(dir)))));

        assertEquals(dir.toString(), node.get("result").get("directories").get(0).asText());
    }

    @Test
    void whenParsingFormat_givenNames_shouldMatchCaseSensitiveLowercase() {
        assertEquals(ReportWriter.Format.JSON, ReportWriter.Format.fromName("json").orElseThrow());
        assertTrue(ReportWriter.Format.fromName("xml").isEmpty());
    }
}

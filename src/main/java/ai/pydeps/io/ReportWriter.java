package ai.pydeps.io;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;

import ai.pydeps.model.ImportEdge;
import ai.pydeps.query.QueryResult;

/**
 * Renders a {@link QueryResult} as the line-oriented text listing or as JSON.
 * Results arrive sorted; nothing is reordered here.
 */
public final class ReportWriter {

    public static final String SCHEMA_VERSION = "py-deps/v1";

    private static final int MODULE_COLUMN = 60;
    private static final int RULE_WIDTH = 90;

    public enum Format {
        TEXT,
        JSON;

        public static Optional<Format> fromName(String name) {
            for (Format f : values()) {
                if (f.name().toLowerCase(Locale.ROOT).equals(name)) {
                    return Optional.of(f);
                }
            }
            return Optional.empty();
        }
    }

    private final Format format;
    private final ObjectMapper jsonMapper;

    public ReportWriter(Format format) {
        this.format = Objects.requireNonNull(format, "format");
        final SimpleModule paths = new SimpleModule("paths");
        paths.addSerializer(Path.class, ToStringSerializer.instance);
        this.jsonMapper = new ObjectMapper()
                .registerModule(paths)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String render(QueryResult result) throws JsonProcessingException {
        Objects.requireNonNull(result, "result");
        if (format == Format.JSON) {
            return jsonMapper.writeValueAsString(
                    new JsonReport(SCHEMA_VERSION, result.mode().cliName(), result)) + "\n";
        }
        return String.join("\n", textLines(result)) + "\n";
    }

    List<String> textLines(QueryResult result) {
        final List<String> out = new ArrayList<>();

        if (result instanceof QueryResult.InternalImports r) {
            header(out, "Internal Imports Found:");
            for (ImportEdge edge : r.imports()) {
                out.add(edge.caller() + " imports " + edge.target() + " --> " + edge.target());
            }
        } else if (result instanceof QueryResult.Unreferenced r) {
            header(out, "Modules with no internal dependencies:");
            out.addAll(r.modules());
        } else if (result instanceof QueryResult.UnreferencedVerbose r) {
            header(out, "Modules with no internal dependencies (external dependencies shown):");
            out.add(pad("MODULE") + " | EXTERNAL IMPORT");
            out.add("=".repeat(RULE_WIDTH));
            for (QueryResult.ModuleExternals m : r.modules()) {
                if (m.externalImports().isEmpty()) {
                    out.add(pad(m.module()) + " | -");
                    continue;
                }
                for (int i = 0; i < m.externalImports().size(); i++) {
                    out.add(pad(i == 0 ? m.module() : "") + " | " + m.externalImports().get(i));
                }
            }
        } else if (result instanceof QueryResult.PackageDependents r) {
            // paths never hold a direct dependent: BFS seeds are not reported
            for (Map.Entry<String, List<String>> e : r.indirect().entrySet()) {
                out.add(e.getKey() + " (indirect)");
                out.add("  path: " + String.join(" -> ", e.getValue()));
            }
            for (String module : r.direct()) {
                out.add(module + " (direct)");
            }
        } else if (result instanceof QueryResult.NonDependents r) {
            header(out, "Modules NOT dependent (even recursively) on package '" + r.packageName() + "':");
            out.addAll(r.modules());
        } else if (result instanceof QueryResult.OutsideLocalDirectory r) {
            header(out, "Files importing outside their local directory or subdirectories:");
            for (QueryResult.OutsideImports caller : r.callers()) {
                out.add(String.valueOf(caller.callerPath()));
                for (QueryResult.OutsideTarget target : caller.targets()) {
                    out.add(target.path() != null
                            ? "  ↳ " + target.path()
                            : "  ↳ " + target.module() + " (not found in local module map)");
                }
            }
        } else if (result instanceof QueryResult.EncapsulatedDirectories r) {
            header(out, "Encapsulated directories (only import within own directory tree):");
            for (Path dir : r.directories()) {
                out.add(dir.toString());
            }
        } else {
            throw new IllegalArgumentException("unsupported result: " + result.getClass().getSimpleName());
        }
        return out;
    }

    private static void header(List<String> out, String title) {
        out.add("");
        out.add(title);
    }

    private static String pad(String s) {
        return String.format("%-" + MODULE_COLUMN + "s", s);
    }

    public record JsonReport(String schema, String mode, QueryResult result) {
    }
}

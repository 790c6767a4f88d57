package ai.pydeps;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

import ai.pydeps.io.ReportWriter;
import ai.pydeps.modules.InitModulePolicy;
import ai.pydeps.query.QueryMode;
import ai.pydeps.scan.RelativeImportPolicy;

/**
 * Everything one run needs, as parsed from the command line.
 */
public record AnalyzerOptions(
        List<Path> roots,
        QueryMode mode,
        String packageName,      // only used by pkg_dep / not_pkg_dep
        ReportWriter.Format format,
        InitModulePolicy initPolicy,
        RelativeImportPolicy relativePolicy,
        int threads
) {

    public AnalyzerOptions {
        roots = List.copyOf(roots);
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(initPolicy, "initPolicy");
        Objects.requireNonNull(relativePolicy, "relativePolicy");
        if (roots.isEmpty()) {
            throw new IllegalArgumentException("at least one --root is required");
        }
        if (threads < 1) {
            throw new IllegalArgumentException("--threads must be >= 1");
        }
    }

    public static AnalyzerOptions defaults(List<Path> roots, QueryMode mode, String packageName) {
        return new AnalyzerOptions(roots, mode, packageName, ReportWriter.Format.TEXT,
                InitModulePolicy.KEEP, RelativeImportPolicy.SINGLE_EDGE,
                Runtime.getRuntime().availableProcessors());
    }
}

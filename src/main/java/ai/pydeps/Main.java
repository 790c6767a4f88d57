package ai.pydeps;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import ai.pydeps.graph.ImportGraph;
import ai.pydeps.io.ReportWriter;
import ai.pydeps.modules.InitModulePolicy;
import ai.pydeps.query.QueryMode;
import ai.pydeps.query.QueryResult;
import ai.pydeps.scan.RelativeImportPolicy;

public final class Main {

    public static void main(String[] args) {
        final int code = run(args,
                utf8(new FileOutputStream(FileDescriptor.out)),
                utf8(new FileOutputStream(FileDescriptor.err)));
        if (code != 0) {
            System.exit(code);
        }
    }

    // UTF-8 regardless of the platform charset
    static PrintStream utf8(OutputStream stream) {
        return new PrintStream(stream, true, StandardCharsets.UTF_8);
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        final List<Path> roots = new ArrayList<>();
        String modeName = null;
        String packageName = null;
        ReportWriter.Format format = ReportWriter.Format.TEXT;
        InitModulePolicy initPolicy = InitModulePolicy.KEEP;
        RelativeImportPolicy relativePolicy = RelativeImportPolicy.SINGLE_EDGE;
        int threads = Runtime.getRuntime().availableProcessors();

        try {
            for (int i = 0; i < args.length; i++) {
                final String arg = args[i];
                if ("--help".equals(arg) || "-h".equals(arg)) {
                    printUsage(out);
                    return 0;
                }
                if ("--root".equals(arg) || "--mode".equals(arg)) {
                    if (i + 1 >= args.length) {
                        return usageError(err, "missing value for " + arg);
                    }
                    final String value = args[++i];
                    if ("--root".equals(arg)) {
                        roots.add(Paths.get(value));
                    } else {
                        modeName = value;
                    }
                    continue;
                }
                if (arg.startsWith("--root=")) {
                    roots.add(Paths.get(arg.substring("--root=".length())));
                    continue;
                }
                if (arg.startsWith("--mode=")) {
                    modeName = arg.substring("--mode=".length());
                    continue;
                }
                if (arg.startsWith("--format=")) {
                    final String name = arg.substring("--format=".length()).trim();
                    final Optional<ReportWriter.Format> f = ReportWriter.Format.fromName(name);
                    if (f.isEmpty()) {
                        return usageError(err, "unknown format: " + name);
                    }
                    format = f.get();
                    continue;
                }
                if (arg.startsWith("--collapseInit=")) {
                    initPolicy = Boolean.parseBoolean(arg.substring("--collapseInit=".length()))
                            ? InitModulePolicy.COLLAPSE
                            : InitModulePolicy.KEEP;
                    continue;
                }
                if (arg.startsWith("--probeRelativeNames=")) {
                    relativePolicy = Boolean.parseBoolean(arg.substring("--probeRelativeNames=".length()))
                            ? RelativeImportPolicy.PROBE_NAMES
                            : RelativeImportPolicy.SINGLE_EDGE;
                    continue;
                }
                if (arg.startsWith("--threads=")) {
                    final String value = arg.substring("--threads=".length()).trim();
                    try {
                        threads = Integer.parseInt(value);
                    } catch (NumberFormatException ex) {
                        return usageError(err, "invalid thread count: " + value);
                    }
                    if (threads < 1) {
                        return usageError(err, "--threads must be >= 1");
                    }
                    continue;
                }
                if (arg.startsWith("--")) {
                    return usageError(err, "unknown argument: " + arg);
                }
                if (packageName == null) {
                    packageName = arg;
                    continue;
                }
                return usageError(err, "unexpected argument: " + arg);
            }

            if (roots.isEmpty()) {
                return usageError(err, "at least one --root <dir> is required");
            }
            if (modeName == null) {
                return usageError(err, "--mode is required");
            }
            final Optional<QueryMode> mode = QueryMode.fromCliName(modeName);
            if (mode.isEmpty()) {
                return usageError(err, "unknown mode: " + modeName);
            }
            if (mode.get().requiresPackage() && (packageName == null || packageName.isBlank())) {
                err.println("Error: --mode " + mode.get().cliName() + " requires a package name.");
                return 2;
            }
            for (Path root : roots) {
                if (!Files.isDirectory(root)) {
                    return usageError(err, "root is not a directory: " + root);
                }
            }

            final AnalyzerOptions options = new AnalyzerOptions(
                    roots, mode.get(), packageName, format, initPolicy, relativePolicy, threads);
            final Analyzer analyzer = new Analyzer(options);
            final ImportGraph graph = analyzer.buildGraph();
            final QueryResult result = analyzer.query(graph);

            out.print(new ReportWriter(format).render(result));
            if (graph.parseWarnings() > 0) {
                err.println("WARN: parse warnings: " + graph.parseWarnings());
            }
            return 0;
        } catch (java.io.IOException ex) {
            err.println("ERROR: IO failure: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            err.println("ERROR: interrupted");
            return 1;
        } catch (Exception ex) {
            err.println("ERROR: failed to analyze: "
                    + ex.getClass().getSimpleName() + ": " + safeMsg(ex.getMessage()));
            return 1;
        }
    }

    private static int usageError(PrintStream err, String message) {
        err.println("ERROR: " + message);
        printUsage(err);
        return 2;
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage: py-deps --root <dir> [--root <dir> ...] --mode <mode> [package] [options]");
        out.println("Modes:");
        out.println("  nodeps              modules that import no module under the roots");
        out.println("  nodeps_verbose      same as nodeps, with a table of external imports");
        out.println("  dep                 imports that resolve to modules under the roots");
        out.println("  pkg_dep             modules depending on <package>, directly or through others");
        out.println("  not_pkg_dep         modules not depending on <package>, even indirectly");
        out.println("  outside_local_dir   modules importing outside their own directory tree");
        out.println("  encapsulated_dir    directories whose modules only import within their own tree");
        out.println("Options:");
        out.println("  --format=<text|json>          Output format (default: text)");
        out.println("  --collapseInit=<bool>         Name pkg/__init__.py as 'pkg' (default: false)");
        out.println("  --probeRelativeNames=<bool>   Resolve names of relative imports as submodules (default: false)");
        out.println("  --threads=<n>                 Parallel file scanning (default: CPU count)");
        out.println("  --help, -h                    Show this help");
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}

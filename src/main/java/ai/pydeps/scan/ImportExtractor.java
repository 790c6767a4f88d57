package ai.pydeps.scan;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

import ai.pydeps.model.ImportEdge;
import ai.pydeps.model.ModuleNames;
import ai.pydeps.model.SourceRoot;
import ai.pydeps.modules.ModuleResolver;

/**
 * Turns the import statements of one file into (caller, target) edges,
 * one edge per imported name.
 * <p>
 * "from X import y" is ambiguous: y may be a submodule or an attribute of X.
 * It is settled by asking {@code fileExists} whether {@code <root>/X/y.py} or
 * {@code <root>/X/y/__init__.py} exists; if neither does the edge points at X.
 */
public final class ImportExtractor {

    private final ModuleResolver resolver;
    private final RelativeImportPolicy relativePolicy;
    private final ImportParser parser;
    private final AtomicInteger parseWarnings = new AtomicInteger();

    public ImportExtractor(ModuleResolver resolver, RelativeImportPolicy relativePolicy) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.relativePolicy = Objects.requireNonNull(relativePolicy, "relativePolicy");
        this.parser = new ImportParser();
    }

    /**
     * Reads and scans {@code file}. A file that cannot be read or parsed has no
     * imports: a warning is printed and counted, the caller carries on.
     */
    public List<ImportEdge> extract(SourceRoot root, Path file, Predicate<Path> fileExists) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(file, "file");

        if (resolver.canonicalize(root, file).isEmpty()) {
            return List.of();
        }
        try {
            final String source = Files.readString(file, StandardCharsets.UTF_8);
            return extract(root, file, source, fileExists);
        } catch (IOException | ImportSyntaxException ex) {
            parseWarnings.incrementAndGet();
            System.err.println("WARN: failed to parse " + file + " -> "
                    + ex.getClass().getSimpleName() + ": " + safeMsg(ex.getMessage()));
            return List.of();
        }
    }

    public List<ImportEdge> extract(SourceRoot root, Path file, String source, Predicate<Path> fileExists)
            throws ImportSyntaxException {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(fileExists, "fileExists");

        final Optional<String> caller = resolver.canonicalize(root, file);
        if (caller.isEmpty()) {
            return List.of();
        }
        final List<String> callerParts = resolver.moduleParts(root, file);
        return edgesFor(caller.get(), callerParts, root, parser.parse(source), fileExists);
    }

    List<ImportEdge> edgesFor(String caller,
                              List<String> callerParts,
                              SourceRoot root,
                              List<ImportStatement> statements,
                              Predicate<Path> fileExists) {
        final List<ImportEdge> out = new ArrayList<>();

        for (ImportStatement st : statements) {
            if (st.kind() == ImportStatement.Kind.IMPORT) {
                for (String name : st.names()) {
                    out.add(new ImportEdge(caller, name));
                }
                continue;
            }

            if (st.isRelative()) {
                final String resolved = ModuleResolver.resolveRelative(callerParts, st.level(), st.module());
                if (relativePolicy == RelativeImportPolicy.SINGLE_EDGE) {
                    out.add(new ImportEdge(caller, resolved));
                    continue;
                }
                final Optional<Path> dir = ModuleResolver.packageDirectory(root, resolved);
                if (dir.isEmpty()) {
                    out.add(new ImportEdge(caller, resolved));
                    continue;
                }
                for (String name : st.names()) {
                    out.add(new ImportEdge(caller, probe(dir.get(), resolved, name, fileExists)));
                }
                continue;
            }

            // absolute "from X import ...": X is taken relative to the root directory itself
            Path dir = root.dir();
            for (String part : ModuleNames.split(st.module())) {
                dir = dir.resolve(part);
            }
            for (String name : st.names()) {
                out.add(new ImportEdge(caller, probe(dir, st.module(), name, fileExists)));
            }
        }
        return out;
    }

    private static String probe(Path packageDir, String module, String name, Predicate<Path> fileExists) {
        if ("*".equals(name)) {
            return module;
        }
        final Path asModule = packageDir.resolve(name + ModuleNames.SOURCE_SUFFIX);
        final Path asPackage = packageDir.resolve(name).resolve(ModuleNames.PACKAGE_INIT + ModuleNames.SOURCE_SUFFIX);
        if (fileExists.test(asModule) || fileExists.test(asPackage)) {
            return ModuleNames.child(module, name);
        }
        return module;
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }

    public int parseWarningCount() {
        return parseWarnings.get();
    }
}

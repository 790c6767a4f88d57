package ai.pydeps.modules;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import ai.pydeps.model.ModuleNames;
import ai.pydeps.model.SourceRoot;

/**
 * Maps files to dotted module ids and resolves relative imports.
 * Strategy:
 * 1) Only *.py files inside the root are modules
 * 2) Id = root dir name + relative path without extension, separators as dots
 * 3) __init__ files are named according to {@link InitModulePolicy}
 */
public final class ModuleResolver {

    private final InitModulePolicy initPolicy;

    public ModuleResolver(InitModulePolicy initPolicy) {
        this.initPolicy = Objects.requireNonNull(initPolicy, "initPolicy");
    }

    public InitModulePolicy initPolicy() {
        return initPolicy;
    }

    public Optional<String> canonicalize(SourceRoot root, Path file) {
        final List<String> parts = moduleParts(root, file);
        if (parts.isEmpty()) {
            return Optional.empty();
        }
        if (initPolicy == InitModulePolicy.COLLAPSE
                && parts.size() > 1
                && ModuleNames.PACKAGE_INIT.equals(parts.get(parts.size() - 1))) {
            parts.remove(parts.size() - 1);
        }
        return Optional.of(ModuleNames.join(parts));
    }

    /**
     * Segments of the module id as the file names them, {@code __init__} included.
     * Relative imports are resolved against these so that a package initializer
     * imports relative to its own package under either policy.
     * Empty when the file is not a module of this root.
     */
    public List<String> moduleParts(SourceRoot root, Path file) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(file, "file");

        final Path abs = file.toAbsolutePath().normalize();
        final Path fileName = abs.getFileName();
        if (fileName == null || !ModuleNames.isSourceFile(fileName.toString())) {
            return new ArrayList<>();
        }
        if (!abs.startsWith(root.dir()) || abs.equals(root.dir())) {
            return new ArrayList<>();
        }

        final Path rel = root.dir().relativize(abs);
        final List<String> parts = new ArrayList<>(rel.getNameCount() + 1);
        parts.add(root.name());
        for (int i = 0; i < rel.getNameCount(); i++) {
            final String segment = rel.getName(i).toString();
            parts.add(i == rel.getNameCount() - 1 ? ModuleNames.stripSourceSuffix(segment) : segment);
        }
        return parts;
    }

    /**
     * Resolves {@code from <level dots><moduleSuffix> import ...} for a caller.
     * Each level drops one trailing segment of the caller's own id, so level 1
     * from {@code a.b.c} resolves against {@code a.b}.
     *
     * @return the dotted target, or {@link ModuleNames#INVALID} when level exceeds the caller depth
     */
    public static String resolveRelative(List<String> callerParts, int level, String moduleSuffix) {
        Objects.requireNonNull(callerParts, "callerParts");
        if (level < 1) {
            throw new IllegalArgumentException("relative import level must be >= 1: " + level);
        }
        if (level > callerParts.size()) {
            return ModuleNames.INVALID;
        }
        final List<String> base = new ArrayList<>(callerParts.subList(0, callerParts.size() - level));
        if (moduleSuffix != null && !moduleSuffix.isEmpty()) {
            base.addAll(ModuleNames.split(moduleSuffix));
        }
        return ModuleNames.join(base);
    }

    /**
     * Directory a module id maps to under {@code root}, when its first segment is the root name.
     * {@code pkgA.sub} under root {@code /x/pkgA} is {@code /x/pkgA/sub}.
     */
    public static Optional<Path> packageDirectory(SourceRoot root, String moduleId) {
        Objects.requireNonNull(root, "root");
        if (moduleId == null || moduleId.isEmpty() || ModuleNames.INVALID.equals(moduleId)) {
            return Optional.empty();
        }
        final List<String> parts = ModuleNames.split(moduleId);
        if (!root.name().equals(parts.get(0))) {
            return Optional.empty();
        }
        Path dir = root.dir();
        for (String part : parts.subList(1, parts.size())) {
            dir = dir.resolve(part);
        }
        return Optional.of(dir);
    }
}

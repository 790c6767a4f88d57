package ai.pydeps.scan;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import ai.pydeps.model.ModuleNames;
import ai.pydeps.model.SourceRoot;

/**
 * Lists every directory under a root with the *.py files directly inside it.
 * A root that is itself a symbolic link is followed; links below it are not.
 * Paths are reported under the root path as given.
 */
public final class SourceFinder {

    public SourceTree scan(SourceRoot root) throws IOException {
        Objects.requireNonNull(root, "root");
        if (!Files.isDirectory(root.dir())) {
            throw new IOException("Root is not a directory: " + root.dir());
        }

        final Path start = root.dir().toRealPath();

        // LinkedHashMap keeps walk order until the final sort
        final Map<Path, List<Path>> filesByDir = new LinkedHashMap<>();

        Files.walkFileTree(start, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                filesByDir.put(underRoot(root, start, dir), new ArrayList<>());
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                final Path name = file.getFileName();
                if (name != null && ModuleNames.isSourceFile(name.toString()) && Files.isRegularFile(file)) {
                    final Path mapped = underRoot(root, start, file);
                    filesByDir.computeIfAbsent(mapped.getParent(), k -> new ArrayList<>()).add(mapped);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                System.err.println("WARN: cannot read " + file + " -> "
                        + exc.getClass().getSimpleName() + ": " + exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });

        final List<SourceDirectory> dirs = new ArrayList<>(filesByDir.size());
        for (var e : filesByDir.entrySet()) {
            final List<Path> files = new ArrayList<>(e.getValue());
            files.sort(Comparator.naturalOrder());
            dirs.add(new SourceDirectory(e.getKey(), files));
        }
        dirs.sort(Comparator.comparing(SourceDirectory::dir));
        return new SourceTree(root, dirs);
    }

    private static Path underRoot(SourceRoot root, Path start, Path walked) {
        return root.dir().resolve(start.relativize(walked));
    }

    public record SourceDirectory(Path dir, List<Path> files) {
        public SourceDirectory {
            files = List.copyOf(files);
        }
    }

    public record SourceTree(SourceRoot root, List<SourceDirectory> directories) {
        public SourceTree {
            directories = List.copyOf(directories);
        }

        public List<Path> allFiles() {
            final List<Path> out = new ArrayList<>();
            for (SourceDirectory d : directories) {
                out.addAll(d.files());
            }
            return out;
        }
    }
}

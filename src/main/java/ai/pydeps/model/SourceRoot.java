package ai.pydeps.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A directory analyzed as the top of a namespace. Its own name is the first
 * segment of every module id found beneath it.
 */
public record SourceRoot(Path dir, String name) {

    public SourceRoot {
        Objects.requireNonNull(dir, "dir");
        Objects.requireNonNull(name, "name");
    }

    public static SourceRoot of(Path dir) {
        Objects.requireNonNull(dir, "dir");
        final Path abs = dir.toAbsolutePath().normalize();
        final Path fileName = abs.getFileName();
        return new SourceRoot(abs, fileName != null ? fileName.toString() : "");
    }
}

package ai.pydeps.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Modules whose file lives directly in {@code dir} (not in a subdirectory).
 */
public record DirectoryModules(Path dir, List<String> modules) {

    public DirectoryModules {
        modules = List.copyOf(modules);
    }
}

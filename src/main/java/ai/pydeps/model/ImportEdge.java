package ai.pydeps.model;

import java.util.Objects;

/**
 * One import relationship: {@code caller} imports {@code target}.
 * <p>
 * target:
 * - a module id when it names a known module or a probed submodule
 * - a package id when a "from" import names an attribute rather than a file
 * - {@link ModuleNames#INVALID} for a relative import that climbs too high
 */
public record ImportEdge(String caller, String target) {

    public ImportEdge {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(target, "target");
    }
}

package ai.pydeps.query;

import java.util.Objects;

/**
 * A mode plus the package it is about. The package is dropped for modes that do not use it.
 */
public record QueryRequest(QueryMode mode, String packageName) {

    public QueryRequest {
        Objects.requireNonNull(mode, "mode");
        if (!mode.requiresPackage()) {
            packageName = null;
        } else if (packageName == null || packageName.isBlank()) {
            throw new IllegalArgumentException("--mode " + mode.cliName() + " requires a package name.");
        }
    }

    public static QueryRequest of(QueryMode mode) {
        return new QueryRequest(mode, null);
    }
}

package ai.pydeps.query;

import java.util.Optional;

/**
 * The analyses a run can ask for, by command-line name.
 */
public enum QueryMode {
    DEP("dep", false),
    NODEPS("nodeps", false),
    NODEPS_VERBOSE("nodeps_verbose", false),
    PKG_DEP("pkg_dep", true),
    NOT_PKG_DEP("not_pkg_dep", true),
    OUTSIDE_LOCAL_DIR("outside_local_dir", false),
    ENCAPSULATED_DIR("encapsulated_dir", false);

    private final String cliName;
    private final boolean requiresPackage;

    QueryMode(String cliName, boolean requiresPackage) {
        this.cliName = cliName;
        this.requiresPackage = requiresPackage;
    }

    public String cliName() {
        return cliName;
    }

    public boolean requiresPackage() {
        return requiresPackage;
    }

    public static Optional<QueryMode> fromCliName(String name) {
        for (QueryMode mode : values()) {
            if (mode.cliName.equals(name)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}

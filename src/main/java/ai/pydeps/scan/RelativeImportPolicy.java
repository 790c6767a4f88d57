package ai.pydeps.scan;

/**
 * How the names of a relative "from" import become edges.
 */
public enum RelativeImportPolicy {
    /** One edge to the resolved module; imported names are not looked at. */
    SINGLE_EDGE,
    /** One edge per name, probing each name as a submodule like absolute imports do. */
    PROBE_NAMES
}

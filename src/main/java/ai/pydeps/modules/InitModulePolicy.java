package ai.pydeps.modules;

/**
 * How a package initializer file ({@code pkg/__init__.py}) is named.
 */
public enum InitModulePolicy {
    /** {@code pkg/__init__.py} is {@code pkg.__init__}. */
    KEEP,
    /** {@code pkg/__init__.py} is {@code pkg}. */
    COLLAPSE
}

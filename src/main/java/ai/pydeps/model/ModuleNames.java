package ai.pydeps.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

public final class ModuleNames {

    /** Target of a relative import that climbs above the caller's top-level package. */
    public static final String INVALID = "<invalid>";

    public static final String SOURCE_SUFFIX = ".py";

    public static final String PACKAGE_INIT = "__init__";

    private ModuleNames() {
    }

    public static List<String> split(String dotted) {
        Objects.requireNonNull(dotted, "dotted");
        if (dotted.isEmpty()) {
            return new ArrayList<>();
        }
        return new ArrayList<>(Arrays.asList(dotted.split("\\.", -1)));
    }

    public static String join(List<String> parts) {
        Objects.requireNonNull(parts, "parts");
        return String.join(".", parts);
    }

    public static String child(String parent, String name) {
        Objects.requireNonNull(parent, "parent");
        Objects.requireNonNull(name, "name");
        return parent.isEmpty() ? name : parent + "." + name;
    }

    /**
     * True when {@code target} is {@code pkg} itself or a dotted descendant of it.
     * {@code pkg.sub} is inside {@code pkg}, {@code pkgother} is not.
     */
    public static boolean isWithin(String target, String pkg) {
        if (target == null || pkg == null) {
            return false;
        }
        return target.equals(pkg) || target.startsWith(pkg + ".");
    }

    public static boolean isSourceFile(String fileName) {
        return fileName != null && fileName.endsWith(SOURCE_SUFFIX);
    }

    public static String stripSourceSuffix(String fileName) {
        Objects.requireNonNull(fileName, "fileName");
        if (!fileName.endsWith(SOURCE_SUFFIX)) {
            return fileName;
        }
        return fileName.substring(0, fileName.length() - SOURCE_SUFFIX.length());
    }
}

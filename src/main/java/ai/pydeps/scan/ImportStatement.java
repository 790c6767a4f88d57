package ai.pydeps.scan;

import java.util.List;
import java.util.Objects;

/**
 * One import statement as written in the source; aliases are dropped.
 * <p>
 * kind:
 * - IMPORT for "import a.b, c"            (level 0, module null, names [a.b, c])
 * - FROM   for "from ..pkg import x, y"   (level 2, module "pkg", names [x, y])
 */
public record ImportStatement(
        Kind kind,
        int level,      // leading dots of a "from" import, 0 when absolute
        String module,  // dotted module after "from", null for "from . import x" and plain imports
        List<String> names,
        int line
) {

    public enum Kind {
        IMPORT,
        FROM
    }

    public ImportStatement {
        Objects.requireNonNull(kind, "kind");
        names = List.copyOf(names);
    }

    public static ImportStatement plain(List<String> names, int line) {
        return new ImportStatement(Kind.IMPORT, 0, null, names, line);
    }

    public static ImportStatement from(int level, String module, List<String> names, int line) {
        return new ImportStatement(Kind.FROM, level, module, names, line);
    }

    public boolean isRelative() {
        return level > 0;
    }
}

package ai.pydeps.scan;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

/**
 * Finds the import statements of a Python source file with tree-sitter-python.
 * <p>
 * The whole file is parsed; any syntax error anywhere in it fails the file.
 * Imports nested in functions, conditionals or {@code try} blocks are found
 * like top-level ones, in source order.
 */
public final class ImportParser {

    private static final String IMPORT_STATEMENT = "import_statement";
    private static final String IMPORT_FROM_STATEMENT = "import_from_statement";
    private static final String FUTURE_IMPORT_STATEMENT = "future_import_statement";
    private static final String DOTTED_NAME = "dotted_name";
    private static final String ALIASED_IMPORT = "aliased_import";
    private static final String RELATIVE_IMPORT = "relative_import";
    private static final String IMPORT_PREFIX = "import_prefix";
    private static final String WILDCARD_IMPORT = "wildcard_import";
    private static final String IDENTIFIER = "identifier";
    private static final String COMMENT = "comment";
    private static final String FUTURE_MODULE = "__future__";

    // TSParser is not thread-safe; extraction runs on a worker pool
    private final ThreadLocal<TSParser> parsers = ThreadLocal.withInitial(() -> {
        final TSParser parser = new TSParser();
        if (!parser.setLanguage(new TreeSitterPython())) {
            throw new IllegalStateException("tree-sitter-python language could not be loaded");
        }
        return parser;
    });

    public List<ImportStatement> parse(String source) throws ImportSyntaxException {
        Objects.requireNonNull(source, "source");
        final byte[] bytes = source.getBytes(StandardCharsets.UTF_8);
        final TSTree tree = parsers.get().parseString(null, source);
        final TSNode root = tree.getRootNode();
        if (root.isNull()) {
            throw new ImportSyntaxException("source could not be parsed", 1);
        }
        if (root.hasError()) {
            throw new ImportSyntaxException("invalid syntax", firstErrorLine(root));
        }

        final List<ImportStatement> out = new ArrayList<>();
        collect(root, bytes, out);
        return out;
    }

    private static void collect(TSNode node, byte[] src, List<ImportStatement> out) {
        switch (node.getType()) {
            case IMPORT_STATEMENT -> {
                out.add(ImportStatement.plain(importedNames(node, 0, src), line(node)));
                return;
            }
            case IMPORT_FROM_STATEMENT -> {
                out.add(fromStatement(node, src));
                return;
            }
            case FUTURE_IMPORT_STATEMENT -> {
                out.add(ImportStatement.from(0, FUTURE_MODULE, importedNames(node, 0, src), line(node)));
                return;
            }
            default -> {
                // keep descending
            }
        }
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            collect(node.getNamedChild(i), src, out);
        }
    }

    // from_stmt: 'from' (relative_import | dotted_name) 'import' (wildcard_import | names)
    private static ImportStatement fromStatement(TSNode node, byte[] src) {
        int level = 0;
        String module = null;
        int first = -1;
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            final TSNode child = node.getNamedChild(i);
            if (COMMENT.equals(child.getType())) {
                continue;
            }
            if (RELATIVE_IMPORT.equals(child.getType())) {
                for (int j = 0; j < child.getNamedChildCount(); j++) {
                    final TSNode part = child.getNamedChild(j);
                    if (IMPORT_PREFIX.equals(part.getType())) {
                        level = countDots(text(part, src));
                    } else if (DOTTED_NAME.equals(part.getType())) {
                        module = dottedName(part, src);
                    }
                }
            } else {
                module = dottedName(child, src);
            }
            first = i;
            break;
        }
        return ImportStatement.from(level, module, importedNames(node, first + 1, src), line(node));
    }

    private static List<String> importedNames(TSNode node, int from, byte[] src) {
        final List<String> names = new ArrayList<>();
        for (int i = from; i < node.getNamedChildCount(); i++) {
            final TSNode child = node.getNamedChild(i);
            switch (child.getType()) {
                case DOTTED_NAME -> names.add(dottedName(child, src));
                case ALIASED_IMPORT -> names.add(dottedName(child.getNamedChild(0), src));
                case WILDCARD_IMPORT -> names.add("*");
                default -> {
                    // comments between names
                }
            }
        }
        return names;
    }

    private static String dottedName(TSNode node, byte[] src) {
        if (IDENTIFIER.equals(node.getType())) {
            return text(node, src);
        }
        final List<String> parts = new ArrayList<>(node.getNamedChildCount());
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            final TSNode part = node.getNamedChild(i);
            if (IDENTIFIER.equals(part.getType())) {
                parts.add(text(part, src));
            }
        }
        return String.join(".", parts);
    }

    private static int firstErrorLine(TSNode node) {
        TSNode current = node;
        boolean descended = true;
        while (descended) {
            descended = false;
            for (int i = 0; i < current.getChildCount(); i++) {
                final TSNode child = current.getChild(i);
                if (child.hasError()) {
                    current = child;
                    descended = true;
                    break;
                }
            }
        }
        return line(current);
    }

    private static int countDots(String prefix) {
        int dots = 0;
        for (int i = 0; i < prefix.length(); i++) {
            if (prefix.charAt(i) == '.') {
                dots++;
            }
        }
        return dots;
    }

    private static int line(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    private static String text(TSNode node, byte[] src) {
        final int start = node.getStartByte();
        final int end = Math.min(node.getEndByte(), src.length);
        if (start >= end) {
            return "";
        }
        return new String(src, start, end - start, StandardCharsets.UTF_8);
    }
}

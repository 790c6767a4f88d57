package ai.pydeps.scan;

/**
 * Source text that cannot be read as Python import statements.
 */
public final class ImportSyntaxException extends Exception {

    private static final long serialVersionUID = 1L;

    private final int line;

    public ImportSyntaxException(String message, int line) {
        super(message + " (line " + line + ")");
        this.line = line;
    }

    public int line() {
        return line;
    }
}

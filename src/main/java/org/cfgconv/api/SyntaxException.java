package org.cfgconv.api;

/**
 * An exception that is thrown when the source does not follow the grammar.
 * A syntax error always aborts the whole conversion; no partial document is returned.
 */
public class SyntaxException extends Exception {

    private final SyntaxErrorCode code;
    private final SourceInfo sourceInfo;
    private final String expected;
    private final String actual;

    /**
     * Constructs a new syntax exception.
     * @param code The error code.
     * @param message The detail message, without position.
     * @param sourceInfo Where the error was detected.
     * @param expected The expected token kind or a description of it.
     * @param actual The token kind that was actually found.
     */
    public SyntaxException(SyntaxErrorCode code, String message, SourceInfo sourceInfo, String expected, String actual) {
        super(String.format("%s: %s", sourceInfo, message));
        this.code = code;
        this.sourceInfo = sourceInfo;
        this.expected = expected;
        this.actual = actual;
    }

    public SyntaxErrorCode getCode() {
        return code;
    }

    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }

    public int getLine() {
        return sourceInfo.lineNumber();
    }

    public int getColumn() {
        return sourceInfo.columnNumber();
    }

    /**
     * @return The expected token kind or description, never {@code null}.
     */
    public String getExpected() {
        return expected;
    }

    /**
     * @return The token kind found instead, never {@code null}.
     */
    public String getActual() {
        return actual;
    }
}

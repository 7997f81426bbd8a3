package com.syntaxlens.core.javascript;

/**
 * Raised when JavaScript source cannot be parsed.
 *
 * <p>Carries the position reported by the grammar when one is known; positions are
 * -1 otherwise.
 */
public class JsParseException extends RuntimeException {

    private final int index;
    private final int lineNumber;
    private final int column;
    private final String description;

    public JsParseException(String message, int index, int lineNumber, int column, String description) {
        super(message);
        this.index = index;
        this.lineNumber = lineNumber;
        this.column = column;
        this.description = description;
    }

    public JsParseException(String message, Throwable cause) {
        super(message, cause);
        if (cause instanceof JsParseException grammarError) {
            this.index = grammarError.index;
            this.lineNumber = grammarError.lineNumber;
            this.column = grammarError.column;
            this.description = grammarError.description;
        } else {
            this.index = -1;
            this.lineNumber = -1;
            this.column = -1;
            this.description = null;
        }
    }

    /**
     * @return character offset of the error, or -1
     */
    public int getIndex() {
        return index;
    }

    /**
     * @return 1-based line of the error, or -1
     */
    public int getLineNumber() {
        return lineNumber;
    }

    /**
     * @return column of the error, or -1
     */
    public int getColumn() {
        return column;
    }

    /**
     * @return the grammar's description without the line prefix (e.g., "Unexpected token ;")
     */
    public String getDescription() {
        return description;
    }
}

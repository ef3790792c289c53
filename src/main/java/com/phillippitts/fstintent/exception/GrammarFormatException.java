package com.phillippitts.fstintent.exception;

/**
 * Thrown when a text FST or symbol table cannot be parsed.
 */
public class GrammarFormatException extends FstIntentException {

    private final String source;
    private final int lineNumber;

    public GrammarFormatException(String message) {
        super(message);
        this.source = "unknown";
        this.lineNumber = 0;
    }

    public GrammarFormatException(String source, int lineNumber, String message) {
        super(message + " (" + source + ":" + lineNumber + ")");
        this.source = source;
        this.lineNumber = lineNumber;
    }

    public GrammarFormatException(String message, Throwable cause) {
        super(message, cause);
        this.source = "unknown";
        this.lineNumber = 0;
    }

    public String getSource() {
        return source;
    }

    /**
     * @return 1-based line number of the offending line, or 0 when not tied to a line
     */
    public int getLineNumber() {
        return lineNumber;
    }
}

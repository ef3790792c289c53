package com.phillippitts.fstintent.exception;

/**
 * Thrown when a grammar FST or one of its symbol tables cannot be found at the configured path.
 * This is a fatal error that prevents the recognizer from starting.
 */
public class GrammarNotFoundException extends FstIntentException {

    private final String grammarPath;

    public GrammarNotFoundException(String grammarPath) {
        super("Grammar not found at path: " + grammarPath);
        this.grammarPath = grammarPath;
    }

    public GrammarNotFoundException(String grammarPath, Throwable cause) {
        super("Grammar not found at path: " + grammarPath, cause);
        this.grammarPath = grammarPath;
    }

    public String getGrammarPath() {
        return grammarPath;
    }
}

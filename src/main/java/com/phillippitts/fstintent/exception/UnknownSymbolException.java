package com.phillippitts.fstintent.exception;

/**
 * Thrown when an arc label has no entry in the symbol table it is resolved against.
 * Indicates an inconsistency between a grammar and its symbol tables.
 */
public class UnknownSymbolException extends FstIntentException {

    private final long label;

    public UnknownSymbolException(long label, String tableName) {
        super("Label " + label + " not found in symbol table '" + tableName + "'");
        this.label = label;
    }

    public long getLabel() {
        return label;
    }
}

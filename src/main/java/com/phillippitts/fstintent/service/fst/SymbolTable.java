package com.phillippitts.fstintent.service.fst;

import com.phillippitts.fstintent.exception.GrammarFormatException;
import com.phillippitts.fstintent.exception.UnknownSymbolException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Bidirectional mapping between integer labels and symbol strings.
 *
 * <p>Label {@value #EPSILON_LABEL} is always epsilon ({@value #EPSILON}); it is registered on
 * construction. Tables are populated while a grammar is loaded and only read afterwards, so a
 * loaded table can be shared between threads.
 */
public final class SymbolTable {

    public static final String EPSILON = "<eps>";
    public static final long EPSILON_LABEL = 0L;

    /** Label for symbols missing from the table; never matches during composition. */
    public static final long NO_LABEL = -1L;

    private final String name;
    private final Map<String, Long> labelsBySymbol = new LinkedHashMap<>();
    private final Map<Long, String> symbolsByLabel = new LinkedHashMap<>();
    private long nextLabel = 1L;

    public SymbolTable(String name) {
        this.name = Objects.requireNonNull(name, "name");
        put(EPSILON, EPSILON_LABEL);
    }

    /**
     * Adds a symbol under the next free label, or returns its existing label.
     *
     * @param symbol symbol to register
     * @return label of the symbol
     */
    public long add(String symbol) {
        Objects.requireNonNull(symbol, "symbol");
        Long existing = labelsBySymbol.get(symbol);
        if (existing != null) {
            return existing;
        }
        long label = nextLabel;
        put(symbol, label);
        return label;
    }

    /**
     * Adds a symbol under an explicit label, as read from a symbol table file.
     *
     * @throws GrammarFormatException if the symbol or label is already bound to something else
     */
    public void add(String symbol, long label) {
        Objects.requireNonNull(symbol, "symbol");
        if (label < 0) {
            throw new GrammarFormatException("Negative label " + label + " for symbol '" + symbol + "'");
        }
        Long existingLabel = labelsBySymbol.get(symbol);
        String existingSymbol = symbolsByLabel.get(label);
        if (existingLabel != null && existingLabel == label) {
            return;
        }
        if (existingLabel != null || existingSymbol != null) {
            throw new GrammarFormatException("Symbol table '" + name + "' already binds "
                    + (existingLabel != null ? "symbol '" + symbol + "' to " + existingLabel
                                             : "label " + label + " to '" + existingSymbol + "'"));
        }
        put(symbol, label);
    }

    private void put(String symbol, long label) {
        labelsBySymbol.put(symbol, label);
        symbolsByLabel.put(label, symbol);
        nextLabel = Math.max(nextLabel, label + 1);
    }

    /**
     * Resolves a label to its symbol.
     *
     * @throws UnknownSymbolException if the label is not in the table
     */
    public String find(long label) {
        String symbol = symbolsByLabel.get(label);
        if (symbol == null) {
            throw new UnknownSymbolException(label, name);
        }
        return symbol;
    }

    /**
     * Resolves a symbol to its label.
     *
     * @return label, or {@link #NO_LABEL} when the symbol is unknown
     */
    public long find(String symbol) {
        Long label = labelsBySymbol.get(symbol);
        return label == null ? NO_LABEL : label;
    }

    public boolean contains(String symbol) {
        return labelsBySymbol.containsKey(symbol);
    }

    public boolean contains(long label) {
        return symbolsByLabel.containsKey(label);
    }

    /**
     * @return number of symbols, epsilon included
     */
    public int size() {
        return symbolsByLabel.size();
    }

    public String name() {
        return name;
    }

    /**
     * @return read-only view of label → symbol in insertion order
     */
    public Map<Long, String> entries() {
        return Collections.unmodifiableMap(symbolsByLabel);
    }

    @Override
    public String toString() {
        return "SymbolTable[" + name + ", size=" + size() + "]";
    }
}

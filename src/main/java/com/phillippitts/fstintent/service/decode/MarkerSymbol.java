package com.phillippitts.fstintent.service.decode;

import com.phillippitts.fstintent.service.fst.SymbolTable;

import java.util.Objects;

/**
 * A grammar output symbol classified by the marker vocabulary of the grammar format.
 *
 * <p>The prefixes {@value #BEGIN_PREFIX}, {@value #END_PREFIX} and {@value #LABEL_PREFIX} are
 * part of the grammar file contract and must stay bit-compatible with grammars compiled
 * elsewhere.
 *
 * @param kind     symbol kind
 * @param argument tag or intent name for markers, the token itself for literals, empty for epsilon
 */
public record MarkerSymbol(Kind kind, String argument) {

    public static final String BEGIN_PREFIX = "__begin__";
    public static final String END_PREFIX = "__end__";
    public static final String LABEL_PREFIX = "__label__";

    public enum Kind { EPSILON, BEGIN, END, LABEL, LITERAL }

    public MarkerSymbol {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(argument, "argument");
    }

    public static MarkerSymbol parse(String symbol) {
        Objects.requireNonNull(symbol, "symbol");
        if (SymbolTable.EPSILON.equals(symbol)) {
            return new MarkerSymbol(Kind.EPSILON, "");
        }
        if (symbol.startsWith(BEGIN_PREFIX)) {
            return new MarkerSymbol(Kind.BEGIN, symbol.substring(BEGIN_PREFIX.length()));
        }
        if (symbol.startsWith(END_PREFIX)) {
            return new MarkerSymbol(Kind.END, symbol.substring(END_PREFIX.length()));
        }
        if (symbol.startsWith(LABEL_PREFIX)) {
            return new MarkerSymbol(Kind.LABEL, symbol.substring(LABEL_PREFIX.length()));
        }
        return new MarkerSymbol(Kind.LITERAL, symbol);
    }
}

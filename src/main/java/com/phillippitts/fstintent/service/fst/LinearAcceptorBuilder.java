package com.phillippitts.fstintent.service.fst;

import java.util.List;
import java.util.Objects;

/**
 * Builds the chain acceptor for a token sequence: state {@code i} has a single arc to
 * {@code i+1} labelled with token {@code i}; the last state is final with weight
 * {@link TropicalWeight#ONE}.
 *
 * <p>Labels come from the reference machine's input symbol table, and the acceptor reuses that
 * table instance so that composition compares the same label ids. A token missing from the
 * table gets {@link SymbolTable#NO_LABEL}; its arc simply never matches downstream.
 */
public final class LinearAcceptorBuilder {

    /**
     * @param tokens    tokens in sentence order (may be empty)
     * @param reference machine whose input symbols label the acceptor
     * @return acceptor with {@code tokens.size() + 1} states
     */
    public VectorFst build(List<String> tokens, Fst reference) {
        Objects.requireNonNull(tokens, "tokens");
        Objects.requireNonNull(reference, "reference");

        SymbolTable symbols = reference.inputSymbols();
        VectorFst acceptor = new VectorFst(symbols, symbols);
        int state = acceptor.addState();
        acceptor.setStart(state);
        for (String token : tokens) {
            int next = acceptor.addState();
            acceptor.addArc(state, Arc.acceptor(symbols.find(token), TropicalWeight.ONE, next));
            state = next;
        }
        acceptor.setFinal(state, TropicalWeight.ONE);
        return acceptor;
    }
}

package com.phillippitts.fstintent.service.fst;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Mutable, array-backed {@link Fst}. Used while building grammars, acceptors and composition
 * results; callers treat instances as read-only once handed out.
 */
public final class VectorFst implements Fst {

    private final List<List<Arc>> arcs = new ArrayList<>();
    private final List<Double> finalWeights = new ArrayList<>();
    private SymbolTable inputSymbols;
    private SymbolTable outputSymbols;
    private int start = NO_STATE;

    public VectorFst(SymbolTable inputSymbols, SymbolTable outputSymbols) {
        this.inputSymbols = Objects.requireNonNull(inputSymbols, "inputSymbols");
        this.outputSymbols = Objects.requireNonNull(outputSymbols, "outputSymbols");
    }

    /**
     * Adds a new non-final state.
     *
     * @return id of the new state
     */
    public int addState() {
        arcs.add(new ArrayList<>());
        finalWeights.add(TropicalWeight.ZERO);
        return arcs.size() - 1;
    }

    public void setStart(int state) {
        checkState(state);
        this.start = state;
    }

    public void setFinal(int state, double weight) {
        checkState(state);
        finalWeights.set(state, weight);
    }

    public void addArc(int state, Arc arc) {
        checkState(state);
        Objects.requireNonNull(arc, "arc");
        checkState(arc.nextState());
        arcs.get(state).add(arc);
    }

    public void setInputSymbols(SymbolTable inputSymbols) {
        this.inputSymbols = Objects.requireNonNull(inputSymbols, "inputSymbols");
    }

    public void setOutputSymbols(SymbolTable outputSymbols) {
        this.outputSymbols = Objects.requireNonNull(outputSymbols, "outputSymbols");
    }

    @Override
    public int start() {
        return start;
    }

    @Override
    public int numStates() {
        return arcs.size();
    }

    @Override
    public List<Arc> arcs(int state) {
        checkState(state);
        return Collections.unmodifiableList(arcs.get(state));
    }

    @Override
    public double finalWeight(int state) {
        checkState(state);
        return finalWeights.get(state);
    }

    @Override
    public SymbolTable inputSymbols() {
        return inputSymbols;
    }

    @Override
    public SymbolTable outputSymbols() {
        return outputSymbols;
    }

    private void checkState(int state) {
        if (state < 0 || state >= arcs.size()) {
            throw new IndexOutOfBoundsException("State " + state + " out of range [0, " + arcs.size() + ")");
        }
    }

    @Override
    public String toString() {
        return "VectorFst[states=" + numStates() + ", arcs=" + totalArcs() + ", start=" + start + "]";
    }
}

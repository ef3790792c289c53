package com.phillippitts.fstintent.service.fst;

import java.util.List;

/**
 * Read-only view of a weighted finite-state transducer.
 *
 * <p>States are dense integers {@code 0..numStates()-1}. Arc order is stable: repeated calls to
 * {@link #arcs(int)} return the same arcs in the same order, which makes path enumeration
 * deterministic.
 */
public interface Fst {

    /** Start state value of an empty machine. */
    int NO_STATE = -1;

    /**
     * @return start state, or {@link #NO_STATE} when the machine is empty
     */
    int start();

    int numStates();

    /**
     * @param state state id
     * @return outgoing arcs in native order (never null)
     */
    List<Arc> arcs(int state);

    /**
     * @param state state id
     * @return final weight, {@link TropicalWeight#ZERO} for non-final states
     */
    double finalWeight(int state);

    SymbolTable inputSymbols();

    SymbolTable outputSymbols();

    /**
     * A state is accepting when its final weight is not the semiring zero; the magnitude is
     * irrelevant.
     */
    default boolean isFinal(int state) {
        return !TropicalWeight.isZero(finalWeight(state));
    }

    default int numArcs(int state) {
        return arcs(state).size();
    }

    default int totalArcs() {
        int total = 0;
        for (int s = 0; s < numStates(); s++) {
            total += numArcs(s);
        }
        return total;
    }
}

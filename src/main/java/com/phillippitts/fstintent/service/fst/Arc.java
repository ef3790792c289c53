package com.phillippitts.fstintent.service.fst;

/**
 * A weighted transducer transition.
 *
 * @param ilabel    input label ({@link SymbolTable#EPSILON_LABEL} for epsilon)
 * @param olabel    output label ({@link SymbolTable#EPSILON_LABEL} for epsilon)
 * @param weight    tropical weight of the transition
 * @param nextState destination state id
 */
public record Arc(long ilabel, long olabel, double weight, int nextState) {

    public Arc {
        if (nextState < 0) {
            throw new IllegalArgumentException("nextState must be >= 0, got: " + nextState);
        }
    }

    /**
     * Creates an arc carrying the same label on both sides (acceptor arc).
     */
    public static Arc acceptor(long label, double weight, int nextState) {
        return new Arc(label, label, weight, nextState);
    }
}

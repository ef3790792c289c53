package com.phillippitts.fstintent.exception;

/**
 * Thrown when path enumeration descends deeper than the configured bound. Grammars must be
 * acyclic once composed with a sentence; exceeding the bound almost always means an epsilon
 * cycle is reachable from the start state.
 */
public class CyclicGrammarException extends FstIntentException {

    private final int maxDepth;

    public CyclicGrammarException(int maxDepth, int state) {
        super("Path enumeration exceeded max depth " + maxDepth + " at state " + state
                + " (grammar is likely cyclic)");
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}

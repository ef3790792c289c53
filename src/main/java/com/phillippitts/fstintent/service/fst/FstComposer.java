package com.phillippitts.fstintent.service.fst;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.phillippitts.fstintent.service.fst.SymbolTable.EPSILON_LABEL;

/**
 * Composition and projection of weighted transducers.
 *
 * <p>{@link #compose(Fst, Fst)} matches the output labels of the left machine against the input
 * labels of the right machine. Epsilons are sequenced: output-epsilon moves of the left machine
 * are taken before input-epsilon moves of the right machine, so every composed path corresponds to
 * exactly one pair of operand paths. The composed states are discovered breadth-first from the
 * pair of start states and the result is trimmed to states that lie on an accepting path.
 *
 * <p>Instances are stateless and thread-safe.
 */
public final class FstComposer {

    private final LinearAcceptorBuilder acceptorBuilder;

    public FstComposer() {
        this(new LinearAcceptorBuilder());
    }

    public FstComposer(LinearAcceptorBuilder acceptorBuilder) {
        this.acceptorBuilder = Objects.requireNonNull(acceptorBuilder, "acceptorBuilder");
    }

    /**
     * Runs a token sequence through a grammar: linear acceptor, composition, output projection.
     *
     * @param tokens  sentence tokens
     * @param grammar grammar transducer
     * @return acceptor over the grammar's output symbols; empty when the tokens do not match
     */
    public VectorFst apply(List<String> tokens, Fst grammar) {
        VectorFst acceptor = acceptorBuilder.build(tokens, grammar);
        return project(compose(acceptor, grammar), ProjectType.OUTPUT);
    }

    /**
     * Composes two transducers.
     *
     * @return connected composition; {@code start() == NO_STATE} when nothing is accepted
     */
    public VectorFst compose(Fst left, Fst right) {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");

        VectorFst result = new VectorFst(left.inputSymbols(), right.outputSymbols());
        if (left.start() == Fst.NO_STATE || right.start() == Fst.NO_STATE) {
            return result;
        }

        Map<StatePair, Integer> ids = new HashMap<>();
        Deque<StatePair> queue = new ArrayDeque<>();
        StatePair startPair = new StatePair(left.start(), right.start(), EpsilonFilter.ANY);
        result.setStart(stateFor(startPair, result, ids, queue));

        while (!queue.isEmpty()) {
            StatePair pair = queue.poll();
            int state = ids.get(pair);

            double finalWeight = TropicalWeight.times(left.finalWeight(pair.left()), right.finalWeight(pair.right()));
            if (!TropicalWeight.isZero(finalWeight)) {
                result.setFinal(state, finalWeight);
            }

            List<Arc> leftArcs = left.arcs(pair.left());

            // Left output-epsilons, right machine stays put
            if (pair.filter() == EpsilonFilter.ANY) {
                for (Arc la : leftArcs) {
                    if (la.olabel() == EPSILON_LABEL) {
                        StatePair next = new StatePair(la.nextState(), pair.right(), EpsilonFilter.ANY);
                        result.addArc(state, new Arc(la.ilabel(), EPSILON_LABEL, la.weight(),
                                stateFor(next, result, ids, queue)));
                    }
                }
            }

            for (Arc ra : right.arcs(pair.right())) {
                if (ra.ilabel() == EPSILON_LABEL) {
                    // Right input-epsilon, left machine stays put
                    StatePair next = new StatePair(pair.left(), ra.nextState(), EpsilonFilter.RIGHT_ONLY);
                    result.addArc(state, new Arc(EPSILON_LABEL, ra.olabel(), ra.weight(),
                            stateFor(next, result, ids, queue)));
                    continue;
                }
                for (Arc la : leftArcs) {
                    if (la.olabel() == ra.ilabel()) {
                        StatePair next = new StatePair(la.nextState(), ra.nextState(), EpsilonFilter.ANY);
                        result.addArc(state, new Arc(la.ilabel(), ra.olabel(),
                                TropicalWeight.times(la.weight(), ra.weight()),
                                stateFor(next, result, ids, queue)));
                    }
                }
            }
        }
        return connect(result);
    }

    /**
     * Projects a transducer onto one of its label sides. Structure, arc order and weights are
     * preserved; both symbol table slots take the kept side's table.
     */
    public VectorFst project(Fst fst, ProjectType type) {
        Objects.requireNonNull(fst, "fst");
        Objects.requireNonNull(type, "type");

        SymbolTable symbols = type == ProjectType.OUTPUT ? fst.outputSymbols() : fst.inputSymbols();
        VectorFst result = new VectorFst(symbols, symbols);
        for (int s = 0; s < fst.numStates(); s++) {
            result.addState();
        }
        for (int s = 0; s < fst.numStates(); s++) {
            result.setFinal(s, fst.finalWeight(s));
            for (Arc arc : fst.arcs(s)) {
                long label = type == ProjectType.OUTPUT ? arc.olabel() : arc.ilabel();
                result.addArc(s, Arc.acceptor(label, arc.weight(), arc.nextState()));
            }
        }
        if (fst.start() != Fst.NO_STATE) {
            result.setStart(fst.start());
        }
        return result;
    }

    /**
     * Removes states that are not both reachable from the start state and able to reach an
     * accepting state. Surviving states keep their relative order and arc order.
     */
    public VectorFst connect(Fst fst) {
        int n = fst.numStates();
        VectorFst result = new VectorFst(fst.inputSymbols(), fst.outputSymbols());
        if (fst.start() == Fst.NO_STATE) {
            return result;
        }

        boolean[] accessible = new boolean[n];
        Deque<Integer> pending = new ArrayDeque<>();
        accessible[fst.start()] = true;
        pending.push(fst.start());
        List<List<Integer>> reverse = new ArrayList<>(n);
        for (int s = 0; s < n; s++) {
            reverse.add(new ArrayList<>());
        }
        while (!pending.isEmpty()) {
            int s = pending.pop();
            for (Arc arc : fst.arcs(s)) {
                reverse.get(arc.nextState()).add(s);
                if (!accessible[arc.nextState()]) {
                    accessible[arc.nextState()] = true;
                    pending.push(arc.nextState());
                }
            }
        }

        boolean[] coaccessible = new boolean[n];
        for (int s = 0; s < n; s++) {
            if (accessible[s] && fst.isFinal(s)) {
                coaccessible[s] = true;
                pending.push(s);
            }
        }
        while (!pending.isEmpty()) {
            int s = pending.pop();
            for (int prev : reverse.get(s)) {
                if (!coaccessible[prev]) {
                    coaccessible[prev] = true;
                    pending.push(prev);
                }
            }
        }

        if (!coaccessible[fst.start()]) {
            return result;
        }

        int[] remap = new int[n];
        Arrays.fill(remap, Fst.NO_STATE);
        for (int s = 0; s < n; s++) {
            if (coaccessible[s]) {
                remap[s] = result.addState();
            }
        }
        for (int s = 0; s < n; s++) {
            if (remap[s] == Fst.NO_STATE) {
                continue;
            }
            result.setFinal(remap[s], fst.finalWeight(s));
            for (Arc arc : fst.arcs(s)) {
                int target = remap[arc.nextState()];
                if (target != Fst.NO_STATE) {
                    result.addArc(remap[s], new Arc(arc.ilabel(), arc.olabel(), arc.weight(), target));
                }
            }
        }
        result.setStart(remap[fst.start()]);
        return result;
    }

    private static int stateFor(StatePair pair, VectorFst result, Map<StatePair, Integer> ids,
                                Deque<StatePair> queue) {
        Integer id = ids.get(pair);
        if (id == null) {
            id = result.addState();
            ids.put(pair, id);
            queue.add(pair);
        }
        return id;
    }

    private enum EpsilonFilter {
        /** Any move allowed. */
        ANY,
        /** A right-epsilon move was taken; left-epsilon moves are blocked until the next match. */
        RIGHT_ONLY
    }

    private record StatePair(int left, int right, EpsilonFilter filter) {
    }
}

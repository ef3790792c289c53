package com.phillippitts.fstintent.service.fst;

import com.phillippitts.fstintent.exception.CyclicGrammarException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Enumerates the output symbols of every path from the start state to an accepting state.
 *
 * <p>Traversal is depth-first in native arc order with an explicit frame stack, so output order is
 * deterministic and deep machines cannot overflow the call stack. A path ends at the first
 * accepting state it reaches: arcs leaving an accepting state are not followed from that path.
 * The start state alone is never reported as a path.
 *
 * <p>The machine must be acyclic along every path from the start state (for a composed sentence
 * the depth is bounded by the sentence length plus the grammar's epsilon runs). Paths longer than
 * {@code maxDepth} arcs abort the enumeration with {@link CyclicGrammarException}.
 */
public final class PathEnumerator {

    /** Meta prefix shared by tag and label markers. */
    public static final String META_PREFIX = "__";

    public static final int DEFAULT_MAX_DEPTH = 10_000;

    private final int maxDepth;

    public PathEnumerator() {
        this(DEFAULT_MAX_DEPTH);
    }

    public PathEnumerator(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be >= 1, got: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    /**
     * @param fst  machine to traverse (labels resolved through its output symbols)
     * @param mode which symbols to keep
     * @return one symbol list per accepting path, in traversal order
     * @throws CyclicGrammarException if a path exceeds {@code maxDepth} arcs
     */
    public List<List<String>> enumerate(Fst fst, PathMode mode) {
        List<List<String>> paths = new ArrayList<>();
        if (fst.start() == Fst.NO_STATE) {
            return paths;
        }

        Deque<Frame> stack = new ArrayDeque<>();
        List<Arc> path = new ArrayList<>();
        stack.push(new Frame(fst.start()));

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            List<Arc> arcs = fst.arcs(frame.state);
            if (frame.nextArc >= arcs.size()) {
                stack.pop();
                if (!stack.isEmpty()) {
                    path.remove(path.size() - 1);
                }
                continue;
            }

            Arc arc = arcs.get(frame.nextArc++);
            path.add(arc);
            if (fst.isFinal(arc.nextState())) {
                paths.add(symbols(fst, path, mode));
                path.remove(path.size() - 1);
            } else {
                if (path.size() > maxDepth) {
                    throw new CyclicGrammarException(maxDepth, arc.nextState());
                }
                stack.push(new Frame(arc.nextState()));
            }
        }
        return paths;
    }

    /**
     * Writes every literal-only path as one space-separated line.
     *
     * @return number of paths written
     */
    public int print(Fst fst, Appendable out) {
        List<List<String>> paths = enumerate(fst, PathMode.LITERAL_ONLY);
        try {
            for (List<String> path : paths) {
                out.append(String.join(" ", path)).append(System.lineSeparator());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write paths", e);
        }
        return paths.size();
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    private static List<String> symbols(Fst fst, List<Arc> path, PathMode mode) {
        SymbolTable outputSymbols = fst.outputSymbols();
        List<String> symbols = new ArrayList<>(path.size());
        for (Arc arc : path) {
            if (arc.olabel() == SymbolTable.EPSILON_LABEL) {
                continue;
            }
            String symbol = outputSymbols.find(arc.olabel());
            if (mode == PathMode.LITERAL_ONLY && symbol.startsWith(META_PREFIX)) {
                continue;
            }
            symbols.add(symbol);
        }
        return symbols;
    }

    private static final class Frame {
        private final int state;
        private int nextArc;

        private Frame(int state) {
            this.state = state;
        }
    }
}

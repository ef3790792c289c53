package com.phillippitts.fstintent.config;

import com.phillippitts.fstintent.exception.GrammarFormatException;
import com.phillippitts.fstintent.service.fst.Arc;
import com.phillippitts.fstintent.service.fst.Fst;
import com.phillippitts.fstintent.service.fst.Grammar;
import com.phillippitts.fstintent.service.fst.SymbolTable;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Validates the loaded grammar at startup.
 *
 * Fail-fast philosophy: abort application startup with clear, actionable errors
 * if the grammar cannot be used.
 *
 * Validation performed:
 * - grammar has a start state and at least one final state
 * - every arc label resolves in its symbol table
 * - cycles reachable from the start state are reported (warning only: a cycle is harmless unless
 *   a sentence can reach it, in which case that sentence fails with a depth error)
 */
@Component
@ConditionalOnProperty(name = "fst.grammar.validation.enabled", havingValue = "true", matchIfMissing = true)
class GrammarValidationService {

    private static final Logger LOG = LogManager.getLogger(GrammarValidationService.class);

    private final Grammar grammar;

    GrammarValidationService(Grammar grammar) {
        this.grammar = grammar;
    }

    @PostConstruct
    void validateOnStartup() {
        Fst fst = grammar.fst();
        LOG.info("Validating grammar '{}' (states={}, arcs={})", grammar.name(), fst.numStates(), fst.totalArcs());

        validateStructure(fst);
        validateLabels(fst);
        if (hasReachableCycle(fst)) {
            LOG.warn("Grammar '{}' contains a cycle reachable from the start state; "
                    + "sentences that reach it will fail", grammar.name());
        }

        LOG.info("Grammar validation OK: '{}'", grammar.name());
    }

    // Visible for tests
    void validateStructure(Fst fst) {
        if (fst.start() == Fst.NO_STATE) {
            throw new GrammarFormatException("Grammar '" + grammar.name() + "' has no start state");
        }
        for (int s = 0; s < fst.numStates(); s++) {
            if (fst.isFinal(s)) {
                return;
            }
        }
        throw new GrammarFormatException("Grammar '" + grammar.name() + "' has no final state");
    }

    // Visible for tests
    void validateLabels(Fst fst) {
        SymbolTable isyms = fst.inputSymbols();
        SymbolTable osyms = fst.outputSymbols();
        for (int s = 0; s < fst.numStates(); s++) {
            for (Arc arc : fst.arcs(s)) {
                if (!isyms.contains(arc.ilabel())) {
                    throw new GrammarFormatException("Grammar '" + grammar.name() + "': input label "
                            + arc.ilabel() + " at state " + s + " missing from " + isyms.name());
                }
                if (!osyms.contains(arc.olabel())) {
                    throw new GrammarFormatException("Grammar '" + grammar.name() + "': output label "
                            + arc.olabel() + " at state " + s + " missing from " + osyms.name());
                }
            }
        }
    }

    // Visible for tests
    static boolean hasReachableCycle(Fst fst) {
        if (fst.start() == Fst.NO_STATE) {
            return false;
        }
        // 0 = unvisited, 1 = on stack, 2 = done
        int[] color = new int[fst.numStates()];
        Deque<int[]> stack = new ArrayDeque<>();
        stack.push(new int[]{fst.start(), 0});
        color[fst.start()] = 1;
        while (!stack.isEmpty()) {
            int[] frame = stack.peek();
            int state = frame[0];
            if (frame[1] >= fst.numArcs(state)) {
                color[state] = 2;
                stack.pop();
                continue;
            }
            int next = fst.arcs(state).get(frame[1]++).nextState();
            if (color[next] == 1) {
                return true;
            }
            if (color[next] == 0) {
                color[next] = 1;
                stack.push(new int[]{next, 0});
            }
        }
        return false;
    }
}

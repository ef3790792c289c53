package com.phillippitts.fstintent.service.health;

import com.phillippitts.fstintent.service.fst.Fst;
import com.phillippitts.fstintent.service.fst.Grammar;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the loaded grammar.
 *
 * <p>UP when the grammar has a start state and at least one accepting state; DOWN otherwise.
 * Details report the grammar name, state and arc counts and symbol table sizes.
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class GrammarHealthIndicator implements HealthIndicator {

    private final Grammar grammar;

    public GrammarHealthIndicator(Grammar grammar) {
        this.grammar = grammar;
    }

    @Override
    public Health health() {
        Fst fst = grammar.fst();
        boolean hasStart = fst.start() != Fst.NO_STATE;
        int finalStates = countFinalStates(fst);

        Health.Builder builder = hasStart && finalStates > 0 ? Health.up() : Health.down();
        return builder
                .withDetail("name", grammar.name())
                .withDetail("states", fst.numStates())
                .withDetail("arcs", fst.totalArcs())
                .withDetail("finalStates", finalStates)
                .withDetail("inputSymbols", fst.inputSymbols().size())
                .withDetail("outputSymbols", fst.outputSymbols().size())
                .build();
    }

    private static int countFinalStates(Fst fst) {
        int count = 0;
        for (int s = 0; s < fst.numStates(); s++) {
            if (fst.isFinal(s)) {
                count++;
            }
        }
        return count;
    }
}

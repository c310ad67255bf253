package com.cellmodeler.engine;

import com.cellmodeler.model.AutomatonConfig;
import com.cellmodeler.model.Rule;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Picks the next state of a single cell.
 *
 * <p>Rules are scanned in declaration order and the first one whose current state and condition both
 * match is applied. Its probability is rolled once: on success the cell moves to the rule's next state,
 * on failure it keeps its current state. A failed roll does not fall through to later rules that would
 * also match. A cell that matches no rule keeps its state.
 */
public final class TransitionEngine {

    private final List<List<Rule>> rulesByState;
    private final Map<String, Integer> indexByName;

    public TransitionEngine(AutomatonConfig config) {
        Objects.requireNonNull(config, "config");
        this.indexByName = NeighborhoodSummary.indexByName(config.states());
        List<List<Rule>> grouped = new ArrayList<>(config.states().size());
        for (int i = 0; i < config.states().size(); i++) {
            grouped.add(new ArrayList<>());
        }
        // grouping keeps declaration order within each state
        for (Rule rule : config.rules()) {
            grouped.get(index(rule.currentState())).add(rule);
        }
        List<List<Rule>> frozen = new ArrayList<>(grouped.size());
        for (List<Rule> rules : grouped) {
            frozen.add(List.copyOf(rules));
        }
        this.rulesByState = List.copyOf(frozen);
    }

    public int nextState(int currentState, NeighborhoodSummary summary, Random random) {
        for (Rule rule : rulesByState.get(currentState)) {
            if (ConditionEvaluator.evaluate(rule.condition(), summary)) {
                double u = random.nextDouble();
                return u < rule.probability() ? index(rule.nextState()) : currentState;
            }
        }
        return currentState;
    }

    Map<String, Integer> indexByName() {
        return indexByName;
    }

    private int index(String stateName) {
        Integer index = indexByName.get(stateName);
        if (index == null) {
            throw new IllegalArgumentException("Unknown state '" + stateName + "'; validate the config first");
        }
        return index;
    }
}

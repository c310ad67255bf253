package com.cellmodeler.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of parsing one configuration text: grid dimensions, the ordered state alphabet and the
 * ordered rule list. Immutable; only a config that passed validation may be simulated.
 */
public record AutomatonConfig(GridSpec grid, List<StateDef> states, List<Rule> rules) {

    public AutomatonConfig {
        Objects.requireNonNull(grid, "grid");
        states = List.copyOf(states);
        rules = List.copyOf(rules);
    }

    /**
     * Position of the first state declared with {@code name}, or -1.
     */
    public int indexOf(String name) {
        for (int i = 0; i < states.size(); i++) {
            if (states.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    public Optional<StateDef> state(String name) {
        int index = indexOf(name);
        return index < 0 ? Optional.empty() : Optional.of(states.get(index));
    }

    public List<String> stateNames() {
        return states.stream().map(StateDef::name).toList();
    }
}

package com.cellmodeler.engine;

import com.cellmodeler.model.StateDef;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Count of neighboring cells per state for one cell of one generation. Instances are reused across
 * cells by the driver, so they are not thread-safe.
 */
public final class NeighborhoodSummary {

    private final Map<String, Integer> indexByName;
    private final int[] counts;

    NeighborhoodSummary(Map<String, Integer> indexByName, int stateCount) {
        this.indexByName = indexByName;
        this.counts = new int[stateCount];
    }

    public static NeighborhoodSummary of(List<StateDef> states, Map<String, Integer> countsByName) {
        NeighborhoodSummary summary = new NeighborhoodSummary(indexByName(states), states.size());
        countsByName.forEach((name, count) -> summary.counts[summary.indexFor(name)] = count);
        return summary;
    }

    static Map<String, Integer> indexByName(List<StateDef> states) {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < states.size(); i++) {
            index.putIfAbsent(states.get(i).name(), i);
        }
        return Map.copyOf(index);
    }

    public int count(String stateName) {
        return counts[indexFor(stateName)];
    }

    int[] counts() {
        return counts;
    }

    void clear() {
        Arrays.fill(counts, 0);
    }

    private int indexFor(String stateName) {
        Integer index = indexByName.get(stateName);
        if (index == null) {
            throw new IllegalArgumentException("Unknown state '" + stateName + "'");
        }
        return index;
    }
}

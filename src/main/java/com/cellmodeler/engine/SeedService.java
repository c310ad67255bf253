package com.cellmodeler.engine;

import com.cellmodeler.model.AutomatonConfig;
import com.cellmodeler.model.StateDef;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Builds the first generation of a simulation.
 */
public final class SeedService {

    public static final long DEFAULT_RANDOM_SEED = 0x5EED5EEDL;

    private SeedService() {
    }

    /**
     * Every cell in {@code stateName}.
     */
    public static Grid uniformGrid(AutomatonConfig config, String stateName) {
        Objects.requireNonNull(config, "config");
        Grid grid = new Grid(config);
        int index = grid.indexOf(stateName);
        for (int y = 0; y < grid.height(); y++) {
            for (int x = 0; x < grid.width(); x++) {
                grid.set(x, y, index);
            }
        }
        return grid;
    }

    /**
     * Draws every cell independently, each state chosen with probability {@code weight / totalWeight}.
     * States with weight 0 are never chosen; when every weight is 0 the first declared state fills the grid.
     */
    public static Grid weightedRandomGrid(AutomatonConfig config, long seed) {
        Objects.requireNonNull(config, "config");
        Grid grid = new Grid(config);
        List<StateDef> states = config.states();
        long totalWeight = 0;
        for (StateDef state : states) {
            totalWeight += Math.max(state.weight(), 0);
        }
        if (totalWeight == 0) {
            return grid;
        }
        Random random = new Random(seed);
        for (int y = 0; y < grid.height(); y++) {
            for (int x = 0; x < grid.width(); x++) {
                grid.set(x, y, pickWeighted(states, totalWeight, random));
            }
        }
        return grid;
    }

    /**
     * Uniform {@code defaultState} grid with the given cells overwritten.
     */
    public static Grid fromAssignments(AutomatonConfig config, String defaultState, List<CellAssignment> assignments) {
        Objects.requireNonNull(assignments, "assignments");
        Grid grid = uniformGrid(config, defaultState);
        for (CellAssignment assignment : assignments) {
            int x = assignment.x();
            int y = assignment.y();
            if (x < 0 || x >= grid.width() || y < 0 || y >= grid.height()) {
                throw new IllegalArgumentException("Cell (" + x + ", " + y + ") is outside the "
                        + grid.width() + "x" + grid.height() + " grid");
            }
            grid.set(x, y, assignment.state());
        }
        return grid;
    }

    private static int pickWeighted(List<StateDef> states, long totalWeight, Random random) {
        long roll = (long) (random.nextDouble() * totalWeight);
        for (int i = 0; i < states.size(); i++) {
            int weight = Math.max(states.get(i).weight(), 0);
            if (roll < weight) {
                return i;
            }
            roll -= weight;
        }
        // only reachable through rounding at the very top of the range
        for (int i = states.size() - 1; i >= 0; i--) {
            if (states.get(i).weight() > 0) {
                return i;
            }
        }
        return 0;
    }
}

package com.cellmodeler.web;

import com.cellmodeler.engine.Grid;
import com.cellmodeler.model.StateDef;
import com.cellmodeler.service.GridSnapshot;
import java.util.List;

/**
 * Snapshot of one generation. {@code cells[y][x]} indexes into {@code states}.
 */
public record SimulationResponse(
        String id,
        long generation,
        int width,
        int height,
        List<StateView> states,
        int[][] cells
) {

    public record StateView(String name, int r, int g, int b, int weight) {

        static StateView of(StateDef state) {
            return new StateView(state.name(), state.color().red(), state.color().green(), state.color().blue(), state.weight());
        }
    }

    static SimulationResponse of(GridSnapshot snapshot) {
        Grid grid = snapshot.grid();
        List<StateView> states = grid.states().stream().map(StateView::of).toList();
        return new SimulationResponse(
                snapshot.sessionId(),
                snapshot.generation(),
                grid.width(),
                grid.height(),
                states,
                grid.toRows());
    }
}

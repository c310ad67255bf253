package com.cellmodeler.engine;

import java.util.Objects;

public record CellAssignment(int x, int y, String state) {

    public CellAssignment {
        Objects.requireNonNull(state, "state");
    }
}

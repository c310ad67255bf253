package com.cellmodeler.model;

import java.util.Objects;

/**
 * One symbol of the automaton's alphabet. {@code weight} is the relative frequency used when a grid
 * is seeded at random; a weight of zero keeps the state out of random seeding.
 */
public record StateDef(String name, Rgb color, int weight) {

    public StateDef {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(color, "color");
    }
}

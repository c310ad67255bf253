package com.cellmodeler.model;

/**
 * Fixed dimensions shared by every generation of an automaton.
 * Positivity is checked by the validator so that every violation can be reported at once.
 */
public record GridSpec(int width, int height) {

    /**
     * Widened to {@code long} so that any pair of {@code int} dimensions multiplies without overflow.
     */
    public long cellCount() {
        return (long) width * height;
    }
}

package com.cellmodeler.service;

public enum SeedingPolicy {
    /** Every cell starts in one state. */
    UNIFORM,
    /** Cells drawn at random using each state's weight. */
    WEIGHTED,
    /** Uniform default state with caller-supplied cells on top. */
    ASSIGNED
}

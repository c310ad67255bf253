package com.cellmodeler.engine;

import java.util.Objects;
import java.util.Random;

/**
 * Source of the per-cell probability rolls for one step. The driver asks for one generator per row and
 * draws from it left to right, so a seeded partition gives the same result whether rows run on one
 * thread or many.
 */
@FunctionalInterface
public interface RandomPartition {

    Random forRow(int row);

    /**
     * One generator for every row. Reproducible only when the step runs sequentially.
     */
    static RandomPartition shared(Random random) {
        Objects.requireNonNull(random, "random");
        return row -> random;
    }

    /**
     * Independent generator per row, derived from the simulation seed and the generation number.
     */
    static RandomPartition seeded(long seed, long generation) {
        return row -> new Random(mix(seed, generation, row));
    }

    private static long mix(long seed, long generation, int row) {
        long z = seed;
        z = splitMix(z ^ splitMix(generation + 0x9E3779B97F4A7C15L));
        z = splitMix(z ^ splitMix(row + 0xBF58476D1CE4E5B9L));
        return z;
    }

    private static long splitMix(long value) {
        long z = value;
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }
}

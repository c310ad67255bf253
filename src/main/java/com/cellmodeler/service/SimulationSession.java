package com.cellmodeler.service;

import com.cellmodeler.engine.Grid;
import com.cellmodeler.engine.Neighborhood;
import com.cellmodeler.engine.RandomPartition;
import com.cellmodeler.engine.SimulationDriver;
import com.cellmodeler.model.AutomatonConfig;
import java.time.Instant;
import java.util.Objects;

/**
 * One running automaton. Steps are serialized on the session; readers only ever see complete
 * generations through {@link #snapshot()}.
 */
public final class SimulationSession {

    private final String id;
    private final SimulationDriver driver;
    private final long randomSeed;
    private final Instant createdAt;
    private Grid current;
    private long generation;

    SimulationSession(String id, SimulationDriver driver, Grid initial, long randomSeed) {
        this.id = Objects.requireNonNull(id, "id");
        this.driver = Objects.requireNonNull(driver, "driver");
        this.current = Objects.requireNonNull(initial, "initial").copy();
        this.randomSeed = randomSeed;
        this.createdAt = Instant.now();
    }

    public String id() {
        return id;
    }

    public AutomatonConfig config() {
        return driver.config();
    }

    public Neighborhood neighborhood() {
        return driver.neighborhood();
    }

    public boolean wrap() {
        return driver.wrap();
    }

    public long randomSeed() {
        return randomSeed;
    }

    public Instant createdAt() {
        return createdAt;
    }

    /**
     * Runs {@code steps} generations. Each generation draws from its own seeded partition, so a session
     * replays identically for the same seed and initial grid.
     */
    public synchronized GridSnapshot advance(int steps) {
        if (steps < 0) {
            throw new IllegalArgumentException("Steps must not be negative");
        }
        for (int i = 0; i < steps; i++) {
            Grid next = driver.step(current, RandomPartition.seeded(randomSeed, generation));
            current = next;
            generation++;
        }
        return snapshot();
    }

    public synchronized GridSnapshot snapshot() {
        return new GridSnapshot(id, generation, current.copy());
    }

    public synchronized long generation() {
        return generation;
    }
}

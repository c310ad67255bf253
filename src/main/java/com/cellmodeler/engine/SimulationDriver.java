package com.cellmodeler.engine;

import com.cellmodeler.model.AutomatonConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Advances a grid by one generation.
 *
 * <p>{@link #step} reads only from its input grid and writes into a fresh one, so cells never see
 * results written earlier in the same step. The input grid is never modified.
 */
public final class SimulationDriver {

    public static final int DEFAULT_PARALLEL_THRESHOLD = 10_000;

    private static final Logger log = LoggerFactory.getLogger(SimulationDriver.class);

    private final AutomatonConfig config;
    private final TransitionEngine engine;
    private final Neighborhood neighborhood;
    private final boolean wrap;
    private final Executor executor;
    private final int parallelThreshold;

    public SimulationDriver(AutomatonConfig config, Neighborhood neighborhood, boolean wrap) {
        this(config, neighborhood, wrap, null, DEFAULT_PARALLEL_THRESHOLD);
    }

    /**
     * @param executor          runs rows in parallel for grids of at least {@code parallelThreshold} cells;
     *                          {@code null} keeps every step on the calling thread
     */
    public SimulationDriver(AutomatonConfig config, Neighborhood neighborhood, boolean wrap,
            Executor executor, int parallelThreshold) {
        this.config = Objects.requireNonNull(config, "config");
        this.neighborhood = Objects.requireNonNull(neighborhood, "neighborhood");
        this.engine = new TransitionEngine(config);
        this.wrap = wrap;
        this.executor = executor;
        this.parallelThreshold = parallelThreshold;
    }

    public AutomatonConfig config() {
        return config;
    }

    public Neighborhood neighborhood() {
        return neighborhood;
    }

    public boolean wrap() {
        return wrap;
    }

    public Grid step(Grid read, RandomPartition random) {
        Objects.requireNonNull(read, "read");
        Objects.requireNonNull(random, "random");
        if (!read.states().equals(config.states())) {
            throw new IllegalArgumentException("Grid was not built for this configuration");
        }
        Grid next = new Grid(read.states(), read.width(), read.height());
        int cellCount = read.cellCount();
        if (executor == null || cellCount < parallelThreshold || read.height() == 1) {
            for (int y = 0; y < read.height(); y++) {
                stepRow(read, next, y, random);
            }
            return next;
        }

        log.debug("Stepping {}x{} grid with rows in parallel", read.width(), read.height());
        List<CompletableFuture<Void>> rows = new ArrayList<>(read.height());
        for (int y = 0; y < read.height(); y++) {
            int row = y;
            rows.add(CompletableFuture.runAsync(() -> stepRow(read, next, row, random), executor));
        }
        CompletableFuture.allOf(rows.toArray(CompletableFuture[]::new)).join();
        return next;
    }

    private void stepRow(Grid read, Grid next, int y, RandomPartition random) {
        Map<String, Integer> indexByName = engine.indexByName();
        NeighborhoodSummary summary = new NeighborhoodSummary(indexByName, read.states().size());
        Random rowRandom = random.forRow(y);
        for (int x = 0; x < read.width(); x++) {
            summary.clear();
            read.countNeighbors(x, y, neighborhood, wrap, summary.counts());
            next.set(x, y, engine.nextState(read.get(x, y), summary, rowRandom));
        }
    }
}

package com.cellmodeler.service;

import com.cellmodeler.engine.CellAssignment;
import com.cellmodeler.engine.SeedService;
import java.util.List;
import java.util.Objects;

/**
 * How to build generation zero. {@code defaultState} may be null, meaning the first declared state.
 */
public record SeedingRequest(SeedingPolicy policy, String defaultState, List<CellAssignment> cells, long randomSeed) {

    public SeedingRequest {
        Objects.requireNonNull(policy, "policy");
        cells = cells == null ? List.of() : List.copyOf(cells);
    }

    public static SeedingRequest weighted(long randomSeed) {
        return new SeedingRequest(SeedingPolicy.WEIGHTED, null, List.of(), randomSeed);
    }

    public static SeedingRequest uniform(String state) {
        return new SeedingRequest(SeedingPolicy.UNIFORM, state, List.of(), SeedService.DEFAULT_RANDOM_SEED);
    }

    public static SeedingRequest assigned(String defaultState, List<CellAssignment> cells) {
        return new SeedingRequest(SeedingPolicy.ASSIGNED, defaultState, cells, SeedService.DEFAULT_RANDOM_SEED);
    }
}

package com.cellmodeler.web;

import java.util.List;

/**
 * Either {@code config} (configuration text) or {@code example} (a bundled example id) must be set.
 * {@code neighborhood} and {@code wrap} override the service defaults for this simulation only.
 */
public record CreateSimulationRequest(
        String config,
        String example,
        String seeding,
        String defaultState,
        List<SeedCell> cells,
        Long randomSeed,
        String neighborhood,
        Boolean wrap
) {
}

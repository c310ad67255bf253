package com.cellmodeler.config;

import com.cellmodeler.engine.Neighborhood;
import com.cellmodeler.engine.SimulationDriver;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class AppProperties {

    static final int DEFAULT_MAX_STEPS_PER_REQUEST = 1000;
    static final int DEFAULT_MAX_SESSIONS = 64;
    static final int DEFAULT_MAX_CELLS = 1_000_000;

    private final Neighborhood neighborhood;
    private final boolean wrap;
    private final int parallelThreshold;
    private final int maxStepsPerRequest;
    private final int maxSessions;
    private final int maxCells;

    public AppProperties(Environment environment) {
        String neighborhoodRaw = resolveOptional(environment, "app.simulation.neighborhood", "SIM_NEIGHBORHOOD");
        this.neighborhood = neighborhoodRaw == null ? Neighborhood.MOORE : Neighborhood.parse(neighborhoodRaw);
        String wrapRaw = resolveOptional(environment, "app.simulation.wrap", "SIM_WRAP");
        this.wrap = wrapRaw != null && parseBoolean(wrapRaw, "SIM_WRAP");
        this.parallelThreshold = resolvePositiveInt(environment, "app.simulation.parallel-threshold",
                "SIM_PARALLEL_THRESHOLD", SimulationDriver.DEFAULT_PARALLEL_THRESHOLD);
        this.maxStepsPerRequest = resolvePositiveInt(environment, "app.simulation.max-steps-per-request",
                "SIM_MAX_STEPS", DEFAULT_MAX_STEPS_PER_REQUEST);
        this.maxSessions = resolvePositiveInt(environment, "app.simulation.max-sessions",
                "SIM_MAX_SESSIONS", DEFAULT_MAX_SESSIONS);
        this.maxCells = resolvePositiveInt(environment, "app.simulation.max-cells",
                "SIM_MAX_CELLS", DEFAULT_MAX_CELLS);
    }

    public Neighborhood getNeighborhood() {
        return neighborhood;
    }

    public boolean isWrap() {
        return wrap;
    }

    public int getParallelThreshold() {
        return parallelThreshold;
    }

    public int getMaxStepsPerRequest() {
        return maxStepsPerRequest;
    }

    public int getMaxSessions() {
        return maxSessions;
    }

    public int getMaxCells() {
        return maxCells;
    }

    private String resolveOptional(Environment environment, String propertyKey, String envKey) {
        String value = environment.getProperty(propertyKey);
        if (StringUtils.hasText(value)) {
            return value.trim();
        }
        value = environment.getProperty(envKey);
        return StringUtils.hasText(value) ? value.trim() : null;
    }

    private int resolvePositiveInt(Environment environment, String propertyKey, String envKey, int defaultValue) {
        String value = resolveOptional(environment, propertyKey, envKey);
        if (value == null) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value);
            if (parsed <= 0) {
                throw new IllegalArgumentException();
            }
            return parsed;
        } catch (Exception ex) {
            throw new IllegalStateException("Invalid " + envKey + " value: " + value, ex);
        }
    }

    private boolean parseBoolean(String value, String envKey) {
        if ("true".equalsIgnoreCase(value) || "1".equals(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value) || "0".equals(value)) {
            return false;
        }
        throw new IllegalStateException("Invalid " + envKey + " value: " + value);
    }
}

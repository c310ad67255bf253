package com.cellmodeler.service;

import com.cellmodeler.engine.Neighborhood;

/**
 * Per-simulation neighborhood shape and edge handling. A null field falls back to the configured default.
 */
public record Topology(Neighborhood neighborhood, Boolean wrap) {

    public static final Topology DEFAULTS = new Topology(null, null);

    Neighborhood neighborhoodOr(Neighborhood fallback) {
        return neighborhood != null ? neighborhood : fallback;
    }

    boolean wrapOr(boolean fallback) {
        return wrap != null ? wrap : fallback;
    }
}

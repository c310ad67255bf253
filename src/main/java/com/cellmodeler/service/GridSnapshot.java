package com.cellmodeler.service;

import com.cellmodeler.engine.Grid;

/**
 * A whole generation as seen by readers. The grid is a private copy.
 */
public record GridSnapshot(String sessionId, long generation, Grid grid) {
}

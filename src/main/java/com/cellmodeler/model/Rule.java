package com.cellmodeler.model;

import java.util.Objects;

/**
 * Guarded, probabilistic transition {@code currentState -> nextState}. Rules are kept in declaration
 * order and the first applicable one wins.
 */
public record Rule(String currentState, ConditionExpr condition, String nextState, double probability) {

    public static final double DEFAULT_PROBABILITY = 1.0d;

    public Rule {
        Objects.requireNonNull(currentState, "currentState");
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(nextState, "nextState");
    }

    public Rule(String currentState, ConditionExpr condition, String nextState) {
        this(currentState, condition, nextState, DEFAULT_PROBABILITY);
    }

    public boolean isUnconditional() {
        return condition instanceof ConditionExpr.Unconditional;
    }
}

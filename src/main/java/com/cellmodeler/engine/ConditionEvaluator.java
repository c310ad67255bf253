package com.cellmodeler.engine;

import com.cellmodeler.model.ConditionExpr;

public final class ConditionEvaluator {

    private ConditionEvaluator() {
    }

    /**
     * Evaluates a condition tree against one cell's neighbor counts. Combined conditions are evaluated
     * left to right; XOR holds when exactly one side holds.
     */
    public static boolean evaluate(ConditionExpr condition, NeighborhoodSummary summary) {
        if (condition instanceof ConditionExpr.Leaf leaf) {
            return leaf.operator().test(summary.count(leaf.stateName()), leaf.value());
        }
        if (condition instanceof ConditionExpr.Combine combine) {
            boolean left = evaluate(combine.left(), summary);
            boolean right = evaluate(combine.right(), summary);
            return combine.connective().apply(left, right);
        }
        return true;
    }
}

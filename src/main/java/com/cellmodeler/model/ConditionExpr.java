package com.cellmodeler.model;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Neighbor condition attached to a rule.
 *
 * <p>Trees built by the parser are strictly left-associative: the language gives AND, OR and XOR the
 * same precedence, so {@code a OR b AND c} is {@code (a OR b) AND c}. {@link Unconditional} is the
 * {@code (no conditions)} marker and never appears inside a {@link Combine}.
 */
public sealed interface ConditionExpr permits ConditionExpr.Leaf, ConditionExpr.Combine, ConditionExpr.Unconditional {

    /**
     * Visits every leaf from left to right.
     */
    void forEachLeaf(Consumer<Leaf> consumer);

    static ConditionExpr unconditional() {
        return Unconditional.INSTANCE;
    }

    /**
     * {@code count(stateName) <operator> value}.
     */
    record Leaf(String stateName, ComparisonOperator operator, int value) implements ConditionExpr {

        public Leaf {
            Objects.requireNonNull(stateName, "stateName");
            Objects.requireNonNull(operator, "operator");
        }

        @Override
        public void forEachLeaf(Consumer<Leaf> consumer) {
            consumer.accept(this);
        }

        @Override
        public String toString() {
            return "count(" + stateName + ") " + operator.symbol() + " " + value;
        }
    }

    record Combine(Connective connective, ConditionExpr left, ConditionExpr right) implements ConditionExpr {

        public Combine {
            Objects.requireNonNull(connective, "connective");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
            if (left instanceof Unconditional || right instanceof Unconditional) {
                throw new IllegalArgumentException("(no conditions) cannot be combined with other conditions");
            }
        }

        @Override
        public void forEachLeaf(Consumer<Leaf> consumer) {
            left.forEachLeaf(consumer);
            right.forEachLeaf(consumer);
        }

        @Override
        public String toString() {
            return left + " " + connective + " " + right;
        }
    }

    enum Unconditional implements ConditionExpr {
        INSTANCE;

        @Override
        public void forEachLeaf(Consumer<Leaf> consumer) {
        }

        @Override
        public String toString() {
            return "(no conditions)";
        }
    }
}

package com.cellmodeler.model;

public enum Connective {
    AND,
    OR,
    XOR;

    public boolean apply(boolean left, boolean right) {
        return switch (this) {
            case AND -> left && right;
            case OR -> left || right;
            case XOR -> left != right;
        };
    }
}

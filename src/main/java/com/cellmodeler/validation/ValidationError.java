package com.cellmodeler.validation;

/**
 * One semantic problem found in a parsed configuration.
 */
public sealed interface ValidationError {

    String message();

    enum ReferenceSite {
        CURRENT_STATE("current state"),
        NEXT_STATE("next state"),
        CONDITION("condition");

        private final String label;

        ReferenceSite(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    enum Dimension {
        WIDTH,
        HEIGHT
    }

    enum ColorComponent {
        RED,
        GREEN,
        BLUE
    }

    record UnknownStateReference(int ruleIndex, ReferenceSite site, String name) implements ValidationError {
        @Override
        public String message() {
            return "Rule " + (ruleIndex + 1) + " references unknown " + site.label() + " '" + name + "'";
        }
    }

    record DuplicateStateName(String name) implements ValidationError {
        @Override
        public String message() {
            return "State '" + name + "' is declared more than once";
        }
    }

    record ProbabilityOutOfRange(int ruleIndex, double value) implements ValidationError {
        @Override
        public String message() {
            return "Rule " + (ruleIndex + 1) + " has probability " + value + " outside 0.0-1.0";
        }
    }

    record ColorComponentOutOfRange(String state, ColorComponent component, int value) implements ValidationError {
        @Override
        public String message() {
            return "State '" + state + "' has " + component.name().toLowerCase() + " component " + value
                    + " outside 0-255";
        }
    }

    record NonPositiveGridDimension(Dimension which, int value) implements ValidationError {
        @Override
        public String message() {
            return "Grid " + which.name().toLowerCase() + " must be positive but was " + value;
        }
    }

    record NegativeStateWeight(String state, int value) implements ValidationError {
        @Override
        public String message() {
            return "State '" + state + "' has negative weight " + value;
        }
    }

    record NoStatesDeclared() implements ValidationError {
        @Override
        public String message() {
            return "At least one state must be declared";
        }
    }
}

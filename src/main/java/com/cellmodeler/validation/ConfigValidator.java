package com.cellmodeler.validation;

import com.cellmodeler.model.AutomatonConfig;
import com.cellmodeler.model.Rgb;
import com.cellmodeler.model.Rule;
import com.cellmodeler.model.StateDef;
import com.cellmodeler.validation.ValidationError.ColorComponent;
import com.cellmodeler.validation.ValidationError.Dimension;
import com.cellmodeler.validation.ValidationError.ReferenceSite;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Cross-checks a parsed config. Every violation is collected in one pass so that callers can report
 * all of them together.
 */
public final class ConfigValidator {

    private ConfigValidator() {
    }

    public static List<ValidationError> validate(AutomatonConfig config) {
        Objects.requireNonNull(config, "config");
        List<ValidationError> errors = new ArrayList<>();
        checkGrid(config, errors);
        Set<String> names = checkStates(config, errors);
        checkRules(config, names, errors);
        return List.copyOf(errors);
    }

    /**
     * @return the same config when it is valid
     * @throws ConfigValidationException listing every violation otherwise
     */
    public static AutomatonConfig requireValid(AutomatonConfig config) {
        List<ValidationError> errors = validate(config);
        if (!errors.isEmpty()) {
            throw new ConfigValidationException(errors);
        }
        return config;
    }

    private static void checkGrid(AutomatonConfig config, List<ValidationError> errors) {
        if (config.grid().width() <= 0) {
            errors.add(new ValidationError.NonPositiveGridDimension(Dimension.WIDTH, config.grid().width()));
        }
        if (config.grid().height() <= 0) {
            errors.add(new ValidationError.NonPositiveGridDimension(Dimension.HEIGHT, config.grid().height()));
        }
    }

    private static Set<String> checkStates(AutomatonConfig config, List<ValidationError> errors) {
        if (config.states().isEmpty()) {
            errors.add(new ValidationError.NoStatesDeclared());
        }
        Set<String> names = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (StateDef state : config.states()) {
            if (!names.add(state.name())) {
                duplicates.add(state.name());
            }
            Rgb color = state.color();
            checkComponent(state.name(), ColorComponent.RED, color.red(), errors);
            checkComponent(state.name(), ColorComponent.GREEN, color.green(), errors);
            checkComponent(state.name(), ColorComponent.BLUE, color.blue(), errors);
            if (state.weight() < 0) {
                errors.add(new ValidationError.NegativeStateWeight(state.name(), state.weight()));
            }
        }
        for (String duplicate : duplicates) {
            errors.add(new ValidationError.DuplicateStateName(duplicate));
        }
        return names;
    }

    private static void checkComponent(String state, ColorComponent component, int value, List<ValidationError> errors) {
        if (value < 0 || value > 255) {
            errors.add(new ValidationError.ColorComponentOutOfRange(state, component, value));
        }
    }

    private static void checkRules(AutomatonConfig config, Set<String> names, List<ValidationError> errors) {
        List<Rule> rules = config.rules();
        for (int i = 0; i < rules.size(); i++) {
            int ruleIndex = i;
            Rule rule = rules.get(i);
            if (!names.contains(rule.currentState())) {
                errors.add(new ValidationError.UnknownStateReference(ruleIndex, ReferenceSite.CURRENT_STATE, rule.currentState()));
            }
            rule.condition().forEachLeaf(leaf -> {
                if (!names.contains(leaf.stateName())) {
                    errors.add(new ValidationError.UnknownStateReference(ruleIndex, ReferenceSite.CONDITION, leaf.stateName()));
                }
            });
            if (!names.contains(rule.nextState())) {
                errors.add(new ValidationError.UnknownStateReference(ruleIndex, ReferenceSite.NEXT_STATE, rule.nextState()));
            }
            double p = rule.probability();
            if (Double.isNaN(p) || p < 0.0 || p > 1.0) {
                errors.add(new ValidationError.ProbabilityOutOfRange(ruleIndex, p));
            }
        }
    }
}

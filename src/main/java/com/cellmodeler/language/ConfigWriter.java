package com.cellmodeler.language;

import com.cellmodeler.model.AutomatonConfig;
import com.cellmodeler.model.ConditionExpr;
import com.cellmodeler.model.Rule;
import com.cellmodeler.model.StateDef;
import java.math.BigDecimal;
import java.util.Objects;

/**
 * Renders a config back to configuration text. The output parses to an equal {@link AutomatonConfig}.
 */
public final class ConfigWriter {

    private static final String INDENT = "  ";

    private ConfigWriter() {
    }

    public static String write(AutomatonConfig config) {
        Objects.requireNonNull(config, "config");
        StringBuilder out = new StringBuilder();
        out.append("WIDTH ").append(config.grid().width())
                .append(" HEIGHT ").append(config.grid().height()).append('\n');

        out.append("STATE {\n");
        for (StateDef state : config.states()) {
            out.append(INDENT).append(state.name()).append('(')
                    .append(state.color().red()).append(", ")
                    .append(state.color().green()).append(", ")
                    .append(state.color().blue()).append(", ")
                    .append(state.weight()).append(")\n");
        }
        out.append("}\n");

        out.append("RULES {\n");
        for (Rule rule : config.rules()) {
            out.append(INDENT).append(formatRule(rule)).append('\n');
        }
        out.append("}\n");
        return out.toString();
    }

    public static String formatRule(Rule rule) {
        return "IF current is '" + rule.currentState() + "' AND " + formatCondition(rule.condition())
                + " THEN next is '" + rule.nextState() + "' WITH PROB " + formatProbability(rule.probability());
    }

    static String formatCondition(ConditionExpr condition) {
        if (condition instanceof ConditionExpr.Unconditional) {
            return "(no conditions)";
        }
        if (condition instanceof ConditionExpr.Leaf leaf) {
            return "count(" + leaf.stateName() + ") " + leaf.operator().symbol() + " " + leaf.value();
        }
        ConditionExpr.Combine combine = (ConditionExpr.Combine) condition;
        // left-associative trees print in source order without parentheses
        return formatCondition(combine.left()) + " " + combine.connective() + " " + formatCondition(combine.right());
    }

    private static String formatProbability(double probability) {
        return BigDecimal.valueOf(probability).toPlainString();
    }
}

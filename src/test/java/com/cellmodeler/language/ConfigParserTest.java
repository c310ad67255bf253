package com.cellmodeler.language;

import static org.junit.jupiter.api.Assertions.*;

import com.cellmodeler.model.AutomatonConfig;
import com.cellmodeler.model.ComparisonOperator;
import com.cellmodeler.model.ConditionExpr;
import com.cellmodeler.model.Connective;
import com.cellmodeler.model.GridSpec;
import com.cellmodeler.model.Rgb;
import com.cellmodeler.model.Rule;
import com.cellmodeler.model.StateDef;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConfigParserTest {

    static final String FOREST_FIRE = """
            WIDTH 50 HEIGHT 40
            STATE {
              Empty(0, 0, 0, 10)
              Tree(0, 200, 0, 7)
              Burning(255, 0, 0, 3)
            }
            RULES {
              IF current is 'Burning' AND (no conditions) THEN next is 'Empty' WITH PROB 0.5
              IF current is 'Tree' AND count(Burning) >= 1 THEN next is 'Burning' WITH PROB 1.0
              IF current is 'Empty' AND (no conditions) THEN next is 'Tree' WITH PROB 0.1
            }
            """;

    @Test
    void parsesForestFireExample() {
        AutomatonConfig config = ConfigParser.parse(FOREST_FIRE);

        assertEquals(new GridSpec(50, 40), config.grid());
        assertEquals(List.of(
                new StateDef("Empty", new Rgb(0, 0, 0), 10),
                new StateDef("Tree", new Rgb(0, 200, 0), 7),
                new StateDef("Burning", new Rgb(255, 0, 0), 3)), config.states());
        assertEquals(List.of(
                new Rule("Burning", ConditionExpr.unconditional(), "Empty", 0.5),
                new Rule("Tree", new ConditionExpr.Leaf("Burning", ComparisonOperator.GREATER_OR_EQUAL, 1), "Burning", 1.0),
                new Rule("Empty", ConditionExpr.unconditional(), "Tree", 0.1)), config.rules());
    }

    @Test
    void connectivesAreLeftAssociativeWithEqualPrecedence() {
        AutomatonConfig config = ConfigParser.parse("""
                WIDTH 3 HEIGHT 3
                STATE { A(0, 0, 0, 1) B(1, 1, 1, 1) }
                RULES {
                  IF current is 'A' AND count(A) == 1 OR count(B) < 2 AND count(A) != 0 XOR count(B) > 4 THEN next is 'B'
                }
                """);
        ConditionExpr a1 = new ConditionExpr.Leaf("A", ComparisonOperator.EQUALS, 1);
        ConditionExpr b2 = new ConditionExpr.Leaf("B", ComparisonOperator.LESS_THAN, 2);
        ConditionExpr a0 = new ConditionExpr.Leaf("A", ComparisonOperator.NOT_EQUALS, 0);
        ConditionExpr b4 = new ConditionExpr.Leaf("B", ComparisonOperator.GREATER_THAN, 4);
        ConditionExpr expected = new ConditionExpr.Combine(Connective.XOR,
                new ConditionExpr.Combine(Connective.AND,
                        new ConditionExpr.Combine(Connective.OR, a1, b2),
                        a0),
                b4);
        assertEquals(expected, config.rules().get(0).condition());
    }

    @Test
    void probabilityDefaultsToOne() {
        AutomatonConfig config = ConfigParser.parse("""
                WIDTH 1 HEIGHT 1
                STATE { A(0, 0, 0, 1) }
                RULES { IF current is 'A' AND (no conditions) THEN next is 'A' }
                """);
        assertEquals(1.0, config.rules().get(0).probability());
    }

    @Test
    void acceptsIntegerProbabilityAndMissingConditionClause() {
        AutomatonConfig config = ConfigParser.parse("""
                WIDTH 1 HEIGHT 1
                STATE { A(0, 0, 0, 1) }
                RULES { IF current is 'A' THEN next is 'A' WITH PROB 1 }
                """);
        Rule rule = config.rules().get(0);
        assertTrue(rule.isUnconditional());
        assertEquals(1.0, rule.probability());
    }

    @Test
    void emptyBlocksAreAllowed() {
        AutomatonConfig config = ConfigParser.parse("WIDTH 2 HEIGHT 2 STATE { } RULES { }");
        assertTrue(config.states().isEmpty());
        assertTrue(config.rules().isEmpty());
    }

    @Test
    void reportsExpectedAndFound() {
        ConfigParseException ex = assertThrows(ConfigParseException.class,
                () -> ConfigParser.parse("WIDTH 10 HEIGHT STATE { }"));
        assertEquals("grid height", ex.expected());
        assertEquals("STATE", ex.found());
        assertEquals(1, ex.line());
        assertEquals(17, ex.column());
    }

    @Test
    void reportsMissingThen() {
        ConfigParseException ex = assertThrows(ConfigParseException.class, () -> ConfigParser.parse("""
                WIDTH 1 HEIGHT 1
                STATE { A(0, 0, 0, 1) }
                RULES { IF current is 'A' AND (no conditions) next is 'A' }
                """));
        assertEquals("THEN", ex.expected());
        assertEquals(3, ex.line());
    }

    @Test
    void noConditionsCannotBeCombined() {
        ConfigParseException ex = assertThrows(ConfigParseException.class, () -> ConfigParser.parse("""
                WIDTH 1 HEIGHT 1
                STATE { A(0, 0, 0, 1) }
                RULES { IF current is 'A' AND (no conditions) OR count(A) > 1 THEN next is 'A' }
                """));
        assertEquals("THEN", ex.expected());
        assertEquals("OR", ex.found());
    }

    @Test
    void stateDefinitionNeedsFourNumbers() {
        ConfigParseException ex = assertThrows(ConfigParseException.class,
                () -> ConfigParser.parse("WIDTH 1 HEIGHT 1 STATE { A(0, 0, 0) } RULES { }"));
        assertEquals("','", ex.expected());
        assertEquals("')'", ex.found());
    }

    @Test
    void rejectsTrailingInput() {
        ConfigParseException ex = assertThrows(ConfigParseException.class,
                () -> ConfigParser.parse("WIDTH 1 HEIGHT 1 STATE { } RULES { } RULES"));
        assertEquals("end of input", ex.expected());
    }

    @Test
    void rejectsOversizedNumbers() {
        assertThrows(ConfigParseException.class,
                () -> ConfigParser.parse("WIDTH 99999999999 HEIGHT 1 STATE { } RULES { }"));
    }

    @Test
    void unexpectedEndOfInputIsReported() {
        ConfigParseException ex = assertThrows(ConfigParseException.class,
                () -> ConfigParser.parse("WIDTH 1 HEIGHT 1 STATE { A(0, 0, 0, 1)"));
        assertEquals("end of input", ex.found());
    }
}

package com.cellmodeler.validation;

import static org.junit.jupiter.api.Assertions.*;

import com.cellmodeler.language.ConfigParser;
import com.cellmodeler.model.AutomatonConfig;
import com.cellmodeler.validation.ValidationError.ColorComponent;
import com.cellmodeler.validation.ValidationError.Dimension;
import com.cellmodeler.validation.ValidationError.ReferenceSite;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConfigValidatorTest {

    @Test
    void validConfigHasNoErrors() {
        AutomatonConfig config = ConfigParser.parse("""
                WIDTH 4 HEIGHT 4
                STATE { Off(0, 0, 0, 1) On(255, 255, 255, 0) }
                RULES { IF current is 'Off' AND count(On) == 3 THEN next is 'On' WITH PROB 0.0 }
                """);
        assertTrue(ConfigValidator.validate(config).isEmpty());
        assertSame(config, ConfigValidator.requireValid(config));
    }

    @Test
    void collectsEveryErrorInOnePass() {
        AutomatonConfig config = ConfigParser.parse("""
                WIDTH 4 HEIGHT 4
                STATE { Off(0, 0, 0, 1) On(255, 255, 255, 1) }
                RULES {
                  IF current is 'Of' AND (no conditions) THEN next is 'On'
                  IF current is 'On' AND count(Onn) > 1 THEN next is 'Off' WITH PROB 1.5
                }
                """);
        List<ValidationError> errors = ConfigValidator.validate(config);
        assertEquals(List.of(
                new ValidationError.UnknownStateReference(0, ReferenceSite.CURRENT_STATE, "Of"),
                new ValidationError.UnknownStateReference(1, ReferenceSite.CONDITION, "Onn"),
                new ValidationError.ProbabilityOutOfRange(1, 1.5)), errors);
    }

    @Test
    void reportsStateAndGridProblems() {
        AutomatonConfig config = ConfigParser.parse("""
                WIDTH 0 HEIGHT -2
                STATE { A(256, 0, -1, 1) A(0, 0, 0, -3) }
                RULES { }
                """);
        List<ValidationError> errors = ConfigValidator.validate(config);
        assertTrue(errors.contains(new ValidationError.NonPositiveGridDimension(Dimension.WIDTH, 0)));
        assertTrue(errors.contains(new ValidationError.NonPositiveGridDimension(Dimension.HEIGHT, -2)));
        assertTrue(errors.contains(new ValidationError.ColorComponentOutOfRange("A", ColorComponent.RED, 256)));
        assertTrue(errors.contains(new ValidationError.ColorComponentOutOfRange("A", ColorComponent.BLUE, -1)));
        assertTrue(errors.contains(new ValidationError.NegativeStateWeight("A", -3)));
        assertTrue(errors.contains(new ValidationError.DuplicateStateName("A")));
        assertEquals(6, errors.size());
    }

    @Test
    void reportsUnknownNextStateAndMissingStates() {
        AutomatonConfig config = ConfigParser.parse("""
                WIDTH 1 HEIGHT 1
                STATE { }
                RULES { IF current is 'A' THEN next is 'B' WITH PROB -0.1 }
                """);
        List<ValidationError> errors = ConfigValidator.validate(config);
        assertEquals(List.of(
                new ValidationError.NoStatesDeclared(),
                new ValidationError.UnknownStateReference(0, ReferenceSite.CURRENT_STATE, "A"),
                new ValidationError.UnknownStateReference(0, ReferenceSite.NEXT_STATE, "B"),
                new ValidationError.ProbabilityOutOfRange(0, -0.1)), errors);
    }

    @Test
    void requireValidCarriesAllErrors() {
        AutomatonConfig config = ConfigParser.parse("""
                WIDTH 2 HEIGHT 2
                STATE { A(0, 0, 0, 1) }
                RULES { IF current is 'X' AND count(Y) == 1 THEN next is 'Z' }
                """);
        ConfigValidationException ex = assertThrows(ConfigValidationException.class, () -> ConfigValidator.requireValid(config));
        assertEquals(3, ex.errors().size());
        assertTrue(ex.getMessage().contains("Rule 1 references unknown condition 'Y'"));
    }
}

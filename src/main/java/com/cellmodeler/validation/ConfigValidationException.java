package com.cellmodeler.validation;

import java.util.List;
import java.util.stream.Collectors;

public class ConfigValidationException extends IllegalArgumentException {

    private final List<ValidationError> errors;

    public ConfigValidationException(List<ValidationError> errors) {
        super(errors.stream().map(ValidationError::message).collect(Collectors.joining("; ")));
        this.errors = List.copyOf(errors);
    }

    public List<ValidationError> errors() {
        return errors;
    }
}

package com.cellmodeler.language;

public class ConfigParseException extends ConfigSyntaxException {

    private final String expected;
    private final String found;

    public ConfigParseException(String expected, Token found) {
        this("Expected " + expected + " but found " + found.describe(), expected, found);
    }

    public ConfigParseException(String message, String expected, Token found) {
        super(message, found.position(), found.line(), found.column());
        this.expected = expected;
        this.found = found.describe();
    }

    public String expected() {
        return expected;
    }

    public String found() {
        return found;
    }
}

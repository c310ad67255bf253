package com.cellmodeler.language;

public class LexException extends ConfigSyntaxException {

    private final char unexpected;

    public LexException(String message, char unexpected, int position, int line, int column) {
        super(message, position, line, column);
        this.unexpected = unexpected;
    }

    public char unexpected() {
        return unexpected;
    }
}

package com.cellmodeler.language;

/**
 * Base type for errors that point at a location in configuration text.
 */
public abstract class ConfigSyntaxException extends IllegalArgumentException {

    private final int position;
    private final int line;
    private final int column;

    protected ConfigSyntaxException(String message, int position, int line, int column) {
        super(message + " at line " + line + ", column " + column);
        this.position = position;
        this.line = line;
        this.column = column;
    }

    public int position() {
        return position;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }
}

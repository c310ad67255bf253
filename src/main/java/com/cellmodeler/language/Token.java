package com.cellmodeler.language;

/**
 * One lexical unit. {@code position} is the zero-based character offset of the first character;
 * {@code line} and {@code column} are one-based. For {@link TokenType#STRING} the text is the
 * unquoted content.
 */
public record Token(TokenType type, String text, int position, int line, int column) {

    public boolean is(TokenType expectedType, String expectedText) {
        return type == expectedType && text.equals(expectedText);
    }

    public boolean isKeyword(String keyword) {
        return is(TokenType.KEYWORD, keyword);
    }

    /**
     * Human-readable description used in parse error messages.
     */
    public String describe() {
        return switch (type) {
            case EOF -> "end of input";
            case STRING -> "'" + text + "'";
            case KEYWORD, OPERATOR -> text;
            case LBRACE, RBRACE, LPAREN, RPAREN, COMMA -> "'" + text + "'";
            default -> type.name().toLowerCase() + " " + text;
        };
    }
}

package com.cellmodeler.language;

public enum TokenType {
    KEYWORD,
    IDENTIFIER,
    INTEGER,
    FLOAT,
    STRING,
    LBRACE,
    RBRACE,
    LPAREN,
    RPAREN,
    COMMA,
    OPERATOR,
    EOF
}

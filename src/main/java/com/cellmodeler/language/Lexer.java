package com.cellmodeler.language;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Turns configuration text into tokens. The scan is lazy and restartable: every call to
 * {@link #iterator()} starts again from the first character and stops after yielding {@link TokenType#EOF}.
 *
 * <p>Upper-case reserved words are {@link TokenType#KEYWORD}s. The lower-case words of the rule syntax
 * ({@code current is next no conditions count}) are plain identifiers and are matched by the parser,
 * so they stay usable as state names.
 */
public final class Lexer implements Iterable<Token> {

    static final Set<String> KEYWORDS = Set.of(
            "WIDTH", "HEIGHT", "STATE", "RULES", "IF", "THEN", "WITH", "PROB", "AND", "OR", "XOR");

    private final String input;

    public Lexer(String input) {
        this.input = input != null ? input : "";
    }

    /**
     * Scans the whole input.
     *
     * @return all tokens, the last one being {@link TokenType#EOF}
     * @throws LexException on the first character that starts no token
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        for (Token token : this) {
            tokens.add(token);
        }
        return tokens;
    }

    @Override
    public Iterator<Token> iterator() {
        return new Scanner();
    }

    private final class Scanner implements Iterator<Token> {

        private int pos;
        private int line = 1;
        private int lineStart;
        private boolean done;

        @Override
        public boolean hasNext() {
            return !done;
        }

        @Override
        public Token next() {
            if (done) {
                throw new NoSuchElementException();
            }
            skipWhitespaceAndComments();
            if (isAtEnd()) {
                done = true;
                return token(TokenType.EOF, "", pos);
            }
            return nextToken();
        }

        private Token nextToken() {
            int start = pos;
            char c = peek();
            return switch (c) {
                case '{' -> single(TokenType.LBRACE);
                case '}' -> single(TokenType.RBRACE);
                case '(' -> single(TokenType.LPAREN);
                case ')' -> single(TokenType.RPAREN);
                case ',' -> single(TokenType.COMMA);
                case '\'' -> scanString();
                case '=', '!' -> {
                    if (peekAt(1) != '=') {
                        throw unexpected(c, pos);
                    }
                    advance();
                    advance();
                    yield token(TokenType.OPERATOR, c + "=", start);
                }
                case '<', '>' -> {
                    advance();
                    if (peek() == '=') {
                        advance();
                        yield token(TokenType.OPERATOR, c + "=", start);
                    }
                    yield token(TokenType.OPERATOR, String.valueOf(c), start);
                }
                default -> {
                    if (isDigit(c) || (c == '-' && isDigit(peekAt(1)))) {
                        yield scanNumber();
                    } else if (isIdentifierStart(c)) {
                        yield scanWord();
                    } else {
                        throw unexpected(c, pos);
                    }
                }
            };
        }

        private Token single(TokenType type) {
            int start = pos;
            char c = advance();
            return token(type, String.valueOf(c), start);
        }

        private Token scanString() {
            int start = pos;
            advance();
            StringBuilder sb = new StringBuilder();
            while (!isAtEnd() && peek() != '\'' && peek() != '\n') {
                sb.append(advance());
            }
            if (isAtEnd() || peek() == '\n') {
                throw new LexException("Unterminated string", '\'', start, line, start - lineStart + 1);
            }
            advance();
            return token(TokenType.STRING, sb.toString().trim(), start);
        }

        private Token scanNumber() {
            int start = pos;
            if (peek() == '-') {
                advance();
            }
            while (isDigit(peek())) {
                advance();
            }
            TokenType type = TokenType.INTEGER;
            if (peek() == '.' && isDigit(peekAt(1))) {
                type = TokenType.FLOAT;
                advance();
                while (isDigit(peek())) {
                    advance();
                }
            }
            if (isIdentifierStart(peek())) {
                throw unexpected(peek(), pos);
            }
            return token(type, input.substring(start, pos), start);
        }

        private Token scanWord() {
            int start = pos;
            while (isIdentifierChar(peek())) {
                advance();
            }
            String word = input.substring(start, pos);
            return token(KEYWORDS.contains(word) ? TokenType.KEYWORD : TokenType.IDENTIFIER, word, start);
        }

        private void skipWhitespaceAndComments() {
            while (!isAtEnd()) {
                char c = peek();
                if (c == '\n') {
                    advance();
                    line++;
                    lineStart = pos;
                } else if (Character.isWhitespace(c)) {
                    advance();
                } else if (c == '#' || (c == '/' && peekAt(1) == '/')) {
                    while (!isAtEnd() && peek() != '\n') {
                        advance();
                    }
                } else {
                    return;
                }
            }
        }

        private Token token(TokenType type, String text, int start) {
            return new Token(type, text, start, line, start - lineStart + 1);
        }

        private LexException unexpected(char c, int at) {
            return new LexException("Unexpected character '" + c + "'", c, at, line, at - lineStart + 1);
        }

        private char peek() {
            return peekAt(0);
        }

        private char peekAt(int offset) {
            int idx = pos + offset;
            return idx < input.length() ? input.charAt(idx) : '\0';
        }

        private char advance() {
            return input.charAt(pos++);
        }

        private boolean isAtEnd() {
            return pos >= input.length();
        }
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierChar(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}

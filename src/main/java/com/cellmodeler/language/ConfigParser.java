package com.cellmodeler.language;

import com.cellmodeler.model.AutomatonConfig;
import com.cellmodeler.model.ComparisonOperator;
import com.cellmodeler.model.ConditionExpr;
import com.cellmodeler.model.Connective;
import com.cellmodeler.model.GridSpec;
import com.cellmodeler.model.Rgb;
import com.cellmodeler.model.Rule;
import com.cellmodeler.model.StateDef;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for the automaton configuration language:
 *
 * <pre>
 * file        := "WIDTH" INT "HEIGHT" INT stateBlock rulesBlock
 * stateBlock  := "STATE" "{" stateDef* "}"
 * stateDef    := IDENT "(" INT "," INT "," INT "," INT ")"
 * rulesBlock  := "RULES" "{" rule* "}"
 * rule        := "IF" "current" "is" STRING condClause? "THEN" "next" "is" STRING probClause?
 * condClause  := "AND" "(" "no" "conditions" ")" | "AND" condExpr
 * condExpr    := condTerm ( ("AND"|"OR"|"XOR") condTerm )*
 * condTerm    := "count" "(" IDENT ")" CMPOP INT
 * probClause  := "WITH" "PROB" (FLOAT | INT)
 * </pre>
 *
 * The parser stops at the first structural error. Semantic checks (unknown names, ranges) are left to
 * the validator.
 */
public final class ConfigParser {

    private final List<Token> tokens;
    private int current;

    public ConfigParser(List<Token> tokens) {
        if (tokens == null || tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            throw new IllegalArgumentException("Token list must end with EOF");
        }
        this.tokens = tokens;
    }

    public static AutomatonConfig parse(String text) {
        return new ConfigParser(new Lexer(text).tokenize()).parse();
    }

    public AutomatonConfig parse() {
        current = 0;
        expectKeyword("WIDTH");
        int width = expectInt("grid width");
        expectKeyword("HEIGHT");
        int height = expectInt("grid height");
        List<StateDef> states = parseStateBlock();
        List<Rule> rules = parseRulesBlock();
        expect(TokenType.EOF, "end of input");
        return new AutomatonConfig(new GridSpec(width, height), states, rules);
    }

    private List<StateDef> parseStateBlock() {
        expectKeyword("STATE");
        expect(TokenType.LBRACE, "'{'");
        List<StateDef> states = new ArrayList<>();
        while (!check(TokenType.RBRACE)) {
            states.add(parseStateDef());
        }
        advance();
        return states;
    }

    private StateDef parseStateDef() {
        String name = expect(TokenType.IDENTIFIER, "state name or '}'").text();
        expect(TokenType.LPAREN, "'('");
        int red = expectInt("red component");
        expect(TokenType.COMMA, "','");
        int green = expectInt("green component");
        expect(TokenType.COMMA, "','");
        int blue = expectInt("blue component");
        expect(TokenType.COMMA, "','");
        int weight = expectInt("weight");
        expect(TokenType.RPAREN, "')'");
        return new StateDef(name, new Rgb(red, green, blue), weight);
    }

    private List<Rule> parseRulesBlock() {
        expectKeyword("RULES");
        expect(TokenType.LBRACE, "'{'");
        List<Rule> rules = new ArrayList<>();
        while (!check(TokenType.RBRACE)) {
            rules.add(parseRule());
        }
        advance();
        return rules;
    }

    private Rule parseRule() {
        if (!peek().isKeyword("IF")) {
            throw new ConfigParseException("IF or '}'", peek());
        }
        advance();
        expectWord("current");
        expectWord("is");
        String currentState = expect(TokenType.STRING, "quoted state name").text();

        ConditionExpr condition = ConditionExpr.unconditional();
        if (peek().isKeyword("AND")) {
            advance();
            condition = parseConditionClause();
        }

        expectKeyword("THEN");
        expectWord("next");
        expectWord("is");
        String nextState = expect(TokenType.STRING, "quoted state name").text();

        double probability = Rule.DEFAULT_PROBABILITY;
        if (peek().isKeyword("WITH")) {
            advance();
            expectKeyword("PROB");
            probability = expectProbability();
        }
        return new Rule(currentState, condition, nextState, probability);
    }

    private ConditionExpr parseConditionClause() {
        if (check(TokenType.LPAREN)) {
            advance();
            expectWord("no");
            expectWord("conditions");
            expect(TokenType.RPAREN, "')'");
            return ConditionExpr.unconditional();
        }
        ConditionExpr expr = parseConditionTerm();
        Connective connective;
        while ((connective = peekConnective()) != null) {
            advance();
            expr = new ConditionExpr.Combine(connective, expr, parseConditionTerm());
        }
        return expr;
    }

    private ConditionExpr parseConditionTerm() {
        expectWord("count");
        expect(TokenType.LPAREN, "'('");
        String stateName = expect(TokenType.IDENTIFIER, "state name").text();
        expect(TokenType.RPAREN, "')'");
        Token operator = expect(TokenType.OPERATOR, "comparison operator");
        int value = expectInt("neighbor count");
        return new ConditionExpr.Leaf(stateName, ComparisonOperator.fromSymbol(operator.text()), value);
    }

    private Connective peekConnective() {
        Token token = peek();
        if (token.type() != TokenType.KEYWORD) {
            return null;
        }
        return switch (token.text()) {
            case "AND" -> Connective.AND;
            case "OR" -> Connective.OR;
            case "XOR" -> Connective.XOR;
            default -> null;
        };
    }

    private int expectInt(String what) {
        Token token = expect(TokenType.INTEGER, what);
        try {
            return Integer.parseInt(token.text());
        } catch (NumberFormatException ex) {
            throw new ConfigParseException("Number " + token.text() + " is out of range", what, token);
        }
    }

    private double expectProbability() {
        Token token = peek();
        if (token.type() != TokenType.FLOAT && token.type() != TokenType.INTEGER) {
            throw new ConfigParseException("probability", token);
        }
        advance();
        return Double.parseDouble(token.text());
    }

    private void expectKeyword(String keyword) {
        if (!peek().isKeyword(keyword)) {
            throw new ConfigParseException(keyword, peek());
        }
        advance();
    }

    private void expectWord(String word) {
        if (!peek().is(TokenType.IDENTIFIER, word)) {
            throw new ConfigParseException("'" + word + "'", peek());
        }
        advance();
    }

    private Token expect(TokenType type, String what) {
        if (!check(type)) {
            throw new ConfigParseException(what, peek());
        }
        return advance();
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token advance() {
        Token token = tokens.get(current);
        if (token.type() != TokenType.EOF) {
            current++;
        }
        return token;
    }
}

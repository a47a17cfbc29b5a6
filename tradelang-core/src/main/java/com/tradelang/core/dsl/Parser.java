package com.tradelang.core.dsl;

import com.tradelang.core.dsl.ParseNode.Production;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser for strategy DSL.
 *
 * Grammar (lowest to highest precedence):
 * strategy       = "ENTRY" ":" expression "EXIT" ":" expression EOF
 * expression     = or_expr
 * or_expr        = and_expr ( "OR" and_expr )*
 * and_expr       = comparison ( "AND" comparison )*
 * comparison     = additive ( OPERATOR additive | CROSS_OP additive )?
 * additive       = multiplicative ( (PLUS | MINUS) multiplicative )*
 * multiplicative = unary ( (MULTIPLY | DIVIDE) unary )*
 * unary          = MINUS unary | primary
 * primary        = NUMBER | IDENTIFIER [ "(" expression ( "," expression )* ")" [ "." IDENTIFIER ] ]
 *                | "(" expression ")"
 *
 * The parser only checks grammar. Names, arity and types are checked by {@link AstBuilder}.
 */
public class Parser {

    private List<Token> tokens = new ArrayList<>();
    private int position = 0;

    /**
     * Parse a complete strategy into a concrete parse tree.
     *
     * @throws DslSyntaxException on any grammar violation
     */
    public ParseNode parse(String source) {
        this.tokens = Lexer.tokenize(source);
        this.position = 0;

        ParseNode entry = section(TokenType.ENTRY, Production.ENTRY_SECTION, "ENTRY");
        ParseNode exit = section(TokenType.EXIT, Production.EXIT_SECTION, "EXIT");

        // Ensure we consumed all tokens
        if (!check(TokenType.EOF)) {
            throw new DslSyntaxException("Unexpected token '" + current().value() + "'", current());
        }

        return ParseNode.of(Production.STRATEGY, null, List.of(entry, exit));
    }

    /**
     * Parse a single expression, without the ENTRY/EXIT sections.
     */
    public ParseNode parseExpression(String source) {
        this.tokens = Lexer.tokenize(source);
        this.position = 0;

        ParseNode expr = expression();
        if (!check(TokenType.EOF)) {
            throw new DslSyntaxException("Unexpected token '" + current().value() + "'", current());
        }
        return expr;
    }

    // ========== Parser Methods ==========

    private ParseNode section(TokenType keyword, Production production, String name) {
        Token start = current();
        expect(keyword, "Expected " + name + " section");
        expect(TokenType.COLON, "Expected ':' after " + name);
        ParseNode body = expression();
        return ParseNode.of(production, start, List.of(body));
    }

    private ParseNode expression() {
        return orExpr();
    }

    private ParseNode orExpr() {
        Token start = current();
        List<ParseNode> operands = new ArrayList<>();
        operands.add(andExpr());

        while (check(TokenType.OR)) {
            advance();
            operands.add(andExpr());
        }

        return ParseNode.of(Production.OR_EXPR, start, operands);
    }

    private ParseNode andExpr() {
        Token start = current();
        List<ParseNode> operands = new ArrayList<>();
        operands.add(comparison());

        while (check(TokenType.AND)) {
            advance();
            operands.add(comparison());
        }

        return ParseNode.of(Production.AND_EXPR, start, operands);
    }

    private ParseNode comparison() {
        ParseNode left = additive();

        // Comparison or cross operator, at most one per comparison
        if (check(TokenType.OPERATOR) || check(TokenType.CROSS_OP)) {
            Token operator = advance();
            ParseNode right = additive();
            return ParseNode.of(Production.COMPARISON, operator, List.of(left, right));
        }

        return left;
    }

    private ParseNode additive() {
        ParseNode left = multiplicative();

        while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            Token operator = advance();
            ParseNode right = multiplicative();
            left = ParseNode.of(Production.ARITHMETIC, operator, List.of(left, right));
        }

        return left;
    }

    private ParseNode multiplicative() {
        ParseNode left = unary();

        while (check(TokenType.MULTIPLY) || check(TokenType.DIVIDE)) {
            Token operator = advance();
            ParseNode right = unary();
            left = ParseNode.of(Production.ARITHMETIC, operator, List.of(left, right));
        }

        return left;
    }

    private ParseNode unary() {
        if (check(TokenType.MINUS)) {
            Token minus = advance();

            // Fold "-<number>" into a negative literal
            if (check(TokenType.NUMBER)) {
                Token number = advance();
                return ParseNode.number(number, negate(numberValue(number)));
            }

            ParseNode operand = unary();
            return ParseNode.of(Production.NEGATION, minus, List.of(operand));
        }

        return primary();
    }

    private ParseNode primary() {
        // Parenthesized expression
        if (check(TokenType.LPAREN)) {
            Token open = advance();
            ParseNode expr = expression();
            expect(TokenType.RPAREN, "Expected ')' after expression");
            return ParseNode.of(Production.GROUP, open, List.of(expr));
        }

        // Number literal
        if (check(TokenType.NUMBER)) {
            Token number = advance();
            return ParseNode.number(number, numberValue(number));
        }

        // Field reference, boolean literal or indicator call
        if (check(TokenType.IDENTIFIER)) {
            Token name = advance();
            if (!check(TokenType.LPAREN)) {
                return ParseNode.leaf(Production.IDENTIFIER, name);
            }
            return call(name);
        }

        if (check(TokenType.EOF)) {
            throw new DslSyntaxException("Unexpected end of input", current());
        }
        throw new DslSyntaxException("Unexpected token '" + current().value() + "'", current());
    }

    private ParseNode call(Token name) {
        expect(TokenType.LPAREN, "Expected '(' after " + name.value());

        List<ParseNode> args = new ArrayList<>();
        args.add(expression());
        while (check(TokenType.COMMA)) {
            advance();
            args.add(expression());
        }

        expect(TokenType.RPAREN, "Expected ')' after " + name.value() + " arguments");
        ParseNode call = ParseNode.of(Production.CALL, name, args);

        // Optional output selection: MACD(close, 12, 26, 9).signal
        if (check(TokenType.DOT)) {
            advance();
            Token output = current();
            expect(TokenType.IDENTIFIER, "Expected output name after '.'");
            return ParseNode.of(Production.OUTPUT_SELECT, output, List.of(call));
        }

        return call;
    }

    /**
     * Whole values become integers, everything else stays floating-point.
     */
    static Number numberValue(Token token) {
        double value;
        try {
            value = Double.parseDouble(token.value());
        } catch (NumberFormatException e) {
            throw new DslSyntaxException("Malformed number '" + token.value() + "'", token);
        }
        if (Double.isFinite(value) && value == Math.rint(value)
                && Math.abs(value) <= Long.MAX_VALUE) {
            return (long) value;
        }
        return value;
    }

    private static Number negate(Number value) {
        if (value instanceof Long l) {
            return -l;
        }
        return -value.doubleValue();
    }

    // ========== Helper Methods ==========

    private Token current() {
        if (position >= tokens.size()) {
            return tokens.get(tokens.size() - 1);
        }
        return tokens.get(position);
    }

    private boolean check(TokenType type) {
        return current().type() == type;
    }

    private Token advance() {
        Token token = current();
        if (token.type() != TokenType.EOF) {
            position++;
        }
        return token;
    }

    private void expect(TokenType type, String message) {
        if (!check(type)) {
            throw new DslSyntaxException(message + ", got '" + current().value() + "'", current());
        }
        advance();
    }
}

package com.tradelang.core.dsl;

/**
 * Token types produced by the {@link Lexer}.
 */
public enum TokenType {
    // Section keywords
    ENTRY,
    EXIT,

    // Logical keywords
    AND,
    OR,

    // Comparison: >, <, >=, <=, ==
    OPERATOR,
    // CROSSES_ABOVE, CROSSES_BELOW
    CROSS_OP,

    // Arithmetic
    PLUS,
    MINUS,
    MULTIPLY,
    DIVIDE,

    // Literals and names
    NUMBER,
    IDENTIFIER,

    // Punctuation
    LPAREN,
    RPAREN,
    COMMA,
    DOT,
    COLON,

    EOF
}

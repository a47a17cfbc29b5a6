package com.tradelang.core.dsl;

/**
 * Token produced by the lexer. Keywords carry their upper-case spelling,
 * identifiers are lower-cased, everything else keeps the source text.
 */
public record Token(TokenType type, String value, int position, int line, int column) {

    public static Token eof(int position, int line, int column) {
        return new Token(TokenType.EOF, "<end of input>", position, line, column);
    }
}

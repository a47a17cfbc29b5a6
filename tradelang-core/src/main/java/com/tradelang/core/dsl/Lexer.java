package com.tradelang.core.dsl;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * DSL Lexer - tokenizes strategy text.
 *
 * Keywords are case-insensitive. Identifiers are normalized to lowercase;
 * whether an identifier names a field or an indicator is decided later by the
 * {@link AstBuilder}, so unknown names are not a lexing error.
 */
public class Lexer {

    private static final Map<String, TokenType> KEYWORDS = Map.of(
        "ENTRY", TokenType.ENTRY,
        "EXIT", TokenType.EXIT,
        "AND", TokenType.AND,
        "OR", TokenType.OR,
        "CROSSES_ABOVE", TokenType.CROSS_OP,
        "CROSSES_BELOW", TokenType.CROSS_OP
    );

    private final String source;
    private int position = 0;
    private int line = 1;
    private int lineStart = 0;
    private final List<Token> tokens = new ArrayList<>();

    public Lexer(String source) {
        this.source = source;
    }

    /**
     * Tokenize the source string. The returned list always ends with an EOF token.
     */
    public List<Token> tokenize() {
        tokens.clear();
        position = 0;
        line = 1;
        lineStart = 0;

        while (position < source.length()) {
            skipWhitespace();

            if (position >= source.length()) {
                break;
            }

            char c = source.charAt(position);

            // Single character tokens
            switch (c) {
                case '(' -> { addToken(TokenType.LPAREN, "("); position++; continue; }
                case ')' -> { addToken(TokenType.RPAREN, ")"); position++; continue; }
                case ',' -> { addToken(TokenType.COMMA, ","); position++; continue; }
                case ':' -> { addToken(TokenType.COLON, ":"); position++; continue; }
                case '*' -> { addToken(TokenType.MULTIPLY, "*"); position++; continue; }
                case '/' -> { addToken(TokenType.DIVIDE, "/"); position++; continue; }
                case '+' -> { addToken(TokenType.PLUS, "+"); position++; continue; }
                case '-' -> { addToken(TokenType.MINUS, "-"); position++; continue; }
                default -> { }
            }

            // '.' starts a number (".5") or a property access ("MACD(...).signal")
            if (c == '.') {
                if (Character.isDigit(peek(1))) {
                    readNumber();
                } else {
                    addToken(TokenType.DOT, ".");
                    position++;
                }
                continue;
            }

            // Comparison operators
            if (c == '>' || c == '<') {
                if (peek(1) == '=') {
                    addToken(TokenType.OPERATOR, c + "=");
                    position += 2;
                } else {
                    addToken(TokenType.OPERATOR, String.valueOf(c));
                    position++;
                }
                continue;
            }

            if (c == '=') {
                if (peek(1) != '=') {
                    throw error("Unexpected character '='; did you mean '=='?");
                }
                addToken(TokenType.OPERATOR, "==");
                position += 2;
                continue;
            }

            if (Character.isDigit(c)) {
                readNumber();
                continue;
            }

            if (Character.isLetter(c) || c == '_') {
                readIdentifier();
                continue;
            }

            throw error("Unexpected character '" + c + "'");
        }

        tokens.add(Token.eof(position, line, column(position)));
        return tokens;
    }

    private void skipWhitespace() {
        while (position < source.length()) {
            char c = source.charAt(position);
            if (c == '\n') {
                line++;
                position++;
                lineStart = position;
            } else if (Character.isWhitespace(c)) {
                position++;
            } else {
                break;
            }
        }
    }

    private char peek(int offset) {
        int pos = position + offset;
        if (pos >= source.length()) {
            return '\0';
        }
        return source.charAt(pos);
    }

    private void readNumber() {
        int start = position;
        boolean hasDecimal = false;

        while (position < source.length()) {
            char c = source.charAt(position);
            if (Character.isDigit(c)) {
                position++;
            } else if (c == '.' && !hasDecimal && Character.isDigit(peek(1))) {
                hasDecimal = true;
                position++;
            } else {
                break;
            }
        }

        // Optional exponent: 1e6, 2.5E-3
        if ((peek(0) == 'e' || peek(0) == 'E')
                && (Character.isDigit(peek(1))
                    || ((peek(1) == '+' || peek(1) == '-') && Character.isDigit(peek(2))))) {
            position += Character.isDigit(peek(1)) ? 1 : 2;
            while (position < source.length() && Character.isDigit(source.charAt(position))) {
                position++;
            }
        }

        if (position < source.length()
                && (Character.isLetter(source.charAt(position)) || source.charAt(position) == '_')) {
            throw error("Malformed number '" + source.substring(start, position + 1) + "'");
        }

        tokens.add(new Token(TokenType.NUMBER, source.substring(start, position), start, line, column(start)));
    }

    private void readIdentifier() {
        int start = position;

        while (position < source.length()) {
            char c = source.charAt(position);
            if (Character.isLetterOrDigit(c) || c == '_') {
                position++;
            } else {
                break;
            }
        }

        String text = source.substring(start, position);
        String upper = text.toUpperCase(Locale.ROOT);
        TokenType keyword = KEYWORDS.get(upper);

        if (keyword != null) {
            tokens.add(new Token(keyword, upper, start, line, column(start)));
        } else {
            tokens.add(new Token(TokenType.IDENTIFIER, text.toLowerCase(Locale.ROOT), start, line, column(start)));
        }
    }

    private void addToken(TokenType type, String value) {
        tokens.add(new Token(type, value, position, line, column(position)));
    }

    private int column(int offset) {
        return offset - lineStart + 1;
    }

    private DslSyntaxException error(String message) {
        String offending = position < source.length() ? String.valueOf(source.charAt(position)) : "";
        return new DslSyntaxException(message, offending, position, line, column(position));
    }

    /**
     * Convenience function to tokenize a string
     */
    public static List<Token> tokenize(String source) {
        return new Lexer(source).tokenize();
    }
}

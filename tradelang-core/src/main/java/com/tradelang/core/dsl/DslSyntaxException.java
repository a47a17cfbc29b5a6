package com.tradelang.core.dsl;

/**
 * Grammar violation in DSL text. Carries the offending token text and where it starts.
 */
public class DslSyntaxException extends StrategyException {

    private final String token;
    private final int position;
    private final int line;
    private final int column;

    public DslSyntaxException(String message, String token, int position, int line, int column) {
        super(message + " at line " + line + ", column " + column);
        this.token = token;
        this.position = position;
        this.line = line;
        this.column = column;
    }

    public DslSyntaxException(String message, Token token) {
        this(message, token.value(), token.position(), token.line(), token.column());
    }

    public String getToken() {
        return token;
    }

    /**
     * Zero-based character offset into the source text.
     */
    public int getPosition() {
        return position;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}

package com.csentinel.core.lexer;

/**
 * A positioned lexeme. Lines and columns are 1-based; the end column is exclusive.
 */
public record Token(
    TokenType type,
    String value,
    int line,
    int column,
    int endLine,
    int endColumn
) {

    public TokenCategory category() {
        return type.category();
    }

    public boolean is(TokenType other) {
        return type == other;
    }

    @Override
    public String toString() {
        return type + "(" + value + ")@" + line + ":" + column;
    }
}

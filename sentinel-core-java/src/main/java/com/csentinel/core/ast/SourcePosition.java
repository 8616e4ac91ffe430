package com.csentinel.core.ast;

import com.csentinel.core.lexer.Token;

/** 1-based line and column of the token a node was built from. */
public record SourcePosition(int line, int column) {

    public static SourcePosition of(Token token) {
        return token == null ? null : new SourcePosition(token.line(), token.column());
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}

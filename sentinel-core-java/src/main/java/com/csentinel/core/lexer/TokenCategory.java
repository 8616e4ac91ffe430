package com.csentinel.core.lexer;

public enum TokenCategory {
    IDENTIFIER,
    KEYWORD,
    LITERAL,
    OPERATOR,
    PUNCTUATOR,
    PREPROCESSOR,
    ERROR
}

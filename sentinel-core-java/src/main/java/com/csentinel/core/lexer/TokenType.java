package com.csentinel.core.lexer;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Every token type the scanner can emit, grouped by category.
 * Keyword and operator types carry their fixed spelling.
 */
public enum TokenType {
    // Identifiers and literals
    IDENTIFIER(TokenCategory.IDENTIFIER, null),
    INT_CONST(TokenCategory.LITERAL, null),
    FLOAT_CONST(TokenCategory.LITERAL, null),
    CHAR_CONST(TokenCategory.LITERAL, null),
    STRING_LITERAL(TokenCategory.LITERAL, null),

    PP_DIRECTIVE(TokenCategory.PREPROCESSOR, null),
    ERROR(TokenCategory.ERROR, null),

    // Keywords
    AUTO(TokenCategory.KEYWORD, "auto"),
    BREAK(TokenCategory.KEYWORD, "break"),
    CASE(TokenCategory.KEYWORD, "case"),
    CHAR(TokenCategory.KEYWORD, "char"),
    CONST(TokenCategory.KEYWORD, "const"),
    CONTINUE(TokenCategory.KEYWORD, "continue"),
    DEFAULT(TokenCategory.KEYWORD, "default"),
    DO(TokenCategory.KEYWORD, "do"),
    DOUBLE(TokenCategory.KEYWORD, "double"),
    ELSE(TokenCategory.KEYWORD, "else"),
    ENUM(TokenCategory.KEYWORD, "enum"),
    EXTERN(TokenCategory.KEYWORD, "extern"),
    FLOAT(TokenCategory.KEYWORD, "float"),
    FOR(TokenCategory.KEYWORD, "for"),
    GOTO(TokenCategory.KEYWORD, "goto"),
    IF(TokenCategory.KEYWORD, "if"),
    INLINE(TokenCategory.KEYWORD, "inline"),
    INT(TokenCategory.KEYWORD, "int"),
    LONG(TokenCategory.KEYWORD, "long"),
    REGISTER(TokenCategory.KEYWORD, "register"),
    RESTRICT(TokenCategory.KEYWORD, "restrict"),
    RETURN(TokenCategory.KEYWORD, "return"),
    SHORT(TokenCategory.KEYWORD, "short"),
    SIGNED(TokenCategory.KEYWORD, "signed"),
    SIZEOF(TokenCategory.KEYWORD, "sizeof"),
    STATIC(TokenCategory.KEYWORD, "static"),
    STRUCT(TokenCategory.KEYWORD, "struct"),
    SWITCH(TokenCategory.KEYWORD, "switch"),
    TYPEDEF(TokenCategory.KEYWORD, "typedef"),
    UNION(TokenCategory.KEYWORD, "union"),
    UNSIGNED(TokenCategory.KEYWORD, "unsigned"),
    VOID(TokenCategory.KEYWORD, "void"),
    VOLATILE(TokenCategory.KEYWORD, "volatile"),
    WHILE(TokenCategory.KEYWORD, "while"),
    BOOL(TokenCategory.KEYWORD, "_Bool"),
    COMPLEX(TokenCategory.KEYWORD, "_Complex"),
    ATOMIC(TokenCategory.KEYWORD, "_Atomic"),
    GENERIC(TokenCategory.KEYWORD, "_Generic"),
    IMAGINARY(TokenCategory.KEYWORD, "_Imaginary"),
    STATIC_ASSERT(TokenCategory.KEYWORD, "_Static_assert"),
    THREAD_LOCAL(TokenCategory.KEYWORD, "_Thread_local"),

    // Operators (three characters)
    LSHIFT_ASSIGN(TokenCategory.OPERATOR, "<<="),
    RSHIFT_ASSIGN(TokenCategory.OPERATOR, ">>="),
    ELLIPSIS(TokenCategory.PUNCTUATOR, "..."),

    // Operators (two characters)
    ARROW(TokenCategory.OPERATOR, "->"),
    INC(TokenCategory.OPERATOR, "++"),
    DEC(TokenCategory.OPERATOR, "--"),
    LSHIFT(TokenCategory.OPERATOR, "<<"),
    RSHIFT(TokenCategory.OPERATOR, ">>"),
    LE(TokenCategory.OPERATOR, "<="),
    GE(TokenCategory.OPERATOR, ">="),
    EQ(TokenCategory.OPERATOR, "=="),
    NEQ(TokenCategory.OPERATOR, "!="),
    AND(TokenCategory.OPERATOR, "&&"),
    OR(TokenCategory.OPERATOR, "||"),
    PLUS_ASSIGN(TokenCategory.OPERATOR, "+="),
    MINUS_ASSIGN(TokenCategory.OPERATOR, "-="),
    MUL_ASSIGN(TokenCategory.OPERATOR, "*="),
    DIV_ASSIGN(TokenCategory.OPERATOR, "/="),
    MOD_ASSIGN(TokenCategory.OPERATOR, "%="),
    AND_ASSIGN(TokenCategory.OPERATOR, "&="),
    OR_ASSIGN(TokenCategory.OPERATOR, "|="),
    XOR_ASSIGN(TokenCategory.OPERATOR, "^="),

    // Operators (one character)
    PLUS(TokenCategory.OPERATOR, "+"),
    MINUS(TokenCategory.OPERATOR, "-"),
    TIMES(TokenCategory.OPERATOR, "*"),
    DIVIDE(TokenCategory.OPERATOR, "/"),
    MOD(TokenCategory.OPERATOR, "%"),
    ASSIGN(TokenCategory.OPERATOR, "="),
    LT(TokenCategory.OPERATOR, "<"),
    GT(TokenCategory.OPERATOR, ">"),
    NOT(TokenCategory.OPERATOR, "!"),
    BAND(TokenCategory.OPERATOR, "&"),
    BOR(TokenCategory.OPERATOR, "|"),
    BXOR(TokenCategory.OPERATOR, "^"),
    BNOT(TokenCategory.OPERATOR, "~"),
    DOT(TokenCategory.OPERATOR, "."),
    QUESTION(TokenCategory.OPERATOR, "?"),

    // Punctuators
    LPAREN(TokenCategory.PUNCTUATOR, "("),
    RPAREN(TokenCategory.PUNCTUATOR, ")"),
    LBRACE(TokenCategory.PUNCTUATOR, "{"),
    RBRACE(TokenCategory.PUNCTUATOR, "}"),
    LBRACKET(TokenCategory.PUNCTUATOR, "["),
    RBRACKET(TokenCategory.PUNCTUATOR, "]"),
    SEMICOLON(TokenCategory.PUNCTUATOR, ";"),
    COMMA(TokenCategory.PUNCTUATOR, ","),
    COLON(TokenCategory.PUNCTUATOR, ":"),

    /** Synthetic end-of-input marker; appended by the parser, never by the lexer. */
    EOF(TokenCategory.PUNCTUATOR, null);

    private static final Map<String, TokenType> KEYWORDS;
    private static final List<TokenType> OPERATORS_LONGEST_FIRST;

    static {
        Map<String, TokenType> keywords = new HashMap<>();
        Map<String, TokenType> operators = new LinkedHashMap<>();
        for (TokenType type : values()) {
            if (type.spelling == null) continue;
            if (type.category == TokenCategory.KEYWORD) {
                keywords.put(type.spelling, type);
            } else {
                operators.put(type.spelling, type);
            }
        }
        KEYWORDS = Collections.unmodifiableMap(keywords);
        List<TokenType> ordered = new java.util.ArrayList<>(operators.values());
        ordered.sort((a, b) -> Integer.compare(b.spelling.length(), a.spelling.length()));
        OPERATORS_LONGEST_FIRST = Collections.unmodifiableList(ordered);
    }

    private final TokenCategory category;
    private final String spelling;

    TokenType(TokenCategory category, String spelling) {
        this.category = category;
        this.spelling = spelling;
    }

    public TokenCategory category() { return category; }

    /** Fixed source text for keywords and operators, null otherwise. */
    public String spelling() { return spelling; }

    /** Keyword type for {@code word}, or IDENTIFIER if it is not reserved. */
    public static TokenType keywordOrIdentifier(String word) {
        return KEYWORDS.getOrDefault(word, IDENTIFIER);
    }

    static List<TokenType> operatorsLongestFirst() {
        return OPERATORS_LONGEST_FIRST;
    }
}
